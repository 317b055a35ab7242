package io.oraclemesh.security;

/**
 * Key material of one oracle node. Fields are base64 encoded.
 *
 * @param hmacSecret        shared secret for {@link HmacSigner}
 * @param ed25519PrivateKey PKCS#8 encoded private key for {@link Ed25519Signer}
 * @param ed25519PublicKey  X.509 encoded public key for {@link Ed25519Signer}
 */
public record NodeKey(
        String nodeId,
        String hmacSecret,
        String ed25519PrivateKey,
        String ed25519PublicKey,
        long createdAtMs
) {
    @Override
    public String toString() {
        return "NodeKey[nodeId=" + nodeId + ", createdAtMs=" + createdAtMs + "]";
    }
}
