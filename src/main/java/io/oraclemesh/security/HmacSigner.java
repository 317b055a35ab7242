package io.oraclemesh.security;

import io.oraclemesh.util.Hashing;

import java.util.Base64;
import java.util.Optional;

public final class HmacSigner implements Signer {
    private final NodeKeyring keyring;

    public HmacSigner(NodeKeyring keyring) {
        this.keyring = keyring;
    }

    @Override
    public String scheme() {
        return "hmac-sha256";
    }

    @Override
    public String sign(String digest, NodeKey key) {
        if (digest == null || key == null) {
            throw new IllegalArgumentException("digest and key are required");
        }
        byte[] secret = Base64.getDecoder().decode(key.hmacSecret());
        return Hashing.toHex(Hashing.hmacSha256(secret, digest));
    }

    @Override
    public boolean verify(String digest, String signature, String publicId) {
        Optional<NodeKey> key = keyring.find(publicId);
        if (key.isEmpty() || digest == null || signature == null) {
            return false;
        }
        return Hashing.constantTimeEquals(sign(digest, key.get()), signature);
    }
}
