package io.oraclemesh.security;

import io.oraclemesh.util.Hashing;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Optional;

/**
 * Asymmetric node signatures. Ed25519 is deterministic, so the same key and digest
 * always give the same signature.
 */
public final class Ed25519Signer implements Signer {
    private static final String ALGORITHM = "Ed25519";

    private final NodeKeyring keyring;

    public Ed25519Signer(NodeKeyring keyring) {
        this.keyring = keyring;
    }

    @Override
    public String scheme() {
        return "ed25519";
    }

    @Override
    public String sign(String digest, NodeKey key) {
        if (digest == null || key == null) {
            throw new IllegalArgumentException("digest and key are required");
        }
        try {
            PrivateKey privateKey = KeyFactory.getInstance(ALGORITHM)
                    .generatePrivate(new PKCS8EncodedKeySpec(Base64.getDecoder().decode(key.ed25519PrivateKey())));
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initSign(privateKey);
            signature.update(digest.getBytes(StandardCharsets.UTF_8));
            return Hashing.toHex(signature.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 signing failed for node " + key.nodeId(), e);
        }
    }

    @Override
    public boolean verify(String digest, String signatureHex, String publicId) {
        Optional<NodeKey> key = keyring.find(publicId);
        if (key.isEmpty() || digest == null || signatureHex == null) {
            return false;
        }
        try {
            PublicKey publicKey = KeyFactory.getInstance(ALGORITHM)
                    .generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(key.get().ed25519PublicKey())));
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initVerify(publicKey);
            signature.update(digest.getBytes(StandardCharsets.UTF_8));
            return signature.verify(Hashing.fromHex(signatureHex));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return false;
        }
    }
}
