package io.oraclemesh.security;

/**
 * Binds a node identity to a digest. Signatures are hex encoded.
 *
 * <p>Two different keys must not produce the same signature for one digest, and
 * {@link #verify(String, String, String)} must succeed given only the node's public id.
 */
public interface Signer {
    String scheme();

    String sign(String digest, NodeKey key);

    boolean verify(String digest, String signature, String publicId);
}
