package io.oraclemesh.model;

/**
 * Signed statement of one node about its validation package.
 *
 * @param digest          lowercase hex SHA-256 of the canonical JSON of {@code validationPackage}
 * @param signature       opaque signature over {@code digest}, hex encoded
 * @param signatureScheme scheme id of the signer that produced {@code signature}
 */
public record NodeAttestation(
        String nodeId,
        ValidationPackage validationPackage,
        String digest,
        String signature,
        String signatureScheme
) {
    public boolean contributes() {
        return validationPackage != null && !validationPackage.isEmpty();
    }
}
