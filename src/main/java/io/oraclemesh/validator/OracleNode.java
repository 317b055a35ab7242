package io.oraclemesh.validator;

import io.oraclemesh.model.AnnotatedToken;
import io.oraclemesh.model.NodeAttestation;
import io.oraclemesh.vocab.Vocabulary;

import java.util.List;

/**
 * A participant of a consensus round.
 */
public interface OracleNode {
    String nodeId();

    /**
     * @return the signed attestation, or {@code null} when the node abstains
     */
    NodeAttestation attest(List<AnnotatedToken> tokens, Vocabulary vocab);
}
