package io.oraclemesh.model;

import java.util.List;

/**
 * Authoritative record produced by a human reviewer after consensus failure.
 * It replaces every node output of the failed round.
 */
public record CorrectedRecord(
        List<ValidatedEntity> entities,
        String correctionReason,
        String validatorId,
        String timestamp
) {
    public static final String VALIDATOR_PREFIX = "HITL_";

    public CorrectedRecord {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public boolean hasHumanValidatorId() {
        return validatorId != null && validatorId.startsWith(VALIDATOR_PREFIX) && validatorId.length() > VALIDATOR_PREFIX.length();
    }
}
