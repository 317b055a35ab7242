package io.oraclemesh.model;

import io.oraclemesh.util.CanonicalJson;

import java.util.List;

/**
 * The single record of a run that is eligible for a ledger commitment.
 *
 * @param runId            run identifier, also the ledger store key
 * @param sourceId         node id of the canonical package, or the human validator id
 * @param correctionReason reviewer note, only set for {@link Provenance#HUMAN}
 */
public record CanonicalRecord(
        String runId,
        List<ValidatedEntity> entities,
        String timestamp,
        Provenance provenance,
        String sourceId,
        String correctionReason
) {
    public CanonicalRecord {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId cannot be empty");
        }
        if (provenance == null) {
            throw new IllegalArgumentException("provenance cannot be null");
        }
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public static CanonicalRecord fromConsensus(String runId, ValidationPackage pkg, boolean partial) {
        return new CanonicalRecord(
                runId,
                pkg.entities(),
                pkg.timestamp(),
                partial ? Provenance.CONSENSUS_PARTIAL : Provenance.CONSENSUS,
                pkg.sourceNodeId(),
                null
        );
    }

    public static CanonicalRecord fromArbitration(String runId, CorrectedRecord corrected) {
        return new CanonicalRecord(
                runId,
                corrected.entities(),
                corrected.timestamp(),
                Provenance.HUMAN,
                corrected.validatorId(),
                corrected.correctionReason()
        );
    }

    public String digest() {
        return CanonicalJson.digest(this);
    }

    public CanonicalRecord withEntities(List<ValidatedEntity> replacement) {
        return new CanonicalRecord(runId, replacement, timestamp, provenance, sourceId, correctionReason);
    }
}
