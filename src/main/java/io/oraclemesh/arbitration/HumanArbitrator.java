package io.oraclemesh.arbitration;

import io.oraclemesh.model.CorrectedRecord;
import io.oraclemesh.model.NodeAttestation;

import java.util.List;

/**
 * Human review invoked only after consensus failed. The returned record replaces every
 * node output of the round.
 */
public interface HumanArbitrator {
    String id();

    /**
     * @param originalText the report the round was started with
     * @param attestations every node slot of the failed round, {@code null} for abstaining nodes
     */
    CorrectedRecord arbitrate(String originalText, List<NodeAttestation> attestations);

    static CorrectedRecord requireHumanProvenance(CorrectedRecord record) {
        if (record == null) {
            throw new IllegalStateException("arbitration returned no record");
        }
        if (!record.hasHumanValidatorId()) {
            throw new IllegalStateException(
                    "corrected record must carry a " + CorrectedRecord.VALIDATOR_PREFIX + " validator id: " + record.validatorId()
            );
        }
        return record;
    }
}
