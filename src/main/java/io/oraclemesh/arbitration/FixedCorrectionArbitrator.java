package io.oraclemesh.arbitration;

import io.oraclemesh.model.CorrectedRecord;
import io.oraclemesh.model.EntityLabels;
import io.oraclemesh.model.NodeAttestation;
import io.oraclemesh.model.ValidatedEntity;

import java.time.Clock;
import java.util.List;

/**
 * Reviewer stand-in that always answers with the same correction. Used for demos and
 * unattended runs where the review queue is not staffed.
 */
public final class FixedCorrectionArbitrator implements HumanArbitrator {
    private final String validatorId;
    private final List<ValidatedEntity> entities;
    private final String correctionReason;
    private final Clock clock;

    public FixedCorrectionArbitrator(String validatorId, List<ValidatedEntity> entities, String correctionReason, Clock clock) {
        this.validatorId = validatorId;
        this.entities = List.copyOf(entities);
        this.correctionReason = correctionReason;
        this.clock = clock;
    }

    public static FixedCorrectionArbitrator defaultReviewer() {
        return new FixedCorrectionArbitrator(
                "HITL_001",
                List.of(
                        new ValidatedEntity("MRI", "PROCEDURE", 0.98d),
                        new ValidatedEntity("headache", EntityLabels.SYMPTOM, 0.95d),
                        new ValidatedEntity("fatigue", EntityLabels.SYMPTOM, 0.93d),
                        new ValidatedEntity("ibuprofen", EntityLabels.DRUG, 0.97d)
                ),
                "Low confidence in NLP extraction for 'MRI'",
                Clock.systemUTC()
        );
    }

    @Override
    public String id() {
        return "fixed";
    }

    @Override
    public CorrectedRecord arbitrate(String originalText, List<NodeAttestation> attestations) {
        return HumanArbitrator.requireHumanProvenance(new CorrectedRecord(
                entities,
                correctionReason,
                validatorId,
                clock.instant().toString()
        ));
    }
}
