package io.oraclemesh.rules;

import io.oraclemesh.model.CanonicalRecord;
import io.oraclemesh.model.RuleEvaluationResult;

/**
 * Downstream side effect (e.g. a reimbursement request). Called only for results with
 * {@code actionTriggered=true}.
 */
@FunctionalInterface
public interface ActionTrigger {
    void fire(CanonicalRecord record, RuleEvaluationResult result);
}
