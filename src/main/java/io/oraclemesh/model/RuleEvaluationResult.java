package io.oraclemesh.model;

import java.util.List;

public record RuleEvaluationResult(
        boolean matched,
        String matchedCondition,
        boolean actionTriggered,
        Reason reason,
        List<String> matchedTerms
) {
    public enum Reason {
        MATCHED,
        NO_MATCH,
        INTEGRITY_MISMATCH
    }

    public RuleEvaluationResult {
        matchedTerms = matchedTerms == null ? List.of() : List.copyOf(matchedTerms);
    }

    public static RuleEvaluationResult matched(String condition, List<String> terms) {
        return new RuleEvaluationResult(true, condition, true, Reason.MATCHED, terms);
    }

    public static RuleEvaluationResult noMatch() {
        return new RuleEvaluationResult(false, null, false, Reason.NO_MATCH, List.of());
    }

    public static RuleEvaluationResult integrityMismatch() {
        return new RuleEvaluationResult(false, null, false, Reason.INTEGRITY_MISMATCH, List.of());
    }
}
