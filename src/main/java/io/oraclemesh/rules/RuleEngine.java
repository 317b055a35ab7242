package io.oraclemesh.rules;

import io.oraclemesh.ledger.LedgerStore;
import io.oraclemesh.model.CanonicalRecord;
import io.oraclemesh.model.LedgerCommitment;
import io.oraclemesh.model.RuleEvaluationResult;
import io.oraclemesh.model.ValidatedEntity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Evaluates a rule over a committed record. The record digest is recomputed and checked
 * against the ledger first; business logic never runs over unverified data.
 */
public final class RuleEngine {
    private final LedgerStore ledger;

    public RuleEngine(LedgerStore ledger) {
        this.ledger = ledger;
    }

    public RuleEvaluationResult evaluate(CanonicalRecord record, LedgerCommitment commitment, Rule rule) {
        if (record == null || !ledger.verify(record.digest(), commitment)) {
            return RuleEvaluationResult.integrityMismatch();
        }
        List<String> matchedTerms = new ArrayList<>(rule.predicates().size());
        for (EntityPredicate predicate : rule.predicates()) {
            String term = firstMatchingTerm(record.entities(), predicate);
            if (term == null) {
                return RuleEvaluationResult.noMatch();
            }
            matchedTerms.add(term);
        }
        return RuleEvaluationResult.matched(describe(rule, matchedTerms), matchedTerms);
    }

    static String firstMatchingTerm(List<ValidatedEntity> entities, EntityPredicate predicate) {
        Set<String> present = new HashSet<>();
        for (ValidatedEntity entity : entities) {
            if (predicate.label().equalsIgnoreCase(entity.label())) {
                present.add(entity.text().trim().toLowerCase(Locale.ROOT));
            }
        }
        for (String term : predicate.terms()) {
            if (present.contains(term)) {
                return term;
            }
        }
        return null;
    }

    private static String describe(Rule rule, List<String> matchedTerms) {
        StringBuilder sb = new StringBuilder(rule.name()).append(": ");
        for (int i = 0; i < matchedTerms.size(); i++) {
            if (i > 0) {
                sb.append(" + ");
            }
            sb.append('\'').append(matchedTerms.get(i)).append('\'');
        }
        return sb.toString();
    }
}
