package io.oraclemesh.rules;

import io.oraclemesh.model.EntityLabels;
import io.oraclemesh.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Conjunction of entity predicates. All of them must hold for the rule to match.
 */
public record Rule(
        String name,
        List<EntityPredicate> predicates
) {
    public static final String DEFAULT_RESOURCE = "/default-rule.json";

    public Rule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("rule name cannot be empty");
        }
        if (predicates == null || predicates.isEmpty()) {
            throw new IllegalArgumentException("rule needs at least one predicate: " + name);
        }
        predicates = List.copyOf(predicates);
    }

    /**
     * Reimbursement rule: a headache-like symptom treated with an approved analgesic.
     */
    public static Rule reimbursement() {
        return new Rule(
                "reimbursement",
                List.of(
                        new EntityPredicate(
                                EntityLabels.SYMPTOM,
                                List.of("headache", "headaches", "pain", "migraine"),
                                "headache synonym"
                        ),
                        new EntityPredicate(
                                EntityLabels.DRUG,
                                List.of("ibuprofen", "paracetamol", "aspirin"),
                                "approved drug"
                        )
                )
        );
    }

    public static Rule loadDefault() {
        try (InputStream in = Rule.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return reimbursement();
            }
            return Jsons.mapper().readValue(in, Rule.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read rule resource: " + DEFAULT_RESOURCE, e);
        }
    }

    public static Rule load(Path file) {
        try {
            return Jsons.mapper().readValue(file.toFile(), Rule.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read rule file: " + file, e);
        }
    }
}
