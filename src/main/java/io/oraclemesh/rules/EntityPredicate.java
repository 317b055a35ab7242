package io.oraclemesh.rules;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * "There is an entity labelled {@code label} whose text is one of {@code terms}".
 * Terms are compared lower-case and whole-token, in declaration order.
 */
public record EntityPredicate(
        String label,
        List<String> terms,
        String description
) {
    public EntityPredicate {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("predicate label cannot be empty");
        }
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("predicate terms cannot be empty: " + label);
        }
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String term : terms) {
            if (term != null && !term.isBlank()) {
                normalized.add(term.trim().toLowerCase(Locale.ROOT));
            }
        }
        label = label.trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("predicate terms cannot be empty: " + label);
        }
        terms = List.copyOf(normalized);
    }
}
