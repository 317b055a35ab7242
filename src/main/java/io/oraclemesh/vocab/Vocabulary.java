package io.oraclemesh.vocab;

import com.fasterxml.jackson.core.type.TypeReference;
import io.oraclemesh.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Custom term lists every validator matches tokens against. Terms are stored lower-case
 * and keep their declaration order.
 */
public record Vocabulary(
        Set<String> drugs,
        Set<String> symptoms,
        Set<String> tests
) {
    public static final String DEFAULT_RESOURCE = "/default-vocabulary.json";

    private static final TypeReference<Map<String, List<String>>> FILE_SHAPE = new TypeReference<>() {
    };

    public Vocabulary {
        drugs = normalize(drugs);
        symptoms = normalize(symptoms);
        tests = normalize(tests);
    }

    public static Vocabulary of(Set<String> drugs, Set<String> symptoms) {
        return new Vocabulary(drugs, symptoms, Set.of());
    }

    public static Vocabulary loadDefault() {
        try (InputStream in = Vocabulary.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing vocabulary resource: " + DEFAULT_RESOURCE);
            }
            return fromMap(Jsons.mapper().readValue(in, FILE_SHAPE));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read vocabulary resource: " + DEFAULT_RESOURCE, e);
        }
    }

    public static Vocabulary load(Path file) {
        try {
            return fromMap(Jsons.mapper().readValue(file.toFile(), FILE_SHAPE));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read vocabulary file: " + file, e);
        }
    }

    private static Vocabulary fromMap(Map<String, List<String>> raw) {
        if (raw == null) {
            throw new IllegalArgumentException("vocabulary file is empty");
        }
        return new Vocabulary(
                new LinkedHashSet<>(raw.getOrDefault("drugs", List.of())),
                new LinkedHashSet<>(raw.getOrDefault("symptoms", List.of())),
                new LinkedHashSet<>(raw.getOrDefault("tests", List.of()))
        );
    }

    private static Set<String> normalize(Set<String> terms) {
        if (terms == null || terms.isEmpty()) {
            return Set.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String term : terms) {
            if (term != null && !term.isBlank()) {
                out.add(term.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(out);
    }
}
