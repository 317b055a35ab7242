package io.oraclemesh.extract;

import io.oraclemesh.model.AnnotatedToken;

import java.util.List;

/**
 * Turns raw text into annotated tokens. Implementations throw
 * {@link ExtractionUnavailableException} when they cannot produce tokens at all.
 */
public interface EntityExtractor {
    String id();

    List<AnnotatedToken> extract(String text);
}
