package io.oraclemesh.model;

/**
 * One token as produced by the entity extractor.
 *
 * @param text            raw token text
 * @param recognizedLabel extractor label, or {@code null} when the extractor did not tag the token
 */
public record AnnotatedToken(
        String text,
        String recognizedLabel
) {
    public AnnotatedToken {
        if (text == null) {
            throw new IllegalArgumentException("token text cannot be null");
        }
        if (recognizedLabel != null && recognizedLabel.isBlank()) {
            recognizedLabel = null;
        }
    }

    public static AnnotatedToken plain(String text) {
        return new AnnotatedToken(text, null);
    }

    public static AnnotatedToken labelled(String text, String label) {
        return new AnnotatedToken(text, label);
    }

    public boolean hasLabel() {
        return recognizedLabel != null;
    }
}
