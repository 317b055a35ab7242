package io.oraclemesh.model;

public record ValidatedEntity(
        String text,
        String label,
        double confidence
) {
    public ValidatedEntity {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("entity text cannot be empty");
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("entity label cannot be empty: " + text);
        }
        if (Double.isNaN(confidence) || confidence < 0.0d || confidence > 1.0d) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
    }

    public ValidatedEntity withConfidence(double value) {
        return new ValidatedEntity(text, label, value);
    }
}
