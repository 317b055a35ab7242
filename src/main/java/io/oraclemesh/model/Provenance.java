package io.oraclemesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Provenance {
    CONSENSUS("consensus"),
    CONSENSUS_PARTIAL("consensus_partial"),
    HUMAN("human");

    private final String wireName;

    Provenance(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Provenance fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("provenance cannot be empty");
        }
        for (Provenance value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown provenance: " + raw);
    }
}
