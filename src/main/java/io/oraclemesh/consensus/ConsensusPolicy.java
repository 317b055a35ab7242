package io.oraclemesh.consensus;

public enum ConsensusPolicy {
    /**
     * Participation threshold: enough nodes returned entities, the first valid one in
     * submission order becomes canonical.
     */
    FIRST_VALID("first-valid"),
    /**
     * Content threshold: valid packages are grouped by entity digest, and the largest
     * group must reach the threshold.
     */
    PLURALITY("plurality");

    private final String configName;

    ConsensusPolicy(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static ConsensusPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return FIRST_VALID;
        }
        for (ConsensusPolicy value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.configName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown consensus policy: " + raw);
    }
}
