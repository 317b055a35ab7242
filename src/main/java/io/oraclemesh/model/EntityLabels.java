package io.oraclemesh.model;

public final class EntityLabels {
    public static final String DRUG = "DRUG";
    public static final String SYMPTOM = "SYMPTOM";
    public static final String TEST = "TEST";

    private EntityLabels() {
    }
}
