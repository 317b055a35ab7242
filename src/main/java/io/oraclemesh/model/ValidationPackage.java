package io.oraclemesh.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Entities validated by one oracle node together with the node's metadata.
 *
 * <p>Entities keep the order of the tokens they were derived from.
 */
public record ValidationPackage(
        List<ValidatedEntity> entities,
        String timestamp,
        String sourceNodeId,
        String source,
        String status
) {
    public static final String STATUS_VALIDATED = "validated";
    public static final String STATUS_NO_VALID_ENTITIES = "no valid entities";
    public static final String DEFAULT_SOURCE = "NLP Module";

    public ValidationPackage {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entities.isEmpty();
    }
}
