package io.oraclemesh.validator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Oracle nodes in registration order. Registration order is the node submission order
 * consensus relies on.
 */
public final class ValidatorRegistry {
    private final Map<String, OracleNode> validators = new LinkedHashMap<>();

    public synchronized void register(OracleNode validator) {
        if (validator.nodeId().startsWith("HITL_")) {
            throw new IllegalArgumentException("node id uses the human validator namespace: " + validator.nodeId());
        }
        if (validators.putIfAbsent(validator.nodeId(), validator) != null) {
            throw new IllegalArgumentException("validator already registered: " + validator.nodeId());
        }
    }

    public synchronized Optional<OracleNode> findById(String nodeId) {
        return Optional.ofNullable(validators.get(nodeId));
    }

    public synchronized List<OracleNode> inSubmissionOrder() {
        return List.copyOf(validators.values());
    }

    public synchronized List<String> listNodeIds() {
        return List.copyOf(validators.keySet());
    }
}
