package io.oraclemesh.config;

import io.oraclemesh.consensus.ConsensusPolicy;
import io.oraclemesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tunables of one pipeline round. Values missing from the settings file, or outside
 * their allowed range, fall back to the defaults. A consensus threshold no node set
 * could reach is rejected.
 */
public record PipelineSettings(
        int consensusThreshold,
        double confidenceThreshold,
        long nodeTimeoutMs,
        List<String> nodeIds,
        String signatureScheme,
        ConsensusPolicy consensusPolicy,
        String contractAddress,
        Map<String, Double> nodeConfidenceThresholds
) {
    public static final String SCHEME_HMAC = "hmac-sha256";
    public static final String SCHEME_ED25519 = "ed25519";

    public PipelineSettings {
        nodeIds = List.copyOf(nodeIds);
        nodeConfidenceThresholds = nodeConfidenceThresholds == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(nodeConfidenceThresholds));
    }

    /**
     * Confidence threshold of one node; nodes without an override use the shared one.
     */
    public double confidenceThresholdFor(String nodeId) {
        Double override = nodeConfidenceThresholds.get(nodeId);
        return override == null ? confidenceThreshold : override;
    }

    public PipelineSettings withNodeConfidenceThresholds(Map<String, Double> overrides) {
        return new PipelineSettings(
                consensusThreshold,
                confidenceThreshold,
                nodeTimeoutMs,
                nodeIds,
                signatureScheme,
                consensusPolicy,
                contractAddress,
                overrides
        );
    }

    public PipelineSettings withConsensusPolicy(ConsensusPolicy policy) {
        return new PipelineSettings(
                consensusThreshold,
                confidenceThreshold,
                nodeTimeoutMs,
                nodeIds,
                signatureScheme,
                policy,
                contractAddress,
                nodeConfidenceThresholds
        );
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(
                OracleMeshConfig.DEFAULT_CONSENSUS_THRESHOLD,
                OracleMeshConfig.DEFAULT_CONFIDENCE_THRESHOLD,
                OracleMeshConfig.DEFAULT_NODE_TIMEOUT_MS,
                List.of("oracle-a", "oracle-b", "oracle-c"),
                SCHEME_HMAC,
                ConsensusPolicy.FIRST_VALID,
                OracleMeshConfig.DEFAULT_CONTRACT_ADDRESS,
                Map.of()
        );
    }

    public static PipelineSettings load(Path settingsFile) {
        PipelineSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read pipeline settings: " + settingsFile, e);
        }
    }

    static PipelineSettings fromFile(SettingsFile file, PipelineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        List<String> nodeIds = sanitizeNodeIds(file.nodeIds(), defaults.nodeIds());
        int threshold = file.consensusThreshold() == null || file.consensusThreshold() < 1
                ? defaults.consensusThreshold()
                : file.consensusThreshold();
        if (threshold > nodeIds.size()) {
            throw new IllegalArgumentException("consensus threshold " + threshold
                    + " exceeds the number of nodes (" + nodeIds.size() + ")");
        }
        double confidence = file.confidenceThreshold() == null
                || file.confidenceThreshold().isNaN()
                || file.confidenceThreshold() < 0.0d
                || file.confidenceThreshold() > 1.0d
                ? defaults.confidenceThreshold()
                : file.confidenceThreshold();
        long timeout = file.nodeTimeoutMs() == null || file.nodeTimeoutMs() < 1L
                ? defaults.nodeTimeoutMs()
                : file.nodeTimeoutMs();
        String scheme = sanitizeScheme(file.signatureScheme(), defaults.signatureScheme());
        ConsensusPolicy policy = file.consensusPolicy() == null || file.consensusPolicy().isBlank()
                ? defaults.consensusPolicy()
                : ConsensusPolicy.fromString(file.consensusPolicy());
        String contract = file.contractAddress() == null || file.contractAddress().isBlank()
                ? defaults.contractAddress()
                : file.contractAddress().trim();
        Map<String, Double> overrides = sanitizeOverrides(file.nodeConfidenceThresholds(), nodeIds);
        return new PipelineSettings(threshold, confidence, timeout, nodeIds, scheme, policy, contract, overrides);
    }

    private static List<String> sanitizeNodeIds(List<String> raw, List<String> fallback) {
        if (raw == null || raw.isEmpty()) {
            return fallback;
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String id : raw) {
            if (id == null || id.isBlank()) {
                continue;
            }
            String trimmed = id.trim();
            if (trimmed.startsWith("HITL_")) {
                throw new IllegalArgumentException("node id uses the human validator namespace: " + trimmed);
            }
            unique.add(trimmed);
        }
        return unique.isEmpty() ? fallback : new ArrayList<>(unique);
    }

    private static Map<String, Double> sanitizeOverrides(Map<String, Double> raw, List<String> nodeIds) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            Double value = entry.getValue();
            if (!nodeIds.contains(entry.getKey()) || value == null || value.isNaN() || value < 0.0d || value > 1.0d) {
                continue;
            }
            out.put(entry.getKey(), value);
        }
        return out;
    }

    private static String sanitizeScheme(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (SCHEME_HMAC.equals(normalized) || SCHEME_ED25519.equals(normalized)) {
            return normalized;
        }
        throw new IllegalArgumentException("Unknown signature scheme: " + raw);
    }

    record SettingsFile(
            Integer consensusThreshold,
            Double confidenceThreshold,
            Long nodeTimeoutMs,
            List<String> nodeIds,
            String signatureScheme,
            String consensusPolicy,
            String contractAddress,
            Map<String, Double> nodeConfidenceThresholds
    ) {
    }
}
