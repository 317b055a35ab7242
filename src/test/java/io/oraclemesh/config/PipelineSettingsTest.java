package io.oraclemesh.config;

import io.oraclemesh.consensus.ConsensusPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class PipelineSettingsTest {

    @Test
    void missingFileGivesDefaults() throws Exception {
        Path root = Files.createTempDirectory("oraclemesh-test-settings-");
        try {
            PipelineSettings settings = PipelineSettings.load(OracleMeshConfig.fromRoot(root.toString()).settingsFile());

            Assertions.assertEquals(2, settings.consensusThreshold());
            Assertions.assertEquals(0.7d, settings.confidenceThreshold());
            Assertions.assertEquals(5_000L, settings.nodeTimeoutMs());
            Assertions.assertEquals(List.of("oracle-a", "oracle-b", "oracle-c"), settings.nodeIds());
            Assertions.assertEquals(PipelineSettings.SCHEME_HMAC, settings.signatureScheme());
            Assertions.assertEquals(ConsensusPolicy.FIRST_VALID, settings.consensusPolicy());
            Assertions.assertEquals(OracleMeshConfig.DEFAULT_CONTRACT_ADDRESS, settings.contractAddress());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesOverrideAndOutOfRangeValuesFallBack() throws Exception {
        Path root = Files.createTempDirectory("oraclemesh-test-settings-file-");
        try {
            Path file = root.resolve(OracleMeshConfig.SETTINGS_FILE);
            Files.writeString(file, """
                    {
                      "consensusThreshold": 3,
                      "confidenceThreshold": 1.7,
                      "nodeTimeoutMs": -1,
                      "nodeIds": ["n1", "n2", "n2", " ", "n3", "n4"],
                      "signatureScheme": "Ed25519",
                      "consensusPolicy": "plurality",
                      "nodeConfidenceThresholds": {"n2": 0.95, "n9": 0.5, "n3": 2.0},
                      "unknownKey": true
                    }
                    """, StandardCharsets.UTF_8);

            PipelineSettings settings = PipelineSettings.load(file);
            Assertions.assertEquals(3, settings.consensusThreshold());
            Assertions.assertEquals(0.7d, settings.confidenceThreshold());
            Assertions.assertEquals(5_000L, settings.nodeTimeoutMs());
            Assertions.assertEquals(List.of("n1", "n2", "n3", "n4"), settings.nodeIds());
            Assertions.assertEquals(PipelineSettings.SCHEME_ED25519, settings.signatureScheme());
            Assertions.assertEquals(ConsensusPolicy.PLURALITY, settings.consensusPolicy());
            Assertions.assertEquals(0.95d, settings.confidenceThresholdFor("n2"));
            Assertions.assertEquals(0.7d, settings.confidenceThresholdFor("n3"));
            Assertions.assertFalse(settings.nodeConfidenceThresholds().containsKey("n9"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownSchemePolicyOrHumanNodeIdIsRejected() throws Exception {
        Path root = Files.createTempDirectory("oraclemesh-test-settings-bad-");
        try {
            Path file = root.resolve(OracleMeshConfig.SETTINGS_FILE);
            Files.writeString(file, "{\"signatureScheme\":\"md5\"}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> PipelineSettings.load(file));

            Files.writeString(file, "{\"consensusPolicy\":\"majority\"}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> PipelineSettings.load(file));

            Files.writeString(file, "{\"nodeIds\":[\"oracle-a\",\"HITL_001\"]}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> PipelineSettings.load(file));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void thresholdAboveNodeCountIsRejected() throws Exception {
        Path root = Files.createTempDirectory("oraclemesh-test-settings-quorum-");
        try {
            Path file = root.resolve(OracleMeshConfig.SETTINGS_FILE);
            Files.writeString(file, "{\"consensusThreshold\":4,\"nodeIds\":[\"a\",\"b\",\"c\"]}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> PipelineSettings.load(file));

            // default node set has three members
            Files.writeString(file, "{\"consensusThreshold\":4}", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> PipelineSettings.load(file));

            Files.writeString(file, "{\"consensusThreshold\":3,\"nodeIds\":[\"a\",\"b\",\"c\"]}", StandardCharsets.UTF_8);
            Assertions.assertEquals(3, PipelineSettings.load(file).consensusThreshold());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
