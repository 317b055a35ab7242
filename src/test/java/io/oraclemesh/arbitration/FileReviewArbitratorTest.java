package io.oraclemesh.arbitration;

import io.oraclemesh.model.CorrectedRecord;
import io.oraclemesh.model.EntityLabels;
import io.oraclemesh.model.ValidatedEntity;
import io.oraclemesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

final class FileReviewArbitratorTest {

    @Test
    void returnsReviewerDecisionAndClosesCase() throws Exception {
        Path root = Files.createTempDirectory("oraclemesh-test-review-");
        try {
            FileReviewArbitrator arbitrator = new FileReviewArbitrator(
                    root.resolve("pending"), root.resolve("resolved"), 10_000L, 20L
            );
            String text = "Patient reports headache after MRI";
            String caseId = FileReviewArbitrator.caseIdFor(text);
            Thread reviewer = new Thread(() -> answerWhenPending(
                    arbitrator, caseId,
                    new CorrectedRecord(
                            List.of(new ValidatedEntity("headache", EntityLabels.SYMPTOM, 0.95d)),
                            "extractor missed the symptom",
                            "HITL_042",
                            "2024-03-01T10:05:00Z"
                    )
            ));
            reviewer.start();

            CorrectedRecord record = arbitrator.arbitrate(text, Arrays.asList(null, null, null));
            reviewer.join(5_000L);

            Assertions.assertEquals("HITL_042", record.validatorId());
            Assertions.assertEquals(1, record.entities().size());
            Assertions.assertFalse(Files.exists(arbitrator.pendingFile(caseId)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void timesOutWithCaseLeftPending() throws Exception {
        Path root = Files.createTempDirectory("oraclemesh-test-review-timeout-");
        try {
            FileReviewArbitrator arbitrator = new FileReviewArbitrator(
                    root.resolve("pending"), root.resolve("resolved"), 50L, 10L
            );
            String text = "no reviewer on duty";

            Assertions.assertThrows(ArbitrationUnavailableException.class, () -> arbitrator.arbitrate(text, List.of()));

            Path pending = arbitrator.pendingFile(FileReviewArbitrator.caseIdFor(text));
            Assertions.assertTrue(Files.exists(pending));
            FileReviewArbitrator.ArbitrationCase reviewCase = Jsons.mapper().readValue(
                    Files.readString(pending, StandardCharsets.UTF_8), FileReviewArbitrator.ArbitrationCase.class
            );
            Assertions.assertEquals(text, reviewCase.originalText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectsDecisionWithoutHumanValidatorId() throws Exception {
        Path root = Files.createTempDirectory("oraclemesh-test-review-prefix-");
        try {
            FileReviewArbitrator arbitrator = new FileReviewArbitrator(
                    root.resolve("pending"), root.resolve("resolved"), 1_000L, 10L
            );
            String text = "bot pretending to be a reviewer";
            Files.createDirectories(root.resolve("resolved"));
            Files.writeString(
                    arbitrator.resolvedFile(FileReviewArbitrator.caseIdFor(text)),
                    Jsons.toJson(new CorrectedRecord(List.of(), "auto", "oracle-a", "2024-03-01T10:05:00Z")),
                    StandardCharsets.UTF_8
            );

            Assertions.assertThrows(IllegalStateException.class, () -> arbitrator.arbitrate(text, List.of()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fixedReviewerCarriesHumanProvenance() {
        CorrectedRecord record = FixedCorrectionArbitrator.defaultReviewer().arbitrate("anything", List.of());

        Assertions.assertEquals("HITL_001", record.validatorId());
        Assertions.assertTrue(record.hasHumanValidatorId());
        Assertions.assertEquals(4, record.entities().size());
        Assertions.assertEquals("Low confidence in NLP extraction for 'MRI'", record.correctionReason());
        Assertions.assertThrows(IllegalStateException.class, () -> HumanArbitrator.requireHumanProvenance(
                new CorrectedRecord(List.of(), "reason", "HITL_", "2024-03-01T10:05:00Z")
        ));
        Assertions.assertThrows(IllegalStateException.class, () -> HumanArbitrator.requireHumanProvenance(null));
    }

    private static void answerWhenPending(FileReviewArbitrator arbitrator, String caseId, CorrectedRecord decision) {
        try {
            long deadline = System.currentTimeMillis() + 5_000L;
            while (!Files.exists(arbitrator.pendingFile(caseId)) && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            Path target = arbitrator.resolvedFile(caseId);
            Path tmp = target.resolveSibling(caseId + ".json.tmp");
            Files.writeString(tmp, Jsons.toJson(decision), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | InterruptedException e) {
            throw new RuntimeException(e);
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
