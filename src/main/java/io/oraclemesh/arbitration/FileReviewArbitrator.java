package io.oraclemesh.arbitration;

import io.oraclemesh.model.CorrectedRecord;
import io.oraclemesh.model.NodeAttestation;
import io.oraclemesh.model.ValidatedEntity;
import io.oraclemesh.util.Hashing;
import io.oraclemesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Review queue on the file system.
 *
 * <p>A failed round writes {@code pending/<caseId>.json} with the original text and the
 * disagreeing node outputs. A reviewer answers by dropping a {@link CorrectedRecord} as
 * {@code resolved/<caseId>.json}. The case id is derived from the text, so re-running
 * the same report finds an earlier decision.
 */
public final class FileReviewArbitrator implements HumanArbitrator {
    private static final long MIN_POLL_MS = 10L;

    private final Path pendingDir;
    private final Path resolvedDir;
    private final long waitMs;
    private final long pollMs;

    public FileReviewArbitrator(Path pendingDir, Path resolvedDir, long waitMs, long pollMs) {
        this.pendingDir = pendingDir;
        this.resolvedDir = resolvedDir;
        this.waitMs = Math.max(0L, waitMs);
        this.pollMs = Math.max(MIN_POLL_MS, pollMs);
    }

    @Override
    public String id() {
        return "file";
    }

    public static String caseIdFor(String originalText) {
        return "case_" + Hashing.sha256Hex(originalText == null ? "" : originalText).substring(0, 16);
    }

    public Path pendingFile(String caseId) {
        return pendingDir.resolve(caseId + ".json");
    }

    public Path resolvedFile(String caseId) {
        return resolvedDir.resolve(caseId + ".json");
    }

    @Override
    public CorrectedRecord arbitrate(String originalText, List<NodeAttestation> attestations) {
        String caseId = caseIdFor(originalText);
        Path resolved = resolvedFile(caseId);
        if (!Files.exists(resolved)) {
            openCase(caseId, originalText, attestations);
        }
        long deadline = System.currentTimeMillis() + waitMs;
        while (!Files.exists(resolved)) {
            if (System.currentTimeMillis() >= deadline) {
                throw new ArbitrationUnavailableException(
                        "no reviewer decision for " + caseId + " within " + waitMs + "ms, case file: " + pendingFile(caseId)
                );
            }
            try {
                Thread.sleep(pollMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ArbitrationUnavailableException("interrupted while waiting for " + caseId, e);
            }
        }
        CorrectedRecord record = readDecision(resolved);
        try {
            Files.deleteIfExists(pendingFile(caseId));
        } catch (IOException e) {
            throw new RuntimeException("Failed to close arbitration case: " + caseId, e);
        }
        return HumanArbitrator.requireHumanProvenance(record);
    }

    private void openCase(String caseId, String originalText, List<NodeAttestation> attestations) {
        List<NodeOutput> outputs = new ArrayList<>();
        List<NodeAttestation> slots = attestations == null ? List.of() : attestations;
        for (int i = 0; i < slots.size(); i++) {
            NodeAttestation attestation = slots.get(i);
            if (attestation == null || attestation.validationPackage() == null) {
                outputs.add(new NodeOutput(i, null, "abstained", List.of()));
            } else {
                outputs.add(new NodeOutput(
                        i,
                        attestation.nodeId(),
                        attestation.validationPackage().status(),
                        attestation.validationPackage().entities()
                ));
            }
        }
        ArbitrationCase reviewCase = new ArbitrationCase(caseId, originalText, outputs, Instant.now().toString());
        Path target = pendingFile(caseId);
        Path tmp = pendingDir.resolve(caseId + ".json.tmp");
        try {
            Files.createDirectories(pendingDir);
            Files.createDirectories(resolvedDir);
            Files.writeString(tmp, Jsons.toJson(reviewCase), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to open arbitration case: " + caseId, e);
        }
    }

    private CorrectedRecord readDecision(Path resolved) {
        try {
            return Jsons.mapper().readValue(Files.readString(resolved, StandardCharsets.UTF_8), CorrectedRecord.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new ArbitrationUnavailableException("unreadable reviewer decision: " + resolved, e);
        }
    }

    public record ArbitrationCase(
            String caseId,
            String originalText,
            List<NodeOutput> nodeOutputs,
            String openedAt
    ) {
    }

    public record NodeOutput(
            int slot,
            String nodeId,
            String status,
            List<ValidatedEntity> entities
    ) {
    }
}
