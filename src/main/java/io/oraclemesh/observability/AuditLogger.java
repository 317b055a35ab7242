package io.oraclemesh.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.oraclemesh.security.SensitiveDataMasker;
import io.oraclemesh.util.Hashing;
import io.oraclemesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL audit trail. Every row carries the hash of the previous row and an
 * HMAC of its own hash, so truncation or edits show up in {@link #verifyIntegrity(int)}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String namespace;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String namespace, String signingSecret) {
        this(auditFile, namespace, signingSecret, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, String namespace, String signingSecret, Clock clock) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException alreadyCreated) {
                    // created by another process between exists() and createFile()
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("trace_id", event.traceId());
        row.put("run_id", event.runId());
        row.put("node_id", event.nodeId());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Walks the chain. {@code limit > 0} checks only the last {@code limit} rows; the
     * first of them is trusted as the chain anchor.
     */
    public synchronized IntegrityReport verifyIntegrity(int limit) {
        int totalRows = 0;
        int checkedRows = 0;
        int brokenLine = 0;
        String reason = "";
        String expectedPrev = null;
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            int start = limit > 0 && limit < lines.size() ? lines.size() - limit : 0;
            if (start == 0) {
                expectedPrev = "";
            }
            for (int i = start; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line == null || line.isBlank()) {
                    continue;
                }
                totalRows++;
                JsonNode parsed;
                try {
                    parsed = Jsons.mapper().readTree(line);
                } catch (JsonProcessingException e) {
                    parsed = null;
                }
                if (parsed == null || !parsed.isObject()) {
                    brokenLine = i + 1;
                    reason = "invalid_json";
                    break;
                }
                String hash = parsed.path("hash").asText("");
                String prevHash = parsed.path("prev_hash").asText("");
                if (expectedPrev != null && !prevHash.equals(expectedPrev)) {
                    brokenLine = i + 1;
                    reason = "prev_hash_mismatch";
                    break;
                }
                ObjectNode canonical = parsed.deepCopy();
                canonical.remove("hash");
                canonical.remove("signature");
                if (hash.isBlank() || !Hashing.sha256Hex(toCompactJson(canonical)).equals(hash)) {
                    brokenLine = i + 1;
                    reason = "hash_mismatch";
                    break;
                }
                if (!signingSecret.isBlank()) {
                    String signature = parsed.path("signature").asText("");
                    if (!Hashing.constantTimeEquals(Hashing.hmacSha256Hex(signingSecret, hash), signature)) {
                        brokenLine = i + 1;
                        reason = "signature_mismatch";
                        break;
                    }
                }
                checkedRows++;
                expectedPrev = hash;
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit integrity: " + auditFile, e);
        }
        return new IntegrityReport(brokenLine == 0, totalRows, checkedRows, brokenLine, reason,
                expectedPrev == null ? "" : expectedPrev);
    }

    public static String loadOrCreateSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit chain tail: " + auditFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    private static String toCompactJson(Object row) {
        return Jsons.toCompactJson(row);
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String traceId,
            String runId,
            String nodeId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String traceId,
                String runId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, traceId, runId, null, details == null ? Map.of() : details);
        }

        public static AuditEvent ofNode(
                String action,
                String nodeId,
                String result,
                String traceId,
                String runId,
                Map<String, Object> details
        ) {
            return new AuditEvent(
                    action,
                    "node",
                    "node/" + nodeId,
                    result,
                    traceId,
                    runId,
                    nodeId,
                    details == null ? Map.of() : details
            );
        }
    }

    public record IntegrityReport(
            boolean ok,
            int totalRows,
            int checkedRows,
            int brokenLine,
            String reason,
            String tailHash
    ) {
    }
}
