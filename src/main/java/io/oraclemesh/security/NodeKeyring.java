package io.oraclemesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.oraclemesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-node key material, created on first use and persisted as JSON.
 * A keyring built with a {@code null} file lives in memory only.
 */
public final class NodeKeyring {
    private static final String SCHEMA = "oraclemesh.node.keys.v1";
    private static final int HMAC_KEY_BYTES = 32;

    private final Path keyFile;
    private final SecureRandom secureRandom;
    private final LinkedHashMap<String, NodeKey> keys;

    public NodeKeyring(Path keyFile) {
        this.keyFile = keyFile;
        this.secureRandom = new SecureRandom();
        this.keys = new LinkedHashMap<>();
        loadExisting();
    }

    public static NodeKeyring inMemory() {
        return new NodeKeyring(null);
    }

    public synchronized NodeKey keyFor(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId cannot be empty");
        }
        NodeKey existing = keys.get(nodeId);
        if (existing != null) {
            return existing;
        }
        NodeKey created = generate(nodeId);
        keys.put(nodeId, created);
        persist();
        return created;
    }

    public synchronized Optional<NodeKey> find(String nodeId) {
        return Optional.ofNullable(keys.get(nodeId));
    }

    public synchronized List<String> nodeIds() {
        return List.copyOf(keys.keySet());
    }

    public Path keyFile() {
        return keyFile;
    }

    private NodeKey generate(String nodeId) {
        byte[] secret = new byte[HMAC_KEY_BYTES];
        secureRandom.nextBytes(secret);
        KeyPair pair;
        try {
            pair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Ed25519 is not available", e);
        }
        Base64.Encoder b64 = Base64.getEncoder();
        return new NodeKey(
                nodeId,
                b64.encodeToString(secret),
                b64.encodeToString(pair.getPrivate().getEncoded()),
                b64.encodeToString(pair.getPublic().getEncoded()),
                Instant.now().toEpochMilli()
        );
    }

    private void loadExisting() {
        if (keyFile == null || !Files.exists(keyFile)) {
            return;
        }
        try {
            JsonNode root = Jsons.mapper().readTree(Files.readString(keyFile, StandardCharsets.UTF_8));
            JsonNode nodes = root.path("nodes");
            if (!nodes.isObject()) {
                return;
            }
            nodes.fieldNames().forEachRemaining(nodeId -> {
                NodeKey key = Jsons.mapper().convertValue(nodes.path(nodeId), NodeKey.class);
                if (key != null && key.hmacSecret() != null && !key.hmacSecret().isBlank()) {
                    keys.put(nodeId, key);
                }
            });
        } catch (IOException | IllegalArgumentException e) {
            throw new RuntimeException("Failed to load node keyring: " + keyFile, e);
        }
    }

    private void persist() {
        if (keyFile == null) {
            return;
        }
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            ObjectNode root = Jsons.mapper().createObjectNode();
            root.put("schema", SCHEMA);
            Map<String, NodeKey> snapshot = new LinkedHashMap<>(keys);
            root.set("nodes", Jsons.mapper().valueToTree(snapshot));
            Files.writeString(keyFile, Jsons.toJson(root), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to persist node keyring: " + keyFile, e);
        }
    }
}
