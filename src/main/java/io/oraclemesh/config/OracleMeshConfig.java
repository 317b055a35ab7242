package io.oraclemesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class OracleMeshConfig {
    public static final String SETTINGS_FILE = "oraclemesh-settings.json";
    public static final String DEFAULT_CONTRACT_ADDRESS = "0x1234567890abcdef1234567890abcdef12345678";
    public static final int DEFAULT_CONSENSUS_THRESHOLD = 2;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7d;
    public static final long DEFAULT_NODE_TIMEOUT_MS = 5_000L;

    private final Path rootDir;

    public OracleMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static OracleMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new OracleMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path dbFile() {
        return rootDir.resolve("oraclemesh.db");
    }

    public Path recordsRoot() {
        return rootDir.resolve("records");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path nodeKeysFile() {
        return securityRoot().resolve("node-keys.json");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }

    public Path arbitrationRoot() {
        return rootDir.resolve("arbitration");
    }

    public Path arbitrationPending() {
        return arbitrationRoot().resolve("pending");
    }

    public Path arbitrationResolved() {
        return arbitrationRoot().resolve("resolved");
    }
}
