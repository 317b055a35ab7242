package io.oraclemesh.storage;

import io.oraclemesh.util.Hashing;
import io.oraclemesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * One pretty-printed JSON file per run under the records directory. Writes go to a
 * temp file first and are moved into place atomically.
 *
 * <p>Keys made only of {@code [A-Za-z0-9_.-]} (and not starting with a dot) are used
 * as file names directly. Any other key is sanitized and suffixed with {@code ~} and
 * the SHA-256 of the raw key; {@code ~} never occurs in a direct name, so distinct
 * keys never share a file.
 */
public final class FileRecordStore implements RecordStore {
    private final Path root;

    public FileRecordStore(Path root) {
        this.root = root;
    }

    @Override
    public void put(String key, PersistedRun run) {
        Path target = fileFor(key);
        Path tmp = null;
        try {
            Files.createDirectories(root);
            tmp = Files.createTempFile(root, target.getFileName().toString(), ".tmp");
            Files.writeString(tmp, Jsons.toJson(run), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new RuntimeException("Failed to write record: " + key, e);
        }
    }

    @Override
    public Optional<PersistedRun> get(String key) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.mapper().readValue(Files.readString(file, StandardCharsets.UTF_8), PersistedRun.class));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read record: " + key, e);
        }
    }

    Path fileFor(String key) {
        return root.resolve(safeKey(key) + ".json");
    }

    static String safeKey(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("record key cannot be empty");
        }
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        if (value.startsWith(".")) {
            value = "run" + value;
        }
        if (value.equals(raw)) {
            return value;
        }
        if (value.length() > 64) {
            value = value.substring(0, 64);
        }
        return value + "~" + Hashing.sha256Hex(raw);
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException ignored) {
            // the write already failed; that error is the one reported
        }
    }
}
