package io.oraclemesh.storage;

import java.util.Optional;

public interface RecordStore {
    void put(String key, PersistedRun run);

    Optional<PersistedRun> get(String key);
}
