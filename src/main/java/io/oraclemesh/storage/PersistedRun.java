package io.oraclemesh.storage;

import io.oraclemesh.model.CanonicalRecord;
import io.oraclemesh.model.LedgerCommitment;

import java.util.List;

/**
 * What a run leaves behind: the canonical record, its digest, the node signatures
 * that backed it (empty for human provenance) and the ledger commitment.
 */
public record PersistedRun(
        String runId,
        CanonicalRecord record,
        String digest,
        List<String> signatures,
        LedgerCommitment commitment
) {
    public PersistedRun {
        signatures = signatures == null ? List.of() : List.copyOf(signatures);
    }
}
