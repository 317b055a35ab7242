package io.oraclemesh.ledger;

import io.oraclemesh.model.CanonicalRecord;
import io.oraclemesh.model.LedgerCommitment;
import io.oraclemesh.util.Hashing;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of record digests, keyed by run id.
 *
 * <p>A key is written once. Committing the same digest again returns the stored
 * commitment; committing a different digest under a stored key throws
 * {@link LedgerCorruptionException}.
 */
public interface LedgerStore {
    LedgerCommitment commit(CanonicalRecord record);

    Optional<LedgerCommitment> find(String storeKey);

    List<LedgerCommitment> list(int limit);

    /**
     * True only when {@code commitment} is the one actually stored under its key and
     * its digest equals {@code candidateDigest}.
     */
    default boolean verify(String candidateDigest, LedgerCommitment commitment) {
        if (candidateDigest == null || commitment == null || commitment.storeKey() == null) {
            return false;
        }
        Optional<LedgerCommitment> stored = find(commitment.storeKey());
        if (stored.isEmpty()) {
            return false;
        }
        boolean sameCommitment = Hashing.constantTimeEquals(stored.get().digest(), commitment.digest());
        boolean sameRecord = Hashing.constantTimeEquals(stored.get().digest(), candidateDigest);
        return sameCommitment & sameRecord;
    }
}
