package io.oraclemesh.ledger;

import io.oraclemesh.model.CanonicalRecord;
import io.oraclemesh.model.LedgerCommitment;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class InMemoryLedgerStore implements LedgerStore {
    private final ConcurrentMap<String, LedgerCommitment> commitments = new ConcurrentHashMap<>();
    private final String contractAddress;
    private final Clock clock;

    public InMemoryLedgerStore(String contractAddress) {
        this(contractAddress, Clock.systemUTC());
    }

    public InMemoryLedgerStore(String contractAddress, Clock clock) {
        this.contractAddress = contractAddress;
        this.clock = clock;
    }

    @Override
    public LedgerCommitment commit(CanonicalRecord record) {
        String digest = record.digest();
        LedgerCommitment candidate = new LedgerCommitment(
                record.runId(),
                digest,
                clock.instant().toString(),
                contractAddress
        );
        LedgerCommitment existing = commitments.putIfAbsent(record.runId(), candidate);
        if (existing == null) {
            return candidate;
        }
        if (existing.digest().equals(digest)) {
            return existing;
        }
        throw new LedgerCorruptionException(record.runId(), existing.digest(), digest);
    }

    @Override
    public Optional<LedgerCommitment> find(String storeKey) {
        return storeKey == null ? Optional.empty() : Optional.ofNullable(commitments.get(storeKey));
    }

    @Override
    public List<LedgerCommitment> list(int limit) {
        List<LedgerCommitment> out = new ArrayList<>(commitments.values());
        out.sort(Comparator.comparing(LedgerCommitment::committedAt).reversed());
        return List.copyOf(out.subList(0, Math.min(Math.max(1, limit), out.size())));
    }
}
