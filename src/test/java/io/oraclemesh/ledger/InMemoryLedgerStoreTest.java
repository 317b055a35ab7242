package io.oraclemesh.ledger;

import io.oraclemesh.model.CanonicalRecord;
import io.oraclemesh.model.LedgerCommitment;
import io.oraclemesh.model.ValidatedEntity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

final class InMemoryLedgerStoreTest {

    @Test
    void commitThenVerifyDetectsMutation() {
        InMemoryLedgerStore ledger = new InMemoryLedgerStore(LedgerFixtures.CONTRACT);
        CanonicalRecord record = LedgerFixtures.record("run-1", 0.95d);

        LedgerCommitment commitment = ledger.commit(record);
        Assertions.assertEquals("run-1", commitment.storeKey());
        Assertions.assertEquals(record.digest(), commitment.digest());
        Assertions.assertEquals(LedgerFixtures.CONTRACT, commitment.contractAddress());
        Assertions.assertTrue(ledger.verify(record.digest(), commitment));

        List<ValidatedEntity> mutated = new ArrayList<>(record.entities());
        mutated.set(0, mutated.get(0).withConfidence(0.99d));
        Assertions.assertFalse(ledger.verify(record.withEntities(mutated).digest(), commitment));
    }

    @Test
    void verifyRejectsUnknownKeyAndForgedCommitment() {
        InMemoryLedgerStore ledger = new InMemoryLedgerStore(LedgerFixtures.CONTRACT);
        CanonicalRecord stored = LedgerFixtures.record("run-1", 0.95d);
        CanonicalRecord other = LedgerFixtures.record("run-1", 0.80d);
        LedgerCommitment commitment = ledger.commit(stored);

        LedgerCommitment forged = new LedgerCommitment("run-1", other.digest(), commitment.committedAt(), LedgerFixtures.CONTRACT);
        Assertions.assertFalse(ledger.verify(other.digest(), forged));
        Assertions.assertFalse(ledger.verify(stored.digest(),
                new LedgerCommitment("run-2", stored.digest(), commitment.committedAt(), LedgerFixtures.CONTRACT)));
        Assertions.assertFalse(ledger.verify(stored.digest(), null));
    }

    @Test
    void recommitIsIdempotentAndConflictIsCorruption() {
        InMemoryLedgerStore ledger = new InMemoryLedgerStore(LedgerFixtures.CONTRACT);
        LedgerCommitment first = ledger.commit(LedgerFixtures.record("run-1", 0.95d));
        LedgerCommitment again = ledger.commit(LedgerFixtures.record("run-1", 0.95d));

        Assertions.assertEquals(first, again);
        LedgerCorruptionException e = Assertions.assertThrows(LedgerCorruptionException.class,
                () -> ledger.commit(LedgerFixtures.record("run-1", 0.80d)));
        Assertions.assertEquals("run-1", e.storeKey());
        Assertions.assertEquals(first.digest(), e.storedDigest());
        Assertions.assertEquals(first, ledger.find("run-1").orElseThrow());
        Assertions.assertEquals(1, ledger.list(10).size());
    }

    @Test
    void concurrentIdenticalCommitsYieldOneEntry() throws Exception {
        InMemoryLedgerStore ledger = new InMemoryLedgerStore(LedgerFixtures.CONTRACT);
        List<LedgerCommitment> results = runConcurrently(16, i -> ledger.commit(LedgerFixtures.record("run-1", 0.95d)));

        for (LedgerCommitment result : results) {
            Assertions.assertEquals(results.get(0), result);
        }
        Assertions.assertEquals(1, ledger.list(100).size());
    }

    @Test
    void concurrentConflictingCommitsRaiseExactlyOnce() throws Exception {
        for (int round = 0; round < 20; round++) {
            InMemoryLedgerStore ledger = new InMemoryLedgerStore(LedgerFixtures.CONTRACT);
            String runId = "run-" + round;
            int[] outcome = commitPair(ledger, LedgerFixtures.record(runId, 0.95d), LedgerFixtures.record(runId, 0.80d));

            Assertions.assertEquals(1, outcome[0]);
            Assertions.assertEquals(1, outcome[1]);
        }
    }

    /**
     * @return {@code [successes, corruptions]}
     */
    static int[] commitPair(LedgerStore ledger, CanonicalRecord left, CanonicalRecord right) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<LedgerCommitment>> futures = new ArrayList<>();
            for (CanonicalRecord record : List.of(left, right)) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return ledger.commit(record);
                }));
            }
            start.countDown();
            int ok = 0;
            int corrupt = 0;
            for (Future<LedgerCommitment> future : futures) {
                try {
                    future.get();
                    ok++;
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof LedgerCorruptionException) {
                        corrupt++;
                    } else {
                        throw e;
                    }
                }
            }
            return new int[]{ok, corrupt};
        } finally {
            pool.shutdownNow();
        }
    }

    static <T> List<T> runConcurrently(int threads, IndexedTask<T> task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                int index = i;
                Callable<T> call = () -> {
                    start.await();
                    return task.run(index);
                };
                futures.add(pool.submit(call));
            }
            start.countDown();
            List<T> out = new ArrayList<>();
            for (Future<T> future : futures) {
                out.add(future.get());
            }
            return out;
        } finally {
            pool.shutdownNow();
        }
    }

    @FunctionalInterface
    interface IndexedTask<T> {
        T run(int index) throws Exception;
    }
}
