package io.oraclemesh.consensus;

import io.oraclemesh.model.AnnotatedToken;
import io.oraclemesh.model.NodeAttestation;
import io.oraclemesh.security.Signer;
import io.oraclemesh.util.CanonicalJson;
import io.oraclemesh.util.Hashing;
import io.oraclemesh.validator.OracleNode;
import io.oraclemesh.validator.Validator;
import io.oraclemesh.vocab.Vocabulary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Barrier between the independent validator tasks and the ledger.
 *
 * <p>{@link #gather} runs one task per node and waits at most {@code nodeTimeoutMs}
 * from the start of the round; late or failing nodes count as abstaining.
 * {@link #reconcile} applies the k-of-n rule of the configured policy.
 */
public final class ConsensusCoordinator implements AutoCloseable {
    private final ExecutorService nodePool;
    private final long nodeTimeoutMs;
    private final ConsensusPolicy policy;
    private final Signer signer;

    public ConsensusCoordinator(long nodeTimeoutMs, ConsensusPolicy policy, Signer signer) {
        if (nodeTimeoutMs < 1L) {
            throw new IllegalArgumentException("nodeTimeoutMs must be positive: " + nodeTimeoutMs);
        }
        this.nodePool = Executors.newCachedThreadPool(new NodeThreadFactory());
        this.nodeTimeoutMs = nodeTimeoutMs;
        this.policy = policy == null ? ConsensusPolicy.FIRST_VALID : policy;
        this.signer = signer;
    }

    public ConsensusPolicy policy() {
        return policy;
    }

    public GatherResult gather(List<? extends OracleNode> validators, List<AnnotatedToken> tokens, Vocabulary vocab) {
        List<AnnotatedToken> frozen = tokens == null ? List.of() : List.copyOf(tokens);
        long startedAtNs = System.nanoTime();
        List<Future<NodeAttestation>> futures = new ArrayList<>(validators.size());
        for (OracleNode validator : validators) {
            futures.add(nodePool.submit(() -> validator.attest(frozen, vocab)));
        }

        long deadlineNs = startedAtNs + TimeUnit.MILLISECONDS.toNanos(nodeTimeoutMs);
        List<NodeAttestation> attestations = new ArrayList<>(validators.size());
        List<NodeReport> reports = new ArrayList<>(validators.size());
        for (int i = 0; i < validators.size(); i++) {
            String nodeId = validators.get(i).nodeId();
            Future<NodeAttestation> future = futures.get(i);
            NodeAttestation attestation = null;
            NodeReport.Status status;
            String error = null;
            try {
                long remainingNs = Math.max(0L, deadlineNs - System.nanoTime());
                attestation = future.get(remainingNs, TimeUnit.NANOSECONDS);
                status = attestation == null ? NodeReport.Status.ABSTAINED : NodeReport.Status.ATTESTED;
            } catch (TimeoutException e) {
                future.cancel(true);
                status = NodeReport.Status.TIMED_OUT;
                error = "no response within " + nodeTimeoutMs + "ms";
            } catch (ExecutionException e) {
                status = NodeReport.Status.FAILED;
                Throwable cause = e.getCause() == null ? e : e.getCause();
                error = cause.getClass().getSimpleName() + ": " + cause.getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                status = NodeReport.Status.FAILED;
                error = "interrupted while waiting for node";
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNs);
            attestations.add(attestation);
            reports.add(new NodeReport(nodeId, status, error, elapsedMs));
        }
        return new GatherResult(attestations, reports);
    }

    public ConsensusOutcome reconcile(List<NodeAttestation> attestations, int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("consensus threshold must be >= 1: " + threshold);
        }
        List<NodeAttestation> submitted = attestations == null ? List.of() : attestations;
        List<NodeAttestation> valid = new ArrayList<>();
        for (NodeAttestation attestation : submitted) {
            if (attestation != null && attestation.contributes() && isAuthentic(attestation)) {
                valid.add(attestation);
            }
        }
        if (valid.size() < threshold) {
            return ConsensusOutcome.failed(
                    submitted,
                    valid.size(),
                    threshold,
                    policy,
                    "only " + valid.size() + " of " + submitted.size() + " nodes produced valid entities, threshold=" + threshold
            );
        }
        return switch (policy) {
            case FIRST_VALID -> ConsensusOutcome.approved(
                    valid.get(0),
                    valid,
                    submitted,
                    valid.size(),
                    threshold,
                    policy,
                    allAgree(valid)
            );
            case PLURALITY -> reconcileByPlurality(submitted, valid, threshold);
        };
    }

    private ConsensusOutcome reconcileByPlurality(List<NodeAttestation> submitted, List<NodeAttestation> valid, int threshold) {
        Map<String, List<NodeAttestation>> byContent = new LinkedHashMap<>();
        for (NodeAttestation attestation : valid) {
            byContent.computeIfAbsent(contentDigest(attestation), k -> new ArrayList<>()).add(attestation);
        }
        List<NodeAttestation> winner = List.of();
        for (List<NodeAttestation> group : byContent.values()) {
            // insertion order keeps the earliest group on ties
            if (group.size() > winner.size()) {
                winner = group;
            }
        }
        if (winner.size() < threshold) {
            return ConsensusOutcome.failed(
                    submitted,
                    valid.size(),
                    threshold,
                    policy,
                    "largest agreeing group has " + winner.size() + " nodes, threshold=" + threshold
            );
        }
        return ConsensusOutcome.approved(
                winner.get(0),
                winner,
                submitted,
                valid.size(),
                threshold,
                policy,
                winner.size() == valid.size()
        );
    }

    private boolean isAuthentic(NodeAttestation attestation) {
        if (signer == null) {
            return true;
        }
        if (!signer.scheme().equals(attestation.signatureScheme())) {
            return false;
        }
        String recomputed = Validator.digestOf(attestation.validationPackage());
        return Hashing.constantTimeEquals(recomputed, attestation.digest())
                && signer.verify(attestation.digest(), attestation.signature(), attestation.nodeId());
    }

    private static boolean allAgree(List<NodeAttestation> valid) {
        String first = contentDigest(valid.get(0));
        for (NodeAttestation attestation : valid) {
            if (!first.equals(contentDigest(attestation))) {
                return false;
            }
        }
        return true;
    }

    static String contentDigest(NodeAttestation attestation) {
        return CanonicalJson.digest(attestation.validationPackage().entities());
    }

    @Override
    public void close() {
        nodePool.shutdownNow();
    }

    private static final class NodeThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "oracle-node-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
