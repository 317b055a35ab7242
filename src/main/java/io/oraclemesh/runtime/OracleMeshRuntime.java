package io.oraclemesh.runtime;

import io.oraclemesh.arbitration.ArbitrationUnavailableException;
import io.oraclemesh.arbitration.FileReviewArbitrator;
import io.oraclemesh.arbitration.HumanArbitrator;
import io.oraclemesh.config.OracleMeshConfig;
import io.oraclemesh.config.PipelineSettings;
import io.oraclemesh.consensus.ConsensusCoordinator;
import io.oraclemesh.consensus.ConsensusOutcome;
import io.oraclemesh.consensus.GatherResult;
import io.oraclemesh.consensus.NodeReport;
import io.oraclemesh.extract.EntityExtractor;
import io.oraclemesh.extract.ExtractionUnavailableException;
import io.oraclemesh.ledger.LedgerCorruptionException;
import io.oraclemesh.ledger.LedgerStore;
import io.oraclemesh.ledger.SqliteLedgerStore;
import io.oraclemesh.model.AnnotatedToken;
import io.oraclemesh.model.CanonicalRecord;
import io.oraclemesh.model.CorrectedRecord;
import io.oraclemesh.model.LedgerCommitment;
import io.oraclemesh.model.RuleEvaluationResult;
import io.oraclemesh.observability.AuditLogger;
import io.oraclemesh.observability.TraceContextUtil;
import io.oraclemesh.rules.ActionTrigger;
import io.oraclemesh.rules.Rule;
import io.oraclemesh.rules.RuleEngine;
import io.oraclemesh.security.NodeKey;
import io.oraclemesh.security.NodeKeyring;
import io.oraclemesh.security.Signer;
import io.oraclemesh.security.Signers;
import io.oraclemesh.storage.Database;
import io.oraclemesh.storage.FileRecordStore;
import io.oraclemesh.storage.PersistedRun;
import io.oraclemesh.storage.RecordStore;
import io.oraclemesh.validator.OracleNode;
import io.oraclemesh.validator.Validator;
import io.oraclemesh.validator.ValidatorRegistry;
import io.oraclemesh.vocab.Vocabulary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class OracleMeshRuntime implements AutoCloseable {
    private static final String NAMESPACE = "oraclemesh";
    private static final long REVIEW_POLL_MS = 200L;

    private final OracleMeshConfig config;
    private final PipelineSettings settings;
    private final Database database;
    private final NodeKeyring keyring;
    private final Signer signer;
    private final ValidatorRegistry registry;
    private final ConsensusCoordinator coordinator;
    private final LedgerStore ledger;
    private final RecordStore recordStore;
    private final Vocabulary vocabulary;
    private final Rule rule;
    private final RuleEngine ruleEngine;
    private final AuditLogger auditLogger;
    private final ActionTrigger actionTrigger;

    public OracleMeshRuntime(OracleMeshConfig config) {
        this(config, PipelineSettings.load(config.settingsFile()), Vocabulary.loadDefault(), Rule.loadDefault(), null, null);
    }

    /**
     * @param ledger        ledger to commit to; {@code null} uses the SQLite ledger under the root
     * @param actionTrigger called for matched rules; {@code null} only records the action in the audit log
     */
    public OracleMeshRuntime(
            OracleMeshConfig config,
            PipelineSettings settings,
            Vocabulary vocabulary,
            Rule rule,
            LedgerStore ledger,
            ActionTrigger actionTrigger
    ) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        this.keyring = new NodeKeyring(config.nodeKeysFile());
        this.signer = Signers.forScheme(settings.signatureScheme(), keyring);
        this.registry = new ValidatorRegistry();
        for (String nodeId : settings.nodeIds()) {
            registry.register(new Validator(nodeId, keyring.keyFor(nodeId), signer, settings.confidenceThresholdFor(nodeId)));
        }
        this.coordinator = new ConsensusCoordinator(settings.nodeTimeoutMs(), settings.consensusPolicy(), signer);
        this.ledger = ledger == null ? new SqliteLedgerStore(database, settings.contractAddress()) : ledger;
        this.recordStore = new FileRecordStore(config.recordsRoot());
        this.vocabulary = vocabulary;
        this.rule = rule;
        this.ruleEngine = new RuleEngine(this.ledger);
        this.auditLogger = new AuditLogger(
                config.auditFile(),
                NAMESPACE,
                AuditLogger.loadOrCreateSigningSecret(config.auditSigningKeyFile())
        );
        this.actionTrigger = actionTrigger == null ? this::auditAction : actionTrigger;
    }

    public void init() {
        database.init();
        auditLogger.log(AuditLogger.AuditEvent.of(
                "runtime.init",
                "cli",
                "runtime/" + config.rootDir().getFileName(),
                "ok",
                null,
                null,
                Map.of(
                        "nodes", registry.listNodeIds(),
                        "consensus_threshold", settings.consensusThreshold(),
                        "policy", settings.consensusPolicy().configName(),
                        "signature_scheme", signer.scheme()
                )
        ));
    }

    public PipelineSettings settings() {
        return settings;
    }

    public LedgerStore ledger() {
        return ledger;
    }

    public RecordStore recordStore() {
        return recordStore;
    }

    public ValidatorRegistry registry() {
        return registry;
    }

    public Rule rule() {
        return rule;
    }

    public FileReviewArbitrator reviewQueue(long waitMs) {
        return new FileReviewArbitrator(config.arbitrationPending(), config.arbitrationResolved(), waitMs, REVIEW_POLL_MS);
    }

    /**
     * One round: extract, gather attestations, reconcile, fall back to human review when
     * consensus fails, commit, persist and evaluate the rule over the committed record.
     *
     * @throws ExtractionUnavailableException before any node runs; nothing is persisted
     * @throws LedgerCorruptionException      when {@code runId} already holds a different record
     */
    public RunOutcome run(String runId, String text, EntityExtractor extractor, HumanArbitrator arbitrator) {
        String resolvedRunId = runId == null || runId.isBlank() ? TraceContextUtil.newRunId() : runId.trim();
        String traceId = TraceContextUtil.newTraceId();

        List<AnnotatedToken> tokens;
        try {
            tokens = extractor.extract(text);
        } catch (ExtractionUnavailableException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "run.extract",
                    "extractor/" + extractor.id(),
                    "run/" + resolvedRunId,
                    "unavailable",
                    traceId,
                    resolvedRunId,
                    Map.of("error", String.valueOf(e.getMessage()))
            ));
            throw e;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "run.extract",
                "extractor/" + extractor.id(),
                "run/" + resolvedRunId,
                "ok",
                traceId,
                resolvedRunId,
                Map.of("annotations", tokens.size())
        ));

        List<OracleNode> nodes = registry.inSubmissionOrder();
        GatherResult gathered = coordinator.gather(nodes, tokens, vocabulary);
        for (NodeReport report : gathered.reports()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("elapsed_ms", report.elapsedMs());
            if (report.error() != null) {
                details.put("error", report.error());
            }
            auditLogger.log(AuditLogger.AuditEvent.ofNode(
                    "node.attest",
                    report.nodeId(),
                    report.status().name().toLowerCase(Locale.ROOT),
                    traceId,
                    resolvedRunId,
                    details
            ));
        }

        ConsensusOutcome consensus = coordinator.reconcile(gathered.attestations(), settings.consensusThreshold());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "consensus.reconcile",
                "coordinator",
                "run/" + resolvedRunId,
                consensus.approved() ? "approved" : "failed",
                traceId,
                resolvedRunId,
                consensusDetails(consensus)
        ));

        CanonicalRecord record;
        CorrectedRecord correction = null;
        List<String> signatures;
        if (consensus.approved()) {
            record = CanonicalRecord.fromConsensus(resolvedRunId, consensus.canonicalPackage(), consensus.partial());
            signatures = consensus.contributingSignatures();
        } else {
            correction = arbitrate(resolvedRunId, traceId, text, consensus, arbitrator);
            record = CanonicalRecord.fromArbitration(resolvedRunId, correction);
            signatures = List.of();
        }

        LedgerCommitment commitment;
        try {
            commitment = ledger.commit(record);
        } catch (LedgerCorruptionException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "ledger.commit",
                    "runtime",
                    "ledger/" + resolvedRunId,
                    "corruption",
                    traceId,
                    resolvedRunId,
                    Map.of("stored_digest", e.storedDigest(), "attempted_digest", e.attemptedDigest())
            ));
            throw e;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "ledger.commit",
                "runtime",
                "ledger/" + resolvedRunId,
                "committed",
                traceId,
                resolvedRunId,
                Map.of(
                        "digest", commitment.digest(),
                        "contract_address", commitment.contractAddress(),
                        "provenance", record.provenance().wireName()
                )
        ));
        recordStore.put(resolvedRunId, new PersistedRun(resolvedRunId, record, commitment.digest(), signatures, commitment));

        RuleEvaluationResult ruleResult = evaluate(record, commitment, traceId);
        return new RunOutcome(
                resolvedRunId,
                traceId,
                gathered.reports(),
                consensus,
                correction,
                record,
                commitment,
                ruleResult
        );
    }

    /**
     * Rule evaluation over a caller-supplied record, gated by the ledger commitment.
     */
    public RuleEvaluationResult evaluate(CanonicalRecord record, LedgerCommitment commitment) {
        return evaluate(record, commitment, TraceContextUtil.newTraceId());
    }

    private RuleEvaluationResult evaluate(CanonicalRecord record, LedgerCommitment commitment, String traceId) {
        String runId = commitment == null ? null : commitment.storeKey();
        RuleEvaluationResult result = ruleEngine.evaluate(record, commitment, rule);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("rule", rule.name());
        details.put("reason", result.reason().name());
        if (result.matchedCondition() != null) {
            details.put("matched_condition", result.matchedCondition());
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "rule.evaluate",
                "rule-engine",
                "rule/" + rule.name(),
                result.reason() == RuleEvaluationResult.Reason.INTEGRITY_MISMATCH ? "integrity_mismatch"
                        : result.matched() ? "matched" : "no_match",
                traceId,
                runId,
                details
        ));
        if (result.actionTriggered()) {
            actionTrigger.fire(record, result);
        }
        return result;
    }

    public Optional<LedgerCommitment> ledgerEntry(String runId) {
        return ledger.find(runId);
    }

    public List<LedgerCommitment> ledgerEntries(int limit) {
        return ledger.list(limit);
    }

    /**
     * Recomputes the digest of the persisted record and checks it against the ledger
     * entry stored under {@code runId}. A record file that belongs to another run never
     * verifies.
     */
    public RecordVerification verifyRecord(String runId) {
        Optional<PersistedRun> persisted = recordStore.get(runId);
        Optional<LedgerCommitment> committed = ledger.find(runId);
        if (persisted.isEmpty()) {
            return new RecordVerification(runId, false, committed.isPresent(), false, null,
                    committed.map(LedgerCommitment::digest).orElse(null));
        }
        String recomputed = persisted.get().record().digest();
        boolean sameRun = runId.equals(persisted.get().runId())
                && runId.equals(persisted.get().record().runId());
        boolean verified = sameRun
                && committed.isPresent()
                && ledger.verify(recomputed, committed.get());
        RecordVerification out = new RecordVerification(
                runId,
                true,
                committed.isPresent(),
                verified,
                recomputed,
                committed.map(LedgerCommitment::digest).orElse(null)
        );
        auditLogger.log(AuditLogger.AuditEvent.of(
                "record.verify",
                "cli",
                "record/" + runId,
                verified ? "ok" : "mismatch",
                null,
                runId,
                Map.of("recomputed_digest", recomputed)
        ));
        return out;
    }

    public AuditLogger.IntegrityReport verifyAuditIntegrity(int limit) {
        AuditLogger.IntegrityReport report = auditLogger.verifyIntegrity(limit);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "audit.verify",
                "cli",
                "runtime/audit",
                report.ok() ? "ok" : "failed",
                null,
                null,
                Map.of(
                        "checked_rows", report.checkedRows(),
                        "broken_line", report.brokenLine(),
                        "reason", report.reason()
                )
        ));
        return report;
    }

    public List<NodeKeyView> keys() {
        List<NodeKeyView> out = new ArrayList<>();
        for (String nodeId : registry.listNodeIds()) {
            NodeKey key = keyring.keyFor(nodeId);
            out.add(new NodeKeyView(
                    nodeId,
                    signer.scheme(),
                    key.ed25519PublicKey(),
                    key.createdAtMs(),
                    settings.confidenceThresholdFor(nodeId)
            ));
        }
        return out;
    }

    private CorrectedRecord arbitrate(
            String runId,
            String traceId,
            String text,
            ConsensusOutcome consensus,
            HumanArbitrator arbitrator
    ) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                "arbitration.request",
                "coordinator",
                "run/" + runId,
                "requested",
                traceId,
                runId,
                Map.of("arbitrator", arbitrator.id(), "reason", consensus.reason())
        ));
        CorrectedRecord correction;
        try {
            correction = HumanArbitrator.requireHumanProvenance(arbitrator.arbitrate(text, consensus.attestations()));
        } catch (ArbitrationUnavailableException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "arbitration.resolve",
                    "arbitrator/" + arbitrator.id(),
                    "run/" + runId,
                    "unavailable",
                    traceId,
                    runId,
                    Map.of("error", String.valueOf(e.getMessage()))
            ));
            throw e;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "arbitration.resolve",
                "arbitrator/" + arbitrator.id(),
                "run/" + runId,
                "corrected",
                traceId,
                runId,
                Map.of(
                        "validator_id", correction.validatorId(),
                        "entities", correction.entities().size(),
                        "correction_reason", String.valueOf(correction.correctionReason())
                )
        ));
        return correction;
    }

    private static Map<String, Object> consensusDetails(ConsensusOutcome consensus) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("policy", consensus.policy().configName());
        details.put("valid", consensus.validCount());
        details.put("threshold", consensus.threshold());
        details.put("reason", consensus.reason());
        if (consensus.approved()) {
            details.put("canonical_node_id", consensus.canonicalNodeId());
            details.put("unanimous", consensus.unanimous());
            details.put("contributing_digests", consensus.contributingDigests());
        }
        return details;
    }

    private void auditAction(CanonicalRecord record, RuleEvaluationResult result) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                "action.fire",
                "rule-engine",
                "rule/" + rule.name(),
                "triggered",
                null,
                record.runId(),
                Map.of("matched_condition", result.matchedCondition())
        ));
    }

    @Override
    public void close() {
        coordinator.close();
    }

    public record RunOutcome(
            String runId,
            String traceId,
            List<NodeReport> nodes,
            ConsensusOutcome consensus,
            CorrectedRecord correction,
            CanonicalRecord record,
            LedgerCommitment commitment,
            RuleEvaluationResult ruleResult
    ) {
        public boolean arbitrated() {
            return correction != null;
        }
    }

    public record RecordVerification(
            String runId,
            boolean recordFound,
            boolean committed,
            boolean verified,
            String recomputedDigest,
            String committedDigest
    ) {
    }

    public record NodeKeyView(
            String nodeId,
            String scheme,
            String ed25519PublicKey,
            long createdAtMs,
            double confidenceThreshold
    ) {
    }
}
