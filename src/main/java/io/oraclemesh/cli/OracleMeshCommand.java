package io.oraclemesh.cli;

import io.oraclemesh.arbitration.FixedCorrectionArbitrator;
import io.oraclemesh.arbitration.HumanArbitrator;
import io.oraclemesh.config.OracleMeshConfig;
import io.oraclemesh.extract.EntityExtractor;
import io.oraclemesh.extract.TokenFileExtractor;
import io.oraclemesh.extract.WhitespaceTokenExtractor;
import io.oraclemesh.model.LedgerCommitment;
import io.oraclemesh.observability.AuditLogger;
import io.oraclemesh.runtime.OracleMeshRuntime;
import io.oraclemesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "oraclemesh",
        mixinStandardHelpOptions = true,
        description = "Multi-node attestation, consensus and ledger commitment pipeline",
        subcommands = {
                OracleMeshCommand.InitCommand.class,
                OracleMeshCommand.RunCommand.class,
                OracleMeshCommand.LedgerCommand.class,
                OracleMeshCommand.VerifyRecordCommand.class,
                OracleMeshCommand.AuditVerifyCommand.class,
                OracleMeshCommand.KeysCommand.class
        }
)
public final class OracleMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | ledger | verify-record | audit-verify | keys");
    }

    OracleMeshRuntime runtime() {
        return new OracleMeshRuntime(OracleMeshConfig.fromRoot(root));
    }

    @Command(name = "init", description = "Initialize directories, SQLite schema and node keys")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        OracleMeshCommand parent;

        @Override
        public Integer call() {
            try (OracleMeshRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println("Initialized OracleMesh at: " + OracleMeshConfig.fromRoot(parent.root).rootDir());
            }
            return 0;
        }
    }

    @Command(name = "run", description = "Run one attestation round over a report")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        OracleMeshCommand parent;

        @Option(names = {"--text"}, description = "Report text")
        String text;

        @Option(names = {"--text-file"}, description = "Read report text from file")
        String textFile;

        @Option(names = {"--tokens-file"}, description = "Pre-annotated tokens (JSON array of {text, recognizedLabel})")
        String tokensFile;

        @Option(names = {"--run-id"}, description = "Run id, also the ledger key; generated when omitted")
        String runId;

        @Option(names = {"--arbitration"}, defaultValue = "fixed", description = "fixed | file")
        String arbitration;

        @Option(names = {"--review-wait-ms"}, defaultValue = "60000", description = "How long the file review queue waits for a decision")
        long reviewWaitMs;

        @Override
        public Integer call() {
            String reportText = resolveText();
            EntityExtractor extractor = tokensFile == null || tokensFile.isBlank()
                    ? new WhitespaceTokenExtractor()
                    : new TokenFileExtractor(Paths.get(tokensFile));
            try (OracleMeshRuntime runtime = parent.runtime()) {
                runtime.init();
                HumanArbitrator arbitrator = switch (arbitration.trim().toLowerCase(Locale.ROOT)) {
                    case "fixed" -> FixedCorrectionArbitrator.defaultReviewer();
                    case "file" -> runtime.reviewQueue(reviewWaitMs);
                    default -> throw new IllegalArgumentException("Unknown arbitration mode: " + arbitration);
                };
                OracleMeshRuntime.RunOutcome out = runtime.run(runId, reportText, extractor, arbitrator);
                System.out.println(Jsons.toJson(summary(out)));
                return 0;
            }
        }

        private String resolveText() {
            if (textFile != null && !textFile.isBlank()) {
                try {
                    return Files.readString(Paths.get(textFile), StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new RuntimeException("Failed to read text file: " + textFile, e);
                }
            }
            return text == null ? "" : text;
        }

        private static Map<String, Object> summary(OracleMeshRuntime.RunOutcome out) {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("runId", out.runId());
            view.put("traceId", out.traceId());
            view.put("nodes", out.nodes());
            view.put("approved", out.consensus().approved());
            view.put("consensusReason", out.consensus().reason());
            view.put("arbitrated", out.arbitrated());
            view.put("record", out.record());
            view.put("commitment", out.commitment());
            view.put("rule", out.ruleResult());
            return view;
        }
    }

    @Command(name = "ledger", description = "Show ledger commitments")
    static final class LedgerCommand implements Callable<Integer> {
        @ParentCommand
        OracleMeshCommand parent;

        @Option(names = {"--run-id"}, description = "Show a single commitment")
        String runId;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows when listing")
        int limit;

        @Override
        public Integer call() {
            try (OracleMeshRuntime runtime = parent.runtime()) {
                runtime.init();
                if (runId == null || runId.isBlank()) {
                    System.out.println(Jsons.toJson(runtime.ledgerEntries(limit)));
                    return 0;
                }
                Optional<LedgerCommitment> entry = runtime.ledgerEntry(runId);
                if (entry.isEmpty()) {
                    System.out.println("{\"error\":\"ledger entry not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(entry.get()));
                return 0;
            }
        }
    }

    @Command(name = "verify-record", description = "Recompute a persisted record digest and check it against the ledger")
    static final class VerifyRecordCommand implements Callable<Integer> {
        @ParentCommand
        OracleMeshCommand parent;

        @Option(names = {"--run-id"}, required = true, description = "Run id")
        String runId;

        @Override
        public Integer call() {
            try (OracleMeshRuntime runtime = parent.runtime()) {
                runtime.init();
                OracleMeshRuntime.RecordVerification out = runtime.verifyRecord(runId);
                System.out.println(Jsons.toJson(out));
                return out.verified() ? 0 : 1;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify audit log hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        OracleMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "0", description = "Optional tail row limit; 0 verifies full log")
        int limit;

        @Override
        public Integer call() {
            try (OracleMeshRuntime runtime = parent.runtime()) {
                runtime.init();
                AuditLogger.IntegrityReport out = runtime.verifyAuditIntegrity(limit);
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "keys", description = "List node ids with their public key material")
    static final class KeysCommand implements Callable<Integer> {
        @ParentCommand
        OracleMeshCommand parent;

        @Override
        public Integer call() {
            try (OracleMeshRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println(Jsons.toJson(runtime.keys()));
                return 0;
            }
        }
    }
}
