package io.oraclemesh.cli;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class OracleMeshCommandTest {

    @Test
    void runThenInspectThroughCommands() throws Exception {
        Path root = Files.createTempDirectory("oraclemesh-test-cli-");
        try {
            String rootArg = root.toString();
            Assertions.assertEquals(0, execute("--root", rootArg, "init"));
            Assertions.assertEquals(0, execute("--root", rootArg, "run",
                    "--text", "Migraine eased by aspirin", "--run-id", "cli-1"));
            Assertions.assertTrue(Files.exists(root.resolve("records").resolve("cli-1.json")));

            Assertions.assertEquals(0, execute("--root", rootArg, "ledger", "--run-id", "cli-1"));
            Assertions.assertEquals(1, execute("--root", rootArg, "ledger", "--run-id", "cli-missing"));
            Assertions.assertEquals(0, execute("--root", rootArg, "verify-record", "--run-id", "cli-1"));
            Assertions.assertEquals(1, execute("--root", rootArg, "verify-record", "--run-id", "cli-missing"));
            Assertions.assertEquals(0, execute("--root", rootArg, "audit-verify"));
            Assertions.assertEquals(0, execute("--root", rootArg, "keys"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runReadsTextFileAndRejectsUnknownArbitration() throws Exception {
        Path root = Files.createTempDirectory("oraclemesh-test-cli-file-");
        try {
            Path report = root.resolve("report.txt");
            Files.writeString(report, "Ordered an MRI scan", StandardCharsets.UTF_8);

            Assertions.assertEquals(0, execute("--root", root.toString(), "run",
                    "--text-file", report.toString(), "--run-id", "cli-file"));
            Assertions.assertNotEquals(0, execute("--root", root.toString(), "run",
                    "--text", "headache", "--arbitration", "oracle-vote"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static int execute(String... args) {
        return new CommandLine(new OracleMeshCommand()).execute(args);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
