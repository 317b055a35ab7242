package io.oraclemesh;

import io.oraclemesh.cli.OracleMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new OracleMeshCommand()).execute(args);
        System.exit(code);
    }
}
