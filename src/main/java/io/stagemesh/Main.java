package io.stagemesh;

import io.stagemesh.cli.StageMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new StageMeshCommand()).execute(args);
        System.exit(code);
    }
}
