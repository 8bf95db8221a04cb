package io.sweepmesh;

import io.sweepmesh.cli.SweepMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SweepMeshCommand()).execute(args);
        System.exit(code);
    }
}
