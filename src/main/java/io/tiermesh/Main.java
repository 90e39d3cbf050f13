package io.tiermesh;

import io.tiermesh.cli.TierMeshCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = TierMeshCommand.commandLine().execute(args);
        System.exit(code);
    }
}
