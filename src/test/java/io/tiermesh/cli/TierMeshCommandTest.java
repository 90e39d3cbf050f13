package io.tiermesh.cli;

import io.tiermesh.error.AlreadyRunningException;
import io.tiermesh.error.CapacityException;
import io.tiermesh.error.IntegrityException;
import io.tiermesh.error.NoHealthyEndpointException;
import io.tiermesh.error.NotFoundException;
import io.tiermesh.error.TransientIOException;
import io.tiermesh.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class TierMeshCommandTest {

    @Test
    void domainFailuresMapToDistinctExitCodes() {
        Assertions.assertEquals(3, TierMeshCommand.exitCodeFor(new NotFoundException("missing")));
        Assertions.assertEquals(4, TierMeshCommand.exitCodeFor(new AlreadyRunningException("core->main", "mig_1")));
        Assertions.assertEquals(5, TierMeshCommand.exitCodeFor(new CapacityException("core", 10L, 1L)));
        Assertions.assertEquals(6, TierMeshCommand.exitCodeFor(new IntegrityException("rec-1", "aa", "bb")));
        Assertions.assertEquals(7, TierMeshCommand.exitCodeFor(new TransientIOException("timeout")));
        Assertions.assertEquals(8, TierMeshCommand.exitCodeFor(new NoHealthyEndpointException("none")));
        Assertions.assertEquals(2, TierMeshCommand.exitCodeFor(new IllegalArgumentException("bad tier")));
        Assertions.assertEquals(1, TierMeshCommand.exitCodeFor(new RuntimeException("boom")));
    }

    @Test
    void putThenReadRoundTripsThroughTheDataRoot() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-cli-put-");
        try {
            Assertions.assertEquals(0, run(root, new StringWriter(), "init"));
            Assertions.assertEquals(0, run(root, new StringWriter(), "put", "--id", "note-1", "--data", "hello tiers"));

            Path out = root.resolve("note-1.out");
            Assertions.assertEquals(0, run(root, new StringWriter(), "read", "note-1", "--out", out.toString()));
            Assertions.assertEquals("hello tiers", Files.readString(out, StandardCharsets.UTF_8));

            Assertions.assertEquals(0, run(root, new StringWriter(), "audit-verify"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void failuresPrintJsonErrorAndExitWithMappedCode() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-cli-errors-");
        try {
            StringWriter err = new StringWriter();
            Assertions.assertEquals(3, run(root, err, "restore", "nope"));
            Assertions.assertTrue(err.toString().contains("\"error\":\"not_found\""), err.toString());

            StringWriter usage = new StringWriter();
            Assertions.assertEquals(2, run(root, usage, "trigger-migration", "--from", "core", "--to", "archive"));
            Assertions.assertTrue(usage.toString().contains("\"error\":\"invalid_request\""), usage.toString());

            StringWriter both = new StringWriter();
            Assertions.assertEquals(2, run(root, both, "put", "--id", "x"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static int run(Path root, StringWriter err, String... args) {
        CommandLine cmd = TierMeshCommand.commandLine();
        cmd.setErr(new PrintWriter(err, true));
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return cmd.execute(full);
    }
}
