package io.tiermesh.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpServer;
import io.tiermesh.config.TierMeshConfig;
import io.tiermesh.error.TierMeshException;
import io.tiermesh.migration.MigrationResult;
import io.tiermesh.model.Endpoint;
import io.tiermesh.model.HealthResult;
import io.tiermesh.model.MigrationJob;
import io.tiermesh.observability.AuditLogger;
import io.tiermesh.runtime.TierMeshRuntime;
import io.tiermesh.util.Hashing;
import io.tiermesh.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "tiermesh",
        mixinStandardHelpOptions = true,
        version = "tiermesh 0.1.0",
        description = "Tiered storage migration and endpoint routing",
        subcommands = {
                TierMeshCommand.InitCommand.class,
                TierMeshCommand.PutCommand.class,
                TierMeshCommand.ReadCommand.class,
                TierMeshCommand.RestoreCommand.class,
                TierMeshCommand.QuotaCheckCommand.class,
                TierMeshCommand.TriggerMigrationCommand.class,
                TierMeshCommand.ResumeMigrationCommand.class,
                TierMeshCommand.CancelMigrationCommand.class,
                TierMeshCommand.JobsCommand.class,
                TierMeshCommand.JobCommand.class,
                TierMeshCommand.ProbeCommand.class,
                TierMeshCommand.SelectEndpointCommand.class,
                TierMeshCommand.StatusCommand.class,
                TierMeshCommand.MetricsCommand.class,
                TierMeshCommand.RetentionSweepCommand.class,
                TierMeshCommand.LifecycleLogCommand.class,
                TierMeshCommand.AuditVerifyCommand.class,
                TierMeshCommand.PayloadKeyStatusCommand.class,
                TierMeshCommand.PayloadKeyRotateCommand.class,
                TierMeshCommand.ServeCommand.class
        }
)
public final class TierMeshCommand implements Runnable {
    static final int EXIT_USAGE = 2;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | put | read | restore | quota-check | trigger-migration | resume-migration | cancel-migration | jobs | job | probe | select-endpoint | status | metrics | retention-sweep | lifecycle-log | audit-verify | payload-key-status | payload-key-rotate | serve");
    }

    /**
     * Command line with domain failures mapped to exit codes and a JSON error body.
     */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new TierMeshCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            ObjectNode body = Jsons.mapper().createObjectNode();
            if (ex instanceof TierMeshException) {
                body.put("error", ((TierMeshException) ex).kind());
            } else if (ex instanceof IllegalArgumentException || ex instanceof IllegalStateException) {
                body.put("error", "invalid_request");
            } else {
                body.put("error", "internal");
            }
            body.put("message", String.valueOf(ex.getMessage()));
            commandLine.getErr().println(Jsons.toCompactJson(body));
            return exitCodeFor(ex);
        });
        return cmd;
    }

    static int exitCodeFor(Exception ex) {
        if (ex instanceof TierMeshException) {
            switch (((TierMeshException) ex).kind()) {
                case "not_found":
                    return 3;
                case "already_running":
                    return 4;
                case "capacity":
                    return 5;
                case "integrity":
                    return 6;
                case "transient_io":
                    return 7;
                case "no_healthy_endpoint":
                    return 8;
                default:
                    return 1;
            }
        }
        if (ex instanceof IllegalArgumentException || ex instanceof IllegalStateException) {
            return EXIT_USAGE;
        }
        return 1;
    }

    TierMeshRuntime runtime() {
        TierMeshRuntime runtime = new TierMeshRuntime(TierMeshConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize directories, keyring and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                System.out.println("Initialized TierMesh at: " + TierMeshConfig.fromRoot(parent.root).rootDir()
                        + " (tiers: " + runtime.tiers().tiers().size() + ")");
            }
            return 0;
        }
    }

    @Command(name = "put", description = "Store a new record in the lowest tier")
    static final class PutCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Option(names = {"--id"}, required = true, description = "Record id")
        String recordId;

        @Option(names = {"--file"}, description = "Read payload from this file")
        String file;

        @Option(names = {"--data"}, description = "Inline UTF-8 payload")
        String data;

        @Override
        public Integer call() throws Exception {
            if ((file == null) == (data == null)) {
                throw new IllegalArgumentException("Exactly one of --file or --data is required");
            }
            byte[] payload = file != null
                    ? Files.readAllBytes(Path.of(file))
                    : data.getBytes(StandardCharsets.UTF_8);
            try (TierMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.put(recordId, payload)));
            }
            return 0;
        }
    }

    @Command(name = "read", description = "Read a record and refresh its last-accessed time")
    static final class ReadCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Parameters(index = "0", description = "Record id")
        String recordId;

        @Option(names = {"--out"}, description = "Write payload to this file instead of printing it")
        String out;

        @Override
        public Integer call() throws Exception {
            try (TierMeshRuntime runtime = parent.runtime()) {
                emitPayload(recordId, runtime.read(recordId), out);
            }
            return 0;
        }
    }

    @Command(name = "restore", description = "Restore a record from whichever tier holds it, verifying its checksum")
    static final class RestoreCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Parameters(index = "0", description = "Record id")
        String recordId;

        @Option(names = {"--out"}, description = "Write payload to this file instead of printing it")
        String out;

        @Override
        public Integer call() throws Exception {
            try (TierMeshRuntime runtime = parent.runtime()) {
                emitPayload(recordId, runtime.restore(recordId), out);
            }
            return 0;
        }
    }

    @Command(name = "quota-check", description = "Run one quota cycle and the migrations it triggers")
    static final class QuotaCheckCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Report triggers without migrating")
        boolean dryRun;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.quotaCheck(dryRun)));
            }
            return 0;
        }
    }

    @Command(name = "trigger-migration", description = "Manually migrate records from one tier to the next")
    static final class TriggerMigrationCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Option(names = {"--from"}, required = true, description = "Source tier id")
        String source;

        @Option(names = {"--to"}, required = true, description = "Destination tier id")
        String destination;

        @Option(names = {"--reclaim-bytes"}, defaultValue = "0", description = "Stop once this many bytes are selected; 0 = one batch")
        long reclaimBytes;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                MigrationResult result = runtime.triggerMigration(source, destination, reclaimBytes);
                System.out.println(Jsons.toJson(result));
            }
            return 0;
        }
    }

    @Command(name = "resume-migration", description = "Resume an interrupted or failed migration job")
    static final class ResumeMigrationCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.resumeMigration(jobId)));
            }
            return 0;
        }
    }

    @Command(name = "cancel-migration", description = "Request cancellation of a running migration job")
    static final class CancelMigrationCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.cancelMigration(jobId)));
            }
            return 0;
        }
    }

    @Command(name = "jobs", description = "List migration jobs")
    static final class JobsCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Option(names = {"--status"}, description = "Filter by status")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Maximum rows")
        int limit;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                List<MigrationJob> jobs = runtime.jobs(status, limit);
                System.out.println(Jsons.toJson(jobs));
            }
            return 0;
        }
    }

    @Command(name = "job", description = "Show one migration job with per-record states")
    static final class JobCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.job(jobId)));
            }
            return 0;
        }
    }

    @Command(name = "probe", description = "Probe one endpoint, or all of them")
    static final class ProbeCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Option(names = {"--endpoint"}, description = "Endpoint id; all endpoints when omitted")
        String endpointId;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                List<HealthResult> results = runtime.probe(endpointId);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("results", results);
                out.put("states", runtime.endpointStates());
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "select-endpoint", description = "Probe all endpoints, then print the router's pick")
    static final class SelectEndpointCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Option(names = {"--no-probe"}, defaultValue = "false", description = "Skip the probe round")
        boolean noProbe;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                if (!noProbe) {
                    runtime.probe(null);
                }
                Endpoint endpoint = runtime.selectEndpoint();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("endpoint", endpoint);
                out.put("algorithm", runtime.router().algorithm());
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }

    @Command(name = "status", description = "Tier inventory, active jobs and endpoint health")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.status()));
            }
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print Prometheus text metrics")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText());
            }
            return 0;
        }
    }

    @Command(name = "retention-sweep", description = "Delete archive records past the retention window")
    static final class RetentionSweepCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.retentionSweep()));
            }
            return 0;
        }
    }

    @Command(name = "lifecycle-log", description = "Show recent record moves and deletions")
    static final class LifecycleLogCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Maximum rows")
        int limit;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.lifecycleLog(limit)));
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                AuditLogger.ChainStatus status = runtime.verifyAudit();
                System.out.println(Jsons.toJson(status));
                return status.intact() ? 0 : 1;
            }
        }
    }

    @Command(name = "payload-key-status", description = "Show payload keyring status")
    static final class PayloadKeyStatusCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.payloadKeyStatus()));
            }
            return 0;
        }
    }

    @Command(name = "payload-key-rotate", description = "Rotate the active payload key; old keys stay readable")
    static final class PayloadKeyRotateCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Override
        public Integer call() {
            try (TierMeshRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.rotatePayloadKey()));
            }
            return 0;
        }
    }

    @Command(name = "serve", description = "Run quota checks, probes and the migration dispatcher until stopped")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        TierMeshCommand parent;

        @Option(names = {"--metrics-port"}, defaultValue = "0", description = "Expose /metrics on this port; 0 disables")
        int metricsPort;

        @Override
        public Integer call() throws Exception {
            TierMeshRuntime runtime = new TierMeshRuntime(TierMeshConfig.fromRoot(parent.root));
            List<MigrationResult> resumed = runtime.start();
            if (!resumed.isEmpty()) {
                System.out.println(Jsons.toJson(resumed));
            }
            HttpServer server = null;
            if (metricsPort > 0) {
                server = HttpServer.create(new InetSocketAddress(metricsPort), 0);
                server.createContext("/metrics", exchange -> {
                    byte[] bytes = runtime.metricsText().getBytes(StandardCharsets.UTF_8);
                    exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                    exchange.sendResponseHeaders(200, bytes.length);
                    try (OutputStream os = exchange.getResponseBody()) {
                        os.write(bytes);
                    }
                });
                server.setExecutor(null);
                server.start();
                System.out.println("Metrics server listening on http://127.0.0.1:" + metricsPort + "/metrics");
            }
            CountDownLatch stopped = new CountDownLatch(1);
            HttpServer httpServer = server;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (httpServer != null) {
                    httpServer.stop(0);
                }
                runtime.close();
                stopped.countDown();
            }, "tiermesh-shutdown-hook"));
            System.out.println("TierMesh serving data root: " + TierMeshConfig.fromRoot(parent.root).rootDir());
            stopped.await();
            return 0;
        }
    }

    private static void emitPayload(String recordId, byte[] payload, String out) throws Exception {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("recordId", recordId);
        row.put("payloadBytes", payload.length);
        row.put("checksum", Hashing.sha256Hex(payload));
        if (out != null && !out.isBlank()) {
            Path target = Path.of(out);
            Files.write(target, payload);
            row.put("out", target.toAbsolutePath().toString());
        } else {
            row.put("payloadBase64", Base64.getEncoder().encodeToString(payload));
        }
        System.out.println(Jsons.toJson(row));
    }
}
