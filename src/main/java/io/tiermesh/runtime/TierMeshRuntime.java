package io.tiermesh.runtime;

import io.tiermesh.archive.Archiver;
import io.tiermesh.archive.PackedBlob;
import io.tiermesh.config.TierMeshConfig;
import io.tiermesh.config.TierMeshSettings;
import io.tiermesh.error.AlreadyRunningException;
import io.tiermesh.error.CapacityException;
import io.tiermesh.error.NotFoundException;
import io.tiermesh.error.TierMeshException;
import io.tiermesh.events.EventListener;
import io.tiermesh.events.EventPublisher;
import io.tiermesh.health.HealthPolicy;
import io.tiermesh.health.HealthProber;
import io.tiermesh.health.HttpProbeTransport;
import io.tiermesh.health.ProbeTransport;
import io.tiermesh.migration.JobRegistry;
import io.tiermesh.migration.MigrationEngine;
import io.tiermesh.migration.MigrationResult;
import io.tiermesh.model.Endpoint;
import io.tiermesh.model.EndpointState;
import io.tiermesh.model.HealthResult;
import io.tiermesh.model.JobRecord;
import io.tiermesh.model.MigrationJob;
import io.tiermesh.model.MigrationTrigger;
import io.tiermesh.model.QuotaSnapshot;
import io.tiermesh.model.RecordMeta;
import io.tiermesh.model.RouterAlgorithm;
import io.tiermesh.model.SelectionPredicate;
import io.tiermesh.model.TierSpec;
import io.tiermesh.model.TriggerReason;
import io.tiermesh.observability.AuditLogger;
import io.tiermesh.observability.PrometheusFormatter;
import io.tiermesh.quota.QuotaMonitor;
import io.tiermesh.routing.EndpointCall;
import io.tiermesh.routing.EndpointRouter;
import io.tiermesh.security.PayloadCrypto;
import io.tiermesh.storage.Database;
import io.tiermesh.storage.MetadataStore;
import io.tiermesh.tier.FileSystemTierBackend;
import io.tiermesh.tier.TierBackend;
import io.tiermesh.tier.TierIo;
import io.tiermesh.tier.TierRegistry;
import io.tiermesh.tier.TierUsage;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires tiers, catalogue, archiver, migration engine, quota monitor, prober and router
 * for one data root, and runs the periodic tasks when started.
 */
public final class TierMeshRuntime implements AutoCloseable {
    private static final long DAY_MS = 24L * 60L * 60L * 1000L;

    private final TierMeshConfig config;
    private final TierMeshSettings settings;
    private final Clock clock;
    private final Database database;
    private final MetadataStore store;
    private final AuditLogger auditLogger;
    private final EventPublisher events;
    private final PayloadCrypto crypto;
    private final TierRegistry tiers;
    private final TierIo tierIo;
    private final Archiver archiver;
    private final JobRegistry jobRegistry;
    private final MigrationEngine engine;
    private final QuotaMonitor quotaMonitor;
    private final HealthProber prober;
    private final EndpointRouter router;
    private final BlockingQueue<MigrationTrigger> mailbox;
    private final Set<String> queuedPairs;
    private final AtomicBoolean started;
    private volatile ScheduledExecutorService scheduler;
    private volatile ExecutorService migrationWorkers;
    private volatile Thread dispatcher;

    public TierMeshRuntime(TierMeshConfig config) {
        this(config, null, Clock.systemUTC());
    }

    public TierMeshRuntime(TierMeshConfig config, ProbeTransport probeTransport, Clock clock) {
        this.config = config;
        this.settings = TierMeshSettings.load(config.settingsFile());
        this.clock = clock;
        this.database = new Database(config);
        this.store = new MetadataStore(database);
        this.auditLogger = new AuditLogger(config.auditFile(), "tiermesh");
        this.events = new EventPublisher(auditLogger);
        this.crypto = new PayloadCrypto(config.payloadKeyFile());
        Map<String, TierBackend> backends = new LinkedHashMap<>();
        for (TierSpec tier : settings.tiers()) {
            backends.put(tier.id(), new FileSystemTierBackend(
                    tier.id(),
                    config.resolveTierLocation(tier.location(), tier.id()),
                    tier.capacityBytes()
            ));
        }
        this.tiers = new TierRegistry(settings.tiers(), backends);
        this.tierIo = new TierIo(settings.tierIoTimeoutMs(), settings.transientRetryAttempts(), settings.retryBackoffMs());
        this.archiver = new Archiver(crypto, tiers, store, tierIo);
        this.jobRegistry = new JobRegistry();
        this.engine = new MigrationEngine(
                tiers,
                store,
                archiver,
                tierIo,
                jobRegistry,
                events,
                auditLogger,
                settings.selectionPolicy(),
                settings.migrationBatchSize(),
                clock
        );
        this.quotaMonitor = new QuotaMonitor(tiers, tierIo, store, jobRegistry, events, auditLogger, basePredicate(), clock);
        this.prober = new HealthProber(
                settings.endpoints(),
                probeTransport == null ? new HttpProbeTransport(settings.probeTimeoutMs()) : probeTransport,
                new HealthPolicy(settings.unhealthyAfterFailures(), settings.healthyAfterSuccesses(), settings.latencyEwmaAlpha()),
                settings.probeTimeoutMs(),
                events,
                auditLogger,
                clock
        );
        this.router = new EndpointRouter(prober, settings.routerAlgorithm(), settings.routerRetryCap());
        this.mailbox = new LinkedBlockingQueue<>();
        this.queuedPairs = ConcurrentHashMap.newKeySet();
        this.started = new AtomicBoolean(false);
    }

    public void init() {
        database.init();
        auditLogger.log(AuditLogger.AuditEvent.of(
                "runtime.init",
                "runtime",
                config.rootDir().toString(),
                "ok",
                null,
                null,
                Map.of(
                        "tiers", settings.tiers().stream().map(TierSpec::id).toList(),
                        "endpoints", settings.endpoints().stream().map(Endpoint::id).toList(),
                        "settings_file", config.settingsFile().toString()
                )
        ));
    }

    /**
     * Long-running mode: finishes interrupted jobs, then schedules the quota check,
     * one probe loop per endpoint and the migration dispatcher.
     */
    public List<MigrationResult> start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Runtime already started");
        }
        init();
        List<MigrationResult> resumed = engine.resumeInterrupted();
        AtomicInteger seq = new AtomicInteger();
        ScheduledExecutorService exec = Executors.newScheduledThreadPool(
                Math.max(2, settings.endpoints().size() + 1),
                r -> {
                    Thread t = new Thread(r, "tiermesh-scheduler-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }
        );
        this.scheduler = exec;
        exec.scheduleAtFixedRate(this::scheduledQuotaTick, 0L, settings.quotaCheckIntervalMs(), TimeUnit.MILLISECONDS);
        if (settings.archiveRetentionDays() > 0) {
            exec.scheduleAtFixedRate(this::scheduledRetentionTick, DAY_MS, DAY_MS, TimeUnit.MILLISECONDS);
        }
        prober.start(exec, settings.probeIntervalMs());
        AtomicInteger workerSeq = new AtomicInteger();
        this.migrationWorkers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tiermesh-migration-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        Thread worker = new Thread(this::dispatchLoop, "tiermesh-migration-dispatcher");
        worker.setDaemon(true);
        worker.start();
        this.dispatcher = worker;
        return resumed;
    }

    @Override
    public void close() {
        Thread worker = dispatcher;
        if (worker != null) {
            worker.interrupt();
        }
        ScheduledExecutorService exec = scheduler;
        if (exec != null) {
            exec.shutdownNow();
        }
        ExecutorService workers = migrationWorkers;
        if (workers != null) {
            workers.shutdownNow();
        }
        prober.close();
        tierIo.close();
    }

    public TierMeshSettings settings() {
        return settings;
    }

    public TierRegistry tiers() {
        return tiers;
    }

    public MetadataStore store() {
        return store;
    }

    public Archiver archiver() {
        return archiver;
    }

    public MigrationEngine engine() {
        return engine;
    }

    public HealthProber prober() {
        return prober;
    }

    public EndpointRouter router() {
        return router;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public void subscribe(EventListener listener) {
        events.subscribe(listener);
    }

    // ---- records ----

    /**
     * Stores a new record in the lowest-rank tier. The id is claimed in the catalogue
     * before the blob is written, so a concurrent put of the same id never touches the
     * winner's blob.
     *
     * @throws IllegalArgumentException if the id is already catalogued
     * @throws CapacityException        if the lowest tier has no room for the blob
     */
    public PutOutcome put(String recordId, byte[] payload) {
        if (store.findRecord(recordId).isPresent()) {
            throw new IllegalArgumentException("Record already exists: " + recordId);
        }
        TierSpec tier = tiers.lowest();
        TierBackend backend = tiers.backend(tier.id());
        PackedBlob packed = archiver.pack(payload);
        TierUsage usage = tierIo.call("usage of " + tier.id(), backend::usage);
        if (usage.availableBytes() < packed.sizeBytes()) {
            throw new CapacityException(tier.id(), packed.sizeBytes(), usage.availableBytes());
        }
        long nowMs = clock.millis();
        RecordMeta meta = new RecordMeta(
                recordId,
                tier.id(),
                packed.sizeBytes(),
                packed.payloadBytes(),
                packed.checksum(),
                nowMs,
                nowMs
        );
        if (!store.insertRecord(meta)) {
            throw new IllegalArgumentException("Record already exists: " + recordId);
        }
        try {
            tierIo.run("put " + recordId + " to " + tier.id(), () -> backend.put(recordId, packed.blob(), packed.checksum()));
        } catch (RuntimeException e) {
            rollbackPut(recordId, tier.id(), backend, e);
            throw e;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "record.put",
                "runtime",
                "tiers/" + tier.id(),
                "ok",
                null,
                recordId,
                Map.of("size_bytes", packed.sizeBytes(), "payload_bytes", packed.payloadBytes(), "checksum", packed.checksum())
        ));
        return new PutOutcome(recordId, tier.id(), packed.sizeBytes(), packed.payloadBytes(), packed.checksum());
    }

    // The claimed row goes first so no catalogue entry outlives a blob that never landed.
    private void rollbackPut(String recordId, String tierId, TierBackend backend, RuntimeException cause) {
        try {
            store.deleteRecord(recordId, tierId, "put_rollback", clock.millis());
            tierIo.call("delete " + recordId + " from " + tierId, () -> backend.delete(recordId));
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "record.put",
                "runtime",
                "tiers/" + tierId,
                cause instanceof TierMeshException ? ((TierMeshException) cause).kind() : "error",
                null,
                recordId,
                Map.of("error", String.valueOf(cause.getMessage()), "rolled_back", cause.getSuppressed().length == 0)
        ));
    }

    /**
     * Normal read: restores the payload and refreshes last-accessed.
     */
    public byte[] read(String recordId) {
        byte[] payload = restore(recordId);
        store.touchRecord(recordId, clock.millis());
        return payload;
    }

    public byte[] restore(String recordId) {
        try {
            byte[] payload = archiver.restore(recordId);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "record.restore",
                    "runtime",
                    "records",
                    "ok",
                    null,
                    recordId,
                    Map.of("payload_bytes", payload.length)
            ));
            return payload;
        } catch (TierMeshException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "record.restore",
                    "runtime",
                    "records",
                    e.kind(),
                    null,
                    recordId,
                    Map.of("error", String.valueOf(e.getMessage()))
            ));
            throw e;
        }
    }

    public Optional<RecordMeta> record(String recordId) {
        return store.findRecord(recordId);
    }

    // ---- quota and migration ----

    public List<MigrationTrigger> checkQuotas() {
        return quotaMonitor.checkQuotas();
    }

    /**
     * One synchronous quota cycle for the CLI: checks, then runs every resulting
     * migration in this process unless {@code dryRun}.
     */
    public QuotaCheckOutcome quotaCheck(boolean dryRun) {
        List<MigrationTrigger> triggers = quotaMonitor.checkQuotas();
        List<MigrationResult> results = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        if (!dryRun) {
            for (MigrationTrigger trigger : triggers) {
                try {
                    results.add(engine.migrate(trigger));
                } catch (AlreadyRunningException e) {
                    dropped.add(trigger.pairKey());
                    auditDropped(trigger, e);
                }
            }
        }
        return new QuotaCheckOutcome(quotaMonitor.latestSnapshots(), triggers, results, dropped);
    }

    /**
     * Manual migration between two tiers. {@code reclaimBytes <= 0} moves up to one batch.
     *
     * @throws AlreadyRunningException if the pair already has an active job
     */
    public MigrationResult triggerMigration(String sourceTier, String destinationTier, long reclaimBytes) {
        MigrationTrigger trigger = new MigrationTrigger(
                sourceTier,
                destinationTier,
                TriggerReason.MANUAL,
                Math.max(0L, reclaimBytes),
                basePredicate()
        );
        return engine.migrate(trigger);
    }

    public MigrationResult resumeMigration(String jobId) {
        return engine.resume(jobId);
    }

    public CancelOutcome cancelMigration(String jobId) {
        boolean accepted = engine.cancel(jobId);
        return new CancelOutcome(jobId, accepted, accepted ? "cancel requested" : "job already terminal");
    }

    public List<MigrationJob> jobs(String status, int limit) {
        return store.listJobs(status, limit);
    }

    public JobDetail job(String jobId) {
        MigrationJob job = store.findJob(jobId)
                .orElseThrow(() -> new NotFoundException("Migration job not found: " + jobId));
        return new JobDetail(job, store.listJobRecords(jobId));
    }

    /**
     * Queues a trigger for the background dispatcher; used by the scheduled quota task.
     * A trigger whose pair has an active job, or already has a trigger waiting, is
     * dropped and audited.
     *
     * @return {@code true} if the trigger was queued
     */
    public boolean offerTrigger(MigrationTrigger trigger) {
        Optional<String> active = engine.activeJob(trigger.sourceTier(), trigger.destinationTier());
        if (active.isPresent()) {
            auditDropped(trigger, "already_running", active.get());
            return false;
        }
        if (!queuedPairs.add(trigger.pairKey())) {
            auditDropped(trigger, "already_queued", null);
            return false;
        }
        if (!mailbox.offer(trigger)) {
            queuedPairs.remove(trigger.pairKey());
            auditDropped(trigger, "mailbox_full", null);
            return false;
        }
        return true;
    }

    // ---- retention ----

    /**
     * Deletes records in the highest tier created before the archive retention cutoff.
     */
    public RetentionOutcome retentionSweep() {
        int days = settings.archiveRetentionDays();
        TierSpec archive = tiers.highest();
        long nowMs = clock.millis();
        if (days <= 0) {
            return new RetentionOutcome(archive.id(), 0L, List.of(), List.of());
        }
        long cutoff = nowMs - days * DAY_MS;
        TierBackend backend = tiers.backend(archive.id());
        List<String> deleted = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (RecordMeta record : store.listRecordsCreatedBefore(archive.id(), cutoff, settings.migrationBatchSize())) {
            try {
                tierIo.call("delete " + record.recordId() + " from " + archive.id(), () -> backend.delete(record.recordId()));
                if (store.deleteRecord(record.recordId(), archive.id(), "retention_delete", nowMs)) {
                    deleted.add(record.recordId());
                }
            } catch (TierMeshException e) {
                failed.add(record.recordId());
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "retention.delete",
                        "runtime",
                        "tiers/" + archive.id(),
                        e.kind(),
                        null,
                        record.recordId(),
                        Map.of("error", String.valueOf(e.getMessage()))
                ));
            }
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "retention.sweep",
                "runtime",
                "tiers/" + archive.id(),
                failed.isEmpty() ? "ok" : "partial",
                null,
                null,
                Map.of("retention_days", days, "cutoff_ms", cutoff, "deleted", deleted.size(), "failed", failed.size())
        ));
        return new RetentionOutcome(archive.id(), cutoff, deleted, failed);
    }

    public List<MetadataStore.LifecycleEntry> lifecycleLog(int limit) {
        return store.listLifecycleLog(limit);
    }

    // ---- endpoints ----

    public List<HealthResult> probe(String endpointId) {
        if (endpointId == null || endpointId.isBlank()) {
            return prober.probeAll();
        }
        Endpoint endpoint = prober.endpoint(endpointId)
                .orElseThrow(() -> new NotFoundException("Endpoint not found: " + endpointId));
        return List.of(prober.probe(endpoint));
    }

    public List<EndpointState> endpointStates() {
        return prober.states();
    }

    public Endpoint selectEndpoint() {
        return router.selectEndpoint();
    }

    public <T> T route(EndpointCall<T> call) {
        return router.route(call);
    }

    // ---- reporting ----

    public StatusOutcome status() {
        Map<String, MetadataStore.TierInventory> inventory = store.inventoryByTier();
        Map<String, QuotaSnapshot> snapshots = new LinkedHashMap<>();
        for (QuotaSnapshot snapshot : store.listQuotaSnapshots()) {
            snapshots.put(snapshot.tierId(), snapshot);
        }
        List<TierStatus> tierRows = new ArrayList<>();
        for (TierSpec tier : tiers.tiers()) {
            TierBackend backend = tiers.backend(tier.id());
            TierUsage usage = tierIo.call("usage of " + tier.id(), backend::usage);
            MetadataStore.TierInventory inv = inventory.getOrDefault(tier.id(), new MetadataStore.TierInventory(tier.id(), 0L, 0L));
            QuotaSnapshot snapshot = snapshots.get(tier.id());
            tierRows.add(new TierStatus(
                    tier.id(),
                    tier.rank(),
                    tier.capacityBytes(),
                    usage.usedBytes(),
                    usage.usagePercent(),
                    tier.highWaterPercent(),
                    tier.lowWaterPercent(),
                    inv.recordCount(),
                    inv.storedBytes(),
                    snapshot == null ? 0L : snapshot.takenAtMs()
            ));
        }
        return new StatusOutcome(
                tierRows,
                store.listNonTerminalJobs(),
                store.countJobsByStatus(),
                prober.states(),
                router.algorithm()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(status());
    }

    public PayloadCrypto.KeyringStatus payloadKeyStatus() {
        return crypto.status();
    }

    public PayloadCrypto.RotationOutcome rotatePayloadKey() {
        PayloadCrypto.RotationOutcome out = crypto.rotate();
        auditLogger.log(AuditLogger.AuditEvent.of(
                "payload.key.rotate",
                "runtime",
                "security",
                "ok",
                null,
                null,
                Map.of("previous_kid", out.previousKid(), "active_kid", out.activeKid(), "total_keys", out.totalKeys())
        ));
        return out;
    }

    public AuditLogger.ChainStatus verifyAudit() {
        return auditLogger.verifyChain();
    }

    // ---- background tasks ----

    private void scheduledQuotaTick() {
        try {
            for (MigrationTrigger trigger : quotaMonitor.checkQuotas()) {
                offerTrigger(trigger);
            }
        } catch (RuntimeException e) {
            auditBackgroundFailure("quota.tick", e);
        }
    }

    private void scheduledRetentionTick() {
        try {
            retentionSweep();
        } catch (RuntimeException e) {
            auditBackgroundFailure("retention.tick", e);
        }
    }

    private void dispatchLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            MigrationTrigger trigger;
            try {
                trigger = mailbox.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                migrationWorkers.execute(() -> runQueued(trigger));
            } catch (RejectedExecutionException e) {
                queuedPairs.remove(trigger.pairKey());
                auditBackgroundFailure("migration.dispatch", e);
                return;
            }
        }
    }

    // Jobs for different pairs run side by side; one pair never has two queued or running.
    private void runQueued(MigrationTrigger trigger) {
        try {
            engine.migrate(trigger);
        } catch (AlreadyRunningException e) {
            auditDropped(trigger, e);
        } catch (RuntimeException e) {
            auditBackgroundFailure("migration.dispatch", e);
        } finally {
            queuedPairs.remove(trigger.pairKey());
        }
    }

    private void auditDropped(MigrationTrigger trigger, AlreadyRunningException e) {
        auditDropped(trigger, e.kind(), e.activeJobId());
    }

    private void auditDropped(MigrationTrigger trigger, String result, String activeJobId) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                "migration.trigger.dropped",
                "dispatcher",
                "jobs/" + trigger.pairKey(),
                result,
                activeJobId,
                null,
                Map.of("reason", trigger.reason().name())
        ));
    }

    private void auditBackgroundFailure(String action, RuntimeException e) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                action,
                "scheduler",
                "runtime",
                e instanceof TierMeshException ? ((TierMeshException) e).kind() : "error",
                null,
                null,
                Map.of("error", String.valueOf(e.getMessage()), "type", e.getClass().getName())
        ));
    }

    private SelectionPredicate basePredicate() {
        return new SelectionPredicate(settings.minIdleMs(), settings.minRecordBytes(), settings.maxRecordBytes());
    }

    public record PutOutcome(String recordId, String tierId, long sizeBytes, long payloadBytes, String checksum) {
    }

    public record QuotaCheckOutcome(
            List<QuotaSnapshot> snapshots,
            List<MigrationTrigger> triggers,
            List<MigrationResult> migrations,
            List<String> droppedPairs
    ) {
    }

    public record CancelOutcome(String jobId, boolean accepted, String message) {
    }

    public record JobDetail(MigrationJob job, List<JobRecord> records) {
    }

    public record RetentionOutcome(String tierId, long cutoffMs, List<String> deleted, List<String> failed) {
    }

    public record TierStatus(
            String tierId,
            int rank,
            long capacityBytes,
            long usedBytes,
            double usagePercent,
            int highWaterPercent,
            int lowWaterPercent,
            long recordCount,
            long catalogueBytes,
            long lastSnapshotAtMs
    ) {
    }

    public record StatusOutcome(
            List<TierStatus> tiers,
            List<MigrationJob> activeJobs,
            Map<String, Long> jobsByStatus,
            List<EndpointState> endpoints,
            RouterAlgorithm routerAlgorithm
    ) {
    }
}
