package io.tiermesh.quota;

import com.fasterxml.jackson.databind.JsonNode;
import io.tiermesh.archive.Archiver;
import io.tiermesh.archive.PackedBlob;
import io.tiermesh.config.TierMeshConfig;
import io.tiermesh.events.CoreEvent;
import io.tiermesh.events.EventPublisher;
import io.tiermesh.migration.JobRegistry;
import io.tiermesh.migration.MigrationEngine;
import io.tiermesh.migration.MigrationResult;
import io.tiermesh.model.MigrationStatus;
import io.tiermesh.model.MigrationTrigger;
import io.tiermesh.model.QuotaSnapshot;
import io.tiermesh.model.RecordMeta;
import io.tiermesh.model.SelectionPolicy;
import io.tiermesh.model.SelectionPredicate;
import io.tiermesh.model.TierSpec;
import io.tiermesh.model.TriggerReason;
import io.tiermesh.observability.AuditLogger;
import io.tiermesh.security.PayloadCrypto;
import io.tiermesh.storage.Database;
import io.tiermesh.storage.MetadataStore;
import io.tiermesh.testing.MutableClock;
import io.tiermesh.testing.TestFiles;
import io.tiermesh.tier.FaultInjectingTierBackend;
import io.tiermesh.tier.FileSystemTierBackend;
import io.tiermesh.tier.TierBackend;
import io.tiermesh.tier.TierIo;
import io.tiermesh.tier.TierRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class QuotaMonitorTest {
    private static final long T0 = 1_700_000_000_000L;
    private static final long DAY_MS = 24L * 60L * 60L * 1000L;
    private static final byte[] PAYLOAD = "sensor=42;reading=17.5;unit=C;".repeat(10).getBytes(StandardCharsets.UTF_8);

    @Test
    void tierAboveHighWaterIsDrainedToLowWaterMark() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-quota-drain-");
        try {
            long blob = blobSize(root.resolve("data"));
            // core holds 100 blobs; 90 stored = 90%, low water 60% => reclaim 30 blobs.
            try (Fixture f = new Fixture(root.resolve("data"), 100L * blob, 0)) {
                List<CoreEvent> events = Collections.synchronizedList(new ArrayList<>());
                f.events.subscribe(events::add);
                for (int i = 0; i < 90; i++) {
                    f.seed(String.format("rec-%02d", i), "core", T0 - 100_000L + i);
                }

                List<MigrationTrigger> triggers = f.monitor.checkQuotas();

                Assertions.assertEquals(1, triggers.size());
                MigrationTrigger trigger = triggers.get(0);
                Assertions.assertEquals("core", trigger.sourceTier());
                Assertions.assertEquals("main", trigger.destinationTier());
                Assertions.assertEquals(TriggerReason.QUOTA, trigger.reason());
                Assertions.assertEquals(30L * blob, trigger.reclaimBytes());

                CoreEvent crossed = events.stream()
                        .filter(e -> CoreEvent.QUOTA_THRESHOLD_CROSSED.equals(e.type()))
                        .findFirst()
                        .orElseThrow();
                Assertions.assertEquals("core", crossed.subject());
                Assertions.assertEquals(30L * blob, crossed.attributes().get("reclaim_bytes"));

                MigrationResult result = f.engine.migrate(trigger);

                Assertions.assertEquals(MigrationStatus.COMPLETED, result.status());
                Assertions.assertEquals(30, result.committed().size());
                Assertions.assertEquals("rec-00", result.committed().get(0));
                Assertions.assertEquals("rec-29", result.committed().get(29));
                Assertions.assertTrue(result.reclaimedBytes() >= 30L * blob);
                long usedAfter = f.backends.get("core").usage().usedBytes();
                Assertions.assertTrue(usedAfter <= 70L * blob, "core usage after migration: " + usedAfter);
                Assertions.assertEquals(60L * blob, usedAfter);

                Assertions.assertTrue(f.monitor.checkQuotas().isEmpty(), "drained tier must not trigger again");
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void triggerIsSuppressedWhileThePairHasAnActiveJob() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-quota-suppressed-");
        try {
            long blob = blobSize(root.resolve("data"));
            try (Fixture f = new Fixture(root.resolve("data"), 10L * blob, 0)) {
                List<CoreEvent> events = Collections.synchronizedList(new ArrayList<>());
                f.events.subscribe(events::add);
                for (int i = 0; i < 9; i++) {
                    f.seed("rec-" + i, "core", T0 - 1_000L);
                }
                f.engine.createJob(new MigrationTrigger("core", "main", TriggerReason.MANUAL, 0L, SelectionPredicate.any()));

                Assertions.assertTrue(f.monitor.checkQuotas().isEmpty());
                Assertions.assertEquals(1, events.stream()
                        .filter(e -> CoreEvent.QUOTA_THRESHOLD_CROSSED.equals(e.type()))
                        .count());

                // A monitor in another process only sees the persisted job.
                QuotaMonitor other = new QuotaMonitor(f.tiers, f.tierIo, f.store, new JobRegistry(), f.events, f.auditLogger, SelectionPredicate.any(), f.clock);
                Assertions.assertTrue(other.checkQuotas().isEmpty());
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void highestTierNeverTriggersAndEveryTierIsSnapshotted() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-quota-highest-");
        try {
            long blob = blobSize(root.resolve("data"));
            try (Fixture f = new Fixture(root.resolve("data"), 100L * blob, 0, 2L * blob)) {
                f.seed("arch-1", "archive", T0);
                f.seed("arch-2", "archive", T0);

                Assertions.assertTrue(f.monitor.checkQuotas().isEmpty());

                Map<String, QuotaSnapshot> snapshots = new LinkedHashMap<>();
                for (QuotaSnapshot snapshot : f.monitor.latestSnapshots()) {
                    snapshots.put(snapshot.tierId(), snapshot);
                }
                Assertions.assertEquals(List.of("archive", "core", "main"), List.copyOf(snapshots.keySet()));
                Assertions.assertEquals(100D, snapshots.get("archive").usagePercent(), 0.0001D);
                Assertions.assertEquals(0L, snapshots.get("core").usedBytes());
                Assertions.assertEquals(T0, snapshots.get("core").takenAtMs());
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void idleRecordsPastRetentionTriggerAgeMigrationBelowHighWater() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-quota-age-");
        try {
            long blob = blobSize(root.resolve("data"));
            try (Fixture f = new Fixture(root.resolve("data"), 100L * blob, 7)) {
                f.seed("stale", "core", T0 - 8L * DAY_MS);
                f.seed("fresh", "core", T0 - DAY_MS);

                List<MigrationTrigger> triggers = f.monitor.checkQuotas();

                Assertions.assertEquals(1, triggers.size());
                MigrationTrigger trigger = triggers.get(0);
                Assertions.assertEquals(TriggerReason.AGE, trigger.reason());
                Assertions.assertEquals(7L * DAY_MS, trigger.predicate().minIdleMs());

                MigrationResult result = f.engine.migrate(trigger);
                Assertions.assertEquals(List.of("stale"), result.committed());
                Assertions.assertEquals("core", f.store.findRecord("fresh").orElseThrow().tierId());

                Assertions.assertTrue(f.monitor.checkQuotas().isEmpty());
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void stalledTierIsSkippedAndAuditedWhileOthersAreStillChecked() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-quota-stalled-");
        try {
            long blob = blobSize(root.resolve("data"));
            try (Fixture f = new Fixture(root.resolve("data"), 10L * blob, 0);
                 TierIo shortTimeout = new TierIo(200L, 1, 0L)) {
                for (int i = 0; i < 9; i++) {
                    f.seed("rec-" + i, "core", T0 - 1_000L + i);
                }
                f.mainFaults.stallUsage(10_000L);
                QuotaMonitor monitor = new QuotaMonitor(f.tiers, shortTimeout, f.store, f.jobRegistry, f.events, f.auditLogger, SelectionPredicate.any(), f.clock);

                long startedNs = System.nanoTime();
                List<MigrationTrigger> triggers = monitor.checkQuotas();
                long elapsedMs = (System.nanoTime() - startedNs) / 1_000_000L;

                Assertions.assertTrue(elapsedMs < 5_000L, "quota check took " + elapsedMs + " ms");
                Assertions.assertEquals(1, triggers.size());
                Assertions.assertEquals("core", triggers.get(0).sourceTier());
                List<String> checked = monitor.latestSnapshots().stream().map(QuotaSnapshot::tierId).toList();
                Assertions.assertFalse(checked.contains("main"), checked.toString());

                List<JsonNode> audit = f.auditLogger.tail(10);
                Assertions.assertTrue(audit.stream().anyMatch(row ->
                        "quota.tier_unreadable".equals(row.path("action").asText())
                                && "tiers/main".equals(row.path("resource").asText())
                                && "transient_io".equals(row.path("result").asText())), audit.toString());
                Assertions.assertTrue(audit.stream().anyMatch(row ->
                        "quota.check".equals(row.path("action").asText())
                                && "partial".equals(row.path("result").asText())), audit.toString());
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    // Sized with the keyring the fixture will load, so blob lengths match exactly.
    private static long blobSize(Path dataRoot) {
        TierMeshConfig config = TierMeshConfig.fromRoot(dataRoot.toString());
        Archiver archiver = new Archiver(new PayloadCrypto(config.payloadKeyFile()), null, null, null);
        PackedBlob packed = archiver.pack(PAYLOAD);
        return packed.sizeBytes();
    }

    private static final class Fixture implements AutoCloseable {
        final MutableClock clock = new MutableClock(T0);
        final MetadataStore store;
        final AuditLogger auditLogger;
        final EventPublisher events;
        final Map<String, TierBackend> backends;
        final FaultInjectingTierBackend mainFaults;
        final TierRegistry tiers;
        final Archiver archiver;
        final TierIo tierIo;
        final JobRegistry jobRegistry;
        final MigrationEngine engine;
        final QuotaMonitor monitor;

        Fixture(Path root, long coreCapacity, int coreRetentionDays) {
            this(root, coreCapacity, coreRetentionDays, 1_000_000_000L);
        }

        Fixture(Path root, long coreCapacity, int coreRetentionDays, long archiveCapacity) {
            TierMeshConfig config = TierMeshConfig.fromRoot(root.toString());
            Database db = new Database(config);
            db.init();
            this.store = new MetadataStore(db);
            this.auditLogger = new AuditLogger(config.auditFile(), "test");
            this.events = new EventPublisher(auditLogger);
            List<TierSpec> specs = List.of(
                    new TierSpec("core", 0, coreCapacity, 85, 60, null, false, coreRetentionDays),
                    new TierSpec("main", 1, 1_000_000_000L, 85, 60, null, false, 0),
                    new TierSpec("archive", 2, archiveCapacity, 85, 60, null, false, 0)
            );
            this.backends = new LinkedHashMap<>();
            for (TierSpec spec : specs) {
                backends.put(spec.id(), new FileSystemTierBackend(spec.id(), config.resolveTierLocation(null, spec.id()), spec.capacityBytes()));
            }
            this.mainFaults = new FaultInjectingTierBackend(backends.get("main"));
            backends.put("main", mainFaults);
            this.tiers = new TierRegistry(specs, backends);
            this.tierIo = new TierIo(5_000L, 1, 0L);
            this.archiver = new Archiver(new PayloadCrypto(config.payloadKeyFile()), tiers, store, tierIo);
            this.jobRegistry = new JobRegistry();
            this.engine = new MigrationEngine(
                    tiers,
                    store,
                    archiver,
                    tierIo,
                    jobRegistry,
                    events,
                    auditLogger,
                    SelectionPolicy.OLDEST_ACCESS_FIRST,
                    500,
                    clock
            );
            this.monitor = new QuotaMonitor(tiers, tierIo, store, jobRegistry, events, auditLogger, SelectionPredicate.any(), clock);
        }

        void seed(String recordId, String tierId, long lastAccessedAtMs) {
            PackedBlob packed = archiver.pack(PAYLOAD);
            backends.get(tierId).put(recordId, packed.blob(), packed.checksum());
            store.insertRecord(new RecordMeta(
                    recordId,
                    tierId,
                    packed.sizeBytes(),
                    PAYLOAD.length,
                    packed.checksum(),
                    lastAccessedAtMs,
                    lastAccessedAtMs
            ));
        }

        @Override
        public void close() {
            tierIo.close();
        }
    }
}
