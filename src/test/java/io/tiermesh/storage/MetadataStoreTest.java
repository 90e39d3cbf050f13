package io.tiermesh.storage;

import io.tiermesh.config.TierMeshConfig;
import io.tiermesh.error.AlreadyRunningException;
import io.tiermesh.model.JobRecord;
import io.tiermesh.model.MigrationJob;
import io.tiermesh.model.MigrationStatus;
import io.tiermesh.model.RecordMeta;
import io.tiermesh.model.RecordMigrationState;
import io.tiermesh.model.SelectionPolicy;
import io.tiermesh.model.SelectionPredicate;
import io.tiermesh.model.TriggerReason;
import io.tiermesh.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class MetadataStoreTest {

    @Test
    void secondActiveJobForSamePairIsRejectedUntilFirstTerminates() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-store-active-pair-");
        try {
            MetadataStore store = open(root);
            store.createJob(job("mig_a", "hot", "cold", 10L));

            AlreadyRunningException ex = Assertions.assertThrows(
                    AlreadyRunningException.class,
                    () -> store.createJob(job("mig_b", "hot", "cold", 11L))
            );
            Assertions.assertEquals("mig_a", ex.activeJobId());

            // Another pair is independent.
            store.createJob(job("mig_c", "cold", "archive", 12L));

            store.updateJobStatus("mig_a", MigrationStatus.COMPLETED, null, 20L);
            store.createJob(job("mig_d", "hot", "cold", 21L));
            Assertions.assertEquals("mig_d", store.findActiveJob("hot", "cold").orElseThrow().jobId());

            Map<String, Long> counts = store.countJobsByStatus();
            Assertions.assertEquals(1L, counts.get("COMPLETED"));
            Assertions.assertEquals(2L, counts.get("PENDING"));
            Assertions.assertEquals(2, store.listNonTerminalJobs().size());
            Assertions.assertEquals(1, store.listJobs("COMPLETED", 10).size());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void candidatesFollowPolicyAndSkipRecordsClaimedByActiveJobs() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-store-candidates-");
        try {
            MetadataStore store = open(root);
            long now = 1_000_000L;
            store.insertRecord(new RecordMeta("r-old", "hot", 100L, 300L, "c1", 10L, now - 50_000L));
            store.insertRecord(new RecordMeta("r-mid", "hot", 500L, 900L, "c2", 20L, now - 40_000L));
            store.insertRecord(new RecordMeta("r-new", "hot", 300L, 600L, "c3", 30L, now - 1_000L));
            store.insertRecord(new RecordMeta("r-cold", "cold", 100L, 200L, "c4", 40L, now - 90_000L));

            List<String> byAccess = ids(store.listCandidates("hot", SelectionPolicy.OLDEST_ACCESS_FIRST, SelectionPredicate.any(), now, 10));
            Assertions.assertEquals(List.of("r-old", "r-mid", "r-new"), byAccess);

            List<String> bySize = ids(store.listCandidates("hot", SelectionPolicy.LARGEST_FIRST, SelectionPredicate.any(), now, 10));
            Assertions.assertEquals(List.of("r-mid", "r-new", "r-old"), bySize);

            List<String> idle = ids(store.listCandidates("hot", SelectionPolicy.OLDEST_ACCESS_FIRST, SelectionPredicate.idleLongerThan(10_000L), now, 10));
            Assertions.assertEquals(List.of("r-old", "r-mid"), idle);

            List<String> bounded = ids(store.listCandidates("hot", SelectionPolicy.OLDEST_ACCESS_FIRST, new SelectionPredicate(0L, 200L, 400L), now, 10));
            Assertions.assertEquals(List.of("r-new"), bounded);

            store.createJob(job("mig_claim", "hot", "cold", now));
            store.insertJobRecords("mig_claim", List.of(store.findRecord("r-old").orElseThrow()), now);
            List<String> afterClaim = ids(store.listCandidates("hot", SelectionPolicy.OLDEST_ACCESS_FIRST, SelectionPredicate.any(), now, 10));
            Assertions.assertEquals(List.of("r-mid", "r-new"), afterClaim);

            store.updateJobStatus("mig_claim", MigrationStatus.FAILED, "test", now);
            Assertions.assertEquals(3, store.listCandidates("hot", SelectionPolicy.OLDEST_ACCESS_FIRST, SelectionPredicate.any(), now, 10).size());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void commitMovesRecordAndWritesLifecycleRowAtomically() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-store-commit-");
        try {
            MetadataStore store = open(root);
            RecordMeta record = new RecordMeta("rec-1", "hot", 120L, 400L, "sum-1", 5L, 5L);
            Assertions.assertTrue(store.insertRecord(record));
            Assertions.assertFalse(store.insertRecord(record), "duplicate insert must be ignored");

            store.createJob(job("mig_1", "hot", "cold", 6L));
            store.insertJobRecords("mig_1", List.of(record), 6L);
            store.markTransferred("mig_1", "rec-1", "sum-1", "blob-sum", 130L, 7L);
            store.markJobRecordState("mig_1", "rec-1", RecordMigrationState.VERIFIED, 8L);
            store.commitRecordMove("mig_1", "rec-1", "hot", "cold", 130L, 9L);

            RecordMeta moved = store.findRecord("rec-1").orElseThrow();
            Assertions.assertEquals("cold", moved.tierId());
            Assertions.assertEquals(130L, moved.sizeBytes());
            Assertions.assertEquals("sum-1", moved.checksum());

            JobRecord jr = store.listJobRecords("mig_1").get(0);
            Assertions.assertEquals(RecordMigrationState.COMMITTED, jr.state());
            Assertions.assertEquals(120L, jr.sizeBytes());
            Assertions.assertEquals(130L, jr.blobBytes());
            Assertions.assertEquals("blob-sum", jr.blobChecksum());

            MetadataStore.LifecycleEntry entry = store.listLifecycleLog(10).get(0);
            Assertions.assertEquals("rec-1", entry.recordId());
            Assertions.assertEquals("migrate", entry.operation());
            Assertions.assertEquals("hot", entry.fromTier());
            Assertions.assertEquals("cold", entry.toTier());
            Assertions.assertEquals("mig_1", entry.jobId());

            MetadataStore.TierInventory inventory = store.inventoryByTier().get("cold");
            Assertions.assertEquals(1L, inventory.recordCount());
            Assertions.assertEquals(130L, inventory.storedBytes());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void reopenClearsCancelFlagAndResetsFailedRecords() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-store-reopen-");
        try {
            MetadataStore store = open(root);
            RecordMeta a = new RecordMeta("a", "hot", 10L, 10L, "sa", 1L, 1L);
            RecordMeta b = new RecordMeta("b", "hot", 10L, 10L, "sb", 1L, 1L);
            store.insertRecord(a);
            store.insertRecord(b);
            store.createJob(job("mig_r", "hot", "cold", 2L));
            store.insertJobRecords("mig_r", List.of(a, b), 2L);
            Assertions.assertTrue(store.requestCancel("mig_r", 3L));
            Assertions.assertTrue(store.isCancelRequested("mig_r"));
            store.markJobRecordFailed("mig_r", "a", "cancelled", "Job cancelled before transfer", 4L);
            store.markJobRecordFailed("mig_r", "b", "cancelled", "Job cancelled before transfer", 4L);
            store.updateJobStatus("mig_r", MigrationStatus.FAILED, "cancelled", 5L);
            Assertions.assertFalse(store.requestCancel("mig_r", 6L), "terminal job cannot be cancelled");

            MigrationJob failed = store.findJob("mig_r").orElseThrow();
            store.reopenJob(failed, 7L);
            Assertions.assertEquals(2, store.resetFailedJobRecords("mig_r", 7L));

            MigrationJob reopened = store.findJob("mig_r").orElseThrow();
            Assertions.assertEquals(MigrationStatus.PENDING, reopened.status());
            Assertions.assertFalse(reopened.cancelRequested());
            Assertions.assertNull(reopened.failureReason());
            for (JobRecord record : store.listJobRecords("mig_r")) {
                Assertions.assertEquals(RecordMigrationState.SELECTED, record.state());
                Assertions.assertNull(record.errorKind());
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void retentionDeleteRemovesRecordAndLogsIt() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-store-retention-");
        try {
            MetadataStore store = open(root);
            store.insertRecord(new RecordMeta("old", "archive", 10L, 10L, "s1", 100L, 100L));
            store.insertRecord(new RecordMeta("young", "archive", 10L, 10L, "s2", 900L, 900L));

            List<RecordMeta> expired = store.listRecordsCreatedBefore("archive", 500L, 10);
            Assertions.assertEquals(List.of("old"), ids(expired));
            Assertions.assertTrue(store.deleteRecord("old", "archive", "retention_delete", 1_000L));
            Assertions.assertFalse(store.deleteRecord("old", "archive", "retention_delete", 1_001L));
            Assertions.assertTrue(store.findRecord("old").isEmpty());

            MetadataStore.LifecycleEntry entry = store.listLifecycleLog(1).get(0);
            Assertions.assertEquals("retention_delete", entry.operation());
            Assertions.assertEquals("archive", entry.fromTier());
            Assertions.assertNull(entry.toTier());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static MetadataStore open(Path root) {
        Database db = new Database(TierMeshConfig.fromRoot(root.toString()));
        db.init();
        return new MetadataStore(db);
    }

    private static MigrationJob job(String jobId, String source, String destination, long nowMs) {
        return new MigrationJob(
                jobId,
                source,
                destination,
                TriggerReason.MANUAL,
                MigrationStatus.PENDING,
                0L,
                SelectionPredicate.any(),
                nowMs,
                0L,
                0L,
                null,
                false
        );
    }

    private static List<String> ids(List<RecordMeta> records) {
        return records.stream().map(RecordMeta::recordId).toList();
    }
}
