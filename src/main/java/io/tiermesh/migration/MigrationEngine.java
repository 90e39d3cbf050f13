package io.tiermesh.migration;

import io.tiermesh.archive.Archiver;
import io.tiermesh.archive.PackedBlob;
import io.tiermesh.archive.UnpackedPayload;
import io.tiermesh.error.AlreadyRunningException;
import io.tiermesh.error.CapacityException;
import io.tiermesh.error.IntegrityException;
import io.tiermesh.error.NotFoundException;
import io.tiermesh.error.TierMeshException;
import io.tiermesh.error.TransientIOException;
import io.tiermesh.events.CoreEvent;
import io.tiermesh.events.EventPublisher;
import io.tiermesh.model.JobRecord;
import io.tiermesh.model.MigrationJob;
import io.tiermesh.model.MigrationStatus;
import io.tiermesh.model.MigrationTrigger;
import io.tiermesh.model.RecordMeta;
import io.tiermesh.model.RecordMigrationState;
import io.tiermesh.model.SelectionPolicy;
import io.tiermesh.model.SelectionPredicate;
import io.tiermesh.observability.AuditLogger;
import io.tiermesh.storage.MetadataStore;
import io.tiermesh.tier.StoredBlob;
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
import java.util.UUID;

/**
 * Moves records between two tiers in three persisted phases. Every selected record is
 * written to the destination first, then each destination copy is re-read and checked
 * against the checksum taken before transfer, and only then is the source copy deleted
 * and the catalogue repointed. A crash at any point leaves each record in a state
 * {@link #resume(String)} knows how to finish.
 */
public final class MigrationEngine {
    public static final String CANCELLED = "cancelled";
    public static final String COMMIT_INCOMPLETE = "commit_incomplete";

    private final TierRegistry tiers;
    private final MetadataStore store;
    private final Archiver archiver;
    private final TierIo tierIo;
    private final JobRegistry registry;
    private final EventPublisher events;
    private final AuditLogger auditLogger;
    private final SelectionPolicy policy;
    private final int batchSize;
    private final Clock clock;

    public MigrationEngine(
            TierRegistry tiers,
            MetadataStore store,
            Archiver archiver,
            TierIo tierIo,
            JobRegistry registry,
            EventPublisher events,
            AuditLogger auditLogger,
            SelectionPolicy policy,
            int batchSize,
            Clock clock
    ) {
        this.tiers = tiers;
        this.store = store;
        this.archiver = archiver;
        this.tierIo = tierIo;
        this.registry = registry;
        this.events = events;
        this.auditLogger = auditLogger;
        this.policy = policy == null ? SelectionPolicy.OLDEST_ACCESS_FIRST : policy;
        this.batchSize = Math.max(1, batchSize);
        this.clock = clock;
    }

    /**
     * Creates a PENDING job for the trigger's tier pair.
     *
     * @throws AlreadyRunningException if the pair already has a non-terminal job
     */
    public MigrationJob createJob(MigrationTrigger trigger) {
        tiers.validatePair(trigger.sourceTier(), trigger.destinationTier());
        String jobId = "mig_" + UUID.randomUUID().toString().replace("-", "");
        registry.claim(trigger.pairKey(), jobId);
        long nowMs = clock.millis();
        MigrationJob job = new MigrationJob(
                jobId,
                trigger.sourceTier(),
                trigger.destinationTier(),
                trigger.reason(),
                MigrationStatus.PENDING,
                trigger.reclaimBytes(),
                trigger.predicate() == null ? SelectionPredicate.any() : trigger.predicate(),
                nowMs,
                0L,
                0L,
                null,
                false
        );
        try {
            store.createJob(job);
        } catch (RuntimeException e) {
            registry.release(trigger.pairKey(), jobId);
            throw e;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "migration.job.create",
                "migration-engine",
                "jobs/" + job.pairKey(),
                "ok",
                jobId,
                null,
                Map.of(
                        "reason", trigger.reason().name(),
                        "reclaim_target_bytes", trigger.reclaimBytes(),
                        "min_idle_ms", job.predicate().minIdleMs()
                )
        ));
        return job;
    }

    public MigrationResult migrate(MigrationTrigger trigger) {
        return runMigration(createJob(trigger));
    }

    public MigrationResult runMigration(MigrationJob job) {
        registry.claim(job.pairKey(), job.jobId());
        try {
            return execute(job);
        } catch (RuntimeException e) {
            markCrashed(job, e);
            throw e;
        } finally {
            registry.release(job.pairKey(), job.jobId());
        }
    }

    /**
     * Finishes a job left non-terminal by a crash, or retries the unfinished records of a
     * FAILED job. VERIFIED records only have their source deleted, TRANSFERRED records are
     * re-verified and SELECTED records are transferred again.
     */
    public MigrationResult resume(String jobId) {
        MigrationJob job = store.findJob(jobId)
                .orElseThrow(() -> new NotFoundException("Migration job not found: " + jobId));
        if (job.status() == MigrationStatus.COMPLETED) {
            throw new IllegalStateException("Migration job already completed: " + jobId);
        }
        if (registry.isActive(jobId)) {
            throw new AlreadyRunningException(job.pairKey(), jobId);
        }
        registry.claim(job.pairKey(), jobId);
        try {
            if (job.status() == MigrationStatus.FAILED) {
                long nowMs = clock.millis();
                store.reopenJob(job, nowMs);
                int reset = store.resetFailedJobRecords(jobId, nowMs);
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "migration.job.reopen",
                        "migration-engine",
                        "jobs/" + job.pairKey(),
                        "ok",
                        jobId,
                        null,
                        Map.of("previous_failure", String.valueOf(job.failureReason()), "records_reset", reset)
                ));
            }
        } catch (RuntimeException e) {
            registry.release(job.pairKey(), jobId);
            throw e;
        }
        MigrationJob reloaded = store.findJob(jobId)
                .orElseThrow(() -> new NotFoundException("Migration job not found: " + jobId));
        auditLogger.log(AuditLogger.AuditEvent.of(
                "migration.job.resume",
                "migration-engine",
                "jobs/" + job.pairKey(),
                "ok",
                jobId,
                null,
                Map.of("status", reloaded.status().name())
        ));
        return runMigration(reloaded);
    }

    /**
     * Resumes every non-terminal job not already running in this process.
     */
    public List<MigrationResult> resumeInterrupted() {
        List<MigrationResult> out = new ArrayList<>();
        for (MigrationJob job : store.listNonTerminalJobs()) {
            if (registry.isActive(job.jobId())) {
                continue;
            }
            try {
                out.add(resume(job.jobId()));
            } catch (TierMeshException e) {
                auditLogger.log(AuditLogger.AuditEvent.of(
                        "migration.job.resume",
                        "migration-engine",
                        "jobs/" + job.pairKey(),
                        "error",
                        job.jobId(),
                        null,
                        Map.of("kind", e.kind(), "error", String.valueOf(e.getMessage()))
                ));
            }
        }
        return out;
    }

    /**
     * Requests cancellation. The flag is persisted so a job running in another process
     * sees it before its next transfer.
     *
     * @return {@code false} if the job is already terminal
     */
    public boolean cancel(String jobId) {
        MigrationJob job = store.findJob(jobId)
                .orElseThrow(() -> new NotFoundException("Migration job not found: " + jobId));
        if (job.status().terminal()) {
            return false;
        }
        registry.requestCancel(jobId);
        boolean persisted = store.requestCancel(jobId, clock.millis());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "migration.job.cancel",
                "migration-engine",
                "jobs/" + job.pairKey(),
                persisted ? "ok" : "noop",
                jobId,
                null,
                Map.of("status", job.status().name())
        ));
        return persisted;
    }

    /**
     * Active job for a pair, in this process or any other sharing the database.
     */
    public Optional<String> activeJob(String sourceTier, String destinationTier) {
        Optional<String> local = registry.activeJob(sourceTier + "->" + destinationTier);
        if (local.isPresent()) {
            return local;
        }
        return store.findActiveJob(sourceTier, destinationTier).map(MigrationJob::jobId);
    }

    private MigrationResult execute(MigrationJob job) {
        String jobId = job.jobId();
        List<JobRecord> records = store.listJobRecords(jobId);
        if (records.isEmpty() && job.status() == MigrationStatus.PENDING) {
            List<RecordMeta> selected = select(job);
            store.insertJobRecords(jobId, selected, clock.millis());
            records = store.listJobRecords(jobId);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "migration.job.select",
                    "migration-engine",
                    "jobs/" + job.pairKey(),
                    "ok",
                    jobId,
                    null,
                    Map.of("selected", selected.size(), "policy", policy.name())
            ));
        }

        Map<String, RecordFailure> failures = new LinkedHashMap<>();
        TierBackend source = tiers.backend(job.sourceTier());
        TierBackend destination = tiers.backend(job.destinationTier());

        setStatus(job, MigrationStatus.TRANSFERRING, null);
        boolean cancelled = false;
        CapacityException capacityStop = null;
        for (JobRecord record : records) {
            if (record.state() != RecordMigrationState.SELECTED) {
                continue;
            }
            if (!cancelled && (registry.cancelRequested(jobId) || store.isCancelRequested(jobId))) {
                cancelled = true;
            }
            if (cancelled) {
                failRecord(job, record.recordId(), CANCELLED, "Job cancelled before transfer", failures);
                continue;
            }
            if (capacityStop != null) {
                failRecord(job, record.recordId(), capacityStop.kind(), capacityStop.getMessage(), failures);
                continue;
            }
            try {
                transfer(job, record, source, destination);
            } catch (CapacityException e) {
                capacityStop = e;
                failRecord(job, record.recordId(), e.kind(), describe(e), failures);
            } catch (TierMeshException e) {
                failRecord(job, record.recordId(), e.kind(), describe(e), failures);
            }
        }

        setStatus(job, MigrationStatus.VERIFYING, null);
        for (JobRecord record : store.listJobRecords(jobId)) {
            if (record.state() == RecordMigrationState.TRANSFERRED) {
                verify(job, record, destination, failures);
            }
        }

        setStatus(job, MigrationStatus.COMMITTING, null);
        Map<String, TierMeshException> commitErrors = new LinkedHashMap<>();
        for (JobRecord record : store.listJobRecords(jobId)) {
            if (record.state() != RecordMigrationState.VERIFIED) {
                continue;
            }
            try {
                commit(job, record, source);
            } catch (TierMeshException e) {
                commitErrors.put(record.recordId(), e);
            }
        }

        List<String> committed = new ArrayList<>();
        List<RecordFailure> failed = new ArrayList<>();
        long reclaimed = 0L;
        for (JobRecord record : store.listJobRecords(jobId)) {
            switch (record.state()) {
                case COMMITTED -> {
                    committed.add(record.recordId());
                    reclaimed += record.sizeBytes();
                }
                case FAILED -> failed.add(failures.getOrDefault(
                        record.recordId(),
                        new RecordFailure(record.recordId(), record.errorKind(), record.error())
                ));
                case VERIFIED -> {
                    TierMeshException e = commitErrors.get(record.recordId());
                    failed.add(new RecordFailure(
                            record.recordId(),
                            e == null ? COMMIT_INCOMPLETE : e.kind(),
                            e == null ? "Source copy not yet removed" : e.getMessage()
                    ));
                }
                default -> failed.add(new RecordFailure(record.recordId(), "incomplete", "Record left in state " + record.state()));
            }
        }

        String failureReason = null;
        if (cancelled) {
            failureReason = CANCELLED;
        } else if (capacityStop != null) {
            failureReason = "capacity: " + capacityStop.getMessage();
        } else if (!commitErrors.isEmpty()) {
            failureReason = COMMIT_INCOMPLETE;
        }
        MigrationStatus finalStatus = failureReason == null ? MigrationStatus.COMPLETED : MigrationStatus.FAILED;
        setStatus(job, finalStatus, failureReason);

        MigrationResult result = new MigrationResult(
                jobId,
                job.sourceTier(),
                job.destinationTier(),
                finalStatus,
                committed,
                failed,
                reclaimed,
                failureReason
        );
        publishOutcome(job, result);
        return result;
    }

    private List<RecordMeta> select(MigrationJob job) {
        long nowMs = clock.millis();
        List<RecordMeta> candidates = store.listCandidates(job.sourceTier(), policy, job.predicate(), nowMs, batchSize);
        List<RecordMeta> selected = new ArrayList<>();
        long cumulative = 0L;
        for (RecordMeta candidate : candidates) {
            if (job.reclaimTargetBytes() > 0L && cumulative >= job.reclaimTargetBytes()) {
                break;
            }
            if (!job.predicate().matches(candidate, nowMs)) {
                continue;
            }
            selected.add(candidate);
            cumulative += candidate.sizeBytes();
        }
        return selected;
    }

    private void transfer(MigrationJob job, JobRecord record, TierBackend source, TierBackend destination) {
        String recordId = record.recordId();
        RecordMeta meta = store.findRecord(recordId)
                .filter(m -> m.tierId().equals(job.sourceTier()))
                .orElseThrow(() -> new NotFoundException("Record " + recordId + " is no longer in tier " + job.sourceTier()));
        StoredBlob stored = tierIo.call("get " + recordId + " from " + source.tierId(), () -> source.get(recordId))
                .orElseThrow(() -> new NotFoundException("Record " + recordId + " missing from tier " + source.tierId()));
        UnpackedPayload payload = archiver.unpack(recordId, stored.blob());
        if (!payload.checksum().equals(meta.checksum())) {
            throw new IntegrityException(recordId, meta.checksum(), payload.checksum());
        }
        PackedBlob packed = archiver.pack(payload.payload());
        TierUsage usage = tierIo.call("usage of " + destination.tierId(), destination::usage);
        if (usage.availableBytes() < packed.sizeBytes()) {
            throw new CapacityException(destination.tierId(), packed.sizeBytes(), usage.availableBytes());
        }
        try {
            tierIo.run("put " + recordId + " to " + destination.tierId(),
                    () -> destination.put(recordId, packed.blob(), packed.checksum()));
            store.markTransferred(job.jobId(), recordId, meta.checksum(), packed.blobChecksum(), packed.sizeBytes(), clock.millis());
        } catch (RuntimeException e) {
            // The write may have landed even though the call failed; the record stays catalogued in the source.
            String cleanupError = discardCopy(recordId, destination);
            if (cleanupError != null) {
                e.addSuppressed(new TransientIOException("destination cleanup failed: " + cleanupError));
            }
            throw e;
        }
    }

    private void verify(MigrationJob job, JobRecord record, TierBackend destination, Map<String, RecordFailure> failures) {
        String recordId = record.recordId();
        try {
            StoredBlob stored = tierIo.call("get " + recordId + " from " + destination.tierId(), () -> destination.get(recordId))
                    .orElseThrow(() -> IntegrityException.missingCopy(recordId, destination.tierId()));
            UnpackedPayload payload = archiver.unpack(recordId, stored.blob());
            if (!payload.checksum().equals(record.sourceChecksum())) {
                throw new IntegrityException(recordId, record.sourceChecksum(), payload.checksum());
            }
            store.markJobRecordState(job.jobId(), recordId, RecordMigrationState.VERIFIED, clock.millis());
        } catch (TierMeshException e) {
            String message = e.getMessage();
            String cleanupError = discardCopy(recordId, destination);
            if (cleanupError != null) {
                message = message + "; destination cleanup failed: " + cleanupError;
            }
            failRecord(job, recordId, e.kind(), message, failures);
        }
    }

    // Returns the cleanup error message, or null once the destination holds no copy.
    private String discardCopy(String recordId, TierBackend destination) {
        try {
            tierIo.call("delete " + recordId + " from " + destination.tierId(), () -> destination.delete(recordId));
            return null;
        } catch (TierMeshException cleanup) {
            return cleanup.getMessage();
        }
    }

    private void commit(MigrationJob job, JobRecord record, TierBackend source) {
        String recordId = record.recordId();
        tierIo.call("delete " + recordId + " from " + source.tierId(), () -> source.delete(recordId));
        store.commitRecordMove(job.jobId(), recordId, job.sourceTier(), job.destinationTier(), record.blobBytes(), clock.millis());
    }

    private static String describe(TierMeshException e) {
        StringBuilder sb = new StringBuilder(String.valueOf(e.getMessage()));
        for (Throwable suppressed : e.getSuppressed()) {
            sb.append("; ").append(suppressed.getMessage());
        }
        return sb.toString();
    }

    private void failRecord(MigrationJob job, String recordId, String kind, String message, Map<String, RecordFailure> failures) {
        store.markJobRecordFailed(job.jobId(), recordId, kind, message, clock.millis());
        failures.put(recordId, new RecordFailure(recordId, kind, message));
        auditLogger.log(AuditLogger.AuditEvent.of(
                "migration.record.failed",
                "migration-engine",
                "jobs/" + job.pairKey(),
                kind,
                job.jobId(),
                recordId,
                Map.of("error", String.valueOf(message))
        ));
    }

    private void setStatus(MigrationJob job, MigrationStatus status, String failureReason) {
        store.updateJobStatus(job.jobId(), status, failureReason, clock.millis());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", status.name());
        if (failureReason != null) {
            details.put("failure_reason", failureReason);
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "migration.job.status",
                "migration-engine",
                "jobs/" + job.pairKey(),
                "ok",
                job.jobId(),
                null,
                details
        ));
    }

    private void markCrashed(MigrationJob job, RuntimeException cause) {
        String reason = "internal: " + cause.getMessage();
        try {
            store.updateJobStatus(job.jobId(), MigrationStatus.FAILED, reason, clock.millis());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            return;
        }
        events.publish(new CoreEvent(
                CoreEvent.MIGRATION_FAILED,
                job.jobId(),
                clock.millis(),
                Map.of(
                        "job_id", job.jobId(),
                        "source_tier", job.sourceTier(),
                        "destination_tier", job.destinationTier(),
                        "failure_reason", reason
                )
        ));
    }

    private void publishOutcome(MigrationJob job, MigrationResult result) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("job_id", job.jobId());
        attributes.put("source_tier", job.sourceTier());
        attributes.put("destination_tier", job.destinationTier());
        attributes.put("reason", job.reason().name());
        attributes.put("committed", result.committed().size());
        attributes.put("failed", result.failed().size());
        attributes.put("reclaimed_bytes", result.reclaimedBytes());
        if (!result.failed().isEmpty()) {
            List<Map<String, String>> failedRecords = new ArrayList<>();
            for (RecordFailure failure : result.failed()) {
                failedRecords.add(Map.of("record_id", failure.recordId(), "kind", String.valueOf(failure.kind())));
            }
            attributes.put("failed_records", failedRecords);
            attributes.put("integrity_failures", result.failed().stream().filter(f -> "integrity".equals(f.kind())).count());
        }
        if (result.failureReason() != null) {
            attributes.put("failure_reason", result.failureReason());
        }
        String type = result.status() == MigrationStatus.COMPLETED ? CoreEvent.MIGRATION_COMPLETED : CoreEvent.MIGRATION_FAILED;
        events.publish(new CoreEvent(type, job.jobId(), clock.millis(), attributes));
    }
}
