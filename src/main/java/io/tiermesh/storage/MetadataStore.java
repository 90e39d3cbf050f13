package io.tiermesh.storage;

import io.tiermesh.error.AlreadyRunningException;
import io.tiermesh.model.JobRecord;
import io.tiermesh.model.MigrationJob;
import io.tiermesh.model.MigrationStatus;
import io.tiermesh.model.QuotaSnapshot;
import io.tiermesh.model.RecordMeta;
import io.tiermesh.model.RecordMigrationState;
import io.tiermesh.model.SelectionPolicy;
import io.tiermesh.model.SelectionPredicate;
import io.tiermesh.model.TriggerReason;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Authoritative catalogue: where every record lives, migration jobs with their
 * per-record progress, the latest quota snapshot per tier and the lifecycle log.
 */
public final class MetadataStore {
    private static final String RECORD_COLUMNS =
            "record_id,tier_id,size_bytes,payload_bytes,checksum,created_at_ms,last_accessed_at_ms";
    private static final String JOB_COLUMNS =
            "job_id,source_tier,destination_tier,reason,status,reclaim_target_bytes,min_idle_ms,min_size_bytes,"
                    + "max_size_bytes,failure_reason,cancel_requested,created_at_ms,started_at_ms,completed_at_ms";
    private static final String JOB_RECORD_COLUMNS =
            "job_id,record_id,state,size_bytes,blob_bytes,source_checksum,blob_checksum,error_kind,error,updated_at_ms";
    private static final String TERMINAL_STATUSES = "('COMPLETED','FAILED')";

    private final Database database;

    public MetadataStore(Database database) {
        this.database = database;
    }

    // ---- records ----

    public boolean insertRecord(RecordMeta record) {
        String sql = "INSERT OR IGNORE INTO records(" + RECORD_COLUMNS + ",updated_at_ms) VALUES(?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, record.recordId());
            ps.setString(2, record.tierId());
            ps.setLong(3, record.sizeBytes());
            ps.setLong(4, record.payloadBytes());
            ps.setString(5, record.checksum());
            ps.setLong(6, record.createdAtMs());
            ps.setLong(7, record.lastAccessedAtMs());
            ps.setLong(8, record.createdAtMs());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert record: " + record.recordId(), e);
        }
    }

    public Optional<RecordMeta> findRecord(String recordId) {
        String sql = "SELECT " + RECORD_COLUMNS + " FROM records WHERE record_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, recordId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRecord(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load record: " + recordId, e);
        }
    }

    public void touchRecord(String recordId, long nowMs) {
        String sql = "UPDATE records SET last_accessed_at_ms=?, updated_at_ms=? WHERE record_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setLong(2, nowMs);
            ps.setString(3, recordId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to touch record: " + recordId, e);
        }
    }

    /**
     * Records of {@code tierId} matching the predicate, in policy order. Records already
     * claimed by any non-terminal job are skipped.
     */
    public List<RecordMeta> listCandidates(
            String tierId,
            SelectionPolicy policy,
            SelectionPredicate predicate,
            long nowMs,
            int limit
    ) {
        String sql = "SELECT " + RECORD_COLUMNS + " FROM records"
                + " WHERE tier_id=?"
                + " AND last_accessed_at_ms<=?"
                + " AND size_bytes>=?"
                + " AND (?<=0 OR size_bytes<=?)"
                + " AND record_id NOT IN ("
                + "   SELECT jr.record_id FROM migration_job_records jr"
                + "   JOIN migration_jobs j ON j.job_id=jr.job_id"
                + "   WHERE j.status NOT IN " + TERMINAL_STATUSES + ")"
                + " ORDER BY " + policy.orderBy()
                + " LIMIT ?";
        SelectionPredicate safe = predicate == null ? SelectionPredicate.any() : predicate;
        List<RecordMeta> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, tierId);
            ps.setLong(2, nowMs - Math.max(0L, safe.minIdleMs()));
            ps.setLong(3, Math.max(0L, safe.minSizeBytes()));
            ps.setLong(4, safe.maxSizeBytes());
            ps.setLong(5, safe.maxSizeBytes());
            ps.setInt(6, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRecord(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list migration candidates for tier " + tierId, e);
        }
    }

    public List<RecordMeta> listRecordsCreatedBefore(String tierId, long createdBeforeMs, int limit) {
        String sql = "SELECT " + RECORD_COLUMNS + " FROM records WHERE tier_id=? AND created_at_ms<?"
                + " ORDER BY created_at_ms ASC, record_id ASC LIMIT ?";
        List<RecordMeta> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, tierId);
            ps.setLong(2, createdBeforeMs);
            ps.setInt(3, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRecord(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list records of tier " + tierId, e);
        }
    }

    public boolean hasRecordsIdleSince(String tierId, long idleBeforeMs) {
        String sql = "SELECT 1 FROM records WHERE tier_id=? AND last_accessed_at_ms<? LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, tierId);
            ps.setLong(2, idleBeforeMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check idle records of tier " + tierId, e);
        }
    }

    public Map<String, TierInventory> inventoryByTier() {
        String sql = "SELECT tier_id, COUNT(*) AS n, COALESCE(SUM(size_bytes),0) AS bytes FROM records GROUP BY tier_id ORDER BY tier_id";
        Map<String, TierInventory> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String tier = rs.getString("tier_id");
                out.put(tier, new TierInventory(tier, rs.getLong("n"), rs.getLong("bytes")));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to build tier inventory", e);
        }
    }

    /**
     * Removes a record from the catalogue and appends the lifecycle row in one transaction.
     */
    public boolean deleteRecord(String recordId, String tierId, String operation, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement del = c.prepareStatement("DELETE FROM records WHERE record_id=? AND tier_id=?")) {
                del.setString(1, recordId);
                del.setString(2, tierId);
                int rows = del.executeUpdate();
                if (rows == 1) {
                    insertLifecycle(c, recordId, operation, tierId, null, null, nowMs);
                }
                c.commit();
                return rows == 1;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to delete record: " + recordId, e);
        }
    }

    // ---- jobs ----

    /**
     * Inserts a PENDING job. The partial unique index turns a concurrent second job for
     * the same pair into {@link AlreadyRunningException}.
     */
    public void createJob(MigrationJob job) {
        String sql = "INSERT INTO migration_jobs(" + JOB_COLUMNS + ",updated_at_ms) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            SelectionPredicate predicate = job.predicate() == null ? SelectionPredicate.any() : job.predicate();
            ps.setString(1, job.jobId());
            ps.setString(2, job.sourceTier());
            ps.setString(3, job.destinationTier());
            ps.setString(4, job.reason().name());
            ps.setString(5, job.status().name());
            ps.setLong(6, job.reclaimTargetBytes());
            ps.setLong(7, predicate.minIdleMs());
            ps.setLong(8, predicate.minSizeBytes());
            ps.setLong(9, predicate.maxSizeBytes());
            ps.setString(10, job.failureReason());
            ps.setInt(11, job.cancelRequested() ? 1 : 0);
            ps.setLong(12, job.createdAtMs());
            ps.setLong(13, job.startedAtMs());
            ps.setLong(14, job.completedAtMs());
            ps.setLong(15, job.createdAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                String active = findActiveJob(job.sourceTier(), job.destinationTier())
                        .map(MigrationJob::jobId)
                        .orElse(null);
                throw new AlreadyRunningException(job.pairKey(), active);
            }
            throw new RuntimeException("Failed to create migration job: " + job.jobId(), e);
        }
    }

    public Optional<MigrationJob> findJob(String jobId) {
        String sql = "SELECT " + JOB_COLUMNS + " FROM migration_jobs WHERE job_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapJob(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load migration job: " + jobId, e);
        }
    }

    public Optional<MigrationJob> findActiveJob(String sourceTier, String destinationTier) {
        String sql = "SELECT " + JOB_COLUMNS + " FROM migration_jobs"
                + " WHERE source_tier=? AND destination_tier=? AND status NOT IN " + TERMINAL_STATUSES + " LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sourceTier);
            ps.setString(2, destinationTier);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapJob(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to look up active job for " + sourceTier + "->" + destinationTier, e);
        }
    }

    public List<MigrationJob> listNonTerminalJobs() {
        String sql = "SELECT " + JOB_COLUMNS + " FROM migration_jobs WHERE status NOT IN " + TERMINAL_STATUSES
                + " ORDER BY created_at_ms ASC";
        return queryJobs(sql, null, 0);
    }

    public List<MigrationJob> listJobs(String statusFilter, int limit) {
        String normalized = statusFilter == null ? "" : statusFilter.trim().toUpperCase(Locale.ROOT);
        if (normalized.isBlank()) {
            return queryJobs("SELECT " + JOB_COLUMNS + " FROM migration_jobs ORDER BY created_at_ms DESC LIMIT ?", null, limit);
        }
        MigrationStatus.valueOf(normalized);
        return queryJobs(
                "SELECT " + JOB_COLUMNS + " FROM migration_jobs WHERE status=? ORDER BY created_at_ms DESC LIMIT ?",
                normalized,
                limit
        );
    }

    public Map<String, Long> countJobsByStatus() {
        String sql = "SELECT status, COUNT(*) AS n FROM migration_jobs GROUP BY status ORDER BY status";
        Map<String, Long> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString("status"), rs.getLong("n"));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count migration jobs", e);
        }
    }

    public void updateJobStatus(String jobId, MigrationStatus status, String failureReason, long nowMs) {
        String sql = """
                UPDATE migration_jobs
                SET status=?,
                    failure_reason=COALESCE(?, failure_reason),
                    started_at_ms=CASE WHEN started_at_ms=0 AND ?<>'PENDING' THEN ? ELSE started_at_ms END,
                    completed_at_ms=CASE WHEN ? IN ('COMPLETED','FAILED') THEN ? ELSE completed_at_ms END,
                    updated_at_ms=?
                WHERE job_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status.name());
            ps.setString(2, failureReason);
            ps.setString(3, status.name());
            ps.setLong(4, nowMs);
            ps.setString(5, status.name());
            ps.setLong(6, nowMs);
            ps.setLong(7, nowMs);
            ps.setString(8, jobId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job status: " + jobId, e);
        }
    }

    /**
     * Moves a FAILED job back to PENDING so its unfinished records can be resumed.
     */
    public void reopenJob(MigrationJob job, long nowMs) {
        String sql = """
                UPDATE migration_jobs
                SET status='PENDING', failure_reason=NULL, cancel_requested=0, completed_at_ms=0, updated_at_ms=?
                WHERE job_id=? AND status='FAILED'
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, job.jobId());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                String active = findActiveJob(job.sourceTier(), job.destinationTier())
                        .map(MigrationJob::jobId)
                        .orElse(null);
                throw new AlreadyRunningException(job.pairKey(), active);
            }
            throw new RuntimeException("Failed to reopen job: " + job.jobId(), e);
        }
    }

    public boolean requestCancel(String jobId, long nowMs) {
        String sql = "UPDATE migration_jobs SET cancel_requested=1, updated_at_ms=? WHERE job_id=? AND status NOT IN " + TERMINAL_STATUSES;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, jobId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to request cancel for job: " + jobId, e);
        }
    }

    public boolean isCancelRequested(String jobId) {
        String sql = "SELECT cancel_requested FROM migration_jobs WHERE job_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) == 1;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read cancel flag for job: " + jobId, e);
        }
    }

    // ---- job records ----

    public void insertJobRecords(String jobId, List<RecordMeta> records, long nowMs) {
        String sql = "INSERT INTO migration_job_records(job_id,record_id,seq,state,size_bytes,source_checksum,updated_at_ms) VALUES(?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                int seq = 0;
                for (RecordMeta record : records) {
                    ps.setString(1, jobId);
                    ps.setString(2, record.recordId());
                    ps.setInt(3, seq++);
                    ps.setString(4, RecordMigrationState.SELECTED.name());
                    ps.setLong(5, record.sizeBytes());
                    ps.setString(6, record.checksum());
                    ps.setLong(7, nowMs);
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to insert job records for " + jobId, e);
        }
    }

    public List<JobRecord> listJobRecords(String jobId) {
        String sql = "SELECT " + JOB_RECORD_COLUMNS + " FROM migration_job_records WHERE job_id=? ORDER BY seq ASC";
        List<JobRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new JobRecord(
                            rs.getString("job_id"),
                            rs.getString("record_id"),
                            RecordMigrationState.valueOf(rs.getString("state")),
                            rs.getLong("size_bytes"),
                            rs.getLong("blob_bytes"),
                            rs.getString("source_checksum"),
                            rs.getString("blob_checksum"),
                            rs.getString("error_kind"),
                            rs.getString("error"),
                            rs.getLong("updated_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list job records for " + jobId, e);
        }
    }

    public void markTransferred(String jobId, String recordId, String sourceChecksum, String blobChecksum, long blobBytes, long nowMs) {
        String sql = """
                UPDATE migration_job_records
                SET state='TRANSFERRED', source_checksum=?, blob_checksum=?, blob_bytes=?, error_kind=NULL, error=NULL, updated_at_ms=?
                WHERE job_id=? AND record_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, sourceChecksum);
            ps.setString(2, blobChecksum);
            ps.setLong(3, blobBytes);
            ps.setLong(4, nowMs);
            ps.setString(5, jobId);
            ps.setString(6, recordId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark " + recordId + " transferred in " + jobId, e);
        }
    }

    public void markJobRecordState(String jobId, String recordId, RecordMigrationState state, long nowMs) {
        String sql = "UPDATE migration_job_records SET state=?, updated_at_ms=? WHERE job_id=? AND record_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, state.name());
            ps.setLong(2, nowMs);
            ps.setString(3, jobId);
            ps.setString(4, recordId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update " + recordId + " in " + jobId, e);
        }
    }

    public void markJobRecordFailed(String jobId, String recordId, String errorKind, String error, long nowMs) {
        String sql = "UPDATE migration_job_records SET state='FAILED', error_kind=?, error=?, updated_at_ms=? WHERE job_id=? AND record_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, errorKind);
            ps.setString(2, error);
            ps.setLong(3, nowMs);
            ps.setString(4, jobId);
            ps.setString(5, recordId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark " + recordId + " failed in " + jobId, e);
        }
    }

    public int resetFailedJobRecords(String jobId, long nowMs) {
        String sql = """
                UPDATE migration_job_records
                SET state='SELECTED', error_kind=NULL, error=NULL, updated_at_ms=?
                WHERE job_id=? AND state='FAILED'
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, jobId);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reset failed records of " + jobId, e);
        }
    }

    /**
     * Points the catalogue entry at the destination tier, marks the job record
     * COMMITTED and appends the lifecycle row, all in one transaction. Called only after
     * the source copy is gone.
     */
    public void commitRecordMove(String jobId, String recordId, String fromTier, String toTier, long newSizeBytes, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement rec = c.prepareStatement(
                    "UPDATE records SET tier_id=?, size_bytes=?, updated_at_ms=? WHERE record_id=? AND tier_id IN (?,?)");
                 PreparedStatement jr = c.prepareStatement(
                         "UPDATE migration_job_records SET state='COMMITTED', updated_at_ms=? WHERE job_id=? AND record_id=?")) {
                rec.setString(1, toTier);
                rec.setLong(2, newSizeBytes);
                rec.setLong(3, nowMs);
                rec.setString(4, recordId);
                rec.setString(5, fromTier);
                rec.setString(6, toTier);
                rec.executeUpdate();

                jr.setLong(1, nowMs);
                jr.setString(2, jobId);
                jr.setString(3, recordId);
                jr.executeUpdate();

                insertLifecycle(c, recordId, "migrate", fromTier, toTier, jobId, nowMs);
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to commit move of " + recordId + " in " + jobId, e);
        }
    }

    // ---- quota snapshots ----

    public void upsertQuotaSnapshot(QuotaSnapshot snapshot) {
        String sql = """
                INSERT INTO quota_snapshots(tier_id,used_bytes,capacity_bytes,usage_percent,taken_at_ms) VALUES(?,?,?,?,?)
                ON CONFLICT(tier_id) DO UPDATE SET
                    used_bytes=excluded.used_bytes,
                    capacity_bytes=excluded.capacity_bytes,
                    usage_percent=excluded.usage_percent,
                    taken_at_ms=excluded.taken_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, snapshot.tierId());
            ps.setLong(2, snapshot.usedBytes());
            ps.setLong(3, snapshot.capacityBytes());
            ps.setDouble(4, snapshot.usagePercent());
            ps.setLong(5, snapshot.takenAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store quota snapshot for " + snapshot.tierId(), e);
        }
    }

    public List<QuotaSnapshot> listQuotaSnapshots() {
        String sql = "SELECT tier_id,used_bytes,capacity_bytes,usage_percent,taken_at_ms FROM quota_snapshots ORDER BY tier_id";
        List<QuotaSnapshot> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql); ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new QuotaSnapshot(
                        rs.getString("tier_id"),
                        rs.getLong("used_bytes"),
                        rs.getLong("capacity_bytes"),
                        rs.getDouble("usage_percent"),
                        rs.getLong("taken_at_ms")
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list quota snapshots", e);
        }
    }

    // ---- lifecycle log ----

    public List<LifecycleEntry> listLifecycleLog(int limit) {
        String sql = "SELECT id,record_id,operation,from_tier,to_tier,job_id,occurred_at_ms FROM lifecycle_log ORDER BY id DESC LIMIT ?";
        List<LifecycleEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new LifecycleEntry(
                            rs.getLong("id"),
                            rs.getString("record_id"),
                            rs.getString("operation"),
                            rs.getString("from_tier"),
                            rs.getString("to_tier"),
                            rs.getString("job_id"),
                            rs.getLong("occurred_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list lifecycle log", e);
        }
    }

    private void insertLifecycle(Connection c, String recordId, String operation, String fromTier, String toTier, String jobId, long nowMs)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO lifecycle_log(record_id,operation,from_tier,to_tier,job_id,occurred_at_ms) VALUES(?,?,?,?,?,?)")) {
            ps.setString(1, recordId);
            ps.setString(2, operation);
            ps.setString(3, fromTier);
            ps.setString(4, toTier);
            ps.setString(5, jobId);
            ps.setLong(6, nowMs);
            ps.executeUpdate();
        }
    }

    private List<MigrationJob> queryJobs(String sql, String status, int limit) {
        List<MigrationJob> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (status != null) {
                ps.setString(idx++, status);
            }
            if (sql.contains("LIMIT ?")) {
                ps.setInt(idx, Math.max(1, limit));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapJob(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list migration jobs", e);
        }
    }

    private static boolean isUniqueViolation(SQLException e) {
        String message = e.getMessage() == null ? "" : e.getMessage().toUpperCase(Locale.ROOT);
        return message.contains("UNIQUE") || message.contains("CONSTRAINT");
    }

    private static RecordMeta mapRecord(ResultSet rs) throws SQLException {
        return new RecordMeta(
                rs.getString("record_id"),
                rs.getString("tier_id"),
                rs.getLong("size_bytes"),
                rs.getLong("payload_bytes"),
                rs.getString("checksum"),
                rs.getLong("created_at_ms"),
                rs.getLong("last_accessed_at_ms")
        );
    }

    private static MigrationJob mapJob(ResultSet rs) throws SQLException {
        return new MigrationJob(
                rs.getString("job_id"),
                rs.getString("source_tier"),
                rs.getString("destination_tier"),
                TriggerReason.valueOf(rs.getString("reason")),
                MigrationStatus.valueOf(rs.getString("status")),
                rs.getLong("reclaim_target_bytes"),
                new SelectionPredicate(
                        rs.getLong("min_idle_ms"),
                        rs.getLong("min_size_bytes"),
                        rs.getLong("max_size_bytes")
                ),
                rs.getLong("created_at_ms"),
                rs.getLong("started_at_ms"),
                rs.getLong("completed_at_ms"),
                rs.getString("failure_reason"),
                rs.getInt("cancel_requested") == 1
        );
    }

    public record TierInventory(String tierId, long recordCount, long storedBytes) {
    }

    public record LifecycleEntry(
            long id,
            String recordId,
            String operation,
            String fromTier,
            String toTier,
            String jobId,
            long occurredAtMs
    ) {
    }
}
