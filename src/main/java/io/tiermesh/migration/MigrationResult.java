package io.tiermesh.migration;

import io.tiermesh.model.MigrationStatus;

import java.util.List;

/**
 * Outcome of one run of a job. {@code committed} lists records now served from the
 * destination; {@code failed} lists records that stayed in the source.
 */
public record MigrationResult(
        String jobId,
        String sourceTier,
        String destinationTier,
        MigrationStatus status,
        List<String> committed,
        List<RecordFailure> failed,
        long reclaimedBytes,
        String failureReason
) {
    public MigrationResult {
        committed = committed == null ? List.of() : List.copyOf(committed);
        failed = failed == null ? List.of() : List.copyOf(failed);
    }
}
