package io.tiermesh.model;

/**
 * One record's progress inside a job. {@code sizeBytes} is the stored size in the
 * source tier, {@code blobBytes} the size written to the destination.
 */
public record JobRecord(
        String jobId,
        String recordId,
        RecordMigrationState state,
        long sizeBytes,
        long blobBytes,
        String sourceChecksum,
        String blobChecksum,
        String errorKind,
        String error,
        long updatedAtMs
) {
}
