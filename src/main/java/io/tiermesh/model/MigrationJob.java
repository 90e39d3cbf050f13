package io.tiermesh.model;

public record MigrationJob(
        String jobId,
        String sourceTier,
        String destinationTier,
        TriggerReason reason,
        MigrationStatus status,
        long reclaimTargetBytes,
        SelectionPredicate predicate,
        long createdAtMs,
        long startedAtMs,
        long completedAtMs,
        String failureReason,
        boolean cancelRequested
) {
    public String pairKey() {
        return sourceTier + "->" + destinationTier;
    }
}
