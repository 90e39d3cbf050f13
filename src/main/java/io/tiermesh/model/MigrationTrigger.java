package io.tiermesh.model;

public record MigrationTrigger(
        String sourceTier,
        String destinationTier,
        TriggerReason reason,
        long reclaimBytes,
        SelectionPredicate predicate
) {
    public String pairKey() {
        return sourceTier + "->" + destinationTier;
    }
}
