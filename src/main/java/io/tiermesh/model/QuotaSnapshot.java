package io.tiermesh.model;

public record QuotaSnapshot(
        String tierId,
        long usedBytes,
        long capacityBytes,
        double usagePercent,
        long takenAtMs
) {
}
