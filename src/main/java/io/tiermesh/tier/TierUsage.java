package io.tiermesh.tier;

public record TierUsage(
        long usedBytes,
        long capacityBytes
) {
    public long availableBytes() {
        return Math.max(0L, capacityBytes - usedBytes);
    }

    public double usagePercent() {
        if (capacityBytes <= 0L) {
            return 0D;
        }
        return (usedBytes * 100D) / capacityBytes;
    }
}
