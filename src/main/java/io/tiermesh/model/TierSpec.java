package io.tiermesh.model;

public record TierSpec(
        String id,
        int rank,
        long capacityBytes,
        int highWaterPercent,
        int lowWaterPercent,
        String location,
        boolean directArchive,
        int retentionDays
) {
    public long highWaterBytes() {
        return capacityBytes * highWaterPercent / 100L;
    }

    public long lowWaterBytes() {
        return capacityBytes * lowWaterPercent / 100L;
    }
}
