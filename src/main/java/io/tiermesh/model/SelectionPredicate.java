package io.tiermesh.model;

public record SelectionPredicate(
        long minIdleMs,
        long minSizeBytes,
        long maxSizeBytes
) {
    public static SelectionPredicate any() {
        return new SelectionPredicate(0L, 0L, 0L);
    }

    public static SelectionPredicate idleLongerThan(long idleMs) {
        return new SelectionPredicate(Math.max(0L, idleMs), 0L, 0L);
    }

    public boolean matches(RecordMeta record, long nowMs) {
        if (minIdleMs > 0L && (nowMs - record.lastAccessedAtMs()) < minIdleMs) {
            return false;
        }
        if (minSizeBytes > 0L && record.sizeBytes() < minSizeBytes) {
            return false;
        }
        return maxSizeBytes <= 0L || record.sizeBytes() <= maxSizeBytes;
    }
}
