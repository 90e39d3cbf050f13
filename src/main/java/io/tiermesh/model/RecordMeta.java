package io.tiermesh.model;

public record RecordMeta(
        String recordId,
        String tierId,
        long sizeBytes,
        long payloadBytes,
        String checksum,
        long createdAtMs,
        long lastAccessedAtMs
) {
}
