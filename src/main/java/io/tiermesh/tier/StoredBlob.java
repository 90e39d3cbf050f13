package io.tiermesh.tier;

public record StoredBlob(
        String recordId,
        byte[] blob,
        String checksum
) {
}
