package io.tiermesh.archive;

public record UnpackedPayload(
        byte[] payload,
        String checksum
) {
}
