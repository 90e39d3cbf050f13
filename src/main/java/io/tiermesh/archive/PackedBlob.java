package io.tiermesh.archive;

/**
 * Output of {@link Archiver#pack(byte[])}. {@code checksum} is over the plaintext,
 * {@code blobChecksum} over the sealed bytes as stored.
 */
public record PackedBlob(
        byte[] blob,
        String checksum,
        String blobChecksum,
        long payloadBytes
) {
    public long sizeBytes() {
        return blob.length;
    }
}
