package io.tiermesh.archive;

import io.tiermesh.error.IntegrityException;
import io.tiermesh.error.NotFoundException;
import io.tiermesh.model.RecordMeta;
import io.tiermesh.model.TierSpec;
import io.tiermesh.security.PayloadCrypto;
import io.tiermesh.storage.MetadataStore;
import io.tiermesh.tier.StoredBlob;
import io.tiermesh.tier.TierBackend;
import io.tiermesh.tier.TierIo;
import io.tiermesh.tier.TierRegistry;
import io.tiermesh.util.Hashing;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Turns payloads into stored blobs and back. A blob is the gzip stream of the
 * payload sealed with the active payload key; the JDK gzip header carries no
 * timestamp, so equal payloads compress to equal bytes before sealing.
 */
public final class Archiver {
    private final PayloadCrypto crypto;
    private final TierRegistry tiers;
    private final MetadataStore store;
    private final TierIo tierIo;

    /**
     * {@code tiers}, {@code store} and {@code tierIo} are only needed by {@link #restore(String)}.
     */
    public Archiver(PayloadCrypto crypto, TierRegistry tiers, MetadataStore store, TierIo tierIo) {
        this.crypto = crypto;
        this.tiers = tiers;
        this.store = store;
        this.tierIo = tierIo;
    }

    public PackedBlob pack(byte[] payload) {
        if (payload == null) {
            throw new IllegalArgumentException("Payload must not be null");
        }
        byte[] sealed = crypto.seal(gzip(payload));
        return new PackedBlob(sealed, Hashing.sha256Hex(payload), Hashing.sha256Hex(sealed), payload.length);
    }

    public UnpackedPayload unpack(byte[] blob) {
        return unpack(null, blob);
    }

    /**
     * @throws IntegrityException when the blob fails authentication or is not a gzip stream
     */
    public UnpackedPayload unpack(String recordId, byte[] blob) {
        byte[] compressed;
        try {
            compressed = crypto.open(blob);
        } catch (GeneralSecurityException e) {
            throw new IntegrityException(recordId, "Blob failed authentication" + forRecord(recordId), e);
        }
        byte[] payload;
        try {
            payload = gunzip(compressed);
        } catch (IOException e) {
            throw new IntegrityException(recordId, "Blob is not a valid gzip stream" + forRecord(recordId), e);
        }
        return new UnpackedPayload(payload, Hashing.sha256Hex(payload));
    }

    /**
     * Reads a record back from whichever tier holds it and checks it against the
     * catalogue checksum, or the backend's stored checksum for uncatalogued blobs.
     *
     * @throws NotFoundException  if no tier holds the record
     * @throws IntegrityException if the recomputed checksum differs
     * @throws io.tiermesh.error.TransientIOException if a tier read times out or keeps failing
     */
    public byte[] restore(String recordId) {
        Optional<RecordMeta> meta = store.findRecord(recordId);
        for (TierSpec tier : searchOrder(meta)) {
            TierBackend backend = tiers.backend(tier.id());
            Optional<StoredBlob> stored = tierIo.call("get " + recordId + " from " + tier.id(), () -> backend.get(recordId));
            if (stored.isEmpty()) {
                continue;
            }
            String expected = meta.map(RecordMeta::checksum).orElse(stored.get().checksum());
            UnpackedPayload unpacked = unpack(recordId, stored.get().blob());
            if (expected == null || expected.isBlank() || !expected.equals(unpacked.checksum())) {
                throw new IntegrityException(recordId, expected, unpacked.checksum());
            }
            return unpacked.payload();
        }
        throw new NotFoundException("Record not found in any tier: " + recordId);
    }

    // Catalogued tier first; a crash between write and commit can leave the only copy elsewhere.
    private List<TierSpec> searchOrder(Optional<RecordMeta> meta) {
        List<TierSpec> order = new ArrayList<>();
        meta.ifPresent(m -> order.add(tiers.tier(m.tierId())));
        for (TierSpec tier : tiers.tiers()) {
            if (!order.contains(tier)) {
                order.add(tier);
            }
        }
        return order;
    }

    private static byte[] gzip(byte[] payload) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, payload.length / 2));
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(payload);
        } catch (IOException e) {
            throw new RuntimeException("Failed to compress payload", e);
        }
        return out.toByteArray();
    }

    private static byte[] gunzip(byte[] compressed) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        }
    }

    private static String forRecord(String recordId) {
        return recordId == null ? "" : ": " + recordId;
    }
}
