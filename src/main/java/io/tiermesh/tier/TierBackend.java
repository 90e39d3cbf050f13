package io.tiermesh.tier;

import java.util.List;
import java.util.Optional;

/**
 * Storage behind one tier. Implementations report I/O trouble as
 * {@link io.tiermesh.error.TransientIOException}; a missing blob is an empty result,
 * never an exception.
 */
public interface TierBackend {
    String tierId();

    Optional<StoredBlob> get(String recordId);

    void put(String recordId, byte[] blob, String checksum);

    /**
     * @return {@code true} when a blob was removed, {@code false} when none existed
     */
    boolean delete(String recordId);

    boolean contains(String recordId);

    List<String> list();

    TierUsage usage();
}
