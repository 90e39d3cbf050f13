package io.tiermesh.tier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tiermesh.error.TransientIOException;
import io.tiermesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Directory-per-tier store: {@code <id>.blob} holds the packed bytes and
 * {@code <id>.meta.json} the checksum handed to {@link #put}. Writes go through a temp
 * file and an atomic move so a crash never leaves a half-written blob under its real name.
 */
public final class FileSystemTierBackend implements TierBackend {
    private static final String BLOB_SUFFIX = ".blob";
    private static final String META_SUFFIX = ".meta.json";

    private final String tierId;
    private final Path dir;
    private final long capacityBytes;
    private final AtomicLong usedBytes;

    public FileSystemTierBackend(String tierId, Path dir, long capacityBytes) {
        this.tierId = tierId;
        this.dir = dir;
        this.capacityBytes = capacityBytes;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize tier directory: " + dir, e);
        }
        this.usedBytes = new AtomicLong(scanUsedBytes());
    }

    @Override
    public String tierId() {
        return tierId;
    }

    public Path dir() {
        return dir;
    }

    @Override
    public Optional<StoredBlob> get(String recordId) {
        Path blobPath = blobPath(recordId);
        try {
            byte[] blob = Files.readAllBytes(blobPath);
            String checksum = "";
            Path metaPath = metaPath(recordId);
            if (Files.exists(metaPath)) {
                JsonNode meta = Jsons.mapper().readTree(Files.readString(metaPath, StandardCharsets.UTF_8));
                checksum = meta.path("checksum").asText("");
            }
            return Optional.of(new StoredBlob(recordId, blob, checksum));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new TransientIOException("Failed to read " + recordId + " from tier " + tierId, e);
        }
    }

    @Override
    public void put(String recordId, byte[] blob, String checksum) {
        Path blobPath = blobPath(recordId);
        Path tmp = dir.resolve(fileStem(recordId) + BLOB_SUFFIX + ".tmp");
        try {
            long previous = Files.exists(blobPath) ? Files.size(blobPath) : 0L;
            ObjectNode meta = Jsons.mapper().createObjectNode();
            meta.put("record_id", recordId);
            meta.put("checksum", checksum == null ? "" : checksum);
            meta.put("size_bytes", blob.length);
            meta.put("stored_at_ms", System.currentTimeMillis());
            Files.write(tmp, blob);
            Files.writeString(metaPath(recordId), Jsons.toJson(meta), StandardCharsets.UTF_8);
            moveIntoPlace(tmp, blobPath);
            usedBytes.addAndGet(blob.length - previous);
        } catch (IOException e) {
            throw new TransientIOException("Failed to write " + recordId + " to tier " + tierId, e);
        }
    }

    @Override
    public boolean delete(String recordId) {
        Path blobPath = blobPath(recordId);
        try {
            long size = Files.exists(blobPath) ? Files.size(blobPath) : 0L;
            boolean removed = Files.deleteIfExists(blobPath);
            Files.deleteIfExists(metaPath(recordId));
            if (removed) {
                usedBytes.addAndGet(-size);
            }
            return removed;
        } catch (IOException e) {
            throw new TransientIOException("Failed to delete " + recordId + " from tier " + tierId, e);
        }
    }

    @Override
    public boolean contains(String recordId) {
        return Files.exists(blobPath(recordId));
    }

    @Override
    public List<String> list() {
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + BLOB_SUFFIX)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                ids.add(name.substring(0, name.length() - BLOB_SUFFIX.length()));
            }
        } catch (IOException e) {
            throw new TransientIOException("Failed to list tier " + tierId, e);
        }
        ids.sort(String::compareTo);
        return ids;
    }

    @Override
    public TierUsage usage() {
        return new TierUsage(usedBytes.get(), capacityBytes);
    }

    private long scanUsedBytes() {
        long total = 0L;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + BLOB_SUFFIX)) {
            for (Path path : stream) {
                total += Files.size(path);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to scan tier directory: " + dir, e);
        }
        return total;
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException atomicUnsupported) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path blobPath(String recordId) {
        return dir.resolve(fileStem(recordId) + BLOB_SUFFIX);
    }

    private Path metaPath(String recordId) {
        return dir.resolve(fileStem(recordId) + META_SUFFIX);
    }

    static String fileStem(String recordId) {
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("Record id must not be blank");
        }
        for (int i = 0; i < recordId.length(); i++) {
            char ch = recordId.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            if (!ok) {
                throw new IllegalArgumentException("Unsupported character in record id: " + recordId);
            }
        }
        if (recordId.startsWith(".")) {
            throw new IllegalArgumentException("Record id must not start with '.': " + recordId);
        }
        return recordId;
    }
}
