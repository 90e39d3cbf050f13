package io.tiermesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.tiermesh.security.SensitiveDataMasker;
import io.tiermesh.util.Hashing;
import io.tiermesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row,
 * so truncation or in-place edits break the chain and show up in {@link #verifyChain()}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String namespace;
    private String previousHash;

    public AuditLogger(Path auditFile, String namespace) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("job_id", event.jobId());
        row.put("record_id", event.recordId());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Most recent rows first, up to {@code limit}.
     */
    public synchronized List<JsonNode> tail(int limit) {
        List<JsonNode> rows = readRows();
        int from = Math.max(0, rows.size() - Math.max(1, limit));
        List<JsonNode> out = new ArrayList<>(rows.subList(from, rows.size()));
        Collections.reverse(out);
        return out;
    }

    @SuppressWarnings("unchecked")
    public synchronized ChainStatus verifyChain() {
        String expectedPrev = "";
        int index = 0;
        for (JsonNode node : readRows()) {
            index++;
            String prev = node.path("prev_hash").asText("");
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(prev)) {
                return new ChainStatus(false, index, "prev_hash mismatch at row " + index);
            }
            Map<String, Object> body = Jsons.mapper().convertValue(node, LinkedHashMap.class);
            body.remove("hash");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(body)).equals(hash)) {
                return new ChainStatus(false, index, "hash mismatch at row " + index);
            }
            expectedPrev = hash;
        }
        return new ChainStatus(true, index, "");
    }

    private List<JsonNode> readRows() {
        try {
            List<JsonNode> rows = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    rows.add(Jsons.mapper().readTree(line));
                }
            }
            return rows;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<JsonNode> rows = readRows();
        return rows.isEmpty() ? "" : rows.get(rows.size() - 1).path("hash").asText("");
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, LinkedHashMap.class);
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String jobId,
            String recordId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String jobId,
                String recordId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, jobId, recordId, details == null ? Map.of() : details);
        }
    }

    public record ChainStatus(boolean intact, int rows, String problem) {
    }
}
