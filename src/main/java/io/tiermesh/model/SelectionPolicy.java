package io.tiermesh.model;

import java.util.Locale;

public enum SelectionPolicy {
    OLDEST_ACCESS_FIRST("last_accessed_at_ms ASC, record_id ASC"),
    OLDEST_CREATED_FIRST("created_at_ms ASC, record_id ASC"),
    LARGEST_FIRST("size_bytes DESC, record_id ASC");

    private final String orderBy;

    SelectionPolicy(String orderBy) {
        this.orderBy = orderBy;
    }

    public String orderBy() {
        return orderBy;
    }

    public static SelectionPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return OLDEST_ACCESS_FIRST;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (SelectionPolicy value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown selection policy: " + raw);
    }
}
