package io.tiermesh.model;

import java.util.Locale;

public enum RouterAlgorithm {
    WEIGHTED_LATENCY,
    ROUND_ROBIN,
    LEAST_IN_FLIGHT;

    public static RouterAlgorithm fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return WEIGHTED_LATENCY;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (RouterAlgorithm value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown router algorithm: " + raw);
    }
}
