package io.tiermesh.events;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured notification handed to subscribers. Carries data only; rendering it
 * for humans is the subscriber's business.
 */
public record CoreEvent(
        String type,
        String subject,
        long timestampMs,
        Map<String, Object> attributes
) {
    public static final String QUOTA_THRESHOLD_CROSSED = "quota.threshold_crossed";
    public static final String MIGRATION_COMPLETED = "migration.completed";
    public static final String MIGRATION_FAILED = "migration.failed";
    public static final String ENDPOINT_UNHEALTHY = "endpoint.unhealthy";
    public static final String ENDPOINT_RECOVERED = "endpoint.recovered";

    public CoreEvent {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
