package io.tiermesh.model;

public record HealthResult(
        String endpointId,
        boolean success,
        long latencyMs,
        String error,
        long probedAtMs
) {
    public static HealthResult ok(String endpointId, long latencyMs, long probedAtMs) {
        return new HealthResult(endpointId, true, latencyMs, null, probedAtMs);
    }

    public static HealthResult fail(String endpointId, String error, long probedAtMs) {
        return new HealthResult(endpointId, false, -1L, error, probedAtMs);
    }
}
