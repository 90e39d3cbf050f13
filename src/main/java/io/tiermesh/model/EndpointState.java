package io.tiermesh.model;

/**
 * Immutable health view of one endpoint. A negative {@code latencyEwmaMs} means no
 * successful probe has been observed yet.
 */
public record EndpointState(
        String endpointId,
        HealthStatus status,
        int consecutiveFailures,
        int consecutiveSuccesses,
        long lastProbeAtMs,
        double latencyEwmaMs
) {
    public static EndpointState initial(String endpointId) {
        return new EndpointState(endpointId, HealthStatus.HEALTHY, 0, 0, 0L, -1D);
    }

    public boolean latencyKnown() {
        return latencyEwmaMs >= 0D;
    }
}
