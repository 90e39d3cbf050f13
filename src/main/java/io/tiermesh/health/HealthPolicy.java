package io.tiermesh.health;

public record HealthPolicy(
        int unhealthyAfterFailures,
        int healthyAfterSuccesses,
        double latencyEwmaAlpha
) {
    public HealthPolicy {
        if (unhealthyAfterFailures < 1) {
            throw new IllegalArgumentException("unhealthyAfterFailures must be >= 1");
        }
        if (healthyAfterSuccesses < 1) {
            throw new IllegalArgumentException("healthyAfterSuccesses must be >= 1");
        }
        if (latencyEwmaAlpha <= 0D || latencyEwmaAlpha > 1D) {
            throw new IllegalArgumentException("latencyEwmaAlpha must be in (0, 1]");
        }
    }
}
