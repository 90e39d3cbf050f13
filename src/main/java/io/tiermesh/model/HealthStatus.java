package io.tiermesh.model;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
