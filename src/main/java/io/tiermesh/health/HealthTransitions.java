package io.tiermesh.health;

import io.tiermesh.model.EndpointState;
import io.tiermesh.model.HealthResult;
import io.tiermesh.model.HealthStatus;

/**
 * Pure state machine for endpoint health.
 *
 * <ul>
 *   <li>HEALTHY goes to DEGRADED on the first failure.</li>
 *   <li>DEGRADED goes to UNHEALTHY once consecutive failures reach the configured limit,
 *       and back to HEALTHY on a single success.</li>
 *   <li>UNHEALTHY needs the configured number of consecutive successes to become HEALTHY.</li>
 * </ul>
 *
 * Latency is smoothed over successful probes only; failures never touch it.
 */
public final class HealthTransitions {
    private HealthTransitions() {
    }

    public static EndpointState apply(EndpointState current, HealthResult result, HealthPolicy policy) {
        if (result.success()) {
            return onSuccess(current, result, policy);
        }
        return onFailure(current, result.probedAtMs(), policy);
    }

    static EndpointState onSuccess(EndpointState current, HealthResult result, HealthPolicy policy) {
        int successes = current.consecutiveSuccesses() + 1;
        HealthStatus next = switch (current.status()) {
            case HEALTHY, DEGRADED -> HealthStatus.HEALTHY;
            case UNHEALTHY -> successes >= policy.healthyAfterSuccesses() ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;
        };
        double sample = Math.max(0L, result.latencyMs());
        double latency = current.latencyKnown()
                ? policy.latencyEwmaAlpha() * sample + (1D - policy.latencyEwmaAlpha()) * current.latencyEwmaMs()
                : sample;
        return new EndpointState(current.endpointId(), next, 0, successes, result.probedAtMs(), latency);
    }

    static EndpointState onFailure(EndpointState current, long observedAtMs, HealthPolicy policy) {
        int failures = current.consecutiveFailures() + 1;
        HealthStatus next;
        if (current.status() == HealthStatus.UNHEALTHY
                || (current.status() == HealthStatus.DEGRADED && failures >= policy.unhealthyAfterFailures())) {
            next = HealthStatus.UNHEALTHY;
        } else {
            next = HealthStatus.DEGRADED;
        }
        return new EndpointState(current.endpointId(), next, failures, 0, observedAtMs, current.latencyEwmaMs());
    }
}
