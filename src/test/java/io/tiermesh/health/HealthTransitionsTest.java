package io.tiermesh.health;

import io.tiermesh.model.EndpointState;
import io.tiermesh.model.HealthResult;
import io.tiermesh.model.HealthStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class HealthTransitionsTest {
    private static final HealthPolicy POLICY = new HealthPolicy(3, 2, 0.3D);

    @Test
    void failuresWalkHealthyThroughDegradedToUnhealthy() {
        EndpointState s = EndpointState.initial("ep-1");
        Assertions.assertEquals(HealthStatus.HEALTHY, s.status());

        s = HealthTransitions.apply(s, HealthResult.fail("ep-1", "io", 1L), POLICY);
        Assertions.assertEquals(HealthStatus.DEGRADED, s.status());
        Assertions.assertEquals(1, s.consecutiveFailures());

        s = HealthTransitions.apply(s, HealthResult.fail("ep-1", "io", 2L), POLICY);
        Assertions.assertEquals(HealthStatus.DEGRADED, s.status());

        s = HealthTransitions.apply(s, HealthResult.fail("ep-1", "io", 3L), POLICY);
        Assertions.assertEquals(HealthStatus.UNHEALTHY, s.status());
        Assertions.assertEquals(3, s.consecutiveFailures());
        Assertions.assertEquals(3L, s.lastProbeAtMs());

        s = HealthTransitions.apply(s, HealthResult.fail("ep-1", "io", 4L), POLICY);
        Assertions.assertEquals(HealthStatus.UNHEALTHY, s.status());
    }

    @Test
    void degradedRecoversOnOneSuccessButUnhealthyNeedsTheConfiguredRun() {
        EndpointState degraded = HealthTransitions.apply(EndpointState.initial("ep-1"), HealthResult.fail("ep-1", "io", 1L), POLICY);
        EndpointState healed = HealthTransitions.apply(degraded, HealthResult.ok("ep-1", 20L, 2L), POLICY);
        Assertions.assertEquals(HealthStatus.HEALTHY, healed.status());
        Assertions.assertEquals(0, healed.consecutiveFailures());

        EndpointState unhealthy = new EndpointState("ep-1", HealthStatus.UNHEALTHY, 5, 0, 10L, -1D);
        EndpointState once = HealthTransitions.apply(unhealthy, HealthResult.ok("ep-1", 20L, 11L), POLICY);
        Assertions.assertEquals(HealthStatus.UNHEALTHY, once.status());
        Assertions.assertEquals(1, once.consecutiveSuccesses());

        EndpointState twice = HealthTransitions.apply(once, HealthResult.ok("ep-1", 20L, 12L), POLICY);
        Assertions.assertEquals(HealthStatus.HEALTHY, twice.status());

        // A failure in between restarts the run.
        EndpointState interrupted = HealthTransitions.apply(once, HealthResult.fail("ep-1", "io", 12L), POLICY);
        Assertions.assertEquals(0, interrupted.consecutiveSuccesses());
        EndpointState again = HealthTransitions.apply(interrupted, HealthResult.ok("ep-1", 20L, 13L), POLICY);
        Assertions.assertEquals(HealthStatus.UNHEALTHY, again.status());
    }

    @Test
    void latencyIsSmoothedOverSuccessfulProbesOnly() {
        EndpointState s = EndpointState.initial("ep-1");
        Assertions.assertFalse(s.latencyKnown());

        s = HealthTransitions.apply(s, HealthResult.ok("ep-1", 100L, 1L), POLICY);
        Assertions.assertEquals(100D, s.latencyEwmaMs(), 1e-9);

        s = HealthTransitions.apply(s, HealthResult.ok("ep-1", 10L, 2L), POLICY);
        Assertions.assertEquals(0.3D * 10D + 0.7D * 100D, s.latencyEwmaMs(), 1e-9);

        double before = s.latencyEwmaMs();
        s = HealthTransitions.apply(s, HealthResult.fail("ep-1", "timeout", 3L), POLICY);
        Assertions.assertEquals(before, s.latencyEwmaMs(), 1e-9);
    }

    @Test
    void policyRejectsOutOfRangeValues() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new HealthPolicy(0, 2, 0.3D));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new HealthPolicy(3, 0, 0.3D));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new HealthPolicy(3, 2, 0D));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new HealthPolicy(3, 2, 1.5D));
    }
}
