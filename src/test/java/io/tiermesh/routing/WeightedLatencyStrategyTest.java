package io.tiermesh.routing;

import io.tiermesh.model.Endpoint;
import io.tiermesh.model.EndpointState;
import io.tiermesh.model.HealthStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class WeightedLatencyStrategyTest {

    @Test
    void fasterEndpointWinsMostPicksWithoutStarvingTheSlowOne() {
        List<RoutingCandidate> pool = List.of(candidate("fast", 10D), candidate("slow", 100D));
        WeightedLatencyStrategy strategy = new WeightedLatencyStrategy();

        Map<String, Integer> picks = new HashMap<>();
        for (int i = 0; i < 1000; i++) {
            picks.merge(strategy.choose(pool).id(), 1, Integer::sum);
        }

        Assertions.assertTrue(picks.get("fast") > picks.get("slow"), String.valueOf(picks));
        // Weights 100 vs 10: nine full cycles of 110 picks, then the slow endpoint takes pick 6 of the next 10.
        Assertions.assertEquals(909, picks.get("fast"));
        Assertions.assertEquals(91, picks.get("slow"));
    }

    @Test
    void endpointsWithoutLatencyGetTheMeanKnownWeight() {
        long[] weights = WeightedLatencyStrategy.weights(List.of(
                candidate("a", 10D),
                candidate("b", 1000D),
                candidate("new", -1D)
        ));
        Assertions.assertEquals(100L, weights[0]);
        Assertions.assertEquals(1L, weights[1]);
        Assertions.assertEquals(50L, weights[2]);

        long[] none = WeightedLatencyStrategy.weights(List.of(candidate("x", -1D), candidate("y", -1D)));
        Assertions.assertArrayEquals(new long[]{1L, 1L}, none);

        long[] subMillisecond = WeightedLatencyStrategy.weights(List.of(candidate("z", 0.2D)));
        Assertions.assertEquals(1000L, subMillisecond[0]);
    }

    @Test
    void leastInFlightPrefersIdleEndpointThenLowerLatency() {
        LeastInFlightStrategy strategy = new LeastInFlightStrategy();
        RoutingCandidate busyFast = new RoutingCandidate(endpoint("busy"), state("busy", 5D), 3);
        RoutingCandidate idleSlow = new RoutingCandidate(endpoint("idle-slow"), state("idle-slow", 80D), 0);
        RoutingCandidate idleFast = new RoutingCandidate(endpoint("idle-fast"), state("idle-fast", 20D), 0);

        Assertions.assertEquals("idle-fast", strategy.choose(List.of(busyFast, idleSlow, idleFast)).id());
        Assertions.assertEquals("idle-slow", strategy.choose(List.of(busyFast, idleSlow)).id());
    }

    @Test
    void roundRobinCyclesThroughThePool() {
        RoundRobinStrategy strategy = new RoundRobinStrategy();
        List<RoutingCandidate> pool = List.of(candidate("a", 1D), candidate("b", 1D), candidate("c", 1D));
        StringBuilder order = new StringBuilder();
        for (int i = 0; i < 6; i++) {
            order.append(strategy.choose(pool).id());
        }
        Assertions.assertEquals("abcabc", order.toString());
    }

    private static RoutingCandidate candidate(String id, double latencyMs) {
        return new RoutingCandidate(endpoint(id), state(id, latencyMs), 0);
    }

    private static Endpoint endpoint(String id) {
        return new Endpoint(id, "http://" + id + ".local", "http://" + id + ".local/health");
    }

    private static EndpointState state(String id, double latencyMs) {
        return new EndpointState(id, HealthStatus.HEALTHY, 0, 3, 1L, latencyMs);
    }
}
