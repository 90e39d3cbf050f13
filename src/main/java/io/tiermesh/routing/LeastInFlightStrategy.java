package io.tiermesh.routing;

import io.tiermesh.model.Endpoint;

import java.util.Comparator;
import java.util.List;

/**
 * Fewest requests currently outstanding; ties go to the lower smoothed latency, then
 * to the endpoint id so the choice is stable.
 */
public final class LeastInFlightStrategy implements RoutingStrategy {
    private static final Comparator<RoutingCandidate> ORDER = Comparator
            .comparingInt(RoutingCandidate::inFlight)
            .thenComparingDouble(c -> c.state().latencyKnown() ? c.state().latencyEwmaMs() : Double.MAX_VALUE)
            .thenComparing(RoutingCandidate::id);

    @Override
    public Endpoint choose(List<RoutingCandidate> pool) {
        return pool.stream().min(ORDER).orElseThrow().endpoint();
    }
}
