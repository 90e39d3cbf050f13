package io.tiermesh.routing;

import io.tiermesh.error.NoHealthyEndpointException;
import io.tiermesh.error.TransientIOException;
import io.tiermesh.health.HealthProber;
import io.tiermesh.model.Endpoint;
import io.tiermesh.model.EndpointState;
import io.tiermesh.model.HealthStatus;
import io.tiermesh.model.RouterAlgorithm;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chooses endpoints from the prober's current view. HEALTHY endpoints are preferred,
 * DEGRADED ones are used only when no HEALTHY endpoint exists, and UNHEALTHY endpoints
 * are never chosen. The router only reads health; failures it sees go back to the
 * prober through {@link HealthProber#reportFailure(String, String)}.
 */
public final class EndpointRouter {
    private final HealthProber prober;
    private final RouterAlgorithm algorithm;
    private final RoutingStrategy strategy;
    private final int retryCap;
    private final Map<String, AtomicInteger> inFlight;

    public EndpointRouter(HealthProber prober, RouterAlgorithm algorithm, int retryCap) {
        this.prober = prober;
        this.algorithm = algorithm == null ? RouterAlgorithm.WEIGHTED_LATENCY : algorithm;
        this.strategy = strategyFor(this.algorithm);
        this.retryCap = Math.max(0, retryCap);
        this.inFlight = new ConcurrentHashMap<>();
    }

    public RouterAlgorithm algorithm() {
        return algorithm;
    }

    /**
     * @throws NoHealthyEndpointException when every endpoint is UNHEALTHY
     */
    public Endpoint selectEndpoint() {
        return selectExcluding(Set.of());
    }

    /**
     * Sends {@code call} to a selected endpoint. A transport failure is reported to the
     * prober and the call is retried on a different endpoint, up to the retry cap.
     *
     * @throws TransientIOException when every attempt failed at the transport level
     */
    public <T> T route(EndpointCall<T> call) {
        Set<String> tried = new HashSet<>();
        IOException last = null;
        for (int attempt = 0; attempt <= retryCap; attempt++) {
            Endpoint endpoint;
            try {
                endpoint = selectExcluding(tried);
            } catch (NoHealthyEndpointException e) {
                if (last == null) {
                    throw e;
                }
                break;
            }
            AtomicInteger counter = inFlight.computeIfAbsent(endpoint.id(), id -> new AtomicInteger());
            counter.incrementAndGet();
            try {
                return call.call(endpoint);
            } catch (IOException e) {
                last = e;
                tried.add(endpoint.id());
                prober.reportFailure(endpoint.id(), "route: " + e.getMessage());
            } finally {
                counter.decrementAndGet();
            }
        }
        throw new TransientIOException("Request failed on " + tried.size() + " endpoint(s): " + tried, last);
    }

    public int inFlight(String endpointId) {
        AtomicInteger counter = inFlight.get(endpointId);
        return counter == null ? 0 : counter.get();
    }

    private Endpoint selectExcluding(Set<String> excluded) {
        List<RoutingCandidate> healthy = new ArrayList<>();
        List<RoutingCandidate> degraded = new ArrayList<>();
        for (Endpoint endpoint : prober.endpoints()) {
            if (excluded.contains(endpoint.id())) {
                continue;
            }
            EndpointState state = prober.state(endpoint.id());
            RoutingCandidate candidate = new RoutingCandidate(endpoint, state, inFlight(endpoint.id()));
            if (state.status() == HealthStatus.HEALTHY) {
                healthy.add(candidate);
            } else if (state.status() == HealthStatus.DEGRADED) {
                degraded.add(candidate);
            }
        }
        if (!healthy.isEmpty()) {
            return strategy.choose(healthy);
        }
        if (!degraded.isEmpty()) {
            return strategy.choose(degraded);
        }
        throw new NoHealthyEndpointException(
                "No HEALTHY or DEGRADED endpoint available" + (excluded.isEmpty() ? "" : " outside " + excluded)
        );
    }

    static RoutingStrategy strategyFor(RouterAlgorithm algorithm) {
        return switch (algorithm) {
            case WEIGHTED_LATENCY -> new WeightedLatencyStrategy();
            case ROUND_ROBIN -> new RoundRobinStrategy();
            case LEAST_IN_FLIGHT -> new LeastInFlightStrategy();
        };
    }
}
