package io.tiermesh.routing;

import io.tiermesh.model.Endpoint;

import java.util.List;

/**
 * Picks one endpoint from a non-empty pool whose members all share the same health
 * status. Implementations must be safe for concurrent use.
 */
public interface RoutingStrategy {
    Endpoint choose(List<RoutingCandidate> pool);
}
