package io.tiermesh.routing;

import io.tiermesh.model.Endpoint;
import io.tiermesh.model.EndpointState;

public record RoutingCandidate(
        Endpoint endpoint,
        EndpointState state,
        int inFlight
) {
    public String id() {
        return endpoint.id();
    }
}
