package io.tiermesh.routing;

import io.tiermesh.model.Endpoint;

import java.io.IOException;

/**
 * A request to send through the router. An {@link IOException} marks a transport
 * failure of that endpoint; any other exception is the caller's own and is not retried.
 */
@FunctionalInterface
public interface EndpointCall<T> {
    T call(Endpoint endpoint) throws IOException;
}
