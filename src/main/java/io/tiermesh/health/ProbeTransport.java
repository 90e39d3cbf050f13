package io.tiermesh.health;

import io.tiermesh.model.Endpoint;

import java.io.IOException;

/**
 * One liveness check against an endpoint. Returning normally means healthy.
 */
@FunctionalInterface
public interface ProbeTransport {
    void check(Endpoint endpoint, long timeoutMs) throws IOException;
}
