package io.tiermesh.health;

import io.tiermesh.model.Endpoint;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * GETs the endpoint's health URL; any 2xx status is healthy.
 */
public final class HttpProbeTransport implements ProbeTransport {
    private final HttpClient client;

    public HttpProbeTransport(long connectTimeoutMs) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(1L, connectTimeoutMs)))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Override
    public void check(Endpoint endpoint, long timeoutMs) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(endpoint.healthUrl()))
                .timeout(Duration.ofMillis(Math.max(1L, timeoutMs)))
                .GET()
                .build();
        HttpResponse<Void> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Probe interrupted: " + endpoint.id());
        }
        int status = response.statusCode();
        if (status < 200 || status > 299) {
            throw new IOException("Health check of " + endpoint.id() + " returned HTTP " + status);
        }
    }
}
