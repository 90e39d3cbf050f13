package io.tiermesh.health;

import io.tiermesh.events.CoreEvent;
import io.tiermesh.events.EventPublisher;
import io.tiermesh.model.Endpoint;
import io.tiermesh.model.EndpointState;
import io.tiermesh.model.HealthResult;
import io.tiermesh.model.HealthStatus;
import io.tiermesh.observability.AuditLogger;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns endpoint health. Probes run through a {@link ProbeTransport} under a hard
 * timeout; a probe that does not answer in time counts as a failure.
 */
public final class HealthProber implements AutoCloseable {
    private final Map<String, Endpoint> endpoints;
    private final ProbeTransport transport;
    private final HealthBoard board;
    private final long probeTimeoutMs;
    private final EventPublisher events;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final ExecutorService probeExecutor;
    private final List<ScheduledFuture<?>> schedules;

    public HealthProber(
            List<Endpoint> endpoints,
            ProbeTransport transport,
            HealthPolicy policy,
            long probeTimeoutMs,
            EventPublisher events,
            AuditLogger auditLogger,
            Clock clock
    ) {
        Map<String, Endpoint> byId = new LinkedHashMap<>();
        for (Endpoint endpoint : endpoints) {
            if (byId.put(endpoint.id(), endpoint) != null) {
                throw new IllegalArgumentException("Duplicate endpoint id: " + endpoint.id());
            }
        }
        this.endpoints = byId;
        this.transport = transport;
        this.board = new HealthBoard(byId.keySet(), policy);
        this.probeTimeoutMs = Math.max(1L, probeTimeoutMs);
        this.events = events;
        this.auditLogger = auditLogger;
        this.clock = clock;
        AtomicInteger seq = new AtomicInteger();
        this.probeExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tiermesh-probe-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.schedules = new ArrayList<>();
    }

    public List<Endpoint> endpoints() {
        return List.copyOf(endpoints.values());
    }

    public Optional<Endpoint> endpoint(String endpointId) {
        return Optional.ofNullable(endpoints.get(endpointId));
    }

    public List<EndpointState> states() {
        return board.states();
    }

    public EndpointState state(String endpointId) {
        return board.state(endpointId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown endpoint: " + endpointId));
    }

    /**
     * Probes one endpoint and folds the result into its state.
     */
    public HealthResult probe(Endpoint endpoint) {
        long startedNs = System.nanoTime();
        Future<?> future = probeExecutor.submit(() -> {
            transport.check(endpoint, probeTimeoutMs);
            return null;
        });
        HealthResult result;
        try {
            future.get(probeTimeoutMs, TimeUnit.MILLISECONDS);
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNs);
            result = HealthResult.ok(endpoint.id(), latencyMs, clock.millis());
        } catch (TimeoutException e) {
            future.cancel(true);
            result = HealthResult.fail(endpoint.id(), "timeout after " + probeTimeoutMs + "ms", clock.millis());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            result = HealthResult.fail(endpoint.id(), describe(cause), clock.millis());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            result = HealthResult.fail(endpoint.id(), "interrupted", clock.millis());
        }
        apply(result, "probe");
        return result;
    }

    public List<HealthResult> probeAll() {
        List<HealthResult> out = new ArrayList<>();
        for (Endpoint endpoint : endpoints.values()) {
            out.add(probe(endpoint));
        }
        return out;
    }

    /**
     * Out-of-band failure seen by a caller, e.g. the router after a failed request.
     */
    public EndpointState reportFailure(String endpointId, String reason) {
        HealthResult result = HealthResult.fail(endpointId, reason == null ? "reported" : reason, clock.millis());
        return apply(result, "report").after();
    }

    /**
     * Schedules one fixed-delay probe loop per endpoint on {@code scheduler}.
     */
    public synchronized void start(ScheduledExecutorService scheduler, long intervalMs) {
        long interval = Math.max(1L, intervalMs);
        for (Endpoint endpoint : endpoints.values()) {
            schedules.add(scheduler.scheduleWithFixedDelay(() -> probeSafely(endpoint), 0L, interval, TimeUnit.MILLISECONDS));
        }
    }

    @Override
    public synchronized void close() {
        for (ScheduledFuture<?> schedule : schedules) {
            schedule.cancel(true);
        }
        schedules.clear();
        probeExecutor.shutdownNow();
    }

    // A throwing task would silently stop its fixed-delay schedule.
    private void probeSafely(Endpoint endpoint) {
        try {
            probe(endpoint);
        } catch (RuntimeException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "endpoint.probe",
                    "health-prober",
                    "endpoints/" + endpoint.id(),
                    "error",
                    null,
                    null,
                    Map.of("error", describe(e))
            ));
        }
    }

    private HealthBoard.Transition apply(HealthResult result, String source) {
        HealthBoard.Transition transition = board.record(result);
        if (!transition.statusChanged()) {
            return transition;
        }
        EndpointState after = transition.after();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", transition.before().status().name());
        details.put("to", after.status().name());
        details.put("source", source);
        details.put("consecutive_failures", after.consecutiveFailures());
        details.put("consecutive_successes", after.consecutiveSuccesses());
        if (result.error() != null) {
            details.put("error", result.error());
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "endpoint.transition",
                "health-prober",
                "endpoints/" + result.endpointId(),
                after.status().name().toLowerCase(Locale.ROOT),
                null,
                null,
                details
        ));
        if (after.status() == HealthStatus.UNHEALTHY) {
            events.publish(new CoreEvent(CoreEvent.ENDPOINT_UNHEALTHY, result.endpointId(), result.probedAtMs(), details));
        } else if (after.status() == HealthStatus.HEALTHY && transition.before().status() == HealthStatus.UNHEALTHY) {
            events.publish(new CoreEvent(CoreEvent.ENDPOINT_RECOVERED, result.endpointId(), result.probedAtMs(), details));
        }
        return transition;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        String type = error instanceof IOException ? "io" : error.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}
