package io.tiermesh.health;

import io.tiermesh.events.CoreEvent;
import io.tiermesh.events.EventPublisher;
import io.tiermesh.model.Endpoint;
import io.tiermesh.model.EndpointState;
import io.tiermesh.model.HealthResult;
import io.tiermesh.model.HealthStatus;
import io.tiermesh.observability.AuditLogger;
import io.tiermesh.testing.MutableClock;
import io.tiermesh.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class HealthProberTest {

    @Test
    void probeThatOutlivesTheTimeoutCountsAsFailure() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-prober-timeout-");
        Endpoint slow = new Endpoint("slow", "http://slow.local", "http://slow.local/health");
        ProbeTransport hanging = (endpoint, timeoutMs) -> {
            try {
                Thread.sleep(2_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        try (HealthProber prober = prober(root, List.of(slow), hanging)) {
            long started = System.nanoTime();
            HealthResult result = prober.probe(slow);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            Assertions.assertFalse(result.success());
            Assertions.assertTrue(result.error().startsWith("timeout"), result.error());
            Assertions.assertTrue(elapsedMs < 1_500L, "probe must not wait for the transport: " + elapsedMs + "ms");
            Assertions.assertEquals(HealthStatus.DEGRADED, prober.state("slow").status());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void transportErrorsDriveTransitionsAndPublishEvents() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-prober-events-");
        Endpoint ep = new Endpoint("ep-a", "http://a.local", "http://a.local/health");
        Set<String> down = ConcurrentHashMap.newKeySet();
        down.add("ep-a");
        ProbeTransport flaky = (endpoint, timeoutMs) -> {
            if (down.contains(endpoint.id())) {
                throw new IOException("connection refused");
            }
        };
        List<CoreEvent> events = Collections.synchronizedList(new ArrayList<>());
        try (HealthProber prober = prober(root, List.of(ep), flaky, events)) {
            for (int i = 0; i < 3; i++) {
                HealthResult result = prober.probe(ep);
                Assertions.assertFalse(result.success());
                Assertions.assertTrue(result.error().contains("connection refused"), result.error());
            }
            Assertions.assertEquals(HealthStatus.UNHEALTHY, prober.state("ep-a").status());
            Assertions.assertEquals(List.of(CoreEvent.ENDPOINT_UNHEALTHY), types(events));

            down.clear();
            prober.probe(ep);
            Assertions.assertEquals(HealthStatus.UNHEALTHY, prober.state("ep-a").status());
            HealthResult ok = prober.probe(ep);
            Assertions.assertTrue(ok.success());
            Assertions.assertEquals(HealthStatus.HEALTHY, prober.state("ep-a").status());
            Assertions.assertTrue(prober.state("ep-a").latencyKnown());
            Assertions.assertEquals(List.of(CoreEvent.ENDPOINT_UNHEALTHY, CoreEvent.ENDPOINT_RECOVERED), types(events));
            Assertions.assertEquals("ep-a", events.get(1).subject());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void concurrentFailureReportsAreNeverLost() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-prober-concurrent-");
        Endpoint ep = new Endpoint("ep-a", "http://a.local", "http://a.local/health");
        List<CoreEvent> events = Collections.synchronizedList(new ArrayList<>());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try (HealthProber prober = prober(root, List.of(ep), (endpoint, timeoutMs) -> {
        }, events)) {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        prober.reportFailure("ep-a", "route failure");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }

            EndpointState state = prober.state("ep-a");
            Assertions.assertEquals(400, state.consecutiveFailures());
            Assertions.assertEquals(HealthStatus.UNHEALTHY, state.status());
            Assertions.assertEquals(1L, events.stream().filter(e -> CoreEvent.ENDPOINT_UNHEALTHY.equals(e.type())).count());
        } finally {
            pool.shutdownNow();
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void unknownEndpointIsRejected() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-prober-unknown-");
        Endpoint ep = new Endpoint("ep-a", "http://a.local", "http://a.local/health");
        try (HealthProber prober = prober(root, List.of(ep), (endpoint, timeoutMs) -> {
        })) {
            Assertions.assertThrows(IllegalArgumentException.class, () -> prober.state("nope"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> prober.reportFailure("nope", "x"));
            Assertions.assertTrue(prober.endpoint("nope").isEmpty());
            Assertions.assertThrows(IllegalArgumentException.class, () -> prober(root, List.of(ep, ep), (endpoint, timeoutMs) -> {
            }));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static HealthProber prober(Path root, List<Endpoint> endpoints, ProbeTransport transport) {
        return prober(root, endpoints, transport, Collections.synchronizedList(new ArrayList<>()));
    }

    private static HealthProber prober(Path root, List<Endpoint> endpoints, ProbeTransport transport, List<CoreEvent> sink) {
        AuditLogger audit = new AuditLogger(root.resolve("audit").resolve("audit.log"), "test");
        EventPublisher events = new EventPublisher(audit);
        events.subscribe(sink::add);
        return new HealthProber(
                endpoints,
                transport,
                new HealthPolicy(3, 2, 0.3D),
                200L,
                events,
                audit,
                new MutableClock(1_000L)
        );
    }

    private static List<String> types(List<CoreEvent> events) {
        synchronized (events) {
            return events.stream().map(CoreEvent::type).toList();
        }
    }
}
