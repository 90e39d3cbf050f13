package io.tiermesh.routing;

import io.tiermesh.error.NoHealthyEndpointException;
import io.tiermesh.error.TransientIOException;
import io.tiermesh.events.EventPublisher;
import io.tiermesh.health.HealthPolicy;
import io.tiermesh.health.HealthProber;
import io.tiermesh.model.Endpoint;
import io.tiermesh.model.HealthStatus;
import io.tiermesh.model.RouterAlgorithm;
import io.tiermesh.observability.AuditLogger;
import io.tiermesh.testing.MutableClock;
import io.tiermesh.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

final class EndpointRouterTest {
    private static final Endpoint A = new Endpoint("a", "http://a.local", "http://a.local/health");
    private static final Endpoint B = new Endpoint("b", "http://b.local", "http://b.local/health");
    private static final Endpoint C = new Endpoint("c", "http://c.local", "http://c.local/health");

    @Test
    void unhealthyEndpointIsNeverSelected() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-router-unhealthy-");
        try (HealthProber prober = prober(root, List.of(A, B, C))) {
            markUnhealthy(prober, "b");
            for (RouterAlgorithm algorithm : RouterAlgorithm.values()) {
                EndpointRouter router = new EndpointRouter(prober, algorithm, 1);
                for (int i = 0; i < 300; i++) {
                    Assertions.assertNotEquals("b", router.selectEndpoint().id(), algorithm.name());
                }
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void degradedEndpointsAreUsedOnlyWhenNoHealthyOneRemains() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-router-degraded-");
        try (HealthProber prober = prober(root, List.of(A, B))) {
            EndpointRouter router = new EndpointRouter(prober, RouterAlgorithm.ROUND_ROBIN, 1);
            prober.reportFailure("a", "slow");
            Assertions.assertEquals(HealthStatus.DEGRADED, prober.state("a").status());
            for (int i = 0; i < 10; i++) {
                Assertions.assertEquals("b", router.selectEndpoint().id());
            }

            markUnhealthy(prober, "b");
            Assertions.assertEquals("a", router.selectEndpoint().id());

            prober.reportFailure("a", "slow");
            prober.reportFailure("a", "slow");
            Assertions.assertEquals(HealthStatus.UNHEALTHY, prober.state("a").status());
            Assertions.assertThrows(NoHealthyEndpointException.class, router::selectEndpoint);
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void failedRequestIsReportedAndRetriedOnAnotherEndpoint() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-router-retry-");
        try (HealthProber prober = prober(root, List.of(A, B))) {
            EndpointRouter router = new EndpointRouter(prober, RouterAlgorithm.ROUND_ROBIN, 1);
            List<String> attempts = new ArrayList<>();

            String answer = router.route(endpoint -> {
                attempts.add(endpoint.id());
                if (endpoint.id().equals("a")) {
                    throw new IOException("connection reset");
                }
                return "served-by-" + endpoint.id();
            });

            Assertions.assertEquals("served-by-b", answer);
            Assertions.assertEquals(List.of("a", "b"), attempts);
            Assertions.assertEquals(HealthStatus.DEGRADED, prober.state("a").status());
            Assertions.assertEquals(HealthStatus.HEALTHY, prober.state("b").status());
            Assertions.assertEquals(0, router.inFlight("a"));
            Assertions.assertEquals(0, router.inFlight("b"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void retriesStopAtTheCapAndSurfaceTransientError() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-router-retry-cap-");
        try (HealthProber prober = prober(root, List.of(A, B, C))) {
            EndpointRouter router = new EndpointRouter(prober, RouterAlgorithm.ROUND_ROBIN, 1);
            List<String> attempts = new ArrayList<>();

            TransientIOException ex = Assertions.assertThrows(TransientIOException.class, () -> router.route(endpoint -> {
                attempts.add(endpoint.id());
                throw new IOException("down");
            }));

            Assertions.assertEquals(2, attempts.size());
            Assertions.assertNotEquals(attempts.get(0), attempts.get(1));
            Assertions.assertTrue(ex.getCause() instanceof IOException);
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void routeWithNoRoutableEndpointFailsFast() throws Exception {
        Path root = Files.createTempDirectory("tiermesh-test-router-none-");
        try (HealthProber prober = prober(root, List.of(A))) {
            markUnhealthy(prober, "a");
            EndpointRouter router = new EndpointRouter(prober, RouterAlgorithm.WEIGHTED_LATENCY, 2);
            Assertions.assertThrows(NoHealthyEndpointException.class, () -> router.route(endpoint -> "never"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static void markUnhealthy(HealthProber prober, String endpointId) {
        for (int i = 0; i < 3; i++) {
            prober.reportFailure(endpointId, "test");
        }
        Assertions.assertEquals(HealthStatus.UNHEALTHY, prober.state(endpointId).status());
    }

    private static HealthProber prober(Path root, List<Endpoint> endpoints) {
        AuditLogger audit = new AuditLogger(root.resolve("audit").resolve("audit.log"), "test");
        return new HealthProber(
                endpoints,
                (endpoint, timeoutMs) -> {
                },
                new HealthPolicy(3, 2, 0.3D),
                200L,
                new EventPublisher(audit),
                audit,
                new MutableClock(1_000L)
        );
    }
}
