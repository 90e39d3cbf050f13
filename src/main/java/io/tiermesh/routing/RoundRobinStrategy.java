package io.tiermesh.routing;

import io.tiermesh.model.Endpoint;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

public final class RoundRobinStrategy implements RoutingStrategy {
    private final AtomicLong cursor = new AtomicLong();

    @Override
    public Endpoint choose(List<RoutingCandidate> pool) {
        int index = (int) Math.floorMod(cursor.getAndIncrement(), (long) pool.size());
        return pool.get(index).endpoint();
    }
}
