package io.tiermesh.routing;

import io.tiermesh.model.Endpoint;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Smooth weighted round-robin with weights inversely proportional to smoothed
 * latency. Each pick adds every candidate's weight to its running score, takes the
 * highest score and subtracts the pool total from the winner, which spreads picks
 * evenly instead of bursting on the fastest endpoint.
 */
public final class WeightedLatencyStrategy implements RoutingStrategy {
    static final double WEIGHT_SCALE = 1000D;

    private final Map<String, Long> scores = new HashMap<>();

    @Override
    public synchronized Endpoint choose(List<RoutingCandidate> pool) {
        long[] weights = weights(pool);
        long total = 0L;
        RoutingCandidate best = null;
        long bestScore = Long.MIN_VALUE;
        for (int i = 0; i < pool.size(); i++) {
            RoutingCandidate candidate = pool.get(i);
            long score = scores.getOrDefault(candidate.id(), 0L) + weights[i];
            scores.put(candidate.id(), score);
            total += weights[i];
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        scores.put(best.id(), bestScore - total);
        return best.endpoint();
    }

    /**
     * Weight is {@code 1000 / latencyMs} (latency floored at 1 ms). Endpoints without a
     * latency sample get the mean weight of the others, or 1 when nobody has one.
     */
    static long[] weights(List<RoutingCandidate> pool) {
        long[] out = new long[pool.size()];
        long knownSum = 0L;
        int known = 0;
        for (int i = 0; i < pool.size(); i++) {
            RoutingCandidate candidate = pool.get(i);
            if (candidate.state().latencyKnown()) {
                out[i] = Math.max(1L, Math.round(WEIGHT_SCALE / Math.max(1D, candidate.state().latencyEwmaMs())));
                knownSum += out[i];
                known++;
            } else {
                out[i] = -1L;
            }
        }
        long fallback = known == 0 ? 1L : Math.max(1L, knownSum / known);
        for (int i = 0; i < out.length; i++) {
            if (out[i] < 0L) {
                out[i] = fallback;
            }
        }
        return out;
    }
}
