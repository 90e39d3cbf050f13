package io.tiermesh.migration;

import io.tiermesh.error.AlreadyRunningException;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process view of which job owns each tier pair, plus cancellation flags.
 * The SQLite partial unique index is the cross-process guard; this map keeps a
 * single process from racing itself before the row exists.
 */
public final class JobRegistry {
    private final Map<String, String> activeByPair = new ConcurrentHashMap<>();
    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();

    /**
     * Claims {@code pairKey} for {@code jobId}. Re-claiming by the same job is allowed.
     */
    public void claim(String pairKey, String jobId) {
        String holder = activeByPair.putIfAbsent(pairKey, jobId);
        if (holder != null && !holder.equals(jobId)) {
            throw new AlreadyRunningException(pairKey, holder);
        }
    }

    public void release(String pairKey, String jobId) {
        activeByPair.remove(pairKey, jobId);
        cancelled.remove(jobId);
    }

    public Optional<String> activeJob(String pairKey) {
        return Optional.ofNullable(activeByPair.get(pairKey));
    }

    public boolean isActive(String jobId) {
        return activeByPair.containsValue(jobId);
    }

    public void requestCancel(String jobId) {
        cancelled.add(jobId);
    }

    public boolean cancelRequested(String jobId) {
        return cancelled.contains(jobId);
    }

    public Map<String, String> snapshot() {
        return Map.copyOf(activeByPair);
    }
}
