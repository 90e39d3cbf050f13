package io.tiermesh.tier;

import io.tiermesh.error.TransientIOException;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs tier backend calls with a hard timeout and a bounded number of attempts.
 * Only {@link TransientIOException} and timeouts are retried; anything else
 * surfaces on the first attempt.
 */
public final class TierIo implements AutoCloseable {
    private final long timeoutMs;
    private final int attempts;
    private final long backoffMs;
    private final ExecutorService executor;

    public TierIo(long timeoutMs, int attempts, long backoffMs) {
        this.timeoutMs = Math.max(1L, timeoutMs);
        this.attempts = Math.max(1, attempts);
        this.backoffMs = Math.max(0L, backoffMs);
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tiermesh-tier-io-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public <T> T call(String operation, Supplier<T> action) {
        TransientIOException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return once(operation, action);
            } catch (TransientIOException e) {
                last = e;
                if (attempt < attempts) {
                    pause(attempt, operation);
                }
            }
        }
        throw new TransientIOException(operation + " failed after " + attempts + " attempt(s)", last);
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private <T> T once(String operation, Supplier<T> action) {
        Future<T> future = executor.submit(action::get);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientIOException(operation + " timed out after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientIOException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new TransientIOException(operation + " failed", cause);
        }
    }

    private void pause(int attempt, String operation) {
        if (backoffMs == 0L) {
            return;
        }
        try {
            Thread.sleep(backoffMs * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientIOException(operation + " interrupted during backoff", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
