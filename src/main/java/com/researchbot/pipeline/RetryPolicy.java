package com.researchbot.pipeline;

import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs collaborator calls with a hard per-attempt timeout, bounded retries and
 * exponential backoff ({@code backoffMs * 2^attempt}).
 */
public final class RetryPolicy implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(RetryPolicy.class);

    private final int maxRetries;
    private final long backoffMs;
    private final Duration timeout;
    private final ExecutorService callPool;

    public RetryPolicy(int maxRetries, long backoffMs, Duration timeout) {
        this.maxRetries = Math.max(0, maxRetries);
        this.backoffMs = Math.max(0L, backoffMs);
        this.timeout = timeout;
        AtomicInteger seq = new AtomicInteger();
        this.callPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "collaborator-call-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @param label      collaborator name for logs
     * @param faultKind  kind reported for timeouts and unexpected exceptions
     * @param checkpoint runs before every attempt; its exceptions propagate unchanged
     */
    public <T> T call(String label, FailureKind faultKind, Runnable checkpoint, Callable<T> task) {
        ResearchException last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                sleepBackoff(attempt - 1, label, faultKind);
            }
            if (checkpoint != null) {
                checkpoint.run();
            }
            try {
                return runOnce(label, faultKind, task);
            } catch (ResearchException e) {
                last = e;
                if (!e.kind().isRetryable()) {
                    throw e;
                }
                log.warn("{} attempt {}/{} failed: {}", label, attempt + 1, maxRetries + 1, e.getMessage());
            }
        }
        throw last;
    }

    private <T> T runOnce(String label, FailureKind faultKind, Callable<T> task) {
        Future<T> future = callPool.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ResearchException(faultKind, label + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof ResearchException re) {
                throw re;
            }
            throw new ResearchException(faultKind, label + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ResearchException(faultKind, label + " interrupted", e);
        }
    }

    private void sleepBackoff(int attempt, String label, FailureKind faultKind) {
        long waitMs = backoffMs * (1L << Math.min(attempt, 20));
        if (waitMs <= 0L) {
            return;
        }
        try {
            Thread.sleep(waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResearchException(faultKind, label + " interrupted during backoff", e);
        }
    }

    @Override
    public void close() {
        callPool.shutdownNow();
    }
}
