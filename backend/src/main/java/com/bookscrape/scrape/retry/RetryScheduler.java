package com.bookscrape.scrape.retry;

import com.bookscrape.config.ScraperProperties;
import com.bookscrape.scrape.metrics.RunMetrics;
import com.bookscrape.scrape.util.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Arms delayed re-fetches for failed targets with exponential backoff.
 *
 * <p>Each target has at most one armed retry; scheduling it again cancels the previous
 * timer. {@link #stop()} cancels everything and waits for any retry that is already
 * re-submitting, so no re-submission happens after it returns. {@link #stop()} must not
 * be called from inside {@link RetrySubmitter#resubmit(String)}.
 */
public class RetryScheduler {
    private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(100);
    private static final int MAX_SHIFT = 30;

    private final RetrySubmitter submitter;
    private final RunMetrics metrics;
    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final ScheduledExecutorService timer;
    private final boolean ownsTimer;
    private volatile CancellationSignal cancellation = CancellationSignal.none();

    private final Object lock = new Object();
    private final ReentrantReadWriteLock fireGate = new ReentrantReadWriteLock();
    private final Map<String, Integer> attempts = new HashMap<>();
    private final Map<String, PendingRetry> pending = new HashMap<>();
    // Targets whose timer fired after cancellation and were therefore never re-submitted.
    private final List<String> abandoned = new ArrayList<>();
    private int totalRetries;
    private boolean stopped;

    public RetryScheduler(RetrySubmitter submitter, RunMetrics metrics, ScraperProperties.Retry settings) {
        this(
            submitter,
            metrics,
            settings.getMaxRetries(),
            Duration.ofMillis(settings.getBackoffMs()),
            Duration.ofMillis(settings.getBackoffMaxMs())
        );
    }

    public RetryScheduler(
        RetrySubmitter submitter,
        RunMetrics metrics,
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay
    ) {
        this(submitter, metrics, maxRetries, baseDelay, maxDelay, null);
    }

    RetryScheduler(
        RetrySubmitter submitter,
        RunMetrics metrics,
        int maxRetries,
        Duration baseDelay,
        Duration maxDelay,
        ScheduledExecutorService timer
    ) {
        this.submitter = submitter;
        this.metrics = metrics;
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.ownsTimer = timer == null;
        this.timer = timer != null ? timer : Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("retry-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void setCancellation(CancellationSignal cancellation) {
        this.cancellation = cancellation == null ? CancellationSignal.none() : cancellation;
    }

    /**
     * Arms a retry for {@code target}.
     *
     * @return {@code false} when retries are disabled, the target used up its attempts,
     *     the scheduler is stopped, or the run was cancelled
     */
    public boolean schedule(String target) {
        if (maxRetries == 0 || cancellation.isCancelled()) {
            return false;
        }
        int attempt;
        Duration delay;
        synchronized (lock) {
            if (stopped || cancellation.isCancelled()) {
                return false;
            }
            attempt = attempts.getOrDefault(target, 0);
            if (attempt >= maxRetries) {
                return false;
            }
            attempt++;
            attempts.put(target, attempt);
            totalRetries++;
            if (metrics != null) {
                metrics.incrementRetries();
            }

            delay = backoff(attempt, baseDelay, maxDelay);
            PendingRetry previous = pending.remove(target);
            if (previous != null) {
                previous.future.cancel(false);
            }
            PendingRetry retry = new PendingRetry(target);
            retry.future = timer.schedule(() -> fire(retry), delay.toMillis(), TimeUnit.MILLISECONDS);
            pending.put(target, retry);
        }
        log.debug("Retry {} of {} armed for {} in {}ms", attempt, maxRetries, target, delay.toMillis());
        return true;
    }

    /**
     * {@code base * 2^(attempt-1)}, clamped to {@code max} when it is positive. A non-positive
     * base falls back to {@link #DEFAULT_BASE_DELAY}.
     */
    public static Duration backoff(int attempt, Duration base, Duration max) {
        int safeAttempt = Math.max(1, attempt);
        Duration effectiveBase = base == null || base.isZero() || base.isNegative() ? DEFAULT_BASE_DELAY : base;
        long multiplier = 1L << Math.min(MAX_SHIFT, safeAttempt - 1);
        Duration delay;
        try {
            delay = effectiveBase.multipliedBy(multiplier);
        } catch (ArithmeticException e) {
            delay = Duration.ofMillis(Long.MAX_VALUE);
        }
        if (max != null && !max.isZero() && !max.isNegative() && delay.compareTo(max) > 0) {
            return max;
        }
        return delay;
    }

    /**
     * Cancels armed retries and blocks until an in-progress re-submission ends.
     *
     * @return targets that had a retry armed but will never be re-submitted, including
     *     those skipped after cancellation; empty on every call after the first
     */
    public List<String> stop() {
        List<String> dropped = new ArrayList<>();
        Lock gate = fireGate.writeLock();
        gate.lock();
        try {
            synchronized (lock) {
                if (stopped) {
                    return dropped;
                }
                stopped = true;
                for (PendingRetry retry : pending.values()) {
                    retry.future.cancel(false);
                    dropped.add(retry.target);
                }
                pending.clear();
                dropped.addAll(abandoned);
                abandoned.clear();
            }
        } finally {
            gate.unlock();
        }
        if (ownsTimer) {
            timer.shutdownNow();
        }
        if (!dropped.isEmpty()) {
            log.debug("Retry scheduler stopped with {} unsent retries", dropped.size());
        }
        return dropped;
    }

    public int totalRetries() {
        synchronized (lock) {
            return totalRetries;
        }
    }

    public int attemptsFor(String target) {
        synchronized (lock) {
            return attempts.getOrDefault(target, 0);
        }
    }

    /** Retries armed but not yet finished re-submitting. */
    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public boolean isStopped() {
        synchronized (lock) {
            return stopped;
        }
    }

    private void fire(PendingRetry retry) {
        Lock gate = fireGate.readLock();
        gate.lock();
        try {
            synchronized (lock) {
                if (stopped || pending.get(retry.target) != retry) {
                    return;
                }
            }
            if (cancellation.isCancelled()) {
                log.debug("Skipping retry for {} after cancellation", retry.target);
                synchronized (lock) {
                    abandoned.add(retry.target);
                }
                return;
            }
            submitter.resubmit(retry.target);
        } catch (RuntimeException e) {
            log.warn("Retry re-submission failed for {}", retry.target, e);
        } finally {
            // The entry stays until re-submission returns so pendingCount() never reads zero
            // while the target is between the timer and the producer.
            synchronized (lock) {
                pending.remove(retry.target, retry);
            }
            gate.unlock();
        }
    }

    private static final class PendingRetry {
        private final String target;
        private ScheduledFuture<?> future;

        private PendingRetry(String target) {
            this.target = target;
        }
    }
}
