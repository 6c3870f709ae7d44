package com.bookscrape.scrape.pipeline;

import com.bookscrape.config.ScraperProperties;
import com.bookscrape.scrape.metrics.RunMetrics;
import com.bookscrape.scrape.model.BookRecord;
import com.bookscrape.scrape.model.MetricsSnapshot;
import com.bookscrape.scrape.output.OutputSink;
import com.bookscrape.scrape.validation.InvalidRecordException;
import com.bookscrape.scrape.validation.RecordNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded producer/consumer pipeline that validates, de-duplicates and normalizes
 * records before handing them to an {@link OutputSink} in batches.
 *
 * <p>{@link #submit(BookRecord)} blocks while the buffer is full, so a slow sink
 * eventually stalls the producer. Each worker keeps a private batch; only the
 * de-duplication set and the metrics are shared between workers.
 *
 * <p>The first sink failure wins: it rejects further submissions, makes workers
 * discard whatever is still queued, and is rethrown from {@link #close()}.
 */
public class StreamingPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StreamingPipeline.class);

    public static final int DEFAULT_BUFFER_SIZE = 512;
    public static final int DEFAULT_BATCH_SIZE = 64;
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(5);

    private static final long POLL_INTERVAL_MS = 50;

    private final OutputSink sink;
    private final RunMetrics metrics;
    private final BlockingQueue<BookRecord> queue;
    private final int bufferSize;
    private final int batchSize;
    private final Duration drainTimeout;
    private final SeenUrlCache seenUrls = new SeenUrlCache();

    // Submitters hold the read side while enqueueing; close() takes the write side so
    // that once inputClosed is set no record can still be on its way into the queue.
    private final ReentrantReadWriteLock submitGate = new ReentrantReadWriteLock();
    private final Object stateLock = new Object();
    private volatile boolean closing;
    private volatile boolean inputClosed;
    private volatile PipelineException failure;

    private ExecutorService workers;
    private CountDownLatch workersDone;
    private ScheduledExecutorService reporter;

    public StreamingPipeline(OutputSink sink, RunMetrics metrics) {
        this(sink, metrics, DEFAULT_BUFFER_SIZE, DEFAULT_BATCH_SIZE, DEFAULT_DRAIN_TIMEOUT);
    }

    public StreamingPipeline(OutputSink sink, RunMetrics metrics, ScraperProperties.Pipeline settings) {
        this(
            sink,
            metrics,
            settings.getBufferSize(),
            settings.getBatchSize(),
            Duration.ofMillis(settings.getDrainTimeoutMs())
        );
    }

    public StreamingPipeline(
        OutputSink sink,
        RunMetrics metrics,
        int bufferSize,
        int batchSize,
        Duration drainTimeout
    ) {
        if (sink == null) {
            throw new IllegalArgumentException("sink is required");
        }
        this.sink = sink;
        this.metrics = metrics == null ? new RunMetrics() : metrics;
        this.bufferSize = Math.max(1, bufferSize);
        this.queue = new ArrayBlockingQueue<>(this.bufferSize);
        this.batchSize = Math.max(1, batchSize);
        this.drainTimeout = drainTimeout == null || drainTimeout.isNegative() || drainTimeout.isZero()
            ? DEFAULT_DRAIN_TIMEOUT
            : drainTimeout;
    }

    /**
     * Launches {@code workerCount} consumers (at least one). Does nothing once the
     * pipeline is closed.
     */
    public void start(int workerCount) {
        synchronized (stateLock) {
            if (closing) {
                return;
            }
            if (workers != null) {
                throw new IllegalStateException("pipeline already started");
            }
            int count = Math.max(1, workerCount);
            launchWorkersLocked(count);
            log.info("Pipeline started workers={} buffer={} batchSize={}", count, bufferSize, batchSize);
        }
    }

    /**
     * Enqueues one record, blocking while the buffer is full. {@code null} is ignored.
     *
     * @throws PipelineClosedException if the pipeline is closed or has failed, including
     *     while this call was waiting for buffer space
     */
    public void submit(BookRecord record) {
        if (record == null) {
            return;
        }
        Lock gate = submitGate.readLock();
        gate.lock();
        try {
            while (true) {
                rejectIfClosed();
                if (queue.offer(record, POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("interrupted while submitting record", e);
        } finally {
            gate.unlock();
        }
    }

    public void submitAll(List<BookRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        rejectIfClosed();
        for (BookRecord record : records) {
            submit(record);
        }
    }

    /**
     * Rejects further submissions, waits for the workers to drain the buffer and flush
     * their partial batches, and rethrows the first sink failure. A pipeline that was
     * never started drains with a single worker. Safe to call more than once.
     *
     * @throws DrainTimeoutException if the workers are still busy when the drain
     *     deadline passes; the sink call in progress is not cancelled
     * @throws SinkWriteException the first failure reported by the sink
     */
    @Override
    public void close() {
        closing = true;
        Lock gate = submitGate.writeLock();
        gate.lock();
        try {
            inputClosed = true;
        } finally {
            gate.unlock();
        }

        CountDownLatch done;
        synchronized (stateLock) {
            if (workers == null) {
                launchWorkersLocked(1);
            }
            done = workersDone;
            stopReporterLocked();
        }

        boolean drained;
        try {
            drained = done.await(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("interrupted while draining pipeline", e);
        }
        if (!drained) {
            log.warn("Pipeline drain exceeded {}ms with {} records still buffered", drainTimeout.toMillis(), queue.size());
            throw new DrainTimeoutException(drainTimeout);
        }
        PipelineException first = failure;
        if (first != null) {
            throw first;
        }
        log.info("Pipeline closed processed={} distinctUrls={}", metrics.processed(), seenUrls.size());
    }

    public MetricsSnapshot metrics() {
        return metrics.snapshot();
    }

    /** First failure recorded by a worker, or {@code null}. */
    public PipelineException failure() {
        return failure;
    }

    public boolean isClosed() {
        return closing;
    }

    public int buffered() {
        return queue.size();
    }

    /** Logs progress at a fixed interval until the pipeline is closed. */
    public void startMetricsReporting(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return;
        }
        synchronized (stateLock) {
            if (closing || reporter != null) {
                return;
            }
            reporter = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("pipeline-metrics");
                thread.setDaemon(true);
                return thread;
            });
            reporter.scheduleAtFixedRate(
                this::logProgress,
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS
            );
        }
    }

    private void logProgress() {
        MetricsSnapshot snapshot = metrics.snapshot();
        log.info(
            "pipeline: processed={} validation_errors={} buffered={}",
            snapshot.processed(),
            snapshot.totalValidationErrors(),
            queue.size()
        );
    }

    private void launchWorkersLocked(int count) {
        AtomicInteger index = new AtomicInteger();
        workersDone = new CountDownLatch(count);
        workers = Executors.newFixedThreadPool(count, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("pipeline-worker-" + index.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        CountDownLatch done = workersDone;
        for (int i = 0; i < count; i++) {
            workers.execute(() -> {
                try {
                    workerLoop();
                } finally {
                    done.countDown();
                }
            });
        }
        workers.shutdown();
    }

    private void stopReporterLocked() {
        if (reporter != null) {
            reporter.shutdownNow();
            reporter = null;
        }
    }

    private void workerLoop() {
        List<BookRecord> batch = new ArrayList<>(batchSize);
        BookRecord record;
        while ((record = nextRecord()) != null) {
            if (failure != null) {
                continue;
            }
            BookRecord prepared = prepare(record);
            if (prepared == null) {
                continue;
            }
            batch.add(prepared);
            if (batch.size() >= batchSize) {
                batch = flush(batch);
            }
        }
        if (failure == null) {
            flush(batch);
        }
    }

    /** Next buffered record, or {@code null} once input is closed and the buffer is empty. */
    private BookRecord nextRecord() {
        try {
            while (true) {
                BookRecord record = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (record != null) {
                    return record;
                }
                if (inputClosed) {
                    return queue.poll();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Pipeline worker {} interrupted with {} records buffered", Thread.currentThread().getName(), queue.size());
            return null;
        }
    }

    private BookRecord prepare(BookRecord record) {
        try {
            RecordNormalizer.validate(record);
        } catch (InvalidRecordException e) {
            metrics.addValidationError(RunMetrics.INVALID_RECORD);
            log.debug("Dropping invalid record: {}", e.getMessage());
            return null;
        }
        if (!seenUrls.markSeen(record.getUrl())) {
            metrics.addValidationError(RunMetrics.DUPLICATE_URL);
            return null;
        }
        RecordNormalizer.normalize(record);
        metrics.incrementProcessed();
        return record;
    }

    private List<BookRecord> flush(List<BookRecord> batch) {
        if (batch.isEmpty()) {
            return batch;
        }
        try {
            sink.write(batch);
        } catch (IOException | RuntimeException e) {
            fail(new SinkWriteException(e));
        }
        return new ArrayList<>(batchSize);
    }

    private void fail(PipelineException error) {
        synchronized (stateLock) {
            if (failure != null) {
                log.debug("Discarding later pipeline failure: {}", error.getMessage());
                return;
            }
            failure = error;
            closing = true;
        }
        log.warn("Pipeline halted after sink failure", error);
    }

    private void rejectIfClosed() {
        if (!closing) {
            return;
        }
        PipelineException first = failure;
        throw first == null ? new PipelineClosedException() : new PipelineClosedException(first);
    }
}
