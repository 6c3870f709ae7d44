package com.bookscrape.scrape.service;

import com.bookscrape.config.ScraperProperties;
import com.bookscrape.scrape.catalog.BookListingExtractor;
import com.bookscrape.scrape.catalog.CatalogScraper;
import com.bookscrape.scrape.http.PageFetcher;
import com.bookscrape.scrape.metrics.RunMetrics;
import com.bookscrape.scrape.model.MetricsSnapshot;
import com.bookscrape.scrape.model.ScrapeResult;
import com.bookscrape.scrape.output.OutputSink;
import com.bookscrape.scrape.output.OutputSinkFactory;
import com.bookscrape.scrape.pipeline.DrainTimeoutException;
import com.bookscrape.scrape.pipeline.PipelineException;
import com.bookscrape.scrape.pipeline.StreamingPipeline;
import com.bookscrape.scrape.util.CancellationSignal;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class ScrapeRunService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeRunService.class);

    private final ScraperProperties properties;
    private final PageFetcher fetcher;
    private final BookListingExtractor extractor;
    private final OutputSinkFactory sinkFactory;
    private final ExecutorService fetchExecutor;
    private final ExecutorService scrapeRunExecutor;

    private final AtomicReference<ActiveRun> active = new AtomicReference<>();
    private volatile ScrapeResult latestResult;
    private volatile MetricsSnapshot latestMetrics;

    public ScrapeRunService(
        ScraperProperties properties,
        PageFetcher fetcher,
        BookListingExtractor extractor,
        OutputSinkFactory sinkFactory,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
        @Qualifier("scrapeRunExecutor") ExecutorService scrapeRunExecutor
    ) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.sinkFactory = sinkFactory;
        this.fetchExecutor = fetchExecutor;
        this.scrapeRunExecutor = scrapeRunExecutor;
    }

    /**
     * Runs one complete scrape on the calling thread.
     *
     * @throws ActiveScrapeRunException if another run is in progress
     * @throws ScrapeRunException if the output could not be created, drained or validated
     */
    public ScrapeResult run() {
        return execute(begin());
    }

    /** Starts a run on the run executor and returns its start time. */
    public Instant startAsync() {
        ActiveRun run = begin();
        scrapeRunExecutor.submit(() -> {
            try {
                execute(run);
            } catch (Exception e) {
                log.warn("Async scrape run started at {} failed", run.startedAt(), e);
            }
        });
        return run.startedAt();
    }

    /** Fires the active run's cancellation signal. In-flight fetches still complete. */
    public boolean cancel() {
        ActiveRun run = active.get();
        if (run == null) {
            return false;
        }
        boolean fired = run.cancellation().cancel();
        if (fired) {
            log.info("Cancellation requested for scrape run started at {}", run.startedAt());
        }
        return fired;
    }

    @PreDestroy
    public void cancelOnShutdown() {
        cancel();
    }

    public boolean isRunning() {
        return active.get() != null;
    }

    public ScrapeResult getLatestResult() {
        return latestResult;
    }

    /** Metrics of the active run, or of the last finished run; {@code null} before any run. */
    public MetricsSnapshot getCurrentMetrics() {
        ActiveRun run = active.get();
        if (run != null) {
            return run.metrics().snapshot();
        }
        return latestMetrics;
    }

    private ActiveRun begin() {
        properties.validate();
        ActiveRun run = new ActiveRun(new RunMetrics(), new CancellationSignal(), Instant.now());
        if (!active.compareAndSet(null, run)) {
            throw new ActiveScrapeRunException("A scrape run is already in progress");
        }
        return run;
    }

    private ScrapeResult execute(ActiveRun run) {
        try {
            OutputSink sink;
            try {
                sink = sinkFactory.create(properties.getOutput().getFormat(), properties.getOutput().getFile());
            } catch (IOException e) {
                throw new ScrapeRunException("creating output sink failed: " + e.getMessage(), e);
            }
            return scrapeInto(run, sink);
        } finally {
            latestMetrics = run.metrics().snapshot();
            active.compareAndSet(run, null);
        }
    }

    private ScrapeResult scrapeInto(ActiveRun run, OutputSink sink) {
        boolean sinkClosed = false;
        StreamingPipeline pipeline = new StreamingPipeline(sink, run.metrics(), properties.getPipeline());
        CatalogScraper scraper = new CatalogScraper(properties, fetcher, extractor, fetchExecutor, run.metrics());
        log.info(
            "Starting scrape baseUrl={} maxPages={} workers={} output={} format={}",
            properties.getBaseUrl(),
            properties.getMaxPages(),
            properties.getParallelism(),
            properties.getOutput().getFile(),
            properties.getOutput().getFormat()
        );
        try {
            pipeline.start(properties.getParallelism());
            pipeline.startMetricsReporting(Duration.ofMillis(properties.getPipeline().getMetricsLogIntervalMs()));

            ScrapeResult crawl = scraper.run(pipeline, run.cancellation());
            try {
                pipeline.close();
            } catch (DrainTimeoutException e) {
                sinkClosed = true;
                abandonSink(sink);
                throw new ScrapeRunException("pipeline shutdown failed: " + e.getMessage(), e);
            } catch (PipelineException e) {
                throw new ScrapeRunException("pipeline shutdown failed: " + e.getMessage(), e);
            }

            try {
                sinkClosed = true;
                sink.close();
                sink.validate();
            } catch (IOException e) {
                throw new ScrapeRunException("output validation failed: " + e.getMessage(), e);
            }

            ScrapeResult result = crawl.completed(Instant.now(), pipeline.metrics().processed());
            logSummary(result, pipeline.metrics());
            latestResult = result;
            return result;
        } finally {
            if (!sinkClosed) {
                closeSink(sink, pipeline);
            }
        }
    }

    private void closeSink(OutputSink sink, StreamingPipeline pipeline) {
        // close() is repeatable; calling it again waits for any worker still writing.
        try {
            pipeline.close();
        } catch (DrainTimeoutException e) {
            abandonSink(sink);
            return;
        } catch (PipelineException e) {
            log.warn("Pipeline close after failed run reported: {}", e.getMessage());
        }
        closeQuietly(sink);
    }

    /**
     * A worker that missed the drain deadline is still inside {@code write} and holds the
     * sink's lock, so the sink is closed on its own daemon thread once that write returns.
     */
    private void abandonSink(OutputSink sink) {
        log.warn("Output sink still busy after drain deadline; closing it in the background");
        Thread closer = new Thread(() -> closeQuietly(sink), "sink-close");
        closer.setDaemon(true);
        closer.start();
    }

    private void closeQuietly(OutputSink sink) {
        try {
            sink.close();
        } catch (IOException e) {
            log.warn("Closing output sink failed", e);
        }
    }

    private void logSummary(ScrapeResult result, MetricsSnapshot metrics) {
        log.info(
            "Scrape complete elapsed={}ms items={} itemsPerSec={} pages={} requests={} retries={} errors={}",
            result.elapsed().toMillis(),
            result.processedCount(),
            String.format("%.2f", result.itemsPerSecond()),
            result.pageCount(),
            result.requestCount(),
            result.retryCount(),
            result.errorCount()
        );
        for (Map.Entry<String, Long> entry : metrics.validationErrors().entrySet()) {
            log.info("Validation {}={}", entry.getKey(), entry.getValue());
        }
        for (Map.Entry<String, Long> entry : result.errorsByKind().entrySet()) {
            log.info("Errors {}={}", entry.getKey(), entry.getValue());
        }
        if (!result.failedUrls().isEmpty()) {
            log.warn("Permanently failed URLs ({}): {}", result.failedUrls().size(), result.failedUrls());
        }
    }

    private record ActiveRun(RunMetrics metrics, CancellationSignal cancellation, Instant startedAt) {
    }
}
