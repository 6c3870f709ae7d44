package com.bookscrape.scrape.catalog;

import com.bookscrape.config.ScraperProperties;
import com.bookscrape.scrape.http.HttpStatusException;
import com.bookscrape.scrape.http.PageFetcher;
import com.bookscrape.scrape.metrics.RunMetrics;
import com.bookscrape.scrape.model.BookRecord;
import com.bookscrape.scrape.model.FetchFailure;
import com.bookscrape.scrape.model.FetchResult;
import com.bookscrape.scrape.model.MetricsSnapshot;
import com.bookscrape.scrape.model.ScrapeResult;
import com.bookscrape.scrape.pipeline.PipelineClosedException;
import com.bookscrape.scrape.pipeline.PipelineException;
import com.bookscrape.scrape.pipeline.StreamingPipeline;
import com.bookscrape.scrape.retry.RetryScheduler;
import com.bookscrape.scrape.util.CancellationSignal;
import com.bookscrape.scrape.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Producer for one run: walks the paginated catalog from the base URL, streams every
 * listing into the pipeline and hands failed fetches to the {@link RetryScheduler}.
 *
 * <p>The page counter counts discovered next-page links; discovery stops once it
 * reaches {@code maxPages}. Retries re-fetch a URL that was already counted, so they
 * never consume the page budget again.
 */
public class CatalogScraper {
    private static final Logger log = LoggerFactory.getLogger(CatalogScraper.class);
    private static final long QUIESCENCE_POLL_MS = 20;

    private final ScraperProperties properties;
    private final PageFetcher fetcher;
    private final BookListingExtractor extractor;
    private final ExecutorService fetchExecutor;
    private final RunMetrics metrics;
    private final RetryScheduler retryScheduler;
    private final String allowedHost;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicInteger inFlight = new AtomicInteger();
    // Bumped whenever a fetch starts or ends; see awaitQuiescence().
    private final AtomicLong activity = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final Set<String> discovered = ConcurrentHashMap.newKeySet();
    private final List<String> failedUrls = new ArrayList<>();

    private volatile StreamingPipeline pipeline;
    private volatile CancellationSignal cancellation = CancellationSignal.none();

    public CatalogScraper(
        ScraperProperties properties,
        PageFetcher fetcher,
        BookListingExtractor extractor,
        ExecutorService fetchExecutor,
        RunMetrics metrics
    ) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.fetchExecutor = fetchExecutor;
        this.metrics = metrics;
        this.retryScheduler = new RetryScheduler(this::enqueueFetch, metrics, properties.getRetry());
        this.allowedHost = hostOf(properties.getBaseUrl());
    }

    public RetryScheduler retryScheduler() {
        return retryScheduler;
    }

    /**
     * Crawls until no fetch is in flight and no retry is armed, then stops the retry
     * scheduler. Single use.
     */
    public ScrapeResult run(StreamingPipeline pipeline, CancellationSignal cancellation) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("scraper instances are single use");
        }
        this.pipeline = pipeline;
        this.cancellation = cancellation == null ? CancellationSignal.none() : cancellation;
        retryScheduler.setCancellation(this.cancellation);

        Instant startedAt = Instant.now();
        String baseUrl = properties.getBaseUrl();
        discovered.add(baseUrl);
        enqueueFetch(baseUrl);

        try {
            awaitQuiescence();
        } finally {
            stopRetries();
        }

        MetricsSnapshot snapshot = metrics.snapshot();
        ScrapeResult result = new ScrapeResult(
            startedAt,
            Instant.now(),
            snapshot.processed(),
            errorCount.get(),
            retryScheduler.totalRetries(),
            snapshot.requests(),
            snapshot.pages(),
            snapshotFailedUrls(),
            snapshot.errorsByKind()
        );
        log.info(
            "Catalog crawl finished pages={} requests={} errors={} retries={} failedUrls={}",
            result.pageCount(),
            result.requestCount(),
            result.errorCount(),
            result.retryCount(),
            result.failedUrls().size()
        );
        return result;
    }

    private void enqueueFetch(String url) {
        inFlight.incrementAndGet();
        activity.incrementAndGet();
        try {
            fetchExecutor.execute(() -> {
                try {
                    visit(url);
                } catch (RuntimeException e) {
                    log.warn("Unexpected failure while visiting {}", url, e);
                    recordPermanentFailure(url);
                } finally {
                    activity.incrementAndGet();
                    inFlight.decrementAndGet();
                }
            });
        } catch (RejectedExecutionException e) {
            activity.incrementAndGet();
            inFlight.decrementAndGet();
            log.warn("Fetch executor rejected {}", url);
            recordPermanentFailure(url);
        }
    }

    private void visit(String url) {
        FetchResult result = fetcher.get(url, metrics);
        if (!result.isSuccessful()) {
            handleFailure(url, result);
            return;
        }

        CatalogPage page = extractor.extract(result.body(), result.finalUrlOrRequested());
        for (BookRecord record : page.records()) {
            metrics.incrementItemsScraped();
            try {
                pipeline.submit(record);
            } catch (PipelineClosedException e) {
                log.debug("Pipeline closed, dropping remaining {} records from {}", page.records().size(), url);
                break;
            } catch (PipelineException e) {
                log.warn("Pipeline rejected record from {}", url, e);
                break;
            }
        }

        if (page.hasNextPage()) {
            followNextPage(page.nextPageUrl());
        }
    }

    private void followNextPage(String nextUrl) {
        long currentPage = metrics.incrementPages();
        if (currentPage >= properties.getMaxPages() || cancellation.isCancelled()) {
            return;
        }
        if (allowedHost != null && !allowedHost.equals(hostOf(nextUrl))) {
            log.debug("Skipping off-site next link {}", nextUrl);
            return;
        }
        if (discovered.add(nextUrl)) {
            enqueueFetch(nextUrl);
        }
    }

    private void handleFailure(String url, FetchResult result) {
        int status = result.statusCode();
        Throwable cause = result.error();
        if (cause == null && status >= 400) {
            cause = new HttpStatusException(status);
        }
        FetchFailure failure = FailureClassifier.classify(cause, status);
        errorCount.incrementAndGet();
        metrics.addError(failure.kind());
        log.warn("Request error url={} category={} error={}", url, failure.kind().label(), failure.describe());

        if (!retryScheduler.schedule(url)) {
            recordPermanentFailure(url);
        }
    }

    /**
     * Waits until no fetch is running and no retry is armed. The activity counter guards
     * against reading both counters as zero while a retry moves from the timer to the
     * fetch executor between the two reads.
     */
    private void awaitQuiescence() {
        while (true) {
            if (cancellation.isCancelled() && !retryScheduler.isStopped()) {
                stopRetries();
            }
            long before = activity.get();
            if (inFlight.get() == 0 && retryScheduler.pendingCount() == 0 && activity.get() == before) {
                return;
            }
            try {
                TimeUnit.MILLISECONDS.sleep(QUIESCENCE_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} in-flight fetches", inFlight.get());
                return;
            }
        }
    }

    // A retry that is armed when the scheduler stops never runs, so its target has failed for good.
    private void stopRetries() {
        List<String> unsent = retryScheduler.stop();
        if (!unsent.isEmpty()) {
            log.info("Dropping {} pending retries after stop: {}", unsent.size(), unsent);
            for (String url : unsent) {
                recordPermanentFailure(url);
            }
        }
    }

    private void recordPermanentFailure(String url) {
        synchronized (failedUrls) {
            failedUrls.add(url);
        }
    }

    private List<String> snapshotFailedUrls() {
        synchronized (failedUrls) {
            return new ArrayList<>(failedUrls);
        }
    }

    private static String hostOf(String url) {
        if (url == null) {
            return null;
        }
        try {
            String host = new URI(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (Exception e) {
            return null;
        }
    }
}
