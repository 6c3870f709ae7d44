package com.bookscrape.scrape.catalog;

import com.bookscrape.config.ScraperProperties;
import com.bookscrape.scrape.http.PageFetcher;
import com.bookscrape.scrape.metrics.RunMetrics;
import com.bookscrape.scrape.model.BookRecord;
import com.bookscrape.scrape.model.ScrapeResult;
import com.bookscrape.scrape.output.OutputSink;
import com.bookscrape.scrape.pipeline.StreamingPipeline;
import com.bookscrape.scrape.util.CancellationSignal;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CatalogScraperTest {
    private static final Pattern PAGE_PATH = Pattern.compile("/catalogue/page-(\\d+)\\.html");

    private MockWebServer server;
    private ExecutorService httpExecutor;
    private ExecutorService fetchExecutor;
    private ScraperProperties properties;
    private RunMetrics metrics;
    private RecordingSink sink;
    private StreamingPipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        httpExecutor = Executors.newFixedThreadPool(4);
        fetchExecutor = Executors.newFixedThreadPool(4);

        properties = new ScraperProperties();
        properties.setBaseUrl(server.url("/catalogue/page-1.html").toString());
        properties.setParallelism(2);
        properties.setRequestTimeoutMs(2_000);
        properties.getRetry().setMaxRetries(2);
        properties.getRetry().setBackoffMs(10);
        properties.getRetry().setBackoffMaxMs(50);

        metrics = new RunMetrics();
        sink = new RecordingSink();
        pipeline = new StreamingPipeline(sink, metrics, 64, 8, Duration.ofSeconds(5));
        pipeline.start(2);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (!pipeline.isClosed()) {
            pipeline.close();
        }
        server.shutdown();
        httpExecutor.shutdownNow();
        fetchExecutor.shutdownNow();
    }

    @Test
    void walksEveryPageUntilThereIsNoNextLink() {
        server.setDispatcher(pages(page -> page < 3 ? "page-" + (page + 1) + ".html" : null));

        ScrapeResult result = newScraper().run(pipeline, CancellationSignal.none());
        pipeline.close();

        assertThat(sink.records()).hasSize(6);
        assertThat(result.requestCount()).isEqualTo(3);
        assertThat(result.pageCount()).isEqualTo(2);
        assertThat(result.errorCount()).isZero();
        assertThat(result.failedUrls()).isEmpty();
        assertThat(metrics.snapshot().itemsScraped()).isEqualTo(6);
    }

    @Test
    void stopsDiscoveringOnceThePageBudgetIsReached() {
        properties.setMaxPages(2);
        server.setDispatcher(pages(page -> "page-" + (page + 1) + ".html"));

        ScrapeResult result = newScraper().run(pipeline, CancellationSignal.none());

        assertThat(result.requestCount()).isEqualTo(2);
        assertThat(result.pageCount()).isEqualTo(2);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void notFoundIsRetriedThenRecordedAsPermanentFailure() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return new MockResponse().setResponseCode(404).setBody("missing");
            }
        });

        ScrapeResult result = newScraper().run(pipeline, CancellationSignal.none());

        assertThat(result.requestCount()).isEqualTo(3);
        assertThat(result.errorCount()).isEqualTo(3);
        assertThat(result.retryCount()).isEqualTo(2);
        assertThat(result.failedUrls()).containsExactly(properties.getBaseUrl());
        assertThat(result.errorsByKind()).containsEntry("not_found", 3L);
    }

    @Test
    void serverErrorRecoversOnRetry() {
        AtomicInteger hits = new AtomicInteger();
        Dispatcher catalog = pages(page -> null);
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) throws InterruptedException {
                if (hits.incrementAndGet() == 1) {
                    return new MockResponse().setResponseCode(500).setBody("boom");
                }
                return catalog.dispatch(request);
            }
        });

        ScrapeResult result = newScraper().run(pipeline, CancellationSignal.none());
        pipeline.close();

        assertThat(result.errorsByKind()).containsEntry("other", 1L);
        assertThat(result.retryCount()).isEqualTo(1);
        assertThat(result.failedUrls()).isEmpty();
        assertThat(sink.records()).hasSize(2);
    }

    @Test
    void nextLinksToOtherHostsAreIgnored() {
        server.setDispatcher(pages(page -> "http://elsewhere.invalid/catalogue/page-2.html"));

        ScrapeResult result = newScraper().run(pipeline, CancellationSignal.none());

        assertThat(result.requestCount()).isEqualTo(1);
        assertThat(result.pageCount()).isEqualTo(1);
    }

    @Test
    void pagesLinkingBackAreNotRevisited() {
        server.setDispatcher(pages(page -> page == 1 ? "page-2.html" : "page-1.html"));

        ScrapeResult result = newScraper().run(pipeline, CancellationSignal.none());

        assertThat(result.requestCount()).isEqualTo(2);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void cancelledRunFetchesOnlyTheStartPage() {
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.cancel();
        server.setDispatcher(pages(page -> "page-" + (page + 1) + ".html"));

        ScrapeResult result = newScraper().run(pipeline, cancellation);

        assertThat(result.requestCount()).isEqualTo(1);
        assertThat(result.retryCount()).isZero();
    }

    @Test
    void retryArmedAtCancellationIsReportedAsFailed() throws Exception {
        properties.getRetry().setBackoffMs(10_000);
        properties.getRetry().setBackoffMaxMs(10_000);
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return new MockResponse().setResponseCode(503);
            }
        });
        CancellationSignal cancellation = new CancellationSignal();
        CatalogScraper scraper = newScraper();

        Thread canceller = new Thread(() -> {
            long deadline = System.currentTimeMillis() + 5_000;
            while (scraper.retryScheduler().pendingCount() == 0 && System.currentTimeMillis() < deadline) {
                try {
                    Thread.sleep(5);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
            cancellation.cancel();
        });
        canceller.start();
        long startedAt = System.currentTimeMillis();
        ScrapeResult result = scraper.run(pipeline, cancellation);
        canceller.join(1_000);

        assertThat(System.currentTimeMillis() - startedAt).isLessThan(5_000);
        assertThat(result.requestCount()).isEqualTo(1);
        assertThat(result.retryCount()).isEqualTo(1);
        assertThat(result.failedUrls()).containsExactly(properties.getBaseUrl());
    }

    @Test
    void scraperIsSingleUse() {
        server.setDispatcher(pages(page -> null));
        CatalogScraper scraper = newScraper();
        scraper.run(pipeline, CancellationSignal.none());

        assertThat(scraper.retryScheduler().isStopped()).isTrue();
        assertThrows(IllegalStateException.class, () -> scraper.run(pipeline, CancellationSignal.none()));
    }

    private CatalogScraper newScraper() {
        PageFetcher fetcher = new PageFetcher(properties, httpExecutor);
        return new CatalogScraper(properties, fetcher, new BookListingExtractor(), fetchExecutor, metrics);
    }

    private static Dispatcher pages(Function<Integer, String> nextHref) {
        return new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                Matcher matcher = PAGE_PATH.matcher(request.getPath());
                if (!matcher.matches()) {
                    return new MockResponse().setResponseCode(404);
                }
                int page = Integer.parseInt(matcher.group(1));
                return new MockResponse()
                    .setResponseCode(200)
                    .setHeader("Content-Type", "text/html; charset=utf-8")
                    .setBody(CatalogPages.listing(page, 2, nextHref.apply(page)));
            }
        };
    }

    private static class RecordingSink implements OutputSink {
        private final List<BookRecord> records = new ArrayList<>();

        @Override
        public synchronized void write(List<BookRecord> batch) {
            records.addAll(batch);
        }

        @Override
        public void close() {
        }

        @Override
        public void validate() {
        }

        synchronized List<BookRecord> records() {
            return new ArrayList<>(records);
        }
    }
}
