package com.bookscrape.scrape.http;

import com.bookscrape.config.ScraperProperties;
import com.bookscrape.scrape.metrics.RunMetrics;
import com.bookscrape.scrape.model.FetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);
    private static final int PROGRESS_LOG_EVERY = 50;

    private final ScraperProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;

    public PageFetcher(ScraperProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getParallelism());
    }

    /**
     * Issues one GET. Never throws: transport failures come back as a result with
     * {@link FetchResult#error()} set and status 0.
     */
    public FetchResult get(String url, RunMetrics metrics) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, new URISyntaxException(String.valueOf(url), "URL missing host or malformed"));
        }

        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            politeDelay();

            long requestNumber = metrics == null ? 0 : metrics.incrementRequests();
            if (requestNumber > 0 && requestNumber % PROGRESS_LOG_EVERY == 0) {
                log.debug("Scraper request progress requests={} pages={} url={}", requestNumber, metrics.pages(), url);
            }

            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml")
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] bytes = response.body();
            String body = bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
            if (response.statusCode() >= 400) {
                log.debug("Non-success response status={} url={}", response.statusCode(), url);
            }
            return new FetchResult(
                url,
                response.uri(),
                response.statusCode(),
                body,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null
            );
        } catch (IOException e) {
            return errorResult(url, startedAt, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, e);
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private void politeDelay() throws InterruptedException {
        long delay = properties.getRequestDelayMs();
        int jitter = properties.getRandomDelayMs();
        if (jitter > 0) {
            delay += ThreadLocalRandom.current().nextLong(jitter + 1L);
        }
        if (delay > 0) {
            Thread.sleep(delay);
        }
    }

    private FetchResult errorResult(String url, Instant startedAt, Throwable error) {
        return new FetchResult(
            url,
            null,
            0,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            error
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            return new URI(input.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
