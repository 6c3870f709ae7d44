package com.bookscrape.scrape.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ScrapeResult(
    Instant startedAt,
    Instant finishedAt,
    long processedCount,
    long errorCount,
    long retryCount,
    long requestCount,
    long pageCount,
    List<String> failedUrls,
    Map<String, Long> errorsByKind
) {
    public ScrapeResult {
        failedUrls = failedUrls == null ? List.of() : List.copyOf(failedUrls);
        errorsByKind = errorsByKind == null ? Map.of() : Map.copyOf(errorsByKind);
    }

    public Duration elapsed() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }

    public double itemsPerSecond() {
        double seconds = elapsed().toMillis() / 1000.0;
        if (seconds <= 0) {
            return 0.0;
        }
        return processedCount / seconds;
    }

    /** Copy stamped with the final processed count once the pipeline has drained. */
    public ScrapeResult completed(Instant completedAt, long processed) {
        return new ScrapeResult(
            startedAt,
            completedAt,
            processed,
            errorCount,
            retryCount,
            requestCount,
            pageCount,
            failedUrls,
            errorsByKind
        );
    }
}
