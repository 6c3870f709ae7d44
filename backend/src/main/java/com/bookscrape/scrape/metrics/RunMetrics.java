package com.bookscrape.scrape.metrics;

import com.bookscrape.scrape.model.FailureKind;
import com.bookscrape.scrape.model.MetricsSnapshot;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters for a single scrape run. One instance is created per run and shared by the
 * pipeline, the retry scheduler and the catalog scraper. Counters only ever increase.
 */
public class RunMetrics {
    public static final String INVALID_RECORD = "invalid_record";
    public static final String DUPLICATE_URL = "duplicate_url";

    private final Object lock = new Object();
    private final Map<String, Long> validationErrors = new LinkedHashMap<>();
    private final Map<String, Long> errorsByKind = new LinkedHashMap<>();
    private long processed;
    private long retries;
    private long requests;
    private long pages;
    private long itemsScraped;

    public void incrementProcessed() {
        synchronized (lock) {
            processed++;
        }
    }

    public void addValidationError(String kind) {
        synchronized (lock) {
            validationErrors.merge(kind, 1L, Long::sum);
        }
    }

    public void addError(FailureKind kind) {
        synchronized (lock) {
            errorsByKind.merge(kind.label(), 1L, Long::sum);
        }
    }

    public void incrementRetries() {
        synchronized (lock) {
            retries++;
        }
    }

    public long incrementRequests() {
        synchronized (lock) {
            return ++requests;
        }
    }

    public long incrementPages() {
        synchronized (lock) {
            return ++pages;
        }
    }

    public void incrementItemsScraped() {
        synchronized (lock) {
            itemsScraped++;
        }
    }

    public long processed() {
        synchronized (lock) {
            return processed;
        }
    }

    public long pages() {
        synchronized (lock) {
            return pages;
        }
    }

    public MetricsSnapshot snapshot() {
        synchronized (lock) {
            return new MetricsSnapshot(
                processed,
                new LinkedHashMap<>(validationErrors),
                new LinkedHashMap<>(errorsByKind),
                retries,
                requests,
                pages,
                itemsScraped
            );
        }
    }
}
