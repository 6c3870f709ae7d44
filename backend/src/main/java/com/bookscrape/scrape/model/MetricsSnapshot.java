package com.bookscrape.scrape.model;

import java.util.Map;

public record MetricsSnapshot(
    long processed,
    Map<String, Long> validationErrors,
    Map<String, Long> errorsByKind,
    long retries,
    long requests,
    long pages,
    long itemsScraped
) {
    public MetricsSnapshot {
        validationErrors = validationErrors == null ? Map.of() : Map.copyOf(validationErrors);
        errorsByKind = errorsByKind == null ? Map.of() : Map.copyOf(errorsByKind);
    }

    public long validationErrorCount(String kind) {
        return validationErrors.getOrDefault(kind, 0L);
    }

    public long totalValidationErrors() {
        return validationErrors.values().stream().mapToLong(Long::longValue).sum();
    }

    public long totalErrors() {
        return errorsByKind.values().stream().mapToLong(Long::longValue).sum();
    }
}
