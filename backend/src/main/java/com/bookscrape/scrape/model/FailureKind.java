package com.bookscrape.scrape.model;

import java.util.Locale;

public enum FailureKind {
    TIMEOUT,
    CONNECTION,
    FORBIDDEN,
    NOT_FOUND,
    RATE_LIMITED,
    OTHER,
    UNKNOWN;

    /** Lower-case label used as the metrics key, e.g. {@code rate_limited}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
