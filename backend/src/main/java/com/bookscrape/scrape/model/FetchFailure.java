package com.bookscrape.scrape.model;

/**
 * A classified fetch failure. The cause is {@code null} only for
 * {@link FailureKind#UNKNOWN} or when the failure came from a status code alone.
 */
public record FetchFailure(FailureKind kind, Throwable cause, int statusCode) {
    public FetchFailure {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
    }

    public String describe() {
        if (cause != null && cause.getMessage() != null) {
            return kind.label() + ": " + cause.getMessage();
        }
        if (statusCode > 0) {
            return kind.label() + ": http status " + statusCode;
        }
        return kind.label();
    }
}
