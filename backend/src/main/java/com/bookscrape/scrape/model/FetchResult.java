package com.bookscrape.scrape.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record FetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    Instant fetchedAt,
    Duration duration,
    Throwable error
) {
    public boolean isSuccessful() {
        return error == null && statusCode >= 200 && statusCode < 400;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
