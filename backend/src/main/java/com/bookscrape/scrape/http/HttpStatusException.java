package com.bookscrape.scrape.http;

import java.io.IOException;

public class HttpStatusException extends IOException {
    private final int statusCode;

    public HttpStatusException(int statusCode) {
        super("http status " + statusCode);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
