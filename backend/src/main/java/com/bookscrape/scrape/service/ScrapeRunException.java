package com.bookscrape.scrape.service;

public class ScrapeRunException extends RuntimeException {
    public ScrapeRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
