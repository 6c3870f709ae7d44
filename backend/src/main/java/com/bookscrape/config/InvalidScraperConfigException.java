package com.bookscrape.config;

import java.util.List;

/** Raised by {@link ScraperProperties#validate()}; carries one message per offending property. */
public class InvalidScraperConfigException extends IllegalArgumentException {
    private final List<String> problems;

    public InvalidScraperConfigException(List<String> problems) {
        super("Invalid scraper configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
