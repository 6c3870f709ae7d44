package com.bookscrape.scrape.retry;

/** Hands a fetch target back to the producer once its retry delay has elapsed. */
@FunctionalInterface
public interface RetrySubmitter {
    void resubmit(String target);
}
