package com.bookscrape.scrape.pipeline;

import java.time.Duration;

/** Workers did not finish draining before the close deadline; the sink may still be writing. */
public class DrainTimeoutException extends PipelineException {
    private final Duration timeout;

    public DrainTimeoutException(Duration timeout) {
        super("pipeline: close timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
