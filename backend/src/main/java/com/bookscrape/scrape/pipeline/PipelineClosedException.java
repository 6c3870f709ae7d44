package com.bookscrape.scrape.pipeline;

public class PipelineClosedException extends PipelineException {
    public PipelineClosedException() {
        super("pipeline: closed");
    }

    public PipelineClosedException(Throwable failure) {
        super("pipeline: closed after failure", failure);
    }
}
