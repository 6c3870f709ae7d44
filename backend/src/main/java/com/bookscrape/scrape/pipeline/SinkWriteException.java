package com.bookscrape.scrape.pipeline;

public class SinkWriteException extends PipelineException {
    public SinkWriteException(Throwable cause) {
        super("write batch: " + cause.getMessage(), cause);
    }
}
