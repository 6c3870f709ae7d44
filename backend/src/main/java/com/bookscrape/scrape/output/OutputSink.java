package com.bookscrape.scrape.output;

import com.bookscrape.scrape.model.BookRecord;

import java.io.IOException;
import java.util.List;

/**
 * Destination for accepted records. Implementations must tolerate concurrent
 * {@link #write(List)} calls from different pipeline workers.
 */
public interface OutputSink extends AutoCloseable {

    /** Takes ownership of {@code batch}; the caller keeps no reference after the call. */
    void write(List<BookRecord> batch) throws IOException;

    @Override
    void close() throws IOException;

    /** Post-run sanity check, e.g. that the output is non-empty. */
    void validate() throws IOException;
}
