package com.bookscrape.scrape.output;

import com.bookscrape.scrape.model.BookRecord;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Writes every batch to a CSV sink and a JSON lines sink. */
public class DualOutputSink implements OutputSink {
    private final CsvOutputSink csvSink;
    private final JsonLinesOutputSink jsonSink;

    public DualOutputSink(CsvOutputSink csvSink, JsonLinesOutputSink jsonSink) {
        this.csvSink = csvSink;
        this.jsonSink = jsonSink;
    }

    @Override
    public synchronized void write(List<BookRecord> batch) throws IOException {
        try {
            csvSink.write(batch);
        } catch (IOException e) {
            throw new IOException("CSV write failed: " + e.getMessage(), e);
        }
        try {
            jsonSink.write(batch);
        } catch (IOException e) {
            throw new IOException("JSON write failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        List<String> errors = new ArrayList<>();
        IOException first = null;
        try {
            csvSink.close();
        } catch (IOException e) {
            errors.add("CSV close failed: " + e.getMessage());
            first = e;
        }
        try {
            jsonSink.close();
        } catch (IOException e) {
            errors.add("JSON close failed: " + e.getMessage());
            if (first == null) {
                first = e;
            }
        }
        if (first != null) {
            throw new IOException(String.join("; ", errors), first);
        }
    }

    @Override
    public void validate() throws IOException {
        List<String> errors = new ArrayList<>();
        try {
            csvSink.validate();
        } catch (IOException e) {
            errors.add("CSV validation failed: " + e.getMessage());
        }
        try {
            jsonSink.validate();
        } catch (IOException e) {
            errors.add("JSON validation failed: " + e.getMessage());
        }
        if (!errors.isEmpty()) {
            throw new IOException(String.join("; ", errors));
        }
    }
}
