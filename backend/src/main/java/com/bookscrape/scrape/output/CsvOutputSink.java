package com.bookscrape.scrape.output;

import com.bookscrape.scrape.model.BookRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;

public class CsvOutputSink implements OutputSink {
    static final String[] HEADER = {
        "title", "price", "rating", "rating_numeric", "availability", "image_url", "url", "scraped_at"
    };

    private final Path file;
    private final CSVPrinter printer;

    public CsvOutputSink(Path file) throws IOException {
        OutputFiles.ensureParentDirectory(file);
        this.file = file;
        BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        try {
            this.printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(HEADER).build());
            this.printer.flush();
        } catch (IOException e) {
            writer.close();
            throw new IOException("write csv header: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void write(List<BookRecord> batch) throws IOException {
        for (BookRecord record : batch) {
            printer.printRecord(
                record.getTitle(),
                record.getPrice(),
                record.getRatingText(),
                record.getRatingNumeric(),
                record.getAvailability(),
                record.getImageUrl(),
                record.getUrl(),
                record.getScrapedAt() == null ? "" : DateTimeFormatter.ISO_INSTANT.format(record.getScrapedAt())
            );
        }
        printer.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        printer.close(true);
    }

    @Override
    public void validate() throws IOException {
        OutputFiles.requireNonEmpty(file, "csv");
    }

    public Path getFile() {
        return file;
    }
}
