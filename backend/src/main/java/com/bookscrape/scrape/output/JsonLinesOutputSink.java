package com.bookscrape.scrape.output;

import com.bookscrape.scrape.model.BookRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/** Newline-delimited JSON, one object per record. */
public class JsonLinesOutputSink implements OutputSink {
    private final Path file;
    private final BufferedWriter writer;
    private final ObjectWriter objectWriter;

    public JsonLinesOutputSink(Path file, ObjectMapper objectMapper) throws IOException {
        OutputFiles.ensureParentDirectory(file);
        this.file = file;
        this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        this.objectWriter = objectMapper.writerFor(JsonRow.class);
    }

    @Override
    public synchronized void write(List<BookRecord> batch) throws IOException {
        for (BookRecord record : batch) {
            writer.write(objectWriter.writeValueAsString(JsonRow.from(record)));
            writer.newLine();
        }
        writer.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }

    @Override
    public void validate() throws IOException {
        OutputFiles.requireNonEmpty(file, "json");
    }

    public Path getFile() {
        return file;
    }

    record JsonRow(
        @JsonProperty("title") String title,
        @JsonProperty("price") String price,
        @JsonProperty("rating") String rating,
        @JsonProperty("rating_numeric") int ratingNumeric,
        @JsonProperty("availability") String availability,
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("url") String url,
        @JsonProperty("scraped_at") Instant scrapedAt
    ) {
        static JsonRow from(BookRecord record) {
            return new JsonRow(
                record.getTitle(),
                record.getPrice(),
                record.getRatingText(),
                record.getRatingNumeric(),
                record.getAvailability(),
                record.getImageUrl(),
                record.getUrl(),
                record.getScrapedAt()
            );
        }
    }
}
