package com.bookscrape.scrape.output;

import com.bookscrape.scrape.model.BookRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputSinkTest {
    private static final Instant SCRAPED_AT = Instant.parse("2024-05-01T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @TempDir
    Path tempDir;

    @Test
    void csvSinkWritesHeaderAndQuotedRows() throws Exception {
        Path file = tempDir.resolve("nested/books.csv");
        CsvOutputSink sink = new CsvOutputSink(file);
        sink.write(List.of(book("Sharp Objects, Vol. 1", "/sharp"), book("Soumission", "/soumission")));
        sink.close();
        sink.validate();

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build().parse(reader)) {
            assertThat(parser.getHeaderNames()).containsExactly(CsvOutputSink.HEADER);
            List<CSVRecord> rows = parser.getRecords();
            assertEquals(2, rows.size());
            assertEquals("Sharp Objects, Vol. 1", rows.get(0).get("title"));
            assertEquals("47.82", rows.get(0).get("price"));
            assertEquals("Four", rows.get(0).get("rating"));
            assertEquals("4", rows.get(0).get("rating_numeric"));
            assertEquals("http://books.test/sharp", rows.get(0).get("url"));
            assertEquals("2024-05-01T12:00:00Z", rows.get(0).get("scraped_at"));
        }
    }

    @Test
    void csvWithOnlyHeaderStillValidates() throws Exception {
        CsvOutputSink sink = new CsvOutputSink(tempDir.resolve("empty.csv"));
        sink.close();
        sink.validate();
    }

    @Test
    void jsonSinkWritesOneSnakeCaseObjectPerLine() throws Exception {
        Path file = tempDir.resolve("books.json");
        JsonLinesOutputSink sink = new JsonLinesOutputSink(file, objectMapper);
        sink.write(List.of(book("Tipping the Velvet", "/velvet")));
        sink.write(List.of(book("Set Me Free", "/free")));
        sink.close();
        sink.validate();

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        JsonNode first = objectMapper.readTree(lines.get(0));
        assertEquals("Tipping the Velvet", first.get("title").asText());
        assertEquals(4, first.get("rating_numeric").asInt());
        assertEquals("http://books.test/cover.jpg", first.get("image_url").asText());
        assertEquals("2024-05-01T12:00:00Z", first.get("scraped_at").asText());
    }

    @Test
    void emptyJsonOutputFailsValidation() throws Exception {
        JsonLinesOutputSink sink = new JsonLinesOutputSink(tempDir.resolve("none.json"), objectMapper);
        sink.close();
        IOException error = assertThrows(IOException.class, sink::validate);
        assertThat(error.getMessage()).contains("json file is empty");
    }

    @Test
    void factoryBuildsDualSinkWithJsonCompanion() throws Exception {
        OutputSinkFactory factory = new OutputSinkFactory(objectMapper);
        String csvFile = tempDir.resolve("out/books.csv").toString();

        OutputSink sink = factory.create("dual", csvFile);
        assertThat(sink).isInstanceOf(DualOutputSink.class);
        sink.write(List.of(book("Olio", "/olio")));
        sink.close();
        sink.validate();

        assertTrue(Files.size(Path.of(csvFile)) > 0);
        assertThat(Files.readAllLines(tempDir.resolve("out/books.json"))).hasSize(1);
    }

    @Test
    void dualValidationReportsTheEmptyJsonSide() throws Exception {
        OutputSink sink = new OutputSinkFactory(objectMapper).create("dual", tempDir.resolve("d.csv").toString());
        sink.close();
        IOException error = assertThrows(IOException.class, sink::validate);
        assertThat(error.getMessage()).startsWith("JSON validation failed");
    }

    @Test
    void factorySelectsSinkByFormat() throws Exception {
        OutputSinkFactory factory = new OutputSinkFactory(objectMapper);

        OutputSink csv = factory.create("CSV", tempDir.resolve("a.csv").toString());
        OutputSink json = factory.create("json", tempDir.resolve("a.json").toString());
        csv.close();
        json.close();

        assertThat(csv).isInstanceOf(CsvOutputSink.class);
        assertThat(json).isInstanceOf(JsonLinesOutputSink.class);
        assertThrows(IllegalArgumentException.class, () -> factory.create("xml", tempDir.resolve("a.xml").toString()));
    }

    @Test
    void jsonCompanionReplacesCsvSuffix() {
        assertEquals("output/books.json", OutputSinkFactory.jsonCompanionPath("output/books.csv"));
        assertEquals("output/books.json", OutputSinkFactory.jsonCompanionPath("output/books"));
    }

    private static BookRecord book(String title, String path) {
        BookRecord record = new BookRecord(
            title,
            "47.82",
            "Four",
            "In stock",
            "http://books.test/cover.jpg",
            "http://books.test" + path,
            SCRAPED_AT
        );
        record.setRatingNumeric(4);
        return record;
    }
}
