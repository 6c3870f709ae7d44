package com.bookscrape.scrape.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

@Component
public class OutputSinkFactory {
    private final ObjectMapper objectMapper;

    public OutputSinkFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param format {@code csv}, {@code json} or {@code dual}; dual writes the JSON lines
     *     copy next to the CSV file with a {@code .json} suffix
     */
    public OutputSink create(String format, String file) throws IOException {
        String normalized = format == null ? "csv" : format.trim().toLowerCase(Locale.ROOT);
        Path path = Path.of(file);
        return switch (normalized) {
            case "csv" -> new CsvOutputSink(path);
            case "json" -> new JsonLinesOutputSink(path, objectMapper);
            case "dual" -> createDual(path, file);
            default -> throw new IllegalArgumentException("unsupported output format: " + format);
        };
    }

    static String jsonCompanionPath(String csvFile) {
        String base = csvFile.endsWith(".csv") ? csvFile.substring(0, csvFile.length() - 4) : csvFile;
        return base + ".json";
    }

    private OutputSink createDual(Path csvPath, String file) throws IOException {
        CsvOutputSink csvSink = new CsvOutputSink(csvPath);
        try {
            JsonLinesOutputSink jsonSink = new JsonLinesOutputSink(Path.of(jsonCompanionPath(file)), objectMapper);
            return new DualOutputSink(csvSink, jsonSink);
        } catch (IOException e) {
            csvSink.close();
            throw e;
        }
    }
}
