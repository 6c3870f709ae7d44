package com.bookscrape.scrape.output;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class OutputFiles {
    private OutputFiles() {
    }

    static void ensureParentDirectory(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    static void requireNonEmpty(Path file, String label) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException(label + " file does not exist: " + file);
        }
        if (Files.size(file) <= 0) {
            throw new IOException(label + " file is empty: " + file);
        }
    }
}
