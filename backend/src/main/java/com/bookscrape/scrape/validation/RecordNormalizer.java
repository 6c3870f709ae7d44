package com.bookscrape.scrape.validation;

import com.bookscrape.scrape.model.BookRecord;

import java.util.List;
import java.util.Map;

public final class RecordNormalizer {
    // "Â£" is the mis-decoded pound sign some catalog pages serve; strip it before the plain symbol.
    private static final List<String> CURRENCY_NOISE = List.of("Â£", "£");
    private static final Map<String, Integer> RATINGS = Map.of(
        "Zero", 0,
        "One", 1,
        "Two", 2,
        "Three", 3,
        "Four", 4,
        "Five", 5
    );

    private RecordNormalizer() {
    }

    public static void validate(BookRecord record) {
        if (record == null) {
            throw new InvalidRecordException("record is null");
        }
        if (isBlank(record.getTitle())) {
            throw new InvalidRecordException("record missing title");
        }
        if (isBlank(record.getPrice())) {
            throw new InvalidRecordException("record missing price for " + record.getTitle());
        }
        if (isBlank(record.getRatingText())) {
            throw new InvalidRecordException("record missing rating for " + record.getTitle());
        }
    }

    public static void normalize(BookRecord record) {
        record.setPrice(normalizePrice(record.getPrice()));
        record.setAvailability(normalizeAvailability(record.getAvailability()));
        record.setRatingNumeric(ratingToNumeric(record.getRatingText()));
    }

    public static String normalizePrice(String price) {
        if (price == null) {
            return "";
        }
        String value = price.trim();
        for (String noise : CURRENCY_NOISE) {
            value = value.replace(noise, "");
        }
        return value.trim();
    }

    public static String normalizeAvailability(String text) {
        return text == null ? "" : text.trim();
    }

    /** Case-sensitive lookup; anything outside Zero..Five maps to 0. */
    public static int ratingToNumeric(String rating) {
        if (rating == null) {
            return 0;
        }
        return RATINGS.getOrDefault(rating.trim(), 0);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
