package com.bookscrape.scrape.validation;

import com.bookscrape.scrape.model.BookRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecordNormalizerTest {

    @Test
    void priceLosesCurrencyNoiseAndWhitespace() {
        assertEquals("99.99", RecordNormalizer.normalizePrice("£ 99.99 £"));
        assertEquals("51.77", RecordNormalizer.normalizePrice("Â£51.77"));
        assertEquals("", RecordNormalizer.normalizePrice(""));
        assertEquals("", RecordNormalizer.normalizePrice(null));
    }

    @Test
    void ratingLookupIsCaseSensitive() {
        assertEquals(3, RecordNormalizer.ratingToNumeric("Three"));
        assertEquals(5, RecordNormalizer.ratingToNumeric(" Five "));
        assertEquals(0, RecordNormalizer.ratingToNumeric("three"));
        assertEquals(0, RecordNormalizer.ratingToNumeric("Six"));
        assertEquals(0, RecordNormalizer.ratingToNumeric(""));
        assertEquals(0, RecordNormalizer.ratingToNumeric(null));
    }

    @Test
    void availabilityIsTrimmed() {
        assertEquals("In stock (22 available)", RecordNormalizer.normalizeAvailability("\n  In stock (22 available) \n"));
        assertEquals("", RecordNormalizer.normalizeAvailability(null));
    }

    @Test
    void validateRequiresTitlePriceAndRating() {
        assertThrows(InvalidRecordException.class, () -> RecordNormalizer.validate(null));
        assertThrows(InvalidRecordException.class, () -> RecordNormalizer.validate(record(" ", "£1", "One")));
        assertThrows(InvalidRecordException.class, () -> RecordNormalizer.validate(record("T", "", "One")));
        assertThrows(InvalidRecordException.class, () -> RecordNormalizer.validate(record("T", "£1", null)));
        assertDoesNotThrow(() -> RecordNormalizer.validate(record("T", "£1", "One")));
    }

    @Test
    void normalizeRewritesMutableFieldsOnly() {
        BookRecord record = record("A Light in the Attic", "Â£51.77", "Three");
        RecordNormalizer.normalize(record);

        assertEquals("51.77", record.getPrice());
        assertEquals(3, record.getRatingNumeric());
        assertEquals("In stock", record.getAvailability());
        assertEquals("Three", record.getRatingText());
        assertEquals("A Light in the Attic", record.getTitle());
    }

    private static BookRecord record(String title, String price, String rating) {
        return new BookRecord(title, price, rating, " In stock ", "", "http://books.test/a", Instant.now());
    }
}
