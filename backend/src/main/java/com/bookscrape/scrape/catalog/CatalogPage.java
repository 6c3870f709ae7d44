package com.bookscrape.scrape.catalog;

import com.bookscrape.scrape.model.BookRecord;

import java.util.List;

/** Records found on one listing page plus the absolute next-page link, if any. */
public record CatalogPage(List<BookRecord> records, String nextPageUrl) {
    public CatalogPage {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public boolean hasNextPage() {
        return nextPageUrl != null && !nextPageUrl.isBlank();
    }
}
