package com.bookscrape.scrape.model;

import java.time.Instant;

/**
 * One catalog entry captured from a listing page.
 *
 * <p>Identity fields are fixed at construction. Price, availability and the
 * numeric rating are rewritten in place during normalization.
 */
public final class BookRecord {
    private final String title;
    private final String ratingText;
    private final String imageUrl;
    private final String url;
    private final Instant scrapedAt;

    private String price;
    private String availability;
    private int ratingNumeric;

    public BookRecord(
        String title,
        String price,
        String ratingText,
        String availability,
        String imageUrl,
        String url,
        Instant scrapedAt
    ) {
        this.title = title;
        this.price = price;
        this.ratingText = ratingText;
        this.availability = availability;
        this.imageUrl = imageUrl;
        this.url = url;
        this.scrapedAt = scrapedAt;
    }

    public String getTitle() {
        return title;
    }

    public String getPrice() {
        return price;
    }

    public void setPrice(String price) {
        this.price = price;
    }

    public String getRatingText() {
        return ratingText;
    }

    public int getRatingNumeric() {
        return ratingNumeric;
    }

    public void setRatingNumeric(int ratingNumeric) {
        this.ratingNumeric = ratingNumeric;
    }

    public String getAvailability() {
        return availability;
    }

    public void setAvailability(String availability) {
        this.availability = availability;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public String getUrl() {
        return url;
    }

    public Instant getScrapedAt() {
        return scrapedAt;
    }

    @Override
    public String toString() {
        return "BookRecord{title='" + title + "', url='" + url + "'}";
    }
}
