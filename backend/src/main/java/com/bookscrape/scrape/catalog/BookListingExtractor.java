package com.bookscrape.scrape.catalog;

import com.bookscrape.scrape.model.BookRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Component
public class BookListingExtractor {
    private static final String PRODUCT_SELECTOR = "article.product_pod";
    private static final String NEXT_LINK_SELECTOR = "li.next a[href]";

    private final Clock clock;

    public BookListingExtractor() {
        this(Clock.systemUTC());
    }

    BookListingExtractor(Clock clock) {
        this.clock = clock;
    }

    public CatalogPage extract(String html, String pageUrl) {
        if (html == null || html.isBlank()) {
            return new CatalogPage(List.of(), null);
        }
        Document document = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        Instant capturedAt = clock.instant();

        List<BookRecord> records = new ArrayList<>();
        for (Element product : document.select(PRODUCT_SELECTOR)) {
            BookRecord record = toRecord(product, capturedAt);
            if (record != null) {
                records.add(record);
            }
        }

        Element next = document.selectFirst(NEXT_LINK_SELECTOR);
        String nextUrl = next == null ? null : emptyToNull(next.absUrl("href"));
        return new CatalogPage(records, nextUrl);
    }

    private BookRecord toRecord(Element product, Instant capturedAt) {
        Element link = product.selectFirst("h3 a");
        if (link == null) {
            return null;
        }
        String title = link.attr("title").trim();
        String url = link.absUrl("href");
        if (title.isEmpty() || url.isEmpty()) {
            return null;
        }

        String price = text(product.selectFirst("p.price_color"));
        String ratingText = ratingWord(product.selectFirst("p.star-rating"));
        String availability = text(product.selectFirst("p.instock.availability"));
        if (availability.isEmpty()) {
            availability = text(product.selectFirst("p.availability"));
        }
        Element image = product.selectFirst("img[src]");
        String imageUrl = image == null ? "" : image.absUrl("src");

        return new BookRecord(title, price, ratingText, availability, imageUrl, url, capturedAt);
    }

    // <p class="star-rating Three"> -> "Three"
    private String ratingWord(Element rating) {
        if (rating == null) {
            return "";
        }
        String[] parts = rating.className().trim().split("\\s+");
        return parts.length > 1 ? parts[1] : "";
    }

    private String text(Element element) {
        return element == null ? "" : element.text().trim();
    }

    private String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
