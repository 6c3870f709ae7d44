package com.bookscrape.scrape.api;

import com.bookscrape.scrape.model.MetricsSnapshot;
import com.bookscrape.scrape.model.ScrapeResult;
import com.bookscrape.scrape.service.ScrapeRunService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/scrape")
public class ScrapeController {
    private final ScrapeRunService scrapeRunService;

    public ScrapeController(ScrapeRunService scrapeRunService) {
        this.scrapeRunService = scrapeRunService;
    }

    @PostMapping("/runs")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Instant> startRun() {
        Instant startedAt = scrapeRunService.startAsync();
        return Map.of("startedAt", startedAt);
    }

    @PostMapping("/runs/cancel")
    public Map<String, Boolean> cancelRun() {
        return Map.of("cancelled", scrapeRunService.cancel());
    }

    @GetMapping("/runs/latest")
    public ScrapeResult latestRun() {
        ScrapeResult result = scrapeRunService.getLatestResult();
        if (result == null) {
            throw new ResponseStatusException(NOT_FOUND, "No completed scrape run");
        }
        return result;
    }

    @GetMapping("/metrics")
    public MetricsSnapshot metrics() {
        MetricsSnapshot snapshot = scrapeRunService.getCurrentMetrics();
        if (snapshot == null) {
            throw new ResponseStatusException(NOT_FOUND, "No scrape run has started");
        }
        return snapshot;
    }
}
