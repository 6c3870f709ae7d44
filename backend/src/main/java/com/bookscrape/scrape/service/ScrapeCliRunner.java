package com.bookscrape.scrape.service;

import com.bookscrape.config.ScraperProperties;
import com.bookscrape.scrape.model.ScrapeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class ScrapeCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeCliRunner.class);

    private final ScraperProperties properties;
    private final ScrapeRunService scrapeRunService;
    private final ConfigurableApplicationContext applicationContext;

    public ScrapeCliRunner(
        ScraperProperties properties,
        ScrapeRunService scrapeRunService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.scrapeRunService = scrapeRunService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int exitCode = 0;
        try {
            ScrapeResult result = scrapeRunService.run();
            log.info(
                "Scrape run finished items={} pages={} errors={} output={}",
                result.processedCount(),
                result.pageCount(),
                result.errorCount(),
                properties.getOutput().getFile()
            );
        } catch (RuntimeException e) {
            log.error("Scrape run failed: {}", e.getMessage(), e);
            exitCode = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int code = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> code));
        }
    }
}
