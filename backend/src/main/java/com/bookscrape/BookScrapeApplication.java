package com.bookscrape;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BookScrapeApplication {

  public static void main(String[] args) {
    SpringApplication.run(BookScrapeApplication.class, args);
  }
}
