package com.bookscrape.scrape.api;

import com.bookscrape.config.InvalidScraperConfigException;
import com.bookscrape.scrape.service.ActiveScrapeRunException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScrapeExceptionHandler {

  /** A run is already in flight; the caller can poll {@code /api/scrape/metrics} instead. */
  @ExceptionHandler(ActiveScrapeRunException.class)
  public ResponseEntity<Map<String, Object>> handleRunInProgress(ActiveScrapeRunException ex) {
    return error(HttpStatus.CONFLICT, "active_scrape_run", ex.getMessage());
  }

  @ExceptionHandler(InvalidScraperConfigException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidConfig(InvalidScraperConfigException ex) {
    ResponseEntity<Map<String, Object>> response =
        error(HttpStatus.BAD_REQUEST, "invalid_configuration", "scraper configuration rejected");
    response.getBody().put("problems", ex.getProblems());
    return response;
  }

  private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", code);
    body.put("message", message);
    return ResponseEntity.status(status).body(body);
  }
}
