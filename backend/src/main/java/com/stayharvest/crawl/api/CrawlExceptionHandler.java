package com.stayharvest.crawl.api;

import com.stayharvest.crawl.service.ActiveCrawlRunException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(ActiveCrawlRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveCrawlRunException ex) {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("error", "harvest_run_active");
    body.put("message", ex.getMessage());
    if (ex.getRunStartedAt() != null) {
      body.put("runStartedAt", ex.getRunStartedAt().toString());
    }
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
  }
}
