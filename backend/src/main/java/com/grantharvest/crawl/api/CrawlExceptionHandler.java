package com.grantharvest.crawl.api;

import com.grantharvest.crawl.persistence.StorageFaultException;
import com.grantharvest.crawl.service.ActiveCrawlRunException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(CrawlExceptionHandler.class);

  @ExceptionHandler(ActiveCrawlRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveCrawlRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_crawl_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(StorageFaultException.class)
  public ResponseEntity<Map<String, String>> handleStorageFault(StorageFaultException ex) {
    log.error("Storage fault while serving request", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "storage_fault", "message", ex.getMessage()));
  }
}
