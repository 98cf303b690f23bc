package dev.zzpscanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the ZZP scanner service.
 *
 * <p>Serves the catalog REST API under {@code /api/v1} and runs discovery, website-check and
 * enrichment jobs on an in-process worker pool.
 */
@SpringBootApplication
public class ZzpScannerApplication {
  public static void main(String[] args) {
    SpringApplication.run(ZzpScannerApplication.class, args);
  }
}
