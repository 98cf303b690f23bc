package dev.zzpscanner.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScannerPropertiesTest {

  @Test
  void defaultsAreValid() {
    assertThatCode(() -> new ScannerProperties().validate()).doesNotThrowAnyException();
  }

  @Test
  void emptyTargetCountriesAreRejected() {
    ScannerProperties properties = new ScannerProperties();
    properties.setTargetCountries(List.of());

    assertThatThrownBy(properties::validate).hasMessageContaining("target-countries");
  }

  @Test
  void negativeRetriesAreRejected() {
    ScannerProperties properties = new ScannerProperties();
    properties.getJobs().setMaxRetries(-1);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("scanner.jobs.max-retries");
  }

  @Test
  void zeroTaskTimeLimitIsRejected() {
    ScannerProperties properties = new ScannerProperties();
    properties.getJobs().setTaskTimeLimit(Duration.ZERO);

    assertThatThrownBy(properties::validate).hasMessageContaining("task-time-limit");
  }

  @Test
  void emptyTldListIsRejected() {
    ScannerProperties properties = new ScannerProperties();
    properties.getWebsiteCheck().setTlds(List.of());

    assertThatThrownBy(properties::validate).hasMessageContaining("tlds");
  }

  @Test
  void batchCeilingAboveLimitIsRejected() {
    ScannerProperties properties = new ScannerProperties();
    properties.getWebsiteCheck().setBatchCeiling(5000);

    assertThatThrownBy(properties::validate).hasMessageContaining("batch-ceiling");
  }
}
