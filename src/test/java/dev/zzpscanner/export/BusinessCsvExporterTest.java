package dev.zzpscanner.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;

import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessFilter;
import dev.zzpscanner.business.BusinessService;
import dev.zzpscanner.config.ScannerProperties;
import dev.zzpscanner.fixture.BusinessBuilder;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
class BusinessCsvExporterTest {

  @Mock BusinessService businessService;

  BusinessCsvExporter exporter;

  @BeforeEach
  void setUp() {
    ScannerProperties properties = new ScannerProperties();
    properties.getExport().setMaxRows(2);
    exporter = new BusinessCsvExporter(businessService, properties);
  }

  @Test
  void selectReadsOneRowBeyondTheCap() {
    BusinessFilter filter = new BusinessFilter("Amst", null, null, true, null);
    List<Business> two =
        List.of(new BusinessBuilder().id(1L).build(), new BusinessBuilder().id(2L).build());
    given(businessService.list(eq(filter), argThat((Pageable p) -> p.getPageSize() == 3)))
        .willReturn(two);

    assertThat(exporter.select(filter)).isEqualTo(two);
  }

  @Test
  void selectRejectsFilterMatchingMoreThanTheCap() {
    given(businessService.list(eq(BusinessFilter.none()), argThat((Pageable p) -> true)))
        .willReturn(
            List.of(
                new BusinessBuilder().id(1L).build(),
                new BusinessBuilder().id(2L).build(),
                new BusinessBuilder().id(3L).build()));

    assertThatThrownBy(() -> exporter.select(BusinessFilter.none()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Export too large. Maximum 2 records allowed.");
  }

  @Test
  void writesHeaderAndQuotedRows() throws Exception {
    List<Business> businesses =
        List.of(
            new BusinessBuilder()
                .id(1L)
                .name("Jansen, Bakker & Zn")
                .websiteExists(true)
                .websiteUrl("https://jansen.nl")
                .build(),
            new BusinessBuilder().id(2L).name("Studio Noord").build());
    StringWriter out = new StringWriter();

    int rows = exporter.write(businesses, out);

    assertThat(rows).isEqualTo(2);
    List<CSVRecord> records =
        CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .build()
            .parse(new StringReader(out.toString()))
            .getRecords();
    assertThat(records).hasSize(2);
    assertThat(records.get(0).get("name")).isEqualTo("Jansen, Bakker & Zn");
    assertThat(records.get(0).get("website_exists")).isEqualTo("true");
    assertThat(records.get(1).get("website_exists")).isEmpty();
    assertThat(records.get(1).get("is_zzp")).isEqualTo("true");
  }

  @Test
  void emptyResultStillHasHeader() throws Exception {
    StringWriter out = new StringWriter();

    exporter.write(List.of(), out);

    assertThat(out.toString()).startsWith("id,name,address,city,country");
  }
}
