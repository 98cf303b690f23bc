package dev.zzpscanner.export;

import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessFilter;
import dev.zzpscanner.business.BusinessService;
import dev.zzpscanner.config.ScannerProperties;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

/**
 * Writes the businesses matching a filter as CSV, ascending by id. A filter matching more than
 * {@code scanner.export.max-rows} businesses is rejected instead of being cut off.
 */
@Component
public class BusinessCsvExporter {

  private static final Logger log = LoggerFactory.getLogger(BusinessCsvExporter.class);

  static final String[] HEADER = {
    "id",
    "name",
    "address",
    "city",
    "country",
    "postal_code",
    "phone",
    "email",
    "website_exists",
    "website_url",
    "website_confidence_score",
    "business_type",
    "industry",
    "is_zzp",
    "source",
    "source_id",
    "confidence_score",
    "last_checked"
  };

  private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder().setHeader(HEADER).build();

  private final BusinessService businessService;
  private final int maxRows;

  public BusinessCsvExporter(BusinessService businessService, ScannerProperties properties) {
    this.businessService = businessService;
    this.maxRows = properties.getExport().getMaxRows();
  }

  /**
   * Loads the businesses to export.
   *
   * @throws IllegalArgumentException if more than {@code max-rows} businesses match
   */
  public List<Business> select(BusinessFilter filter) {
    List<Business> businesses =
        businessService.list(filter, PageRequest.of(0, maxRows + 1, Sort.by("id")));
    if (businesses.size() > maxRows) {
      log.info("CSV export rejected, filter {} matches more than {} businesses", filter, maxRows);
      throw new IllegalArgumentException(
          "Export too large. Maximum " + maxRows + " records allowed.");
    }
    return businesses;
  }

  /**
   * @return number of rows written, header excluded
   */
  public int write(List<Business> businesses, Writer out) throws IOException {
    try (CSVPrinter printer = new CSVPrinter(out, FORMAT)) {
      for (Business business : businesses) {
        printer.printRecord(
            business.getId(),
            business.getName(),
            business.getAddress(),
            business.getCity(),
            business.getCountry(),
            business.getPostalCode(),
            business.getPhone(),
            business.getEmail(),
            business.getWebsiteExists(),
            business.getWebsiteUrl(),
            business.getWebsiteConfidenceScore(),
            business.getBusinessType(),
            business.getIndustry(),
            business.isSelfEmployed(),
            business.getSource(),
            business.getSourceId(),
            business.getConfidenceScore(),
            business.getLastChecked());
      }
    }
    return businesses.size();
  }
}
