package dev.zzpscanner.api;

import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessFilter;
import dev.zzpscanner.export.BusinessCsvExporter;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/exports")
public class ExportController {

  static final String CSV_CONTENT_TYPE = "text/csv;charset=UTF-8";

  private final BusinessCsvExporter exporter;

  public ExportController(BusinessCsvExporter exporter) {
    this.exporter = exporter;
  }

  @GetMapping("/businesses.csv")
  public void businesses(
      @RequestParam(name = "city", required = false) @Nullable String city,
      @RequestParam(name = "country", required = false) @Nullable String country,
      @RequestParam(name = "website_exists", required = false) @Nullable Boolean websiteExists,
      @RequestParam(name = "is_zzp", required = false) @Nullable Boolean isZzp,
      @RequestParam(name = "source", required = false) @Nullable String source,
      HttpServletResponse response)
      throws IOException {
    List<Business> businesses =
        exporter.select(new BusinessFilter(city, country, websiteExists, isZzp, source));
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    response.setContentType(CSV_CONTENT_TYPE);
    response.setHeader(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"businesses.csv\"");
    exporter.write(businesses, response.getWriter());
  }
}
