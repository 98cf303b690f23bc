package dev.zzpscanner.api;

import dev.zzpscanner.business.Business;
import dev.zzpscanner.business.BusinessFields;
import dev.zzpscanner.business.BusinessFilter;
import dev.zzpscanner.business.BusinessService;
import dev.zzpscanner.business.BusinessSummary;
import dev.zzpscanner.website.WebsiteCheckService;
import jakarta.validation.Valid;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/businesses")
public class BusinessController {

  private static final Sort BY_ID = Sort.by("id");

  private final BusinessService businessService;
  private final WebsiteCheckService websiteCheckService;

  public BusinessController(
      BusinessService businessService, WebsiteCheckService websiteCheckService) {
    this.businessService = businessService;
    this.websiteCheckService = websiteCheckService;
  }

  @GetMapping
  public List<BusinessResponse> list(
      @RequestParam(name = "city", required = false) @Nullable String city,
      @RequestParam(name = "country", required = false) @Nullable String country,
      @RequestParam(name = "website_exists", required = false) @Nullable Boolean websiteExists,
      @RequestParam(name = "is_zzp", required = false) @Nullable Boolean isZzp,
      @RequestParam(name = "source", required = false) @Nullable String source,
      @RequestParam(name = "skip", defaultValue = "0") long skip,
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    BusinessFilter filter = new BusinessFilter(city, country, websiteExists, isZzp, source);
    return businessService.list(filter, OffsetPageRequest.of(skip, limit, BY_ID)).stream()
        .map(BusinessResponse::from)
        .toList();
  }

  @GetMapping("/{id}")
  public BusinessResponse get(@PathVariable("id") long id) {
    return BusinessResponse.from(businessService.get(id));
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  public BusinessResponse create(@Valid @RequestBody BusinessFields fields) {
    return BusinessResponse.from(businessService.create(fields));
  }

  @PutMapping("/{id}")
  public BusinessResponse update(
      @PathVariable("id") long id, @Valid @RequestBody BusinessFields fields) {
    return BusinessResponse.from(businessService.update(id, fields));
  }

  @DeleteMapping("/{id}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void delete(@PathVariable("id") long id) {
    businessService.delete(id);
  }

  @GetMapping("/stats/summary")
  public BusinessSummary summary() {
    return businessService.summary();
  }

  @GetMapping("/search")
  public List<BusinessResponse> search(
      @RequestParam("q") String query,
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    List<Business> found = businessService.search(query, OffsetPageRequest.of(0, limit, BY_ID));
    return found.stream().map(BusinessResponse::from).toList();
  }

  /** Probes the business's website right away, outside any job. */
  @PostMapping("/{id}/website-check")
  public WebsiteCheckResponse checkWebsite(@PathVariable("id") long id) {
    return WebsiteCheckResponse.from(websiteCheckService.checkBusiness(id));
  }
}
