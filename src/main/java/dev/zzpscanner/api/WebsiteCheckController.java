package dev.zzpscanner.api;

import dev.zzpscanner.website.WebsiteCheckService;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.data.domain.Sort;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/website-checks")
public class WebsiteCheckController {

  private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt", "id");

  private final WebsiteCheckService websiteCheckService;

  public WebsiteCheckController(WebsiteCheckService websiteCheckService) {
    this.websiteCheckService = websiteCheckService;
  }

  @GetMapping
  public List<WebsiteCheckResponse> list(
      @RequestParam(name = "business_id", required = false) @Nullable Long businessId,
      @RequestParam(name = "check_type", required = false) @Nullable String checkType,
      @RequestParam(name = "skip", defaultValue = "0") long skip,
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    return websiteCheckService
        .list(businessId, checkType, OffsetPageRequest.of(skip, limit, NEWEST_FIRST))
        .stream()
        .map(WebsiteCheckResponse::from)
        .toList();
  }

  @GetMapping("/{id}")
  public WebsiteCheckResponse get(@PathVariable("id") long id) {
    return WebsiteCheckResponse.from(websiteCheckService.get(id));
  }

  @GetMapping("/business/{businessId}")
  public List<WebsiteCheckResponse> forBusiness(@PathVariable("businessId") long businessId) {
    return websiteCheckService.forBusiness(businessId).stream()
        .map(WebsiteCheckResponse::from)
        .toList();
  }
}
