package dev.zzpscanner.api;

import dev.zzpscanner.job.JobKind;
import dev.zzpscanner.job.JobLifecycleManager;
import dev.zzpscanner.job.JobParameters;
import dev.zzpscanner.job.JobStatus;
import jakarta.validation.Valid;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Job endpoints. Creating a job returns as soon as it is dispatched; clients poll {@code GET
 * /{id}} for progress.
 */
@RestController
@RequestMapping("/api/v1/jobs")
public class JobController {

  private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt", "id");

  private final JobLifecycleManager lifecycle;

  public JobController(JobLifecycleManager lifecycle) {
    this.lifecycle = lifecycle;
  }

  @GetMapping
  public List<JobResponse> list(
      @RequestParam(name = "status", required = false) @Nullable String status,
      @RequestParam(name = "kind", required = false) @Nullable String kind,
      @RequestParam(name = "skip", defaultValue = "0") long skip,
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    return lifecycle
        .listJobs(
            status == null ? null : JobStatus.fromValue(status),
            kind == null ? null : JobKind.fromValue(kind),
            OffsetPageRequest.of(skip, limit, NEWEST_FIRST))
        .stream()
        .map(JobResponse::from)
        .toList();
  }

  @GetMapping("/{id}")
  public JobResponse get(@PathVariable("id") long id) {
    return JobResponse.from(lifecycle.getJob(id));
  }

  @PostMapping("/discover")
  @ResponseStatus(HttpStatus.CREATED)
  public JobResponse discover(@Valid @RequestBody JobRequests.Discover request) {
    JobKind kind =
        request.kind() == null ? JobKind.DISCOVER_GOOGLE_MAPS : JobKind.fromValue(request.kind());
    if (!kind.isDiscovery()) {
      throw new IllegalArgumentException(kind.value() + " is not a discovery job kind");
    }
    return JobResponse.from(
        lifecycle.createJob(kind, JobParameters.discovery(request.location(), request.industry())));
  }

  @PostMapping("/website-check")
  @ResponseStatus(HttpStatus.CREATED)
  public JobResponse checkWebsites(
      @RequestBody(required = false) JobRequests.@Nullable BusinessIds request) {
    return JobResponse.from(lifecycle.createJob(JobKind.CHECK_WEBSITE, targets(request)));
  }

  @PostMapping("/enrich")
  @ResponseStatus(HttpStatus.CREATED)
  public JobResponse enrich(
      @RequestBody(required = false) JobRequests.@Nullable BusinessIds request) {
    return JobResponse.from(lifecycle.createJob(JobKind.ENRICH_DATA, targets(request)));
  }

  @PostMapping("/{id}/cancel")
  public JobResponse cancel(@PathVariable("id") long id) {
    return JobResponse.from(lifecycle.cancelJob(id));
  }

  @PostMapping("/{id}/retry")
  public JobResponse retry(@PathVariable("id") long id) {
    return JobResponse.from(lifecycle.retryJob(id));
  }

  private static JobParameters targets(JobRequests.@Nullable BusinessIds request) {
    if (request == null || request.businessIds() == null) {
      return JobParameters.empty();
    }
    return JobParameters.businessIds(request.businessIds());
  }
}
