package dev.zzpscanner.crawl;

import dev.zzpscanner.job.JobKind;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Supplies business candidates for discovery jobs. */
public interface DiscoverySource {

  /** Discovery kinds served by this source. */
  Set<JobKind> kinds();

  /**
   * Finds candidates for a location. The returned order is the order the executor processes
   * them in.
   *
   * @param kind the discovery kind being run
   * @param location target location, for example {@code "Amsterdam, Netherlands"}
   * @param industry optional industry to narrow the search
   */
  List<DiscoveredBusiness> discover(JobKind kind, String location, @Nullable String industry);
}
