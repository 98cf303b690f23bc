package dev.zzpscanner.job;

/** Projection for job counts grouped by kind and status. */
public interface KindStatusCount {

  JobKind getKind();

  JobStatus getStatus();

  long getTotal();
}
