package dev.zzpscanner.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import dev.zzpscanner.fixture.JobBuilder;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobTransitionsTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock JobRepository jobRepository;

  JobTransitions transitions;

  @BeforeEach
  void setUp() {
    transitions = new JobTransitions(jobRepository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private Job stored(Job job) {
    given(jobRepository.findByIdForUpdate(job.getId())).willReturn(Optional.of(job));
    return job;
  }

  @Test
  void createStampsCreationTimeFromClock() {
    given(jobRepository.save(any(Job.class))).willAnswer(invocation -> invocation.getArgument(0));

    Job job =
        transitions.create(
            "google_maps - Utrecht",
            JobKind.DISCOVER_GOOGLE_MAPS,
            JobParameters.discovery("Utrecht", "IT"),
            3);

    assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
    assertThat(job.getCreatedAt()).isEqualTo(NOW);
    assertThat(job.getTargetLocation()).isEqualTo("Utrecht");
    assertThat(job.getTargetIndustry()).isEqualTo("IT");
    assertThat(job.getCounters()).isEqualTo(JobCounters.ZERO);
  }

  @Test
  void startMovesPendingJobToRunning() {
    Job job = stored(new JobBuilder().status(JobStatus.PENDING).build());

    boolean started = transitions.start(1L);

    assertThat(started).isTrue();
    assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
    assertThat(job.getStartedAt()).isEqualTo(NOW);
  }

  @Test
  void startKeepsFirstStartTimeOnRetriedJob() {
    Instant firstRun = NOW.minusSeconds(600);
    Job job = stored(new JobBuilder().retryCount(1).startedAt(firstRun).build());

    transitions.start(1L);

    assertThat(job.getStartedAt()).isEqualTo(firstRun);
  }

  @Test
  void startReturnsFalseForJobCancelledWhileQueued() {
    Job job = stored(new JobBuilder().status(JobStatus.CANCELLED).build());

    assertThat(transitions.start(1L)).isFalse();
    assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
    assertThat(job.getStartedAt()).isNull();
  }

  @Test
  void startRejectsCompletedJob() {
    stored(new JobBuilder().status(JobStatus.COMPLETED).build());

    assertThatThrownBy(() -> transitions.start(1L))
        .isInstanceOf(InvalidJobStateException.class)
        .hasMessageContaining("completed");
  }

  @Test
  void reportProgressUpdatesTotalAndProcessed() {
    Job job = stored(new JobBuilder().status(JobStatus.RUNNING).build());

    transitions.reportProgress(1L, 3, 10);

    assertThat(job.getCounters()).isEqualTo(new JobCounters(10, 3, 0, 0));
  }

  @Test
  void reportProgressDropsStaleReport() {
    Job job =
        stored(
            new JobBuilder()
                .status(JobStatus.RUNNING)
                .counters(new JobCounters(10, 5, 0, 0))
                .build());

    transitions.reportProgress(1L, 4, 10);

    assertThat(job.getCounters().processed()).isEqualTo(5);
  }

  @Test
  void reportProgressIgnoredWhenJobNotRunning() {
    Job job = stored(new JobBuilder().status(JobStatus.CANCELLED).build());

    transitions.reportProgress(1L, 2, 2);

    assertThat(job.getCounters()).isEqualTo(JobCounters.ZERO);
  }

  @Test
  void reportProgressRejectsCurrentAboveTotal() {
    assertThatThrownBy(() -> transitions.reportProgress(1L, 3, 2))
        .isInstanceOf(IllegalArgumentException.class);
    verify(jobRepository, never()).findByIdForUpdate(anyLong());
  }

  @Test
  void completeStoresFinalCounters() {
    Job job = stored(new JobBuilder().status(JobStatus.RUNNING).build());
    JobCounters counters = new JobCounters(2, 2, 1, 0);

    transitions.complete(1L, counters);

    assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.getCounters()).isEqualTo(counters);
    assertThat(job.getCompletedAt()).isEqualTo(NOW);
  }

  @Test
  void completeAfterCancellationLeavesJobCancelled() {
    Instant cancelledAt = NOW.minusSeconds(5);
    Job job =
        stored(new JobBuilder().status(JobStatus.CANCELLED).completedAt(cancelledAt).build());

    transitions.complete(1L, new JobCounters(2, 2, 2, 0));

    assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
    assertThat(job.getCompletedAt()).isEqualTo(cancelledAt);
    assertThat(job.getCounters()).isEqualTo(JobCounters.ZERO);
  }

  @Test
  void completeRejectsPendingJob() {
    stored(new JobBuilder().status(JobStatus.PENDING).build());

    assertThatThrownBy(() -> transitions.complete(1L, JobCounters.ZERO))
        .isInstanceOf(InvalidJobStateException.class);
  }

  @Test
  void failRecordsMessage() {
    Job job = stored(new JobBuilder().status(JobStatus.RUNNING).build());

    transitions.fail(1L, "source unreachable");

    assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(job.getErrorMessage()).isEqualTo("source unreachable");
    assertThat(job.getCompletedAt()).isEqualTo(NOW);
  }

  @Test
  void failAfterCancellationIsDropped() {
    Job job = stored(new JobBuilder().status(JobStatus.CANCELLED).build());

    transitions.fail(1L, "interrupted");

    assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
    assertThat(job.getErrorMessage()).isNull();
  }

  @Test
  void cancelRunningJob() {
    Job job = stored(new JobBuilder().status(JobStatus.RUNNING).taskHandle("task-1").build());

    Job cancelled = transitions.cancel(1L);

    assertThat(cancelled.getStatus()).isEqualTo(JobStatus.CANCELLED);
    assertThat(cancelled.getCompletedAt()).isEqualTo(NOW);
    assertThat(cancelled.getTaskHandle()).isEqualTo("task-1");
    assertThat(cancelled).isSameAs(job);
  }

  @Test
  void cancelCompletedJobIsRejectedAndLeavesItUnchanged() {
    Instant completedAt = NOW.minusSeconds(60);
    Job job =
        stored(new JobBuilder().status(JobStatus.COMPLETED).completedAt(completedAt).build());

    assertThatThrownBy(() -> transitions.cancel(1L))
        .isInstanceOf(InvalidJobStateException.class)
        .satisfies(
            e -> assertThat(((InvalidJobStateException) e).getStatus())
                .isEqualTo(JobStatus.COMPLETED));
    assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(job.getCompletedAt()).isEqualTo(completedAt);
  }

  @Test
  void prepareRetryResetsFailedJob() {
    Job job =
        stored(
            new JobBuilder()
                .status(JobStatus.FAILED)
                .retryCount(1)
                .errorMessage("boom")
                .taskHandle("old-task")
                .counters(new JobCounters(4, 3, 1, 2))
                .completedAt(NOW.minusSeconds(30))
                .build());

    transitions.prepareRetry(1L);

    assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
    assertThat(job.getRetryCount()).isEqualTo(2);
    assertThat(job.getErrorMessage()).isNull();
    assertThat(job.getCompletedAt()).isNull();
    assertThat(job.getTaskHandle()).isNull();
    assertThat(job.getCounters()).isEqualTo(JobCounters.ZERO);
  }

  @Test
  void prepareRetryRejectsExhaustedJob() {
    Job job = stored(new JobBuilder().status(JobStatus.FAILED).retryCount(3).maxRetries(3).build());

    assertThatThrownBy(() -> transitions.prepareRetry(1L))
        .isInstanceOf(RetryExhaustedException.class)
        .hasMessageContaining("retry limit of 3");
    assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
    assertThat(job.getRetryCount()).isEqualTo(3);
  }

  @Test
  void prepareRetryRejectsJobThatDidNotFail() {
    stored(new JobBuilder().status(JobStatus.COMPLETED).build());

    assertThatThrownBy(() -> transitions.prepareRetry(1L))
        .isInstanceOf(InvalidJobStateException.class)
        .isNotInstanceOf(RetryExhaustedException.class);
  }

  @Test
  void unknownJobIsNotFound() {
    given(jobRepository.findByIdForUpdate(99L)).willReturn(Optional.empty());

    assertThatThrownBy(() -> transitions.cancel(99L)).isInstanceOf(JobNotFoundException.class);
  }
}
