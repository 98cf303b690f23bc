package dev.zzpscanner.website;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import dev.zzpscanner.business.BusinessRepository;
import dev.zzpscanner.config.ScannerProperties;
import dev.zzpscanner.fixture.BusinessBuilder;
import dev.zzpscanner.job.JobCounters;
import dev.zzpscanner.job.JobKind;
import dev.zzpscanner.job.JobLifecycleManager;
import dev.zzpscanner.job.JobParameters;
import dev.zzpscanner.job.dispatch.TaskContext;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.CannotCreateTransactionException;

@ExtendWith(MockitoExtension.class)
class WebsiteCheckExecutorTest {

  @Mock JobLifecycleManager lifecycle;

  @Mock BusinessRepository businessRepository;

  @Mock WebsiteCheckRecorder recorder;

  FakeWebsiteProbe probe;

  WebsiteCheckExecutor executor;

  @BeforeEach
  void setUp() {
    ScannerProperties properties = new ScannerProperties();
    properties.getWebsiteCheck().setPacing(Duration.ZERO);
    properties.getWebsiteCheck().setBatchCeiling(25);
    probe = new FakeWebsiteProbe();
    executor =
        new WebsiteCheckExecutor(
            lifecycle,
            businessRepository,
            new WebsiteChecker(probe, properties),
            recorder,
            properties);
  }

  @Test
  void claimsCheckWebsiteKind() {
    assertThat(executor.kinds()).containsExactly(JobKind.CHECK_WEBSITE);
  }

  @Test
  void dnsErrorOnEveryCandidateCountsAsFailedItem() {
    given(lifecycle.start(1L)).willReturn(true);
    given(businessRepository.findByIdInOrderByIdAsc(List.of(1L, 2L)))
        .willReturn(
            List.of(
                new BusinessBuilder().id(1L).name("Test Business 1").build(),
                new BusinessBuilder().id(2L).name("Test Business 2").build()));
    probe.site("testbusiness1.nl", 200);
    for (String tld : new String[] {"nl", "com", "be", "de", "lu"}) {
      probe.brokenDns("testbusiness2." + tld);
    }

    executor.execute(
        1L, JobParameters.businessIds(List.of(1L, 2L)), TaskContext.detached(1L));

    verify(recorder)
        .record(eq(1L), eq(WebsiteCheckExecutor.CHECK_TYPE), argThat(o -> o.websiteExists()));
    verify(recorder)
        .record(eq(2L), eq(WebsiteCheckExecutor.CHECK_TYPE), argThat(WebsiteCheckOutcome::error));
    verify(lifecycle).complete(1L, new JobCounters(2, 2, 1, 1));
  }

  @Test
  void withoutIdsChecksUncheckedBusinessesUpToCeiling() {
    given(lifecycle.start(1L)).willReturn(true);
    given(
            businessRepository.findByLastCheckedIsNullOrderByIdAsc(
                argThat((Pageable p) -> p.getPageSize() == 25)))
        .willReturn(List.of(new BusinessBuilder().id(4L).name("Nobody Here").build()));

    executor.execute(1L, JobParameters.empty(), TaskContext.detached(1L));

    verify(recorder)
        .record(eq(4L), eq(WebsiteCheckExecutor.CHECK_TYPE), argThat(o -> !o.websiteExists()));
    verify(lifecycle).complete(1L, new JobCounters(1, 1, 1, 0));
  }

  @Test
  void missingIdsAreSkippedFromTheBatch() {
    given(lifecycle.start(1L)).willReturn(true);
    given(businessRepository.findByIdInOrderByIdAsc(List.of(1L, 99L)))
        .willReturn(List.of(new BusinessBuilder().id(1L).name("Nobody Here").build()));

    executor.execute(
        1L, JobParameters.businessIds(List.of(1L, 99L)), TaskContext.detached(1L));

    verify(lifecycle).complete(1L, new JobCounters(1, 1, 1, 0));
  }

  @Test
  void recorderErrorIsRecordedAsFailedCheckAndBatchContinues() {
    given(lifecycle.start(1L)).willReturn(true);
    given(businessRepository.findByIdInOrderByIdAsc(List.of(1L, 2L)))
        .willReturn(
            List.of(
                new BusinessBuilder().id(1L).name("First").build(),
                new BusinessBuilder().id(2L).name("Second").build()));
    // first call fails, the failure record and the second business succeed
    given(recorder.record(anyLong(), eq(WebsiteCheckExecutor.CHECK_TYPE), any()))
        .willThrow(new IllegalStateException("constraint violated"))
        .willReturn(null);

    executor.execute(
        1L, JobParameters.businessIds(List.of(1L, 2L)), TaskContext.detached(1L));

    verify(recorder)
        .record(
            eq(1L),
            eq(WebsiteCheckExecutor.CHECK_TYPE),
            argThat(o -> o.error() && "constraint violated".equals(o.errorMessage())));
    verify(lifecycle).complete(1L, new JobCounters(2, 2, 1, 1));
  }

  @Test
  void unreachableStoreAbortsTheBatch() {
    given(lifecycle.start(1L)).willReturn(true);
    given(businessRepository.findByIdInOrderByIdAsc(List.of(1L, 2L)))
        .willReturn(
            List.of(
                new BusinessBuilder().id(1L).name("First").build(),
                new BusinessBuilder().id(2L).name("Second").build()));
    given(recorder.record(anyLong(), any(), any()))
        .willThrow(new CannotCreateTransactionException("no connection"));

    executor.execute(
        1L, JobParameters.businessIds(List.of(1L, 2L)), TaskContext.detached(1L));

    verify(lifecycle).fail(1L, "no connection");
    verify(lifecycle, never()).complete(anyLong(), any());
  }
}
