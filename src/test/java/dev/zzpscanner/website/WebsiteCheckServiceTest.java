package dev.zzpscanner.website;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.zzpscanner.business.BusinessNotFoundException;
import dev.zzpscanner.business.BusinessRepository;
import dev.zzpscanner.config.ScannerProperties;
import dev.zzpscanner.fixture.BusinessBuilder;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WebsiteCheckServiceTest {

  @Mock BusinessRepository businessRepository;

  @Mock WebsiteCheckRepository websiteCheckRepository;

  @Mock WebsiteCheckRecorder recorder;

  FakeWebsiteProbe probe = new FakeWebsiteProbe();

  WebsiteCheckService service;

  @BeforeEach
  void setUp() {
    service =
        new WebsiteCheckService(
            websiteCheckRepository,
            businessRepository,
            new WebsiteChecker(probe, new ScannerProperties()),
            recorder);
  }

  @Test
  void singleCheckRecordsUnderSingleType() {
    probe.site("testbusiness2.nl", 200);
    given(businessRepository.findById(2L))
        .willReturn(Optional.of(new BusinessBuilder().id(2L).name("Test Business 2").build()));

    service.checkBusiness(2L);

    verify(recorder)
        .record(
            eq(2L),
            eq(WebsiteCheckService.CHECK_TYPE_SINGLE),
            argThat(o -> "https://testbusiness2.nl".equals(o.websiteUrl())));
  }

  @Test
  void singleCheckOfUnknownBusinessIsNotFound() {
    given(businessRepository.findById(8L)).willReturn(Optional.empty());

    assertThatThrownBy(() -> service.checkBusiness(8L))
        .isInstanceOf(BusinessNotFoundException.class);
    verifyNoInteractions(recorder);
  }

  @Test
  void historyOfUnknownBusinessIsNotFound() {
    given(businessRepository.existsById(8L)).willReturn(false);

    assertThatThrownBy(() -> service.forBusiness(8L))
        .isInstanceOf(BusinessNotFoundException.class);
  }

  @Test
  void unknownCheckIsNotFound() {
    given(websiteCheckRepository.findById(any())).willReturn(Optional.empty());

    assertThatThrownBy(() -> service.get(3L)).isInstanceOf(WebsiteCheckNotFoundException.class);
    assertThat(probe.fetched()).isEmpty();
  }
}
