package dev.zzpscanner.business;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.zzpscanner.BaseIntegrationTest;
import dev.zzpscanner.website.WebsiteCheck;
import dev.zzpscanner.website.WebsiteCheckOutcome;
import dev.zzpscanner.website.WebsiteCheckRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

@Transactional
class BusinessRepositoryIT extends BaseIntegrationTest {

  @Autowired private BusinessRepository businessRepository;

  @Autowired private WebsiteCheckRepository websiteCheckRepository;

  @Test
  void searchMatchesNameCityAndIndustryIgnoringCase() {
    Business bakery = business("Bakkerij Ruurlo", "Ruurlo");
    bakery.setIndustry("Food");
    businessRepository.save(bakery);
    Business studio = business("Studio Zomer", "Ruurlo");
    studio.setIndustry("Fotografie");
    businessRepository.saveAndFlush(studio);

    assertThat(businessRepository.search("RUURLO", PageRequest.of(0, 10)))
        .extracting(Business::getName)
        .containsExactly("Bakkerij Ruurlo", "Studio Zomer");
    assertThat(businessRepository.search("fotograf", PageRequest.of(0, 10)))
        .extracting(Business::getName)
        .containsExactly("Studio Zomer");
  }

  @Test
  void topCitiesGroupsAndCounts() {
    businessRepository.save(business("Kapper Een", "Borculo"));
    businessRepository.save(business("Kapper Twee", "Borculo"));
    businessRepository.saveAndFlush(business("Kapper Drie", "Eibergen"));

    List<LabelCount> cities = businessRepository.topCities(PageRequest.of(0, 1000));

    assertThat(cities)
        .filteredOn(count -> "Borculo".equals(count.getLabel()))
        .singleElement()
        .extracting(LabelCount::getTotal)
        .isEqualTo(2L);
  }

  @Test
  void sourceIdIsUniquePerSource() {
    Business first = business("Eerste", "Lochem");
    first.setSource("linkedin");
    first.setSourceId("li_1_lochem");
    businessRepository.saveAndFlush(first);
    Business second = business("Tweede", "Lochem");
    second.setSource("linkedin");
    second.setSourceId("li_1_lochem");

    assertThatThrownBy(() -> businessRepository.saveAndFlush(second))
        .isInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void cleanupDeletesOnlyOldNonSelfEmployedBusinessesCheckedWithoutWebsite() {
    Business agency = business("Groot Bureau", "Neede");
    agency.setSelfEmployed(false);
    agency.setWebsiteExists(false);
    agency = businessRepository.saveAndFlush(agency);
    Business unchecked = business("Onbekend Bureau", "Neede");
    unchecked.setSelfEmployed(false);
    unchecked = businessRepository.saveAndFlush(unchecked);
    Business freelancer = business("Zelfstandige Neede", "Neede");
    freelancer.setWebsiteExists(false);
    freelancer = businessRepository.saveAndFlush(freelancer);
    websiteCheckRepository.saveAndFlush(
        new WebsiteCheck(
            agency,
            "combined",
            WebsiteCheckOutcome.failed("connection refused"),
            Instant.parse("2026-02-01T09:00:00Z")));
    Instant now = Instant.now();

    int recent =
        businessRepository.deleteNonSelfEmployedWithoutWebsiteBefore(
            now.minus(Duration.ofDays(1)));

    assertThat(recent).isZero();
    assertThat(businessRepository.existsById(agency.getId())).isTrue();

    int deleted =
        businessRepository.deleteNonSelfEmployedWithoutWebsiteBefore(now.plus(Duration.ofDays(1)));

    assertThat(deleted).isGreaterThanOrEqualTo(1);
    assertThat(businessRepository.existsById(agency.getId())).isFalse();
    assertThat(businessRepository.existsById(unchecked.getId())).isTrue();
    assertThat(businessRepository.existsById(freelancer.getId())).isTrue();
    assertThat(websiteCheckRepository.findByBusinessIdOrderByCreatedAtDesc(agency.getId()))
        .isEmpty();
  }

  private static Business business(String name, String city) {
    Business business = new Business(name);
    business.setCity(city);
    business.setCountry("Netherlands");
    return business;
  }
}
