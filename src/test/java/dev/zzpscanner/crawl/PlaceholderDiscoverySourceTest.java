package dev.zzpscanner.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import dev.zzpscanner.config.ScannerProperties;
import dev.zzpscanner.job.JobKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class PlaceholderDiscoverySourceTest {

  private final PlaceholderDiscoverySource source =
      new PlaceholderDiscoverySource(new ScannerProperties());

  @Test
  void producesTwoBusinessesForLocation() {
    List<DiscoveredBusiness> found =
        source.discover(JobKind.DISCOVER_GOOGLE_MAPS, "Amsterdam", null);

    assertThat(found)
        .extracting(DiscoveredBusiness::name)
        .containsExactly("Test Business 1 - Amsterdam", "Test Business 2 - Amsterdam");
    assertThat(found).allSatisfy(b -> assertThat(b.source()).isEqualTo("google_maps"));
    assertThat(found.get(0).websiteExists()).isNull();
    assertThat(found.get(1).websiteUrl()).isEqualTo("https://testbusiness2.nl");
  }

  @Test
  void industryDefaultsDifferPerBusiness() {
    List<DiscoveredBusiness> found = source.discover(JobKind.DISCOVER_LINKEDIN, "Utrecht", null);

    assertThat(found).extracting(DiscoveredBusiness::industry)
        .containsExactly("Technology", "Marketing");
  }

  @Test
  void givenIndustryAppliesToBoth() {
    List<DiscoveredBusiness> found =
        source.discover(JobKind.DISCOVER_FACEBOOK, "Utrecht", "Bouw");

    assertThat(found).extracting(DiscoveredBusiness::industry).containsOnly("Bouw");
  }

  @Test
  void sourceIdsAreStableAcrossRuns() {
    List<DiscoveredBusiness> first =
        source.discover(JobKind.DISCOVER_CHAMBER_OF_COMMERCE, "Den Haag, Netherlands", null);
    List<DiscoveredBusiness> second =
        source.discover(JobKind.DISCOVER_CHAMBER_OF_COMMERCE, "Den Haag, Netherlands", null);

    assertThat(first).extracting(DiscoveredBusiness::sourceId)
        .containsExactly("kvk_1_den-haag-netherlands", "kvk_2_den-haag-netherlands")
        .isEqualTo(second.stream().map(DiscoveredBusiness::sourceId).toList());
  }

  @Test
  void cityAndCountryComeFromCommaSeparatedLocation() {
    assertThat(PlaceholderDiscoverySource.cityOf("Antwerpen, Vlaanderen, Belgium"))
        .isEqualTo("Antwerpen");
    assertThat(
            PlaceholderDiscoverySource.countryOf("Antwerpen, Vlaanderen, Belgium", "Netherlands"))
        .isEqualTo("Belgium");
    assertThat(PlaceholderDiscoverySource.countryOf("Zwolle", "Netherlands"))
        .isEqualTo("Netherlands");
  }

  @Test
  void locationWithoutCountryUsesFirstTargetCountry() {
    ScannerProperties properties = new ScannerProperties();
    properties.setTargetCountries(List.of("Belgium", "Luxembourg"));

    List<DiscoveredBusiness> found =
        new PlaceholderDiscoverySource(properties)
            .discover(JobKind.DISCOVER_FACEBOOK, "Gent", null);

    assertThat(found).extracting(DiscoveredBusiness::country).containsOnly("Belgium");
  }

  @Test
  void slugCollapsesPunctuation() {
    assertThat(PlaceholderDiscoverySource.slug("  's-Hertogenbosch, NL "))
        .isEqualTo("s-hertogenbosch-nl");
  }
}
