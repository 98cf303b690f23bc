package dev.zzpscanner.website;

import dev.zzpscanner.config.ScannerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to fetch candidate websites.
 *
 * <p>Connect and read timeouts both use {@code scanner.website-check.request-timeout}; every
 * request identifies itself with {@code scanner.website-check.user-agent}.
 */
@Configuration
public class WebsiteProbeConfig {

  @Bean
  public RestClient websiteProbeRestClient(
      RestClient.Builder builder, ScannerProperties properties) {
    ScannerProperties.WebsiteCheck settings = properties.getWebsiteCheck();
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(settings.getRequestTimeout());
    requestFactory.setReadTimeout(settings.getRequestTimeout());

    return builder
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.USER_AGENT, settings.getUserAgent())
        .build();
  }
}
