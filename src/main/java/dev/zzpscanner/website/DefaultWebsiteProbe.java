package dev.zzpscanner.website;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link WebsiteProbe} backed by the JVM resolver and a {@link RestClient}.
 *
 * <p>An {@link UnknownHostException} from the resolver means the name does not exist. Fetches
 * never fail on an HTTP status; only connection problems and timeouts surface as {@link
 * ProbeException}.
 */
@Component
public class DefaultWebsiteProbe implements WebsiteProbe {

  /** Hostname lookup, replaceable in tests. */
  @FunctionalInterface
  interface HostResolver {
    InetAddress[] resolve(String host) throws UnknownHostException;
  }

  private final RestClient restClient;
  private final HostResolver resolver;

  @Autowired
  public DefaultWebsiteProbe(@Qualifier("websiteProbeRestClient") RestClient restClient) {
    this(restClient, InetAddress::getAllByName);
  }

  DefaultWebsiteProbe(RestClient restClient, HostResolver resolver) {
    this.restClient = restClient;
    this.resolver = resolver;
  }

  @Override
  public List<String> resolve(String domain) {
    InetAddress[] addresses;
    try {
      addresses = resolver.resolve(domain);
    } catch (UnknownHostException e) {
      throw new DomainNotFoundException(domain, e);
    } catch (SecurityException | IllegalArgumentException e) {
      throw new ProbeException("DNS lookup failed for " + domain + ": " + e.getMessage(), e);
    }
    if (addresses == null || addresses.length == 0) {
      throw new DomainNotFoundException(domain);
    }
    return Arrays.stream(addresses).map(InetAddress::getHostAddress).distinct().toList();
  }

  @Override
  public HttpProbeResult fetch(String url) {
    long started = System.nanoTime();
    try {
      return restClient
          .get()
          .uri(URI.create(url))
          .exchange(
              (request, response) ->
                  new HttpProbeResult(
                      response.getStatusCode().value(),
                      flatten(response.getHeaders()),
                      Duration.ofNanos(System.nanoTime() - started)));
    } catch (RestClientException | IllegalArgumentException e) {
      throw new ProbeException("Fetch failed for " + url + ": " + e.getMessage(), e);
    }
  }

  private static Map<String, String> flatten(HttpHeaders headers) {
    Map<String, String> flat = new LinkedHashMap<>();
    headers.forEach((name, values) -> flat.put(name, String.join(", ", values)));
    return flat;
  }
}
