package com.codeheadsystems.iracing.client.accessor;

import com.codeheadsystems.iracing.client.config.IRacingClientConfig;
import com.codeheadsystems.iracing.client.exceptions.IRacingAccessorException;
import com.codeheadsystems.iracing.client.model.DataResponse;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the authenticated data endpoints ({@code GET <base>/data/...}).
 * <p>
 * Performs exactly one GET per call and hands back status, headers and body untouched;
 * status interpretation, retries and backoff belong to the request dispatcher.
 */
@Singleton
public class DataAccessor {

  private static final Logger log = LoggerFactory.getLogger(DataAccessor.class);

  private final HttpClient httpClient;
  private final IRacingClientConfig config;

  /**
   * Instantiates a new data accessor.
   *
   * @param httpClient the http client
   * @param config     the client config
   */
  @Inject
  public DataAccessor(final HttpClient httpClient, final IRacingClientConfig config) {
    log.info("DataAccessor({})", config.baseUrl());
    this.httpClient = httpClient;
    this.config = config;
  }

  /**
   * Issues one bearer-authenticated GET.
   *
   * @param endpoint    path below the base URL, e.g. {@code /data/member/info}
   * @param queryParams query parameters, sent in iteration order
   * @param accessToken the bearer token
   * @return the raw response
   * @throws IRacingAccessorException if the endpoint does not form a valid URI, or the request fails
   */
  public DataResponse get(final String endpoint,
                          final Map<String, String> queryParams,
                          final String accessToken) {
    final URI uri;
    try {
      uri = uri(endpoint, queryParams);
    } catch (IllegalArgumentException e) {
      throw new IRacingAccessorException("Invalid request URI for endpoint: " + endpoint, e);
    }
    log.trace("get(uri={})", uri);
    try {
      HttpRequest request = HttpRequest.newBuilder()
          .uri(uri)
          .timeout(config.requestTimeout())
          .header("Accept", "application/json")
          .header("Authorization", "Bearer " + accessToken)
          .GET()
          .build();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      return new DataResponse(response.statusCode(), response.headers(), response.body());
    } catch (IOException e) {
      throw new IRacingAccessorException("HTTP request failed for endpoint: " + endpoint, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IRacingAccessorException("HTTP request interrupted for endpoint: " + endpoint, e);
    }
  }

  URI uri(final String endpoint, final Map<String, String> queryParams) {
    String base = config.baseUrl().toString();
    if (base.endsWith("/") && endpoint.startsWith("/")) {
      base = base.substring(0, base.length() - 1);
    } else if (!base.endsWith("/") && !endpoint.startsWith("/")) {
      base = base + "/";
    }
    if (queryParams == null || queryParams.isEmpty()) {
      return URI.create(base + endpoint);
    }
    String query = queryParams.entrySet().stream()
        .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
            + "=" + URLEncoder.encode(String.valueOf(e.getValue()), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
    return URI.create(base + endpoint + "?" + query);
  }
}
