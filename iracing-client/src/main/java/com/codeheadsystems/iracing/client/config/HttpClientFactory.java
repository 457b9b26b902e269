package com.codeheadsystems.iracing.client.config;

import java.net.http.HttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the single {@link HttpClient} shared by every accessor of one data client.
 * <p>
 * The JDK client is safe for concurrent use and pools connections internally, so the
 * accessors share it without extra locking. It has no per-host connection cap, so
 * {@link IRacingClientConfig#maxConnections()} is advisory and only logged here.
 */
public final class HttpClientFactory {

  private static final Logger log = LoggerFactory.getLogger(HttpClientFactory.class);

  private HttpClientFactory() {
  }

  /**
   * Creates an HTTP client honouring the configured connect timeout. TLS verification uses the
   * JDK defaults and redirects are followed only when they do not downgrade to plain HTTP.
   *
   * @param config the client config
   * @return the http client
   */
  public static HttpClient create(IRacingClientConfig config) {
    log.info("create(connectTimeout={}, maxConnections={})", config.connectTimeout(), config.maxConnections());
    return HttpClient.newBuilder()
        .connectTimeout(config.connectTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .version(HttpClient.Version.HTTP_1_1)
        .build();
  }
}
