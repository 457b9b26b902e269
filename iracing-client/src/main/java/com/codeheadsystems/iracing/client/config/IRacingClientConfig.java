package com.codeheadsystems.iracing.client.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Client-side configuration for the iRacing data API.
 * <p>
 * Holds the remote endpoints, the OAuth scope, the retry and backoff tuning of the request
 * dispatcher, network timeouts and the chunk download policy. Production code normally starts
 * from {@link #defaults()} or {@link #fromProperties(Properties)}; tests point the client at a
 * local server with {@link #forTesting(URI, URI)}.
 *
 * @param baseUrl               base URL of the data API; endpoints such as {@code /data/member/info} are appended
 * @param tokenEndpoint         OAuth2 token endpoint
 * @param scope                 scope requested by the password handshake
 * @param minimumBackoff        backoff unit; a 429 without a usable Retry-After waits twice this long
 * @param maxAttempts           attempts shared by 401 re-authentication and 429 backoff
 * @param lowRateLimitThreshold x-ratelimit-remaining values below this log a warning
 * @param connectTimeout        TCP/TLS connect timeout
 * @param requestTimeout        total time allowed for one request, from send to response headers
 * @param maxConnections        upper bound on concurrent connections the caller intends to use
 * @param chunkPolicy           how many chunks of a bulk dataset to download
 */
public record IRacingClientConfig(URI baseUrl,
                                  URI tokenEndpoint,
                                  String scope,
                                  Duration minimumBackoff,
                                  int maxAttempts,
                                  int lowRateLimitThreshold,
                                  Duration connectTimeout,
                                  Duration requestTimeout,
                                  int maxConnections,
                                  ChunkPolicy chunkPolicy) {

  public static final URI DEFAULT_BASE_URL = URI.create("https://members-ng.iracing.com");
  public static final URI DEFAULT_TOKEN_ENDPOINT = URI.create("https://oauth.iracing.com/oauth2/token");
  public static final String DEFAULT_SCOPE = "iracing.auth";
  public static final Duration DEFAULT_MINIMUM_BACKOFF = Duration.ofSeconds(1);
  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final int DEFAULT_LOW_RATE_LIMIT_THRESHOLD = 10;
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
  public static final int DEFAULT_MAX_CONNECTIONS = 100;

  public IRacingClientConfig {
    Objects.requireNonNull(baseUrl, "baseUrl");
    Objects.requireNonNull(tokenEndpoint, "tokenEndpoint");
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(minimumBackoff, "minimumBackoff");
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    Objects.requireNonNull(chunkPolicy, "chunkPolicy");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
    }
    if (minimumBackoff.isNegative()) {
      throw new IllegalArgumentException("minimumBackoff must not be negative: " + minimumBackoff);
    }
    if (maxConnections < 1) {
      throw new IllegalArgumentException("maxConnections must be at least 1: " + maxConnections);
    }
  }

  /**
   * Production configuration pointing at the public iRacing endpoints.
   *
   * @return the config
   */
  public static IRacingClientConfig defaults() {
    return new IRacingClientConfig(DEFAULT_BASE_URL, DEFAULT_TOKEN_ENDPOINT, DEFAULT_SCOPE,
        DEFAULT_MINIMUM_BACKOFF, DEFAULT_MAX_ATTEMPTS, DEFAULT_LOW_RATE_LIMIT_THRESHOLD,
        DEFAULT_CONNECT_TIMEOUT, DEFAULT_REQUEST_TIMEOUT, DEFAULT_MAX_CONNECTIONS,
        ChunkPolicy.FIRST_ONLY);
  }

  /**
   * Test configuration against a local server, with short timeouts and a zero backoff unit so
   * retries without a Retry-After header do not wait.
   *
   * @param baseUrl       the data API base URL
   * @param tokenEndpoint the token endpoint
   * @return the config
   */
  public static IRacingClientConfig forTesting(URI baseUrl, URI tokenEndpoint) {
    return new IRacingClientConfig(baseUrl, tokenEndpoint, DEFAULT_SCOPE,
        Duration.ZERO, DEFAULT_MAX_ATTEMPTS, DEFAULT_LOW_RATE_LIMIT_THRESHOLD,
        Duration.ofSeconds(2), Duration.ofSeconds(5), 10, ChunkPolicy.FIRST_ONLY);
  }

  /**
   * Reads the configuration from {@code iracing.*} properties. Missing keys keep their default.
   * <pre>
   *   iracing.baseUrl                 (default https://members-ng.iracing.com)
   *   iracing.tokenEndpoint           (default https://oauth.iracing.com/oauth2/token)
   *   iracing.scope                   (default iracing.auth)
   *   iracing.minimumBackoffMillis    (default 1000)
   *   iracing.maxAttempts             (default 3)
   *   iracing.lowRateLimitThreshold   (default 10)
   *   iracing.connectTimeoutMillis    (default 10000)
   *   iracing.requestTimeoutMillis    (default 30000)
   *   iracing.maxConnections          (default 100)
   *   iracing.chunkPolicy             (FIRST_ONLY or ALL, default FIRST_ONLY)
   * </pre>
   *
   * @param properties the properties
   * @return the config
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static IRacingClientConfig fromProperties(Properties properties) {
    IRacingClientConfig d = defaults();
    return new IRacingClientConfig(
        URI.create(properties.getProperty("iracing.baseUrl", d.baseUrl().toString())),
        URI.create(properties.getProperty("iracing.tokenEndpoint", d.tokenEndpoint().toString())),
        properties.getProperty("iracing.scope", d.scope()),
        millis(properties, "iracing.minimumBackoffMillis", d.minimumBackoff()),
        integer(properties, "iracing.maxAttempts", d.maxAttempts()),
        integer(properties, "iracing.lowRateLimitThreshold", d.lowRateLimitThreshold()),
        millis(properties, "iracing.connectTimeoutMillis", d.connectTimeout()),
        millis(properties, "iracing.requestTimeoutMillis", d.requestTimeout()),
        integer(properties, "iracing.maxConnections", d.maxConnections()),
        ChunkPolicy.valueOf(properties.getProperty("iracing.chunkPolicy", d.chunkPolicy().name()).trim()));
  }

  /**
   * Copy of this config with a different chunk policy.
   *
   * @param policy the chunk policy
   * @return the config
   */
  public IRacingClientConfig withChunkPolicy(ChunkPolicy policy) {
    return new IRacingClientConfig(baseUrl, tokenEndpoint, scope, minimumBackoff, maxAttempts,
        lowRateLimitThreshold, connectTimeout, requestTimeout, maxConnections, policy);
  }

  /**
   * Copy of this config with a different backoff unit.
   *
   * @param backoff the minimum backoff
   * @return the config
   */
  public IRacingClientConfig withMinimumBackoff(Duration backoff) {
    return new IRacingClientConfig(baseUrl, tokenEndpoint, scope, backoff, maxAttempts,
        lowRateLimitThreshold, connectTimeout, requestTimeout, maxConnections, chunkPolicy);
  }

  private static Duration millis(Properties properties, String key, Duration fallback) {
    String value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Duration.ofMillis(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
    }
  }

  private static int integer(Properties properties, String key, int fallback) {
    String value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
    }
  }
}
