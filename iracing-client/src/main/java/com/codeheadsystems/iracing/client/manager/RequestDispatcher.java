package com.codeheadsystems.iracing.client.manager;

import com.codeheadsystems.iracing.client.accessor.DataAccessor;
import com.codeheadsystems.iracing.client.config.IRacingClientConfig;
import com.codeheadsystems.iracing.client.exceptions.IRacingAccessorException;
import com.codeheadsystems.iracing.client.model.ApiResult;
import com.codeheadsystems.iracing.client.model.DataResponse;
import com.codeheadsystems.iracing.client.model.FailureKind;
import com.codeheadsystems.iracing.client.model.RequestAttempt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The authenticated GET primitive of the data client.
 * <p>
 * Each attempt runs under the session lock: wait until the rate-limit window is open, send the
 * request, and record what the response says about the window. Everything slow that is not the
 * request itself (re-authentication, 429 backoff, link resolution) happens after the lock is
 * released. Outcomes per attempt:
 * <ul>
 *   <li><strong>200</strong>: the window reopens now; the body goes through the
 *       {@link IndirectLinkResolver}.</li>
 *   <li><strong>401</strong>: run the full handshake, then retry with the new token.</li>
 *   <li><strong>429</strong>: close the window for {@code Retry-After} seconds (or twice the
 *       minimum backoff), sleep that long, then retry.</li>
 *   <li><strong>503</strong>: maintenance; fail at once.</li>
 *   <li>anything else: fail.</li>
 * </ul>
 * 401 and 429 share one attempt budget. Expected failures are returned as
 * {@link ApiResult#failure(FailureKind)}, never thrown.
 */
@Singleton
public class RequestDispatcher {

  static final String RATE_LIMIT_REMAINING = "x-ratelimit-remaining";
  static final String RETRY_AFTER = "Retry-After";
  private static final int MAX_LOGGED_BODY = 200;

  private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

  private final Session session;
  private final TokenLifecycleManager tokenLifecycleManager;
  private final DataAccessor dataAccessor;
  private final IndirectLinkResolver linkResolver;
  private final ObjectMapper objectMapper;
  private final IRacingClientConfig config;

  @Inject
  public RequestDispatcher(final Session session,
                           final TokenLifecycleManager tokenLifecycleManager,
                           final DataAccessor dataAccessor,
                           final IndirectLinkResolver linkResolver,
                           final ObjectMapper objectMapper,
                           final IRacingClientConfig config) {
    log.info("RequestDispatcher(maxAttempts={})", config.maxAttempts());
    this.session = session;
    this.tokenLifecycleManager = tokenLifecycleManager;
    this.dataAccessor = dataAccessor;
    this.linkResolver = linkResolver;
    this.objectMapper = objectMapper;
    this.config = config;
  }

  /**
   * Authenticated GET of a data endpoint.
   *
   * @param endpoint    path below the base URL, e.g. {@code /data/member/info}
   * @param queryParams query parameters; may be empty
   * @return the parsed (and link-resolved) payload, or the reason there is none
   */
  public ApiResult<JsonNode> get(final String endpoint, final Map<String, String> queryParams) {
    Objects.requireNonNull(endpoint, "endpoint");
    final Map<String, String> params = queryParams == null ? Map.of() : queryParams;
    log.debug("get(endpoint={}, queryParams={})", endpoint, params);

    if (!tokenLifecycleManager.ensureAuthenticated()) {
      log.warn("Not authenticated; cannot request {}", endpoint);
      return ApiResult.failure(FailureKind.AUTHENTICATION_FAILURE);
    }

    RequestAttempt lastAttempt = null;
    for (int attempt = 0; attempt < config.maxAttempts(); attempt++) {
      final DataResponse response;
      Duration backoff = Duration.ZERO;
      session.lock();
      try {
        awaitWindow(endpoint);
        response = dataAccessor.get(endpoint, params, session.accessToken());
        warnIfRateLimitLow(endpoint, response);
        if (response.statusCode() == 200) {
          session.openWindowNow();
        } else if (response.statusCode() == 429) {
          backoff = retryAfter(response);
          session.deferRequests(backoff);
        }
      } catch (IRacingAccessorException e) {
        log.error("iRacing API request error for {}: {}", endpoint, e.getMessage(), e);
        return ApiResult.failure(FailureKind.TRANSPORT_ERROR);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted waiting for the rate-limit window for {}", endpoint);
        return ApiResult.failure(FailureKind.TRANSPORT_ERROR);
      } finally {
        session.unlock();
      }

      lastAttempt = new RequestAttempt(endpoint, params, attempt, response.statusCode(), response.headers());
      log.trace("{}", lastAttempt);
      switch (response.statusCode()) {
        case 200 -> {
          return parseAndResolve(endpoint, response.body());
        }
        case 401 -> {
          log.warn("Session expired requesting {}, re-authenticating...", endpoint);
          if (!tokenLifecycleManager.authenticate()) {
            return ApiResult.failure(FailureKind.AUTHENTICATION_FAILURE);
          }
        }
        case 429 -> {
          log.warn("Rate limited by iRacing API on {} (attempt {} of {}), backing off {}",
              endpoint, attempt + 1, config.maxAttempts(), backoff);
          if (attempt + 1 < config.maxAttempts() && !sleep(backoff)) {
            return ApiResult.failure(FailureKind.TRANSPORT_ERROR);
          }
        }
        case 503 -> {
          log.error("iRacing API is in maintenance (503) for {}", endpoint);
          return ApiResult.failure(FailureKind.SERVICE_UNAVAILABLE);
        }
        default -> {
          log.error("iRacing API error {} for {}: {}", response.statusCode(), endpoint, truncate(response.body()));
          return ApiResult.failure(FailureKind.UNEXPECTED_STATUS);
        }
      }
    }
    log.warn("iRacing API rate limit exhausted for {} after {} attempts (last: {})",
        endpoint, config.maxAttempts(), lastAttempt);
    return ApiResult.failure(FailureKind.RATE_LIMIT_EXHAUSTED);
  }

  private void awaitWindow(final String endpoint) throws InterruptedException {
    Duration wait = session.timeUntilNextRequest();
    if (!wait.isZero()) {
      log.debug("Waiting {} for the rate-limit window before {}", wait, endpoint);
      session.clock().sleep(wait);
    }
  }

  private Duration retryAfter(final DataResponse response) {
    Optional<String> header = response.header(RETRY_AFTER);
    return header
        .flatMap(value -> RetryAfterParser.parse(value, Instant.now()))
        .orElseGet(() -> {
          log.debug("No usable Retry-After header ({}), using twice the minimum backoff", header.orElse("absent"));
          return session.minimumBackoff().multipliedBy(2);
        });
  }

  private boolean sleep(final Duration backoff) {
    try {
      session.clock().sleep(backoff);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted during rate-limit backoff");
      return false;
    }
  }

  private void warnIfRateLimitLow(final String endpoint, final DataResponse response) {
    Optional<String> remaining = response.header(RATE_LIMIT_REMAINING);
    if (remaining.isEmpty()) {
      return;
    }
    try {
      int value = Integer.parseInt(remaining.get().trim());
      if (value < config.lowRateLimitThreshold()) {
        log.warn("iRacing API rate limit low: {} remaining (last endpoint {})", value, endpoint);
      }
    } catch (NumberFormatException e) {
      log.debug("Ignoring non-numeric {} header: {}", RATE_LIMIT_REMAINING, remaining.get());
    }
  }

  private ApiResult<JsonNode> parseAndResolve(final String endpoint, final String body) {
    final JsonNode node;
    try {
      node = objectMapper.readTree(body == null ? "" : body);
    } catch (JsonProcessingException e) {
      log.error("iRacing API returned unparseable JSON for {}: {}", endpoint, truncate(body));
      return ApiResult.failure(FailureKind.MALFORMED_PAYLOAD);
    }
    if (node == null || node.isMissingNode()) {
      log.error("iRacing API returned an empty body for {}", endpoint);
      return ApiResult.failure(FailureKind.MALFORMED_PAYLOAD);
    }
    return linkResolver.resolve(node);
  }

  static String truncate(final String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= MAX_LOGGED_BODY ? body : body.substring(0, MAX_LOGGED_BODY) + "...";
  }
}
