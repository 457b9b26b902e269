package com.codeheadsystems.iracing.client.manager;

import static com.codeheadsystems.iracing.client.manager.TestFixtures.CONFIG;
import static com.codeheadsystems.iracing.client.manager.TestFixtures.CREDENTIALS;
import static com.codeheadsystems.iracing.client.manager.TestFixtures.response;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.iracing.client.accessor.BlobAccessor;
import com.codeheadsystems.iracing.client.accessor.DataAccessor;
import com.codeheadsystems.iracing.client.accessor.TokenAccessor;
import com.codeheadsystems.iracing.client.exceptions.IRacingAccessorException;
import com.codeheadsystems.iracing.client.model.ApiResult;
import com.codeheadsystems.iracing.client.model.BlobResponse;
import com.codeheadsystems.iracing.client.model.FailureKind;
import com.codeheadsystems.iracing.model.TokenResponse;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link RequestDispatcher}.
 * <p>
 * Session, token lifecycle and link resolver are real and share a virtual clock, so backoff
 * is observed through the recorded sleeps instead of waiting. The three accessors are mocked.
 */
@ExtendWith(MockitoExtension.class)
class RequestDispatcherTest {

  private static final String ENDPOINT = "/data/member/info";
  private static final String MEMBER = "{\"cust_id\":123456,\"display_name\":\"Clunky\"}";

  @Mock private DataAccessor dataAccessor;
  @Mock private TokenAccessor tokenAccessor;
  @Mock private BlobAccessor blobAccessor;

  private FakeSchedulingClock clock;
  private Session session;
  private RequestDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    ObjectMapper objectMapper = new ObjectMapper();
    clock = new FakeSchedulingClock();
    session = new Session(clock, CONFIG);
    TokenLifecycleManager tokens =
        new TokenLifecycleManager(session, tokenAccessor, new CredentialMasker(), CREDENTIALS);
    IndirectLinkResolver resolver = new IndirectLinkResolver(blobAccessor, new PayloadDecoder(objectMapper));
    dispatcher = new RequestDispatcher(session, tokens, dataAccessor, resolver, objectMapper, CONFIG);
  }

  @Test
  void get_coldSession_authenticatesThenReturnsParsedJson() {
    givenHandshakeIssues("token-1");
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1")).thenReturn(response(200, MEMBER));

    ApiResult<JsonNode> result = dispatcher.get(ENDPOINT, Map.of());

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value().get("cust_id").asInt()).isEqualTo(123456);
    verify(tokenAccessor).passwordGrant(any(), any(), any(), any());
    verify(dataAccessor).get(ENDPOINT, Map.of(), "token-1");
    assertThat(clock.sleeps()).isEmpty();
  }

  @Test
  void get_passesQueryParameters() {
    givenHandshakeIssues("token-1");
    Map<String, String> params = Map.of("cust_ids", "123456", "include_licenses", "true");
    when(dataAccessor.get("/data/member/get", params, "token-1")).thenReturn(response(200, "{\"members\":[]}"));

    assertThat(dispatcher.get("/data/member/get", params).isSuccess()).isTrue();
  }

  @Test
  void get_handshakeFails_returnsAuthenticationFailureWithoutRequest() {
    when(tokenAccessor.passwordGrant(any(), any(), any(), any()))
        .thenThrow(new IRacingAccessorException("Token endpoint returned HTTP 401 for grant password_limited", null));

    ApiResult<JsonNode> result = dispatcher.get(ENDPOINT, Map.of());

    assertThat(result.failure()).isEqualTo(FailureKind.AUTHENTICATION_FAILURE);
    verify(dataAccessor, never()).get(anyString(), anyMap(), anyString());
  }

  @Test
  void get_401_reauthenticatesOnceAndRetriesWithNewToken() {
    when(tokenAccessor.passwordGrant(any(), any(), any(), any()))
        .thenReturn(new TokenResponse("token-1", "refresh-1", 600L))
        .thenReturn(new TokenResponse("token-2", "refresh-2", 600L));
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1")).thenReturn(response(401, "{}"));
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-2")).thenReturn(response(200, MEMBER));

    ApiResult<JsonNode> result = dispatcher.get(ENDPOINT, Map.of());

    assertThat(result.isSuccess()).isTrue();
    verify(tokenAccessor, times(2)).passwordGrant(any(), any(), any(), any());
    verify(dataAccessor).get(ENDPOINT, Map.of(), "token-1");
    verify(dataAccessor).get(ENDPOINT, Map.of(), "token-2");
  }

  @Test
  void get_401_reauthenticationRejected_returnsAuthenticationFailure() {
    when(tokenAccessor.passwordGrant(any(), any(), any(), any()))
        .thenReturn(new TokenResponse("token-1", "refresh-1", 600L))
        .thenThrow(new IRacingAccessorException("Token endpoint returned HTTP 401 for grant password_limited", null));
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1")).thenReturn(response(401, "{}"));

    ApiResult<JsonNode> result = dispatcher.get(ENDPOINT, Map.of());

    assertThat(result.failure()).isEqualTo(FailureKind.AUTHENTICATION_FAILURE);
    verify(dataAccessor, times(1)).get(anyString(), anyMap(), anyString());
  }

  @Test
  void get_repeated401_exhaustsAttemptBudget() {
    when(tokenAccessor.passwordGrant(any(), any(), any(), any()))
        .thenReturn(new TokenResponse("token-1", "refresh-1", 600L));
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1")).thenReturn(response(401, "{}"));

    ApiResult<JsonNode> result = dispatcher.get(ENDPOINT, Map.of());

    assertThat(result.failure()).isEqualTo(FailureKind.RATE_LIMIT_EXHAUSTED);
    verify(dataAccessor, times(3)).get(ENDPOINT, Map.of(), "token-1");
  }

  @Test
  void get_429WithRetryAfter_delaysNextRequestAtLeastThatLong() {
    givenHandshakeIssues("token-1");
    List<Long> sentAt = new ArrayList<>();
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1"))
        .thenAnswer(invocation -> {
          sentAt.add(clock.nanoTime());
          return sentAt.size() == 1
              ? response(429, "{}", "Retry-After", "5")
              : response(200, MEMBER);
        });

    ApiResult<JsonNode> result = dispatcher.get(ENDPOINT, Map.of());

    assertThat(result.isSuccess()).isTrue();
    assertThat(sentAt).hasSize(2);
    assertThat(Duration.ofNanos(sentAt.get(1) - sentAt.get(0))).isGreaterThanOrEqualTo(Duration.ofSeconds(5));
    assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(5));
  }

  @Test
  void get_429ThenSuccess_sleepsExactlyOnce() {
    givenHandshakeIssues("token-1");
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1"))
        .thenReturn(response(429, "{}", "Retry-After", "2"))
        .thenReturn(response(200, MEMBER));

    ApiResult<JsonNode> result = dispatcher.get(ENDPOINT, Map.of());

    assertThat(result.isSuccess()).isTrue();
    assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(2));
  }

  @Test
  void get_429WithoutRetryAfter_backsOffTwiceTheMinimum() {
    givenHandshakeIssues("token-1");
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1"))
        .thenReturn(response(429, "{}", "Retry-After", "soon"))
        .thenReturn(response(200, MEMBER));

    dispatcher.get(ENDPOINT, Map.of());

    assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(2));
  }

  @Test
  void get_429WithHugeRetryAfter_backsOffTheCappedDelay() {
    givenHandshakeIssues("token-1");
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1"))
        .thenReturn(response(429, "{}", "Retry-After", "9999999999"))
        .thenReturn(response(200, MEMBER));

    ApiResult<JsonNode> result = dispatcher.get(ENDPOINT, Map.of());

    assertThat(result.isSuccess()).isTrue();
    assertThat(clock.sleeps()).containsExactly(RetryAfterParser.MAX_DELAY);
  }

  @Test
  void get_three429s_failsWithoutAFourthAttempt() {
    givenHandshakeIssues("token-1");
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1")).thenReturn(response(429, "{}", "Retry-After", "1"));

    ApiResult<JsonNode> result = dispatcher.get(ENDPOINT, Map.of());

    assertThat(result.failure()).isEqualTo(FailureKind.RATE_LIMIT_EXHAUSTED);
    verify(dataAccessor, times(3)).get(ENDPOINT, Map.of(), "token-1");
  }

  @Test
  void get_afterExhaustedBackoff_nextCallerWaitsForWindow() {
    givenHandshakeIssues("token-1");
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1"))
        .thenReturn(response(429, "{}", "Retry-After", "4"))
        .thenReturn(response(429, "{}", "Retry-After", "4"))
        .thenReturn(response(429, "{}", "Retry-After", "4"))
        .thenReturn(response(200, MEMBER));

    assertThat(dispatcher.get(ENDPOINT, Map.of()).failure()).isEqualTo(FailureKind.RATE_LIMIT_EXHAUSTED);
    clock.sleeps().clear();

    assertThat(dispatcher.get(ENDPOINT, Map.of()).isSuccess()).isTrue();
    assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(4));
  }

  @Test
  void get_concurrentCallers_neitherSendsBeforeTheBackoffWindow() throws Exception {
    givenHandshakeIssues("token-1");
    List<Long> sentAt = new CopyOnWriteArrayList<>();
    AtomicReference<Future<ApiResult<JsonNode>>> other = new AtomicReference<>();
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      when(dataAccessor.get(ENDPOINT, Map.of(), "token-1"))
          .thenAnswer(invocation -> {
            sentAt.add(clock.nanoTime());
            if (sentAt.size() == 1) {
              // The second caller queues on the session lock while this request is in flight.
              other.set(executor.submit(() -> dispatcher.get(ENDPOINT, Map.of())));
              Thread.sleep(200);
              return response(429, "{}", "Retry-After", "5");
            }
            return response(200, MEMBER);
          });

      ApiResult<JsonNode> first = dispatcher.get(ENDPOINT, Map.of());
      ApiResult<JsonNode> second = other.get().get(5, TimeUnit.SECONDS);

      assertThat(first.isSuccess()).isTrue();
      assertThat(second.isSuccess()).isTrue();
      assertThat(sentAt).hasSize(3);
      long throttledAt = sentAt.get(0);
      assertThat(sentAt.subList(1, sentAt.size()))
          .allSatisfy(at -> assertThat(Duration.ofNanos(at - throttledAt))
              .isGreaterThanOrEqualTo(Duration.ofSeconds(5)));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void get_503_failsWithoutRetry() {
    givenHandshakeIssues("token-1");
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1")).thenReturn(response(503, "maintenance"));

    ApiResult<JsonNode> result = dispatcher.get(ENDPOINT, Map.of());

    assertThat(result.failure()).isEqualTo(FailureKind.SERVICE_UNAVAILABLE);
    verify(dataAccessor, times(1)).get(anyString(), anyMap(), anyString());
    assertThat(clock.sleeps()).isEmpty();
  }

  @Test
  void get_otherStatus_failsWithoutRetry() {
    givenHandshakeIssues("token-1");
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1")).thenReturn(response(404, "x".repeat(1000)));

    ApiResult<JsonNode> result = dispatcher.get(ENDPOINT, Map.of());

    assertThat(result.failure()).isEqualTo(FailureKind.UNEXPECTED_STATUS);
    verify(dataAccessor, times(1)).get(anyString(), anyMap(), anyString());
  }

  @Test
  void get_transportError_returnsFailureAndReleasesLock() {
    givenHandshakeIssues("token-1");
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1"))
        .thenThrow(new IRacingAccessorException("HTTP request failed for endpoint: " + ENDPOINT,
            new HttpTimeoutException("request timed out")))
        .thenReturn(response(200, MEMBER));

    assertThat(dispatcher.get(ENDPOINT, Map.of()).failure()).isEqualTo(FailureKind.TRANSPORT_ERROR);
    assertThat(dispatcher.get(ENDPOINT, Map.of()).isSuccess()).isTrue();
  }

  @Test
  void get_lowRateLimitRemaining_stillSucceeds() {
    givenHandshakeIssues("token-1");
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1"))
        .thenReturn(response(200, MEMBER, "x-ratelimit-remaining", "3"));

    assertThat(dispatcher.get(ENDPOINT, Map.of()).isSuccess()).isTrue();
  }

  @Test
  void get_unparseableBody_isMalformedPayload() {
    givenHandshakeIssues("token-1");
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1")).thenReturn(response(200, "<html>"));

    assertThat(dispatcher.get(ENDPOINT, Map.of()).failure()).isEqualTo(FailureKind.MALFORMED_PAYLOAD);
  }

  @Test
  void get_linkBody_returnsLinkedPayloadNotWrapper() {
    givenHandshakeIssues("token-1");
    when(dataAccessor.get(ENDPOINT, Map.of(), "token-1"))
        .thenReturn(response(200, "{\"link\":\"https://x/y\",\"expires\":\"2026-10-19T20:00:00Z\"}"));
    when(blobAccessor.fetch(URI.create("https://x/y")))
        .thenReturn(new BlobResponse(200, MEMBER.getBytes(StandardCharsets.UTF_8)));

    ApiResult<JsonNode> result = dispatcher.get(ENDPOINT, Map.of());

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value().has("link")).isFalse();
    assertThat(result.value().get("display_name").asText()).isEqualTo("Clunky");
  }

  @Test
  void get_nullQueryParams_treatedAsEmpty() {
    givenHandshakeIssues("token-1");
    when(dataAccessor.get(eq(ENDPOINT), eq(Map.of()), eq("token-1"))).thenReturn(response(200, "[]"));

    assertThat(dispatcher.get(ENDPOINT, null).value().isArray()).isTrue();
  }

  @Test
  void truncate_limitsLoggedBody() {
    assertThat(RequestDispatcher.truncate("a".repeat(500))).hasSize(203);
    assertThat(RequestDispatcher.truncate(null)).isEmpty();
  }

  private void givenHandshakeIssues(String accessToken) {
    when(tokenAccessor.passwordGrant(any(), any(), any(), any()))
        .thenReturn(new TokenResponse(accessToken, "refresh-1", 600L));
  }
}
