package com.codeheadsystems.iracing.client.accessor;

import com.codeheadsystems.iracing.client.config.IRacingClientConfig;
import com.codeheadsystems.iracing.client.exceptions.IRacingAccessorException;
import com.codeheadsystems.iracing.model.TokenResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the OAuth2 token endpoint.
 * <p>
 * Sends form-encoded POSTs for the two grants the data API accepts: the limited password
 * grant (full handshake) and the refresh grant. Any status other than 200 is surfaced as an
 * {@link IRacingAccessorException} carrying the status; I/O errors, interruptions and
 * unparseable bodies are wrapped the same way.
 */
@Singleton
public class TokenAccessor {

  static final String PASSWORD_GRANT = "password_limited";
  static final String REFRESH_GRANT = "refresh_token";

  private static final Logger log = LoggerFactory.getLogger(TokenAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final IRacingClientConfig config;

  /**
   * Instantiates a new token accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param config       the client config
   */
  @Inject
  public TokenAccessor(final HttpClient httpClient,
                       final ObjectMapper objectMapper,
                       final IRacingClientConfig config) {
    log.info("TokenAccessor({})", config.tokenEndpoint());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.config = config;
  }

  /**
   * Full handshake. Secrets must already be masked.
   *
   * @param clientId           the OAuth client id
   * @param maskedClientSecret the client secret masked against the client id
   * @param username           the account identity
   * @param maskedPassword     the password masked against the account identity
   * @return the token response
   */
  public TokenResponse passwordGrant(final String clientId,
                                     final String maskedClientSecret,
                                     final String username,
                                     final String maskedPassword) {
    log.debug("passwordGrant(clientId={}, username={})", clientId, username);
    Map<String, String> form = new LinkedHashMap<>();
    form.put("grant_type", PASSWORD_GRANT);
    form.put("client_id", clientId);
    form.put("client_secret", maskedClientSecret);
    form.put("username", username);
    form.put("password", maskedPassword);
    form.put("scope", config.scope());
    return post(form);
  }

  /**
   * Refresh grant.
   *
   * @param clientId     the OAuth client id
   * @param refreshToken the current refresh token
   * @return the token response
   */
  public TokenResponse refreshGrant(final String clientId, final String refreshToken) {
    log.debug("refreshGrant(clientId={})", clientId);
    Map<String, String> form = new LinkedHashMap<>();
    form.put("grant_type", REFRESH_GRANT);
    form.put("client_id", clientId);
    form.put("refresh_token", refreshToken);
    return post(form);
  }

  static String formEncode(Map<String, String> form) {
    return form.entrySet().stream()
        .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
            + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
  }

  private TokenResponse post(Map<String, String> form) {
    try {
      HttpRequest request = HttpRequest.newBuilder()
          .uri(config.tokenEndpoint())
          .timeout(config.requestTimeout())
          .header("Content-Type", "application/x-www-form-urlencoded")
          .header("Accept", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
          .build();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        throw new IRacingAccessorException(
            "Token endpoint returned HTTP " + response.statusCode() + " for grant " + form.get("grant_type"), null);
      }
      TokenResponse tokens = objectMapper.readValue(response.body(), TokenResponse.class);
      if (tokens == null) {
        throw new IRacingAccessorException(
            "Token endpoint returned an empty body for grant " + form.get("grant_type"), null);
      }
      return tokens;
    } catch (IOException e) {
      throw new IRacingAccessorException("Token request failed for grant " + form.get("grant_type"), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IRacingAccessorException("Token request interrupted for grant " + form.get("grant_type"), e);
    }
  }
}
