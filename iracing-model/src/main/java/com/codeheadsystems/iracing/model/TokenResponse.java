package com.codeheadsystems.iracing.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;

/**
 * Body of a successful OAuth2 token exchange: { access_token, refresh_token, expires_in }.
 * <p>
 * Used by both the {@code password_limited} handshake and the {@code refresh_token} grant.
 * The server may add fields (token_type, scope, refresh_token_expires_in); they are ignored.
 *
 * @param accessToken  bearer token for the data API
 * @param refreshToken token for the next refresh grant; may be absent on a refresh response
 * @param expiresIn    access token lifetime in seconds; may be absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(@JsonProperty("access_token") String accessToken,
                            @JsonProperty("refresh_token") String refreshToken,
                            @JsonProperty("expires_in") Long expiresIn) {

  /**
   * Lifetime used when the server omits {@code expires_in}.
   */
  public static final Duration DEFAULT_LIFETIME = Duration.ofSeconds(600);

  /**
   * Longest lifetime honoured; larger {@code expires_in} values are clamped to it.
   */
  public static final Duration MAX_LIFETIME = Duration.ofDays(1);

  /**
   * The access token lifetime, falling back to {@link #DEFAULT_LIFETIME} and capped at
   * {@link #MAX_LIFETIME}.
   *
   * @return the lifetime
   */
  public Duration lifetime() {
    if (expiresIn == null || expiresIn <= 0) {
      return DEFAULT_LIFETIME;
    }
    return expiresIn > MAX_LIFETIME.getSeconds() ? MAX_LIFETIME : Duration.ofSeconds(expiresIn);
  }

  /**
   * A response is usable only if it carries an access token.
   *
   * @return true if the access token is present and not blank
   */
  public boolean hasAccessToken() {
    return accessToken != null && !accessToken.isBlank();
  }
}
