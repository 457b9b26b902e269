package com.codeheadsystems.iracing.client.manager;

import com.codeheadsystems.iracing.client.accessor.TokenAccessor;
import com.codeheadsystems.iracing.client.exceptions.IRacingAccessorException;
import com.codeheadsystems.iracing.client.model.Credentials;
import com.codeheadsystems.iracing.model.TokenResponse;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the OAuth token pair of a {@link Session}.
 * <p>
 * <strong>States:</strong>
 * <ol>
 *   <li>Unauthenticated: the next {@link #ensureAuthenticated()} runs the full handshake.</li>
 *   <li>Authenticated, token valid: {@link #ensureAuthenticated()} does nothing.</li>
 *   <li>Authenticated, token expired: try the refresh grant, fall back to the full handshake,
 *       and drop to unauthenticated if that fails too.</li>
 * </ol>
 * All token work happens under the session lock, so concurrent callers never run two
 * handshakes for the same expiry. None of these methods throw for a rejected or failed
 * exchange; they return {@code false}. The session changes only after a complete, parsed
 * token response.
 */
@Singleton
public class TokenLifecycleManager {

  private static final Logger log = LoggerFactory.getLogger(TokenLifecycleManager.class);

  private final Session session;
  private final TokenAccessor tokenAccessor;
  private final CredentialMasker credentialMasker;
  private final Credentials credentials;

  @Inject
  public TokenLifecycleManager(final Session session,
                               final TokenAccessor tokenAccessor,
                               final CredentialMasker credentialMasker,
                               final Credentials credentials) {
    log.info("TokenLifecycleManager({})", credentials);
    this.session = session;
    this.tokenAccessor = tokenAccessor;
    this.credentialMasker = credentialMasker;
    this.credentials = credentials;
  }

  /**
   * Makes sure the session holds a usable access token.
   *
   * @return true if the session is authenticated with a valid token afterwards
   */
  public boolean ensureAuthenticated() {
    session.lock();
    try {
      if (!session.isAuthenticated()) {
        log.debug("ensureAuthenticated(): no session, running handshake");
        return handshakeLocked();
      }
      if (session.isAccessTokenValid()) {
        return true;
      }
      log.debug("ensureAuthenticated(): access token expired, refreshing");
      if (refreshLocked()) {
        return true;
      }
      log.info("Token refresh failed, falling back to full handshake");
      return handshakeLocked();
    } finally {
      session.unlock();
    }
  }

  /**
   * Runs the full password handshake, replacing any tokens the session holds.
   *
   * @return true on success; on failure the session is left unauthenticated
   */
  public boolean authenticate() {
    session.lock();
    try {
      return handshakeLocked();
    } finally {
      session.unlock();
    }
  }

  /**
   * Exchanges the refresh token for a new token pair.
   *
   * @return true on success; false if there is no refresh token or the exchange failed
   */
  public boolean refresh() {
    session.lock();
    try {
      return refreshLocked();
    } finally {
      session.unlock();
    }
  }

  private boolean handshakeLocked() {
    log.debug("handshake(identity={})", credentials.identity());
    try {
      TokenResponse response = tokenAccessor.passwordGrant(
          credentials.clientId(),
          credentialMasker.maskedClientSecret(credentials),
          credentials.identity(),
          credentialMasker.maskedPassword(credentials));
      if (response == null || !response.hasAccessToken()) {
        log.error("iRacing authentication failed: token response has no access_token");
        session.invalidate();
        return false;
      }
      session.installTokens(response.accessToken(), response.refreshToken(), response.lifetime());
      log.info("iRacing authentication successful (expires in {})", response.lifetime());
      return true;
    } catch (IRacingAccessorException e) {
      log.error("iRacing authentication failed: {}", e.getMessage(), e);
      session.invalidate();
      return false;
    }
  }

  private boolean refreshLocked() {
    Optional<String> refreshToken = session.refreshToken();
    if (refreshToken.isEmpty()) {
      log.debug("refresh(): no refresh token");
      return false;
    }
    try {
      TokenResponse response = tokenAccessor.refreshGrant(credentials.clientId(), refreshToken.get());
      if (response == null || !response.hasAccessToken()) {
        log.warn("iRacing token refresh returned no access_token");
        return false;
      }
      String nextRefreshToken = response.refreshToken() != null ? response.refreshToken() : refreshToken.get();
      session.installTokens(response.accessToken(), nextRefreshToken, response.lifetime());
      log.info("iRacing token refreshed (expires in {})", response.lifetime());
      return true;
    } catch (IRacingAccessorException e) {
      log.warn("iRacing token refresh failed: {}", e.getMessage());
      return false;
    }
  }
}
