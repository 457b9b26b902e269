package com.codeheadsystems.iracing.client.manager;

import com.codeheadsystems.iracing.client.config.IRacingClientConfig;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable state shared by every request of one data client: the OAuth tokens, their expiry
 * and the earliest time the next data request may be sent.
 * <p>
 * A single fair lock guards all of it. Callers take it with {@link #lock()} and release it in a
 * {@code finally} block with {@link #unlock()}; every accessor and mutator below throws
 * {@link IllegalStateException} when called without holding it. Times are monotonic
 * nanoseconds from the session's {@link SchedulingClock}.
 * <p>
 * Invariants: the access token is non-null whenever the session is authenticated, tokens are
 * replaced wholesale, and the next allowed request time never moves backwards.
 */
@Singleton
public class Session {

  private static final Logger log = LoggerFactory.getLogger(Session.class);

  // Offsets from now are bounded so the monotonic arithmetic below cannot overflow.
  static final Duration MAX_OFFSET = Duration.ofDays(3650);

  private final ReentrantLock lock = new ReentrantLock(true);
  private final SchedulingClock clock;
  private final Duration minimumBackoff;

  private String accessToken;
  private String refreshToken;
  private long accessTokenExpiry;
  private boolean authenticated;
  private long nextAllowedRequestTime;

  @Inject
  public Session(final SchedulingClock clock, final IRacingClientConfig config) {
    this(clock, config.minimumBackoff());
  }

  public Session(final SchedulingClock clock, final Duration minimumBackoff) {
    log.info("Session(minimumBackoff={})", minimumBackoff);
    this.clock = clock;
    this.minimumBackoff = minimumBackoff;
    this.nextAllowedRequestTime = clock.nanoTime();
  }

  public void lock() {
    lock.lock();
  }

  public void unlock() {
    lock.unlock();
  }

  public SchedulingClock clock() {
    return clock;
  }

  public Duration minimumBackoff() {
    return minimumBackoff;
  }

  public boolean isAuthenticated() {
    checkHeld();
    return authenticated;
  }

  /**
   * True if authenticated and the access token has not reached its expiry.
   *
   * @return whether the current access token may be used
   */
  public boolean isAccessTokenValid() {
    checkHeld();
    return authenticated && clock.nanoTime() - accessTokenExpiry < 0;
  }

  public String accessToken() {
    checkHeld();
    return accessToken;
  }

  public Optional<String> refreshToken() {
    checkHeld();
    return Optional.ofNullable(refreshToken);
  }

  /**
   * Replaces both tokens and the expiry, and marks the session authenticated.
   *
   * @param newAccessToken  the access token, never null
   * @param newRefreshToken the refresh token, may be null
   * @param lifetime        how long the access token stays valid from now
   */
  public void installTokens(final String newAccessToken, final String newRefreshToken, final Duration lifetime) {
    checkHeld();
    if (newAccessToken == null) {
      throw new IllegalArgumentException("An authenticated session requires an access token");
    }
    this.accessToken = newAccessToken;
    this.refreshToken = newRefreshToken;
    this.accessTokenExpiry = clock.nanoTime() + boundedNanos(lifetime);
    this.authenticated = true;
    log.debug("installTokens(lifetime={}, hasRefreshToken={})", lifetime, newRefreshToken != null);
  }

  /**
   * Drops the tokens and marks the session unauthenticated.
   */
  public void invalidate() {
    checkHeld();
    this.accessToken = null;
    this.refreshToken = null;
    this.accessTokenExpiry = 0L;
    this.authenticated = false;
  }

  public long nextAllowedRequestTime() {
    checkHeld();
    return nextAllowedRequestTime;
  }

  /**
   * Time left before the next request may be sent; zero if it may be sent now.
   *
   * @return the wait
   */
  public Duration timeUntilNextRequest() {
    checkHeld();
    long remaining = nextAllowedRequestTime - clock.nanoTime();
    return remaining > 0 ? Duration.ofNanos(remaining) : Duration.ZERO;
  }

  /**
   * Moves the next allowed request time to now. Never moves it backwards.
   */
  public void openWindowNow() {
    advanceNextAllowedRequestTime(clock.nanoTime());
  }

  /**
   * Holds back further requests until {@code delay} from now.
   *
   * @param delay the backoff
   */
  public void deferRequests(final Duration delay) {
    advanceNextAllowedRequestTime(clock.nanoTime() + boundedNanos(delay));
  }

  private static long boundedNanos(final Duration offset) {
    if (offset.isNegative()) {
      return 0L;
    }
    return offset.compareTo(MAX_OFFSET) > 0 ? MAX_OFFSET.toNanos() : offset.toNanos();
  }

  private void advanceNextAllowedRequestTime(final long candidate) {
    checkHeld();
    if (candidate - nextAllowedRequestTime > 0) {
      nextAllowedRequestTime = candidate;
    }
  }

  /**
   * Tears the session down: tokens are dropped and the next call authenticates from scratch.
   */
  public void close() {
    lock();
    try {
      invalidate();
      log.info("Session closed");
    } finally {
      unlock();
    }
  }

  private void checkHeld() {
    if (!lock.isHeldByCurrentThread()) {
      throw new IllegalStateException("Session state accessed without holding the session lock");
    }
  }
}
