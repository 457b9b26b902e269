package com.codeheadsystems.iracing.client.exceptions;

/**
 * Transport-level failure talking to the OAuth server, the data API or blob storage:
 * connection refused, timeout, TLS failure, interruption or an unreadable response body.
 */
public class IRacingAccessorException extends RuntimeException {
  /**
   * Instantiates a new iRacing accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public IRacingAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
