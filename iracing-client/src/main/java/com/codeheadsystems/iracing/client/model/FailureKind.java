package com.codeheadsystems.iracing.client.model;

/**
 * Why a call to the data client produced no value.
 */
public enum FailureKind {
  /**
   * The handshake or refresh was rejected, or no token could be obtained.
   */
  AUTHENTICATION_FAILURE,
  /**
   * Every attempt was consumed by 429 throttling or 401 re-authentication.
   */
  RATE_LIMIT_EXHAUSTED,
  /**
   * The API answered 503; it is in maintenance and retrying will not help.
   */
  SERVICE_UNAVAILABLE,
  /**
   * The payload could not be decoded, was not the expected shape, or linked to another link.
   */
  MALFORMED_PAYLOAD,
  /**
   * Timeout, connection, TLS or interruption failure.
   */
  TRANSPORT_ERROR,
  /**
   * Any other non-200 status.
   */
  UNEXPECTED_STATUS
}
