package com.codeheadsystems.iracing.client.model;

import java.net.http.HttpHeaders;
import java.util.Map;

/**
 * One pass through the dispatcher's attempt loop, kept for logging.
 *
 * @param endpoint      the data endpoint
 * @param queryParams   the query parameters
 * @param attemptNumber zero-based attempt number
 * @param lastStatus    status the attempt received
 * @param lastHeaders   headers the attempt received
 */
public record RequestAttempt(String endpoint,
                             Map<String, String> queryParams,
                             int attemptNumber,
                             int lastStatus,
                             HttpHeaders lastHeaders) {

  @Override
  public String toString() {
    return "RequestAttempt[endpoint=" + endpoint + ", attempt=" + attemptNumber + ", status=" + lastStatus + "]";
  }
}
