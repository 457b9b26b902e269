package com.codeheadsystems.iracing.client.model;

import java.net.http.HttpHeaders;
import java.util.Optional;

/**
 * Raw response of an authenticated data API call, before status handling.
 *
 * @param statusCode the HTTP status
 * @param headers    the response headers
 * @param body       the response body as text
 */
public record DataResponse(int statusCode, HttpHeaders headers, String body) {

  /**
   * First value of the named header, matched case-insensitively.
   *
   * @param name header name
   * @return the value, if present
   */
  public Optional<String> header(String name) {
    return headers.firstValue(name);
  }
}
