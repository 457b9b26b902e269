package com.codeheadsystems.iracing.client.manager;

import com.codeheadsystems.iracing.client.accessor.BlobAccessor;
import com.codeheadsystems.iracing.client.exceptions.IRacingAccessorException;
import com.codeheadsystems.iracing.client.model.ApiResult;
import com.codeheadsystems.iracing.client.model.BlobResponse;
import com.codeheadsystems.iracing.client.model.FailureKind;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows the data API's payload indirection.
 * <p>
 * Many endpoints answer with {@code {"link": "<pre-signed url>", "expires": "..."}} instead of
 * the payload itself. The resolver fetches the link once, without the bearer token, and returns
 * what it points to. Exactly one level is followed: a link whose target is another link is a
 * malformed response.
 */
@Singleton
public class IndirectLinkResolver {

  static final String LINK_FIELD = "link";

  private static final Logger log = LoggerFactory.getLogger(IndirectLinkResolver.class);

  private final BlobAccessor blobAccessor;
  private final PayloadDecoder payloadDecoder;

  @Inject
  public IndirectLinkResolver(final BlobAccessor blobAccessor, final PayloadDecoder payloadDecoder) {
    log.info("IndirectLinkResolver()");
    this.blobAccessor = blobAccessor;
    this.payloadDecoder = payloadDecoder;
  }

  static boolean isLink(final JsonNode body) {
    return body != null && body.isObject() && body.has(LINK_FIELD);
  }

  /**
   * Returns the body unchanged, or the payload its link points to.
   *
   * @param body a successful data API body
   * @return the payload
   */
  public ApiResult<JsonNode> resolve(final JsonNode body) {
    if (!isLink(body)) {
      return ApiResult.success(body);
    }
    JsonNode link = body.get(LINK_FIELD);
    if (!link.isTextual() || link.asText().isBlank()) {
      log.warn("Response link is not a URL: {}", link);
      return ApiResult.failure(FailureKind.MALFORMED_PAYLOAD);
    }
    final URI uri;
    try {
      uri = URI.create(link.asText());
    } catch (IllegalArgumentException e) {
      log.warn("Response link is not a valid URI: {}", e.getMessage());
      return ApiResult.failure(FailureKind.MALFORMED_PAYLOAD);
    }
    if (!uri.isAbsolute()) {
      log.warn("Response link is not absolute: {}", uri);
      return ApiResult.failure(FailureKind.MALFORMED_PAYLOAD);
    }
    log.debug("resolve(host={})", uri.getHost());

    final BlobResponse response;
    try {
      response = blobAccessor.fetch(uri);
    } catch (IRacingAccessorException e) {
      log.error("Failed to fetch linked data: {}", e.getMessage(), e);
      return ApiResult.failure(FailureKind.TRANSPORT_ERROR);
    }
    if (response.statusCode() != 200) {
      log.error("Failed to fetch linked data: HTTP {}", response.statusCode());
      return ApiResult.failure(FailureKind.UNEXPECTED_STATUS);
    }
    Optional<JsonNode> resolved = payloadDecoder.decode(response.body());
    if (resolved.isEmpty()) {
      log.error("Linked data is not JSON ({} bytes)", response.body() == null ? 0 : response.body().length);
      return ApiResult.failure(FailureKind.MALFORMED_PAYLOAD);
    }
    if (isLink(resolved.get())) {
      log.error("Linked data is itself a link; only one level of indirection is supported");
      return ApiResult.failure(FailureKind.MALFORMED_PAYLOAD);
    }
    return ApiResult.success(resolved.get());
  }
}
