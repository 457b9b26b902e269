package com.codeheadsystems.iracing.client.accessor;

import com.codeheadsystems.iracing.client.config.IRacingClientConfig;
import com.codeheadsystems.iracing.client.exceptions.IRacingAccessorException;
import com.codeheadsystems.iracing.client.model.BlobResponse;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unauthenticated GET of pre-signed blob-storage URLs: the targets of {@code link} responses
 * and the files of chunked datasets. No bearer token is attached; the URL itself carries the
 * signature.
 */
@Singleton
public class BlobAccessor {

  private static final Logger log = LoggerFactory.getLogger(BlobAccessor.class);

  private final HttpClient httpClient;
  private final IRacingClientConfig config;

  @Inject
  public BlobAccessor(final HttpClient httpClient, final IRacingClientConfig config) {
    log.info("BlobAccessor()");
    this.httpClient = httpClient;
    this.config = config;
  }

  /**
   * Fetches the raw bytes at the given URL.
   *
   * @param url absolute URL
   * @return status and body bytes
   */
  public BlobResponse fetch(final URI url) {
    log.trace("fetch(host={})", url.getHost());
    try {
      HttpRequest request = HttpRequest.newBuilder()
          .uri(url)
          .timeout(config.requestTimeout())
          .GET()
          .build();
      HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
      return new BlobResponse(response.statusCode(), response.body());
    } catch (IOException e) {
      throw new IRacingAccessorException("Blob request failed for host: " + url.getHost(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IRacingAccessorException("Blob request interrupted for host: " + url.getHost(), e);
    }
  }
}
