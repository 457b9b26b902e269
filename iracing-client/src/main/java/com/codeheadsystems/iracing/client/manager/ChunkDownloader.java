package com.codeheadsystems.iracing.client.manager;

import com.codeheadsystems.iracing.client.accessor.BlobAccessor;
import com.codeheadsystems.iracing.client.config.ChunkPolicy;
import com.codeheadsystems.iracing.client.config.IRacingClientConfig;
import com.codeheadsystems.iracing.client.exceptions.IRacingAccessorException;
import com.codeheadsystems.iracing.client.model.ApiResult;
import com.codeheadsystems.iracing.client.model.BlobResponse;
import com.codeheadsystems.iracing.client.model.FailureKind;
import com.codeheadsystems.iracing.model.ChunkDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads bulk datasets that the data API offloaded to blob storage as chunk files.
 * <p>
 * Chunk URLs are independent, pre-signed and short-lived, so this path does not go through
 * the {@link RequestDispatcher}: no scheduling lock, no retries, no shared attempt budget. Each
 * chunk must decode (as plain or gzip-compressed JSON) to an array; the records of all fetched
 * chunks are returned in order.
 * <p>
 * With {@link ChunkPolicy#FIRST_ONLY} only the first chunk is fetched and larger datasets are
 * truncated; {@link ChunkPolicy#ALL} fetches every chunk.
 */
@Singleton
public class ChunkDownloader {

  private static final Logger log = LoggerFactory.getLogger(ChunkDownloader.class);

  private final TokenLifecycleManager tokenLifecycleManager;
  private final BlobAccessor blobAccessor;
  private final PayloadDecoder payloadDecoder;
  private final ChunkPolicy chunkPolicy;

  @Inject
  public ChunkDownloader(final TokenLifecycleManager tokenLifecycleManager,
                         final BlobAccessor blobAccessor,
                         final PayloadDecoder payloadDecoder,
                         final IRacingClientConfig config) {
    log.info("ChunkDownloader(chunkPolicy={})", config.chunkPolicy());
    this.tokenLifecycleManager = tokenLifecycleManager;
    this.blobAccessor = blobAccessor;
    this.payloadDecoder = payloadDecoder;
    this.chunkPolicy = config.chunkPolicy();
  }

  /**
   * Downloads the records of a chunked dataset.
   *
   * @param descriptor the chunk descriptor from a data response
   * @return the records, or the reason there are none
   */
  public ApiResult<List<JsonNode>> downloadChunks(final ChunkDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor");
    int available = descriptor.chunkFileNames().size();
    int wanted = chunkPolicy == ChunkPolicy.ALL ? available : 1;
    log.debug("downloadChunks(chunks={}, fetching={})", available, wanted);
    if (wanted < available) {
      log.debug("Fetching only the first of {} chunks; remaining rows are not downloaded", available);
    }

    if (!tokenLifecycleManager.ensureAuthenticated()) {
      // Chunk URLs are pre-signed; a failed login does not stop the download.
      log.warn("Not authenticated; downloading chunks with their pre-signed URLs only");
    }

    List<JsonNode> records = new ArrayList<>();
    for (int index = 0; index < wanted; index++) {
      ApiResult<JsonNode> chunk = downloadChunk(descriptor, index);
      if (!chunk.isSuccess()) {
        return ApiResult.failure(chunk.failure());
      }
      chunk.value().forEach(records::add);
    }
    log.debug("Downloaded {} records from {} chunk(s)", records.size(), wanted);
    return ApiResult.success(List.copyOf(records));
  }

  private ApiResult<JsonNode> downloadChunk(final ChunkDescriptor descriptor, final int index) {
    String fileName = descriptor.chunkFileNames().get(index);
    final URI uri;
    try {
      uri = URI.create(descriptor.chunkUrl(index));
    } catch (IllegalArgumentException e) {
      log.error("Chunk URL for {} is invalid: {}", fileName, e.getMessage());
      return ApiResult.failure(FailureKind.MALFORMED_PAYLOAD);
    }

    final BlobResponse response;
    try {
      response = blobAccessor.fetch(uri);
    } catch (IRacingAccessorException e) {
      log.error("Error downloading chunk {}: {}", fileName, e.getMessage(), e);
      return ApiResult.failure(FailureKind.TRANSPORT_ERROR);
    }
    if (response.statusCode() != 200) {
      log.error("Failed to download chunk {}: HTTP {}", fileName, response.statusCode());
      return ApiResult.failure(FailureKind.UNEXPECTED_STATUS);
    }

    Optional<JsonNode> decoded = payloadDecoder.decode(response.body());
    if (decoded.isEmpty()) {
      log.error("Chunk {} is neither JSON nor gzip-compressed JSON", fileName);
      return ApiResult.failure(FailureKind.MALFORMED_PAYLOAD);
    }
    if (!decoded.get().isArray()) {
      log.error("Chunk {} is a JSON {}, expected an array", fileName, decoded.get().getNodeType());
      return ApiResult.failure(FailureKind.MALFORMED_PAYLOAD);
    }
    return ApiResult.success(decoded.get());
  }
}
