package com.codeheadsystems.iracing.client;

import com.codeheadsystems.iracing.client.accessor.BlobAccessor;
import com.codeheadsystems.iracing.client.accessor.DataAccessor;
import com.codeheadsystems.iracing.client.accessor.TokenAccessor;
import com.codeheadsystems.iracing.client.config.HttpClientFactory;
import com.codeheadsystems.iracing.client.config.IRacingClientConfig;
import com.codeheadsystems.iracing.client.manager.ChunkDownloader;
import com.codeheadsystems.iracing.client.manager.CredentialMasker;
import com.codeheadsystems.iracing.client.manager.IndirectLinkResolver;
import com.codeheadsystems.iracing.client.manager.PayloadDecoder;
import com.codeheadsystems.iracing.client.manager.RequestDispatcher;
import com.codeheadsystems.iracing.client.manager.SchedulingClock;
import com.codeheadsystems.iracing.client.manager.Session;
import com.codeheadsystems.iracing.client.manager.TokenLifecycleManager;
import com.codeheadsystems.iracing.client.model.ApiResult;
import com.codeheadsystems.iracing.client.model.Credentials;
import com.codeheadsystems.iracing.model.ChunkDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for code that consumes the iRacing data API.
 * <p>
 * One instance owns one {@link Session}, so every request made through it shares the same
 * tokens and rate-limit bookkeeping. Instances are safe to use from many threads at once.
 * <pre>
 *   try (IRacingDataClient client = IRacingDataClient.create(IRacingClientConfig.defaults(), credentials)) {
 *     ApiResult&lt;JsonNode&gt; info = client.get("/data/member/info");
 *   }
 * </pre>
 */
@Singleton
public class IRacingDataClient implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(IRacingDataClient.class);

  private final Session session;
  private final TokenLifecycleManager tokenLifecycleManager;
  private final RequestDispatcher requestDispatcher;
  private final ChunkDownloader chunkDownloader;

  @Inject
  public IRacingDataClient(final Session session,
                           final TokenLifecycleManager tokenLifecycleManager,
                           final RequestDispatcher requestDispatcher,
                           final ChunkDownloader chunkDownloader) {
    log.info("IRacingDataClient()");
    this.session = session;
    this.tokenLifecycleManager = tokenLifecycleManager;
    this.requestDispatcher = requestDispatcher;
    this.chunkDownloader = chunkDownloader;
  }

  /**
   * Wires a client with its own HTTP client, object mapper and session.
   *
   * @param config      the client config
   * @param credentials the account and OAuth client credentials
   * @return the client
   */
  public static IRacingDataClient create(final IRacingClientConfig config, final Credentials credentials) {
    return create(config, credentials, HttpClientFactory.create(config), SchedulingClock.SYSTEM);
  }

  /**
   * Wires a client around a supplied HTTP client and clock.
   *
   * @param config      the client config
   * @param credentials the account and OAuth client credentials
   * @param httpClient  the http client
   * @param clock       the scheduling clock
   * @return the client
   */
  public static IRacingDataClient create(final IRacingClientConfig config,
                                         final Credentials credentials,
                                         final HttpClient httpClient,
                                         final SchedulingClock clock) {
    ObjectMapper objectMapper = new ObjectMapper();
    Session session = new Session(clock, config);
    TokenLifecycleManager tokens = new TokenLifecycleManager(session,
        new TokenAccessor(httpClient, objectMapper, config), new CredentialMasker(), credentials);
    BlobAccessor blobAccessor = new BlobAccessor(httpClient, config);
    PayloadDecoder payloadDecoder = new PayloadDecoder(objectMapper);
    RequestDispatcher dispatcher = new RequestDispatcher(session, tokens,
        new DataAccessor(httpClient, config), new IndirectLinkResolver(blobAccessor, payloadDecoder),
        objectMapper, config);
    ChunkDownloader chunkDownloader = new ChunkDownloader(tokens, blobAccessor, payloadDecoder, config);
    return new IRacingDataClient(session, tokens, dispatcher, chunkDownloader);
  }

  /**
   * Authenticated GET of a data endpoint.
   *
   * @param endpoint    path such as {@code /data/member/info}
   * @param queryParams query parameters
   * @return the payload or a failure
   */
  public ApiResult<JsonNode> get(final String endpoint, final Map<String, String> queryParams) {
    return requestDispatcher.get(endpoint, queryParams);
  }

  public ApiResult<JsonNode> get(final String endpoint) {
    return requestDispatcher.get(endpoint, Map.of());
  }

  /**
   * Downloads the records of a chunked dataset.
   *
   * @param descriptor the chunk descriptor from an earlier {@link #get} response
   * @return the records or a failure
   */
  public ApiResult<List<JsonNode>> downloadChunks(final ChunkDescriptor descriptor) {
    return chunkDownloader.downloadChunks(descriptor);
  }

  /**
   * Logs in eagerly instead of on the first request.
   *
   * @return true if the handshake succeeded
   */
  public boolean authenticate() {
    return tokenLifecycleManager.authenticate();
  }

  public boolean isAuthenticated() {
    session.lock();
    try {
      return session.isAuthenticated();
    } finally {
      session.unlock();
    }
  }

  /**
   * Drops the session's tokens. A later call authenticates again from scratch.
   */
  @Override
  public void close() {
    log.info("close()");
    session.close();
  }
}
