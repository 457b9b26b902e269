package com.codeheadsystems.iracing.client.manager;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes blob-storage payloads, which arrive either as plain UTF-8 JSON or as gzip-compressed
 * JSON with no reliable content-type to tell the two apart. Plain JSON is tried first.
 */
@Singleton
public class PayloadDecoder {

  private static final Logger log = LoggerFactory.getLogger(PayloadDecoder.class);

  private final ObjectMapper objectMapper;

  @Inject
  public PayloadDecoder(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Decodes the bytes as JSON, inflating them first if they are not plain JSON.
   *
   * @param bytes the raw payload
   * @return the parsed JSON, or empty if neither form parses
   */
  public Optional<JsonNode> decode(final byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      return Optional.empty();
    }
    Optional<JsonNode> plain = parseUtf8(bytes);
    if (plain.isPresent()) {
      return plain;
    }
    try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
      return parseUtf8(in.readAllBytes());
    } catch (IOException e) {
      log.debug("Payload is neither JSON nor gzip-compressed JSON: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<JsonNode> parseUtf8(final byte[] bytes) {
    try {
      String text = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
      JsonNode node = objectMapper.readTree(text);
      if (node == null || node.isMissingNode()) {
        return Optional.empty();
      }
      return Optional.of(node);
    } catch (IOException e) {
      log.trace("Not plain JSON: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
