package com.codeheadsystems.iracing.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Location of a bulk dataset that the data API offloaded to blob storage.
 * <p>
 * Returned inside a data response as {@code chunk_info}. Each chunk is fetched from
 * {@code baseDownloadUrl + chunkFileName}. The URLs are pre-signed and short-lived, so a
 * descriptor should be used soon after the response that carried it.
 *
 * @param baseDownloadUrl prefix shared by every chunk URL, including the trailing slash
 * @param chunkFileNames  ordered chunk file names
 * @param rows            total row count across all chunks, when the server reports it
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChunkDescriptor(@JsonProperty("base_download_url") String baseDownloadUrl,
                              @JsonProperty("chunk_file_names") List<String> chunkFileNames,
                              @JsonProperty("rows") Integer rows) {

  public ChunkDescriptor {
    if (baseDownloadUrl == null || baseDownloadUrl.isBlank()) {
      throw new IllegalArgumentException("Missing required field: base_download_url");
    }
    if (chunkFileNames == null || chunkFileNames.isEmpty()) {
      throw new IllegalArgumentException("Missing required field: chunk_file_names");
    }
    chunkFileNames = List.copyOf(chunkFileNames);
  }

  public ChunkDescriptor(String baseDownloadUrl, List<String> chunkFileNames) {
    this(baseDownloadUrl, chunkFileNames, null);
  }

  /**
   * Reads the {@code chunk_info} object of a data response.
   *
   * @param chunkInfo the chunk_info node
   * @return the descriptor
   * @throws IllegalArgumentException if the node is not a well-formed chunk_info object
   */
  public static ChunkDescriptor fromChunkInfo(JsonNode chunkInfo) {
    if (chunkInfo == null || !chunkInfo.isObject()) {
      throw new IllegalArgumentException("chunk_info must be a JSON object");
    }
    JsonNode names = chunkInfo.path("chunk_file_names");
    if (!names.isArray()) {
      throw new IllegalArgumentException("Missing required field: chunk_file_names");
    }
    List<String> fileNames = new ArrayList<>(names.size());
    names.forEach(name -> fileNames.add(name.asText()));
    JsonNode rows = chunkInfo.path("rows");
    return new ChunkDescriptor(
        chunkInfo.path("base_download_url").asText(null),
        fileNames,
        rows.isIntegralNumber() ? rows.intValue() : null);
  }

  /**
   * Full URL of the chunk at the given position.
   *
   * @param index chunk position
   * @return the chunk URL
   */
  public String chunkUrl(int index) {
    return baseDownloadUrl + chunkFileNames.get(index);
  }
}
