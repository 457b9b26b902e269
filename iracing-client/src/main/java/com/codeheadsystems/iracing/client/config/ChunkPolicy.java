package com.codeheadsystems.iracing.client.config;

/**
 * How many chunks of a bulk dataset the chunk downloader fetches.
 */
public enum ChunkPolicy {
  /**
   * Fetch only the first chunk. Cheap, but truncates datasets that span several chunks.
   */
  FIRST_ONLY,
  /**
   * Fetch every chunk in order and concatenate their records.
   */
  ALL
}
