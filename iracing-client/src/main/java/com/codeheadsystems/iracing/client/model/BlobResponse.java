package com.codeheadsystems.iracing.client.model;

/**
 * Raw response of an unauthenticated blob-storage fetch.
 * <p>
 * {@code equals} and {@code hashCode} compare {@code body} by reference, not by content.
 *
 * @param statusCode the HTTP status
 * @param body       the undecoded response bytes
 */
public record BlobResponse(int statusCode, byte[] body) {
}
