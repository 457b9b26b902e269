package com.codeheadsystems.iracing.client.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class BlobResponseTest {

  @Test
  void equals_comparesBodyByReference() {
    byte[] body = "[]".getBytes(StandardCharsets.UTF_8);

    assertThat(new BlobResponse(200, body)).isEqualTo(new BlobResponse(200, body));
    assertThat(new BlobResponse(200, body)).isNotEqualTo(new BlobResponse(200, body.clone()));
  }
}
