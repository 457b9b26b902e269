package com.codeheadsystems.iracing.client.manager;

import com.codeheadsystems.iracing.client.config.IRacingClientConfig;
import com.codeheadsystems.iracing.client.model.Credentials;
import com.codeheadsystems.iracing.client.model.DataResponse;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class TestFixtures {

  static final Credentials CREDENTIALS =
      new Credentials("CLunky@iracing.Com", "MyPassWord", "MyClient", "s3cr3t");

  static final IRacingClientConfig CONFIG = IRacingClientConfig
      .forTesting(URI.create("http://localhost:8080"), URI.create("http://localhost:8080/oauth2/token"))
      .withMinimumBackoff(Duration.ofSeconds(1));

  private TestFixtures() {
  }

  static HttpHeaders headers(String... namesAndValues) {
    Map<String, List<String>> map = new HashMap<>();
    for (int i = 0; i + 1 < namesAndValues.length; i += 2) {
      map.put(namesAndValues[i], List.of(namesAndValues[i + 1]));
    }
    return HttpHeaders.of(map, (name, value) -> true);
  }

  static DataResponse response(int status, String body, String... namesAndValues) {
    return new DataResponse(status, headers(namesAndValues), body);
  }
}
