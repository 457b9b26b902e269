package com.codeheadsystems.iracing.client.model;

import java.util.Objects;

/**
 * Account and OAuth client credentials. Never sent as-is: the password and the client secret
 * are masked before they go on the wire.
 *
 * @param identity     account identity (the e-mail address used to log in)
 * @param password     account password
 * @param clientId     OAuth client id
 * @param clientSecret OAuth client secret
 */
public record Credentials(String identity, String password, String clientId, String clientSecret) {

  public Credentials {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(password, "password");
    Objects.requireNonNull(clientId, "clientId");
    Objects.requireNonNull(clientSecret, "clientSecret");
  }

  @Override
  public String toString() {
    return "Credentials[identity=" + identity + ", clientId=" + clientId + "]";
  }
}
