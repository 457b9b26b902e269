package com.codeheadsystems.iracing.client.manager;

import com.codeheadsystems.iracing.client.model.Credentials;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import javax.inject.Singleton;

/**
 * Derives the masked form of a secret that the OAuth server expects in place of the secret:
 * {@code base64(sha256(utf8(secret + lowercase(identifier))))}.
 * <p>
 * The password is masked against the account identity and the client secret against the
 * client id. Any deviation in order, casing or encoding produces a value the server silently
 * rejects.
 */
@Singleton
public class CredentialMasker {

  private static final Base64.Encoder B64 = Base64.getEncoder();

  /**
   * Masks a secret against an identifier.
   *
   * @param secret     the secret
   * @param identifier the identifier; lower-cased before use
   * @return the base64-encoded SHA-256 digest
   */
  public String mask(final String secret, final String identifier) {
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(identifier, "identifier");
    byte[] input = (secret + identifier.toLowerCase(Locale.ROOT)).getBytes(StandardCharsets.UTF_8);
    return B64.encodeToString(sha256().digest(input));
  }

  public String maskedPassword(final Credentials credentials) {
    return mask(credentials.password(), credentials.identity());
  }

  public String maskedClientSecret(final Credentials credentials) {
    return mask(credentials.clientSecret(), credentials.clientId());
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }
}
