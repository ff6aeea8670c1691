package com.example.keyrotator.core.secrets;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * SMTP credential secret payload.
 *
 * <p>Stored as JSON with the keys {@code SMTP_USERNAME}, {@code SMTP_SECRET}, {@code SMTP_PASSWORD}
 * and {@code SMTP_REGION}. Any other top-level fields (host, port, sender address, ...) are kept in
 * {@link #attributes()} and written back unchanged.
 *
 * @param username IAM access key id, also the SMTP user name
 * @param secretAccessKey IAM secret access key
 * @param password SES SMTP password derived from the secret access key
 * @param region SES region the password was derived for
 * @param attributes additional fields, in document order
 */
public record SmtpSecret(
    String username,
    String secretAccessKey,
    String password,
    String region,
    Map<String, JsonNode> attributes) {

  public SmtpSecret {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(secretAccessKey, "secretAccessKey");
    Objects.requireNonNull(password, "password");
    Objects.requireNonNull(region, "region");
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  /**
   * Returns a copy carrying a different access key and the password derived from it.
   *
   * @param accessKeyId new access key id
   * @param newSecretAccessKey new secret access key
   * @param newPassword SMTP password derived from {@code newSecretAccessKey}
   * @return the updated secret; region and attributes are unchanged
   */
  public SmtpSecret withCredentials(
      final String accessKeyId, final String newSecretAccessKey, final String newPassword) {
    return new SmtpSecret(accessKeyId, newSecretAccessKey, newPassword, region, attributes);
  }

  @Override
  public String toString() {
    return "SmtpSecret[username="
        + username
        + ", region="
        + region
        + ", attributes="
        + attributes.keySet()
        + "]";
  }
}
