package com.example.keyrotator.core.secrets;

import com.example.keyrotator.core.RotationException;
import com.example.keyrotator.core.RotationException.Reason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads and writes {@link SmtpSecret} payloads through a {@link SecretStore}.
 *
 * <p>Every read is validated: the value must be a JSON object whose four credential fields are
 * non-blank strings, otherwise the read fails with {@link Reason#SCHEMA_VIOLATION} before the
 * payload reaches any caller.
 */
public final class SecretHelper {

  public static final String USERNAME_FIELD = "SMTP_USERNAME";
  public static final String SECRET_FIELD = "SMTP_SECRET";
  public static final String PASSWORD_FIELD = "SMTP_PASSWORD";
  public static final String REGION_FIELD = "SMTP_REGION";

  private static final List<String> REQUIRED_FIELDS =
      List.of(USERNAME_FIELD, SECRET_FIELD, PASSWORD_FIELD, REGION_FIELD);

  private final SecretStore store;
  private final ObjectMapper mapper;

  public SecretHelper(final SecretStore store) {
    this(store, new ObjectMapper());
  }

  public SecretHelper(final SecretStore store, final ObjectMapper mapper) {
    this.store = Objects.requireNonNull(store, "store");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Reads the version carrying {@code stage}.
   *
   * @param secretId secret ARN or name
   * @param stage stage label
   * @return the validated payload
   * @throws RotationException {@link Reason#SECRET_NOT_FOUND} or {@link Reason#SCHEMA_VIOLATION}
   */
  public SmtpSecret getSecret(final String secretId, final String stage) {
    return getSecret(secretId, stage, null);
  }

  /**
   * Reads version {@code token}, which must carry {@code stage}.
   *
   * @param secretId secret ARN or name
   * @param stage stage label
   * @param token version id, or {@code null} to read whichever version carries the stage
   * @return the validated payload
   * @throws RotationException {@link Reason#SECRET_NOT_FOUND} or {@link Reason#SCHEMA_VIOLATION}
   */
  public SmtpSecret getSecret(final String secretId, final String stage, final String token) {
    final var json =
        store
            .getSecretString(secretId, stage, token)
            .orElseThrow(
                () ->
                    new RotationException(
                        Reason.SECRET_NOT_FOUND,
                        secretId,
                        token,
                        "no secret value staged as " + stage));
    return parse(secretId, token, json);
  }

  /**
   * Checks whether version {@code token} already has a value staged as {@code stage}.
   *
   * @param secretId secret ARN or name
   * @param stage stage label
   * @param token version id
   * @return true if a value exists
   */
  public boolean hasSecret(final String secretId, final String stage, final String token) {
    return store.getSecretString(secretId, stage, token).isPresent();
  }

  /**
   * Writes {@code secret} as version {@code token} staged {@link SecretStore#PENDING}.
   *
   * @param secretId secret ARN or name
   * @param token version id
   * @param secret payload to store
   */
  public void putPendingSecret(final String secretId, final String token, final SmtpSecret secret) {
    store.putSecretString(secretId, token, toJson(secret), Set.of(SecretStore.PENDING));
  }

  SmtpSecret parse(final String secretId, final String token, final String json) {
    final JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (final JsonProcessingException e) {
      throw new RotationException(
          Reason.SCHEMA_VIOLATION, secretId, token, "secret value is not valid JSON", e);
    }
    if (root == null || !root.isObject())
      throw new RotationException(
          Reason.SCHEMA_VIOLATION, secretId, token, "secret value is not a JSON object");

    for (final var field : REQUIRED_FIELDS) {
      final var value = root.get(field);
      if (value == null || !value.isTextual())
        throw new RotationException(
            Reason.SCHEMA_VIOLATION, secretId, token, field + " key is missing from secret JSON");
      if (value.asText().isBlank())
        throw new RotationException(
            Reason.SCHEMA_VIOLATION, secretId, token, field + " key is blank in secret JSON");
    }

    final var attributes = new LinkedHashMap<String, JsonNode>();
    root.fields()
        .forEachRemaining(
            entry -> {
              if (!REQUIRED_FIELDS.contains(entry.getKey()))
                attributes.put(entry.getKey(), entry.getValue());
            });

    return new SmtpSecret(
        root.get(USERNAME_FIELD).asText(),
        root.get(SECRET_FIELD).asText(),
        root.get(PASSWORD_FIELD).asText(),
        root.get(REGION_FIELD).asText(),
        attributes);
  }

  String toJson(final SmtpSecret secret) {
    final ObjectNode node = mapper.createObjectNode();
    node.setAll(secret.attributes());
    node.put(USERNAME_FIELD, secret.username());
    node.put(SECRET_FIELD, secret.secretAccessKey());
    node.put(PASSWORD_FIELD, secret.password());
    node.put(REGION_FIELD, secret.region());
    try {
      return mapper.writeValueAsString(node);
    } catch (final JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize secret", e);
    }
  }
}
