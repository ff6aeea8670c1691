package com.example.keyrotator.core.secrets;

import static org.junit.jupiter.api.Assertions.*;

import com.example.keyrotator.core.RotationException;
import com.example.keyrotator.core.RotationException.Reason;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SecretHelperTest {

  private static final String SECRET_ID = "smtp/credentials";
  private static final String TOKEN = "version-b";

  private static final String VALID_JSON =
      """
      {
        "SMTP_HOST": "email-smtp.eu-west-1.amazonaws.com",
        "SMTP_USERNAME": "AKIAOLD",
        "SMTP_SECRET": "old-secret",
        "SMTP_PASSWORD": "old-password",
        "SMTP_REGION": "eu-west-1",
        "SMTP_PORT": 587
      }
      """;

  private InMemorySecretStore store;
  private SecretHelper helper;

  @BeforeEach
  void setUp() {
    store = new InMemorySecretStore(SECRET_ID);
    helper = new SecretHelper(store);
  }

  @Test
  @DisplayName("Should parse the credential fields and keep the others as attributes")
  void shouldParseValidSecret() {
    final var secret = helper.parse(SECRET_ID, TOKEN, VALID_JSON);

    assertEquals("AKIAOLD", secret.username());
    assertEquals("old-secret", secret.secretAccessKey());
    assertEquals("old-password", secret.password());
    assertEquals("eu-west-1", secret.region());
    assertEquals(
        "email-smtp.eu-west-1.amazonaws.com", secret.attributes().get("SMTP_HOST").asText());
    assertEquals(587, secret.attributes().get("SMTP_PORT").asInt());
    assertEquals(2, secret.attributes().size());
  }

  @ParameterizedTest
  @ValueSource(strings = {"SMTP_USERNAME", "SMTP_SECRET", "SMTP_PASSWORD", "SMTP_REGION"})
  @DisplayName("Should reject a payload missing a required field")
  void shouldRejectMissingField(final String field) throws Exception {
    final var mapper = new ObjectMapper();
    final var node = mapper.readTree(VALID_JSON);
    ((ObjectNode) node).remove(field);

    final var thrown =
        assertThrows(
            RotationException.class,
            () -> helper.parse(SECRET_ID, TOKEN, mapper.writeValueAsString(node)));

    assertEquals(Reason.SCHEMA_VIOLATION, thrown.reason());
    assertTrue(thrown.getMessage().contains(field));
    assertTrue(thrown.getMessage().contains(SECRET_ID));
    assertTrue(thrown.getMessage().contains(TOKEN));
  }

  @Test
  @DisplayName("Should reject a non-textual required field")
  void shouldRejectNonTextualField() {
    final var json = VALID_JSON.replace("\"eu-west-1\"", "null");

    final var thrown =
        assertThrows(RotationException.class, () -> helper.parse(SECRET_ID, TOKEN, json));
    assertEquals(Reason.SCHEMA_VIOLATION, thrown.reason());
  }

  @ParameterizedTest
  @ValueSource(strings = {"SMTP_USERNAME", "SMTP_SECRET", "SMTP_PASSWORD", "SMTP_REGION"})
  @DisplayName("Should reject a required field holding a blank string")
  void shouldRejectBlankField(final String field) throws Exception {
    final var mapper = new ObjectMapper();
    final var node = (ObjectNode) mapper.readTree(VALID_JSON);
    node.put(field, "  ");

    final var thrown =
        assertThrows(
            RotationException.class,
            () -> helper.parse(SECRET_ID, TOKEN, mapper.writeValueAsString(node)));

    assertEquals(Reason.SCHEMA_VIOLATION, thrown.reason());
    assertTrue(thrown.getMessage().contains(field));
    assertTrue(thrown.getMessage().contains(TOKEN));
  }

  @ParameterizedTest
  @ValueSource(strings = {"not json", "[1, 2]", "\"text\"", ""})
  @DisplayName("Should reject values that are not JSON objects")
  void shouldRejectNonObjects(final String json) {
    final var thrown =
        assertThrows(RotationException.class, () -> helper.parse(SECRET_ID, TOKEN, json));
    assertEquals(Reason.SCHEMA_VIOLATION, thrown.reason());
  }

  @Test
  @DisplayName("Should fail with SECRET_NOT_FOUND when no value carries the stage")
  void shouldFailWhenStageHasNoValue() {
    store.withPlaceholder(TOKEN, SecretStore.PENDING);

    final var thrown =
        assertThrows(
            RotationException.class,
            () -> helper.getSecret(SECRET_ID, SecretStore.PENDING, TOKEN));
    assertEquals(Reason.SECRET_NOT_FOUND, thrown.reason());
    assertFalse(helper.hasSecret(SECRET_ID, SecretStore.PENDING, TOKEN));
  }

  @Test
  @DisplayName("Should only read a version under the requested stage")
  void shouldValidateTokenAgainstStage() {
    store.withVersion("version-a", VALID_JSON, SecretStore.CURRENT);

    assertEquals("AKIAOLD", helper.getSecret(SECRET_ID, SecretStore.CURRENT).username());
    assertThrows(
        RotationException.class,
        () -> helper.getSecret(SECRET_ID, SecretStore.PENDING, "version-a"));
  }

  @Test
  @DisplayName("Should write a pending version that reads back with its attributes")
  void shouldWritePendingVersion() {
    store.withPlaceholder(TOKEN, SecretStore.PENDING);
    final var secret =
        helper.parse(SECRET_ID, TOKEN, VALID_JSON).withCredentials("AKIANEW", "new", "pwd");

    helper.putPendingSecret(SECRET_ID, TOKEN, secret);

    assertEquals(secret, helper.getSecret(SECRET_ID, SecretStore.PENDING, TOKEN));
    assertTrue(store.stages(TOKEN).contains(SecretStore.PENDING));
    assertTrue(store.secretString(TOKEN).contains("\"SMTP_PORT\":587"));
  }

  @Test
  @DisplayName("Should not print credentials in toString")
  void shouldNotPrintCredentials() {
    final var secret = helper.parse(SECRET_ID, TOKEN, VALID_JSON);

    assertFalse(secret.toString().contains("old-secret"));
    assertFalse(secret.toString().contains("old-password"));
  }
}
