package com.example.keyrotator.core;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import java.util.Map;
import java.util.Objects;

/**
 * Entry point for rotation events.
 *
 * <p>The event carries {@code SecretId}, {@code ClientRequestToken} and {@code Step}, as sent by
 * the Secrets Manager rotation schedule.
 */
public final class RotationHandler {

  private static final System.Logger LOGGER = System.getLogger(RotationHandler.class.getName());

  public static final String SECRET_ID = "SecretId";
  public static final String CLIENT_REQUEST_TOKEN = "ClientRequestToken";
  public static final String STEP = "Step";

  private final KeyRotator rotator;

  /** Creates a handler wired to AWS from {@link RotationConfig#fromEnvironment()}. */
  public RotationHandler() {
    this(new KeyRotator(RotationContext.aws(RotationConfig.fromEnvironment())));
  }

  public RotationHandler(final KeyRotator rotator) {
    this.rotator = Objects.requireNonNull(rotator, "rotator");
  }

  /**
   * Handles one rotation event.
   *
   * @param event event parameters
   * @return how the step ended
   * @throws IllegalArgumentException if a parameter is missing
   * @throws RotationException if the step fails
   */
  public RotationOutcome handleRequest(final Map<String, ?> event) {
    final var secretId = required(event, SECRET_ID);
    final var token = required(event, CLIENT_REQUEST_TOKEN);
    final var step = required(event, STEP);

    try {
      final var outcome = rotator.advance(secretId, token, step);
      LOGGER.log(INFO, "{0} for secret {1} version {2}: {3}", step, secretId, token, outcome);
      return outcome;
    } catch (final RotationException e) {
      LOGGER.log(ERROR, "{0} failed: {1}", step, e.getMessage());
      throw e;
    }
  }

  private static String required(final Map<String, ?> event, final String key) {
    final var value = event == null ? null : event.get(key);
    if (value == null || value.toString().isBlank())
      throw new IllegalArgumentException("Event parameter " + key + " is required");
    return value.toString();
  }
}
