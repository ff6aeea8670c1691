package com.example.keyrotator.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Failure of a rotation step. The message always names the secret and the version token so the
 * failure can be matched to the rotation the orchestrator is driving.
 */
public class RotationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Why the step failed. */
  public enum Reason {
    /** The secret does not have rotation enabled. */
    NOT_CONFIGURED,
    /** The token is not a version of the secret. */
    UNKNOWN_VERSION,
    /** The version is neither current nor pending, or the current stage is ambiguous. */
    INVALID_STAGE,
    /** The step value is not one of the rotation steps. */
    UNKNOWN_STEP,
    /** A secret value required by the step does not exist. */
    SECRET_NOT_FOUND,
    /** A secret value is not a JSON object with every required field. */
    SCHEMA_VIOLATION,
    /** The pending credential authenticated as a different principal. */
    VERIFICATION_FAILED,
    /** The pending credential never authenticated within the retry budget. */
    VERIFICATION_EXHAUSTED
  }

  private final Reason reason;
  private final String secretId;
  private final String token;
  private final String resolvedIdentity;

  public RotationException(
      final Reason reason, final String secretId, final String token, final String message) {
    this(reason, secretId, token, message, null, null);
  }

  public RotationException(
      final Reason reason,
      final String secretId,
      final String token,
      final String message,
      final Throwable cause) {
    this(reason, secretId, token, message, null, cause);
  }

  private RotationException(
      final Reason reason,
      final String secretId,
      final String token,
      final String message,
      final String resolvedIdentity,
      final Throwable cause) {
    super(
        "%s: %s (secret %s, version %s)".formatted(reason, message, secretId, token), cause);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.secretId = secretId;
    this.token = token;
    this.resolvedIdentity = resolvedIdentity;
  }

  /**
   * Creates the failure for a pending credential that authenticated as the wrong principal.
   *
   * @param secretId secret being rotated
   * @param token version token
   * @param expected principal the credential should resolve to
   * @param resolvedIdentity principal it actually resolved to
   * @return the exception
   */
  public static RotationException verificationFailed(
      final String secretId,
      final String token,
      final String expected,
      final String resolvedIdentity) {
    return new RotationException(
        Reason.VERIFICATION_FAILED,
        secretId,
        token,
        "authenticated as " + resolvedIdentity + " but expected " + expected,
        resolvedIdentity,
        null);
  }

  public Reason reason() {
    return reason;
  }

  public String secretId() {
    return secretId;
  }

  public String token() {
    return token;
  }

  /**
   * @return the principal the pending credential resolved to, for {@link
   *     Reason#VERIFICATION_FAILED}
   */
  public Optional<String> resolvedIdentity() {
    return Optional.ofNullable(resolvedIdentity);
  }
}
