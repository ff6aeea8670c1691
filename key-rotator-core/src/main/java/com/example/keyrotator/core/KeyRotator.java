package com.example.keyrotator.core;

import static com.example.keyrotator.core.secrets.SecretStore.CURRENT;
import static com.example.keyrotator.core.secrets.SecretStore.PENDING;
import static java.lang.System.Logger.Level.INFO;

import com.example.keyrotator.core.RotationException.Reason;
import com.example.keyrotator.core.iam.AccessKeyVerificationException;
import com.example.keyrotator.core.secrets.SecretHelper;
import com.example.keyrotator.core.smtp.SmtpPasswordDeriver;
import java.lang.System.Logger;
import java.util.Map;
import java.util.Objects;

/**
 * Drives one step of an access key rotation.
 *
 * <h2>Steps</h2>
 *
 * <ul>
 *   <li>{@code createSecret} deletes every access key except the current one, creates a new key and
 *       stores it, with its SMTP password, as the pending version.
 *   <li>{@code setSecret} does nothing: IAM issues the key, so there is nothing to push.
 *   <li>{@code testSecret} authenticates with the pending key and checks it resolves to the
 *       configured user.
 *   <li>{@code finishSecret} moves {@code AWSCURRENT} to the pending version.
 * </ul>
 *
 * <p>Every step may be re-invoked with the same token after a partial failure. Stage information
 * is read fresh from the store on every call. Failures are thrown as {@link RotationException} and
 * left to the caller to log.
 *
 * <pre>{@code
 * var rotator = new KeyRotator(RotationContext.aws(RotationConfig.fromEnvironment()));
 * rotator.advance(secretArn, clientRequestToken, "createSecret");
 * }</pre>
 */
public final class KeyRotator {

  private static final Logger logger = System.getLogger(KeyRotator.class.getName());

  private final RotationContext context;
  private final SecretHelper secrets;

  public KeyRotator(final RotationContext context) {
    this(context, new SecretHelper(context.secretStore()));
  }

  KeyRotator(final RotationContext context, final SecretHelper secrets) {
    this.context = Objects.requireNonNull(context, "context");
    this.secrets = Objects.requireNonNull(secrets, "secrets");
  }

  /**
   * Runs one rotation step given its wire value.
   *
   * <p>The version is validated before the step is resolved, so an already-current version
   * succeeds whatever the step value.
   *
   * @param secretId secret ARN or name
   * @param token client request token, the id of the version being rotated in
   * @param step step value, e.g. {@code createSecret}
   * @return how the step ended
   * @throws RotationException if the version or step is invalid or the step fails
   */
  public RotationOutcome advance(final String secretId, final String token, final String step) {
    if (isAlreadyCurrent(secretId, token)) return RotationOutcome.ALREADY_CURRENT;
    final var resolved =
        RotationStep.fromValue(step)
            .orElseThrow(
                () ->
                    new RotationException(
                        Reason.UNKNOWN_STEP, secretId, token, "invalid step parameter " + step));
    return run(secretId, token, resolved);
  }

  /**
   * Runs one rotation step.
   *
   * @param secretId secret ARN or name
   * @param token client request token, the id of the version being rotated in
   * @param step the step
   * @return how the step ended
   * @throws RotationException if the version is invalid or the step fails
   */
  public RotationOutcome advance(
      final String secretId, final String token, final RotationStep step) {
    if (isAlreadyCurrent(secretId, token)) return RotationOutcome.ALREADY_CURRENT;
    if (step == null)
      throw new RotationException(Reason.UNKNOWN_STEP, secretId, token, "step is required");
    return run(secretId, token, step);
  }

  private RotationOutcome run(final String secretId, final String token, final RotationStep step) {
    return switch (step) {
      case CREATE_SECRET -> createSecret(secretId, token);
      case SET_SECRET -> setSecret(secretId, token);
      case TEST_SECRET -> testSecret(secretId, token);
      case FINISH_SECRET -> finishSecret(secretId, token);
    };
  }

  /**
   * Checks that {@code token} is a version under rotation.
   *
   * @return true if the version already carries {@code AWSCURRENT}
   */
  private boolean isAlreadyCurrent(final String secretId, final String token) {
    final var metadata = context.secretStore().describeSecret(secretId);
    if (!metadata.rotationEnabled())
      throw fail(Reason.NOT_CONFIGURED, secretId, token, "secret is not enabled for rotation");
    if (!metadata.versionStages().containsKey(token))
      throw fail(Reason.UNKNOWN_VERSION, secretId, token, "version has no stage for rotation");

    final var stages = metadata.stagesOf(token);
    if (stages.contains(CURRENT)) {
      logger.log(
          INFO, "Secret version {0} already set as {1} for secret {2}", token, CURRENT, secretId);
      return true;
    }
    if (!stages.contains(PENDING))
      throw fail(Reason.INVALID_STAGE, secretId, token, "version not set as " + PENDING);
    return false;
  }

  private RotationOutcome createSecret(final String secretId, final String token) {
    if (secrets.hasSecret(secretId, PENDING, token)) {
      logger.log(
          INFO,
          "createSecret: pending value already exists for version {0} of {1}",
          token,
          secretId);
      return RotationOutcome.PENDING_EXISTS;
    }

    final var current = secrets.getSecret(secretId, CURRENT);
    final var userName = context.userName();
    final var identityProvider = context.identityProvider();

    for (final var accessKeyId : identityProvider.listAccessKeys(userName)) {
      if (!accessKeyId.equals(current.username())) {
        identityProvider.deleteAccessKey(userName, accessKeyId);
        logger.log(INFO, "createSecret: deleted access key {0} of {1}", accessKeyId, userName);
      }
    }

    final var accessKey = identityProvider.createAccessKey(userName);
    logger.log(
        INFO, "createSecret: created access key {0} for {1}", accessKey.accessKeyId(), userName);

    final var pending =
        current.withCredentials(
            accessKey.accessKeyId(),
            accessKey.secretAccessKey(),
            SmtpPasswordDeriver.derive(accessKey.secretAccessKey(), current.region()));
    secrets.putPendingSecret(secretId, token, pending);
    logger.log(INFO, "createSecret: stored version {0} of {1} as {2}", token, secretId, PENDING);
    return RotationOutcome.COMPLETED;
  }

  private RotationOutcome setSecret(final String secretId, final String token) {
    logger.log(INFO, "setSecret: nothing to set for version {0} of {1}", token, secretId);
    return RotationOutcome.NOTHING_TO_SET;
  }

  private RotationOutcome testSecret(final String secretId, final String token) {
    logger.log(
        INFO, "testSecret: fetching {0} stage of version {1} for {2}", PENDING, token, secretId);
    final var pending = secrets.getSecret(secretId, PENDING, token);

    final String identity;
    try {
      identity = context.verifier().verify(pending.username(), pending.secretAccessKey());
    } catch (final AccessKeyVerificationException e) {
      throw fail(Reason.VERIFICATION_EXHAUSTED, secretId, token, e.getMessage(), e);
    }

    if (!context.userName().equals(identity)) {
      throw RotationException.verificationFailed(secretId, token, context.userName(), identity);
    }

    logger.log(
        INFO, "testSecret: authenticated as {0} for version {1} of {2}", identity, token, secretId);
    return RotationOutcome.COMPLETED;
  }

  private RotationOutcome finishSecret(final String secretId, final String token) {
    final var metadata = context.secretStore().describeSecret(secretId);

    final var current =
        metadata.versionStages().entrySet().stream()
            .filter(entry -> entry.getValue().contains(CURRENT))
            .map(Map.Entry::getKey)
            .toList();
    if (current.contains(token)) {
      logger.log(
          INFO,
          "finishSecret: version {0} already marked as {1} for {2}",
          token,
          CURRENT,
          secretId);
      return RotationOutcome.ALREADY_CURRENT;
    }
    if (current.size() > 1)
      throw fail(
          Reason.INVALID_STAGE,
          secretId,
          token,
          "several versions marked " + CURRENT + ": " + current);

    final var previous = current.isEmpty() ? null : current.get(0);
    context.secretStore().updateVersionStage(secretId, CURRENT, token, previous);
    logger.log(
        INFO, "finishSecret: set {0} stage to version {1} for {2}", CURRENT, token, secretId);
    return RotationOutcome.COMPLETED;
  }

  private static RotationException fail(
      final Reason reason, final String secretId, final String token, final String message) {
    return fail(reason, secretId, token, message, null);
  }

  private static RotationException fail(
      final Reason reason,
      final String secretId,
      final String token,
      final String message,
      final Throwable cause) {
    return new RotationException(reason, secretId, token, message, cause);
  }
}
