package com.example.keyrotator.core.iam;

import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Confirms that a newly created access key can authenticate, tolerating IAM propagation delay.
 *
 * <p>Authentication failures are retried according to the {@link Retry.Policy}; the default is 5
 * attempts in total, 5 seconds apart. A successful call that resolves to an unexpected principal is
 * not retried here, the caller compares the returned identity.
 */
public final class AccessKeyVerifier {

  private static final System.Logger LOGGER = System.getLogger(AccessKeyVerifier.class.getName());

  public static final int DEFAULT_MAX_ATTEMPTS = 5;
  public static final Duration DEFAULT_DELAY = Duration.ofSeconds(5);

  private final IdentityCheck identityCheck;
  private final Retry.Policy policy;
  private final Retry.Sleeper sleeper;

  /**
   * Creates a verifier with the default policy and a real thread sleep.
   *
   * @param identityCheck identity service
   */
  public AccessKeyVerifier(final IdentityCheck identityCheck) {
    this(
        identityCheck,
        Retry.Policy.fixed(DEFAULT_MAX_ATTEMPTS, DEFAULT_DELAY),
        Retry.Sleeper.threadSleep());
  }

  /**
   * Creates a verifier.
   *
   * @param identityCheck identity service
   * @param policy attempt bound and delay
   * @param sleeper waits between attempts
   */
  public AccessKeyVerifier(
      final IdentityCheck identityCheck, final Retry.Policy policy, final Retry.Sleeper sleeper) {
    this.identityCheck = Objects.requireNonNull(identityCheck, "identityCheck");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  /**
   * Authenticates with the candidate credential and returns the principal name it resolves to.
   *
   * @param accessKeyId candidate access key id
   * @param secretAccessKey candidate secret access key
   * @return trailing segment of the caller ARN, normally the IAM user name
   * @throws IllegalArgumentException if either value is null or blank
   * @throws AccessKeyVerificationException if every attempt failed to authenticate
   */
  public String verify(final String accessKeyId, final String secretAccessKey) {
    if (accessKeyId == null || accessKeyId.isBlank())
      throw new IllegalArgumentException("accessKeyId must not be blank");
    if (secretAccessKey == null || secretAccessKey.isBlank())
      throw new IllegalArgumentException("secretAccessKey must not be blank");

    final var attempts = new AtomicInteger();
    final String arn;
    try {
      arn =
          Retry.onException(
              () -> {
                attempts.incrementAndGet();
                return identityCheck.callerArn(accessKeyId, secretAccessKey);
              },
              AuthenticationFailedException.class,
              (attempt, remaining, failure) ->
                  LOGGER.log(
                      WARNING,
                      "Failed to authenticate with access key {0}; {1} attempt(s) remaining",
                      accessKeyId,
                      remaining),
              policy,
              sleeper);
    } catch (final AuthenticationFailedException e) {
      throw new AccessKeyVerificationException(attempts.get(), e);
    }

    final var principal = principalName(arn);
    LOGGER.log(INFO, "Access key {0} authenticated as {1}", accessKeyId, principal);
    return principal;
  }

  /**
   * Extracts the principal name from a caller ARN.
   *
   * @param arn caller ARN
   * @return text after the last {@code /}, or the whole ARN when there is none
   */
  static String principalName(final String arn) {
    Objects.requireNonNull(arn, "arn");
    final var slash = arn.lastIndexOf('/');
    return slash < 0 ? arn : arn.substring(slash + 1);
  }
}
