package com.example.keyrotator.core;

import com.example.keyrotator.core.iam.AccessKeyVerifier;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import software.amazon.awssdk.regions.Region;

/**
 * Settings of the rotator, read once at start-up.
 *
 * <p>Each setting is taken from a system property, then an environment variable:
 *
 * <ul>
 *   <li>rotation.username / USERNAME (required)
 *   <li>aws.region / AWS_REGION (default us-east-1)
 *   <li>aws.sm.endpoint / SECRETS_MANAGER_ENDPOINT
 *   <li>aws.iam.endpoint / AWS_IAM_ENDPOINT
 *   <li>aws.sts.endpoint / AWS_STS_ENDPOINT
 *   <li>rotation.verify.attempts / ROTATION_VERIFY_ATTEMPTS (default 5)
 *   <li>rotation.verify.delay.millis / ROTATION_VERIFY_DELAY_MILLIS (default 5000)
 * </ul>
 *
 * @param userName IAM user whose access keys are rotated
 * @param region region for Secrets Manager and STS clients
 * @param secretsManagerEndpoint Secrets Manager endpoint override, or null
 * @param iamEndpoint IAM endpoint override, or null
 * @param stsEndpoint STS endpoint override, or null
 * @param verifyAttempts total verification attempts
 * @param verifyDelay pause between verification attempts
 */
public record RotationConfig(
    String userName,
    Region region,
    URI secretsManagerEndpoint,
    URI iamEndpoint,
    URI stsEndpoint,
    int verifyAttempts,
    Duration verifyDelay) {

  public RotationConfig {
    if (userName == null || userName.isBlank())
      throw new IllegalArgumentException("userName must not be blank");
    Objects.requireNonNull(region, "region");
    if (verifyAttempts < 1) throw new IllegalArgumentException("verifyAttempts must be >= 1");
    Objects.requireNonNull(verifyDelay, "verifyDelay");
  }

  /**
   * Reads the configuration from system properties and the process environment.
   *
   * @return configuration
   * @throws IllegalStateException if no user name is configured
   */
  public static RotationConfig fromEnvironment() {
    return from(System::getProperty, System::getenv);
  }

  static RotationConfig from(
      final UnaryOperator<String> properties, final UnaryOperator<String> environment) {
    final var settings = new Settings(properties, environment);
    final var userName =
        settings
            .get("rotation.username", "USERNAME")
            .orElseThrow(
                () -> new IllegalStateException("rotation.username / USERNAME must be configured"));
    return new RotationConfig(
        userName,
        settings.get("aws.region", "AWS_REGION").map(Region::of).orElse(Region.US_EAST_1),
        settings.get("aws.sm.endpoint", "SECRETS_MANAGER_ENDPOINT").map(URI::create).orElse(null),
        settings.get("aws.iam.endpoint", "AWS_IAM_ENDPOINT").map(URI::create).orElse(null),
        settings.get("aws.sts.endpoint", "AWS_STS_ENDPOINT").map(URI::create).orElse(null),
        (int)
            settings.positiveLong(
                "rotation.verify.attempts",
                "ROTATION_VERIFY_ATTEMPTS",
                AccessKeyVerifier.DEFAULT_MAX_ATTEMPTS),
        Duration.ofMillis(
            settings.positiveLong(
                "rotation.verify.delay.millis",
                "ROTATION_VERIFY_DELAY_MILLIS",
                AccessKeyVerifier.DEFAULT_DELAY.toMillis())));
  }

  private record Settings(UnaryOperator<String> properties, UnaryOperator<String> environment) {

    Optional<String> get(final String property, final String variable) {
      return Optional.ofNullable(properties.apply(property))
          .or(() -> Optional.ofNullable(environment.apply(variable)))
          .map(String::trim)
          .filter(val -> !val.isEmpty());
    }

    long positiveLong(final String property, final String variable, final long defaultValue) {
      return get(property, variable)
          .flatMap(
              val -> {
                try {
                  return Optional.of(Long.parseLong(val));
                } catch (final NumberFormatException e) {
                  return Optional.empty();
                }
              })
          .filter(parsed -> parsed > 0 && parsed <= Integer.MAX_VALUE)
          .orElse(defaultValue);
    }
  }
}
