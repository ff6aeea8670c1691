package com.example.keyrotator.core;

import java.util.Optional;
import java.util.function.UnaryOperator;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.sts.StsClient;

/**
 * Builds the AWS clients used by the rotator, honoring region and endpoint overrides from {@link
 * RotationConfig}.
 *
 * <p>The rotator's own credentials come from aws.accessKeyId / AWS_ACCESS_KEY_ID and
 * aws.secretAccessKey / AWS_SECRET_ACCESS_KEY when both are set, else from the default provider
 * chain. A session token from aws.sessionToken / AWS_SESSION_TOKEN turns them into temporary
 * session credentials.
 */
final class AwsClientFactory {

  private AwsClientFactory() {}

  static SecretsManagerClient secretsManager(final RotationConfig config) {
    final var builder =
        SecretsManagerClient.builder().region(config.region()).credentialsProvider(credentials());
    Optional.ofNullable(config.secretsManagerEndpoint()).ifPresent(builder::endpointOverride);
    return builder.build();
  }

  /** IAM is a global service. */
  static IamClient iam(final RotationConfig config) {
    final var builder =
        IamClient.builder().region(Region.AWS_GLOBAL).credentialsProvider(credentials());
    Optional.ofNullable(config.iamEndpoint()).ifPresent(builder::endpointOverride);
    return builder.build();
  }

  /**
   * Builds an STS client signing with the given credentials rather than the rotator's own.
   *
   * @param config rotation configuration
   * @param credentials candidate credentials
   * @return STS client
   */
  static StsClient sts(final RotationConfig config, final AwsCredentialsProvider credentials) {
    final var builder =
        StsClient.builder().region(config.region()).credentialsProvider(credentials);
    Optional.ofNullable(config.stsEndpoint()).ifPresent(builder::endpointOverride);
    return builder.build();
  }

  private static AwsCredentialsProvider credentials() {
    return credentials(System::getProperty, System::getenv);
  }

  static AwsCredentialsProvider credentials(
      final UnaryOperator<String> properties, final UnaryOperator<String> environment) {
    final var accessKey =
        setting(properties, environment, "aws.accessKeyId", "AWS_ACCESS_KEY_ID");
    final var secretKey =
        setting(properties, environment, "aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY");
    if (accessKey.isEmpty() || secretKey.isEmpty())
      return DefaultCredentialsProvider.builder().build();

    final AwsCredentials credentials =
        setting(properties, environment, "aws.sessionToken", "AWS_SESSION_TOKEN")
            .<AwsCredentials>map(
                token -> AwsSessionCredentials.create(accessKey.get(), secretKey.get(), token))
            .orElseGet(() -> AwsBasicCredentials.create(accessKey.get(), secretKey.get()));
    return StaticCredentialsProvider.create(credentials);
  }

  private static Optional<String> setting(
      final UnaryOperator<String> properties,
      final UnaryOperator<String> environment,
      final String property,
      final String variable) {
    return Optional.ofNullable(properties.apply(property))
        .or(() -> Optional.ofNullable(environment.apply(variable)))
        .filter(value -> !value.isBlank());
  }
}
