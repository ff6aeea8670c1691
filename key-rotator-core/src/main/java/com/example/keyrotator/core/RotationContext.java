package com.example.keyrotator.core;

import com.example.keyrotator.core.iam.AccessKeyVerifier;
import com.example.keyrotator.core.iam.IamIdentityProvider;
import com.example.keyrotator.core.iam.IdentityProvider;
import com.example.keyrotator.core.iam.Retry;
import com.example.keyrotator.core.iam.StsIdentityCheck;
import com.example.keyrotator.core.secrets.SecretStore;
import com.example.keyrotator.core.secrets.SecretsManagerSecretStore;
import java.util.Objects;

/**
 * Collaborators of a {@link KeyRotator}.
 *
 * @param secretStore versioned secret storage
 * @param identityProvider access key lifecycle for {@code userName}
 * @param verifier live check of candidate credentials
 * @param userName IAM user whose keys are rotated; the identity a pending key must resolve to
 */
public record RotationContext(
    SecretStore secretStore,
    IdentityProvider identityProvider,
    AccessKeyVerifier verifier,
    String userName) {

  public RotationContext {
    Objects.requireNonNull(secretStore, "secretStore");
    Objects.requireNonNull(identityProvider, "identityProvider");
    Objects.requireNonNull(verifier, "verifier");
    if (userName == null || userName.isBlank())
      throw new IllegalArgumentException("userName must not be blank");
  }

  /**
   * Wires the AWS-backed collaborators described by {@code config}.
   *
   * @param config rotation configuration
   * @return context using Secrets Manager, IAM and STS
   */
  public static RotationContext aws(final RotationConfig config) {
    return new RotationContext(
        new SecretsManagerSecretStore(AwsClientFactory.secretsManager(config)),
        new IamIdentityProvider(AwsClientFactory.iam(config)),
        new AccessKeyVerifier(
            new StsIdentityCheck(credentials -> AwsClientFactory.sts(config, credentials)),
            Retry.Policy.fixed(config.verifyAttempts(), config.verifyDelay()),
            Retry.Sleeper.threadSleep()),
        config.userName());
  }
}
