package com.example.keyrotator.core.secrets;

import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.UpdateSecretVersionStageRequest;

/** {@link SecretStore} backed by AWS Secrets Manager. Nothing is cached between calls. */
public final class SecretsManagerSecretStore implements SecretStore {

  private final SecretsManagerClient client;

  /**
   * Creates a store on top of a Secrets Manager client. The client is owned by the caller.
   *
   * @param client Secrets Manager client
   */
  public SecretsManagerSecretStore(final SecretsManagerClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public SecretMetadata describeSecret(final String secretId) {
    final var response =
        client.describeSecret(DescribeSecretRequest.builder().secretId(secretId).build());
    final var stages = new LinkedHashMap<String, Set<String>>();
    if (response.hasVersionIdsToStages())
      response
          .versionIdsToStages()
          .forEach((version, labels) -> stages.put(version, Set.copyOf(labels)));
    return new SecretMetadata(Boolean.TRUE.equals(response.rotationEnabled()), stages);
  }

  @Override
  public Optional<String> getSecretString(
      final String secretId, final String stage, final String versionId) {
    final var request =
        GetSecretValueRequest.builder()
            .secretId(secretId)
            .versionStage(stage)
            .versionId(versionId)
            .build();
    try {
      return Optional.ofNullable(client.getSecretValue(request).secretString());
    } catch (final ResourceNotFoundException e) {
      return Optional.empty();
    }
  }

  @Override
  public void putSecretString(
      final String secretId,
      final String versionId,
      final String secretString,
      final Set<String> stages) {
    client.putSecretValue(
        PutSecretValueRequest.builder()
            .secretId(secretId)
            .clientRequestToken(versionId)
            .secretString(secretString)
            .versionStages(stages)
            .build());
  }

  @Override
  public void updateVersionStage(
      final String secretId,
      final String stage,
      final String moveToVersionId,
      final String removeFromVersionId) {
    client.updateSecretVersionStage(
        UpdateSecretVersionStageRequest.builder()
            .secretId(secretId)
            .versionStage(stage)
            .moveToVersionId(moveToVersionId)
            .removeFromVersionId(removeFromVersionId)
            .build());
  }
}
