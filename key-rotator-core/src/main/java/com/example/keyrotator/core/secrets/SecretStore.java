package com.example.keyrotator.core.secrets;

import java.util.Optional;
import java.util.Set;

/**
 * Versioned secret storage as used by the rotator. Stage bookkeeping belongs to the store; the
 * rotator only reads it and asks for stage moves.
 */
public interface SecretStore {

  /** Stage label of the version clients currently use. */
  String CURRENT = "AWSCURRENT";

  /** Stage label of the version being prepared by an in-flight rotation. */
  String PENDING = "AWSPENDING";

  /** Stage label the store moves to the version that lost {@link #CURRENT}. */
  String PREVIOUS = "AWSPREVIOUS";

  /**
   * Describes the secret.
   *
   * @param secretId secret ARN or name
   * @return rotation flag and version/stage map
   */
  SecretMetadata describeSecret(final String secretId);

  /**
   * Reads a secret value.
   *
   * @param secretId secret ARN or name
   * @param stage stage label the version must carry
   * @param versionId version id to read, or {@code null} for whichever version carries the stage
   * @return the secret string, empty if no such value exists
   */
  Optional<String> getSecretString(
      final String secretId, final String stage, final String versionId);

  /**
   * Stores a secret value as a new version.
   *
   * @param secretId secret ARN or name
   * @param versionId version id (client request token)
   * @param secretString value to store
   * @param stages stage labels to attach
   */
  void putSecretString(
      final String secretId,
      final String versionId,
      final String secretString,
      final Set<String> stages);

  /**
   * Moves a stage label between versions.
   *
   * @param secretId secret ARN or name
   * @param stage stage label to move
   * @param moveToVersionId version receiving the label
   * @param removeFromVersionId version currently holding it, or {@code null} if none does
   */
  void updateVersionStage(
      final String secretId,
      final String stage,
      final String moveToVersionId,
      final String removeFromVersionId);
}
