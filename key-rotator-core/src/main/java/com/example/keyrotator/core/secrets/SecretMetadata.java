package com.example.keyrotator.core.secrets;

import java.util.Map;
import java.util.Set;

/**
 * Rotation-relevant part of a secret's description.
 *
 * @param rotationEnabled whether rotation is configured for the secret
 * @param versionStages stage labels attached to each version id
 */
public record SecretMetadata(boolean rotationEnabled, Map<String, Set<String>> versionStages) {

  public SecretMetadata {
    versionStages = Map.copyOf(versionStages);
  }

  /**
   * Returns the stages of a version.
   *
   * @param versionId version id
   * @return its stage labels, empty if the version is unknown
   */
  public Set<String> stagesOf(final String versionId) {
    return versionStages.getOrDefault(versionId, Set.of());
  }
}
