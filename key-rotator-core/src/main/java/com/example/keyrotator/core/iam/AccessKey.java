package com.example.keyrotator.core.iam;

import java.util.Objects;

/**
 * IAM access key pair as returned when a key is created.
 *
 * @param accessKeyId the access key id, used as the SMTP username
 * @param secretAccessKey the secret access key, only available at creation time
 */
public record AccessKey(String accessKeyId, String secretAccessKey) {

  public AccessKey {
    Objects.requireNonNull(accessKeyId, "accessKeyId");
    Objects.requireNonNull(secretAccessKey, "secretAccessKey");
  }

  @Override
  public String toString() {
    return "AccessKey[accessKeyId=" + accessKeyId + ", secretAccessKey=****]";
  }
}
