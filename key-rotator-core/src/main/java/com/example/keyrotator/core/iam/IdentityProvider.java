package com.example.keyrotator.core.iam;

import java.util.List;

/** Access key lifecycle operations for a single IAM user. */
public interface IdentityProvider {

  /**
   * Lists the ids of every access key the user owns, active or not.
   *
   * @param userName IAM user name
   * @return access key ids
   */
  List<String> listAccessKeys(final String userName);

  /**
   * Deletes one access key.
   *
   * @param userName IAM user name
   * @param accessKeyId key to delete
   */
  void deleteAccessKey(final String userName, final String accessKeyId);

  /**
   * Creates a new access key for the user.
   *
   * @param userName IAM user name
   * @return the new key including its secret
   */
  AccessKey createAccessKey(final String userName);
}
