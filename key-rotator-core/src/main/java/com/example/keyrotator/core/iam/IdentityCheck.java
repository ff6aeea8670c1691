package com.example.keyrotator.core.iam;

/** Resolves the principal a credential authenticates as. */
@FunctionalInterface
public interface IdentityCheck {

  /**
   * Calls the identity service with the given credential.
   *
   * @param accessKeyId access key id to authenticate with
   * @param secretAccessKey matching secret access key
   * @return ARN of the authenticated principal, e.g. {@code arn:aws:iam::123456789012:user/ses}
   * @throws AuthenticationFailedException if the service rejects the credential
   */
  String callerArn(final String accessKeyId, final String secretAccessKey)
      throws AuthenticationFailedException;
}
