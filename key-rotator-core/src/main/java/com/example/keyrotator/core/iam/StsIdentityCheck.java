package com.example.keyrotator.core.iam;

import java.util.Objects;
import java.util.function.Function;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;

/**
 * {@link IdentityCheck} that calls STS {@code GetCallerIdentity} signed with the candidate
 * credential.
 *
 * <p>A fresh client is built for every call because the credential is part of the client
 * configuration; it is closed once the call returns.
 */
public final class StsIdentityCheck implements IdentityCheck {

  private final Function<AwsCredentialsProvider, StsClient> clientFactory;

  /**
   * Creates an identity check.
   *
   * @param clientFactory builds an STS client signing with the given credentials
   */
  public StsIdentityCheck(final Function<AwsCredentialsProvider, StsClient> clientFactory) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
  }

  @Override
  public String callerArn(final String accessKeyId, final String secretAccessKey)
      throws AuthenticationFailedException {
    final var credentials =
        StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey));
    try (final var sts = clientFactory.apply(credentials)) {
      return sts.getCallerIdentity(GetCallerIdentityRequest.builder().build()).arn();
    } catch (final AwsServiceException e) {
      throw new AuthenticationFailedException(
          "GetCallerIdentity rejected access key " + accessKeyId + ": " + e.getMessage(), e);
    }
  }
}
