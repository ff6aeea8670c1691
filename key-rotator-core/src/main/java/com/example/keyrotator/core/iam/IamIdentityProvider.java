package com.example.keyrotator.core.iam;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.AccessKeyMetadata;
import software.amazon.awssdk.services.iam.model.CreateAccessKeyRequest;
import software.amazon.awssdk.services.iam.model.DeleteAccessKeyRequest;
import software.amazon.awssdk.services.iam.model.ListAccessKeysRequest;

/** {@link IdentityProvider} backed by the AWS IAM API. */
public final class IamIdentityProvider implements IdentityProvider {

  private final IamClient iam;

  /**
   * Creates a provider on top of an IAM client. The client is owned by the caller.
   *
   * @param iam IAM client
   */
  public IamIdentityProvider(final IamClient iam) {
    this.iam = Objects.requireNonNull(iam, "iam");
  }

  /** {@inheritDoc} Follows {@code Marker} until IAM reports the listing is complete. */
  @Override
  public List<String> listAccessKeys(final String userName) {
    final var ids = new ArrayList<String>();
    String marker = null;
    do {
      final var request = ListAccessKeysRequest.builder().userName(userName).marker(marker).build();
      final var response = iam.listAccessKeys(request);
      response.accessKeyMetadata().stream().map(AccessKeyMetadata::accessKeyId).forEach(ids::add);
      marker = Boolean.TRUE.equals(response.isTruncated()) ? response.marker() : null;
    } while (marker != null);
    return ids;
  }

  @Override
  public void deleteAccessKey(final String userName, final String accessKeyId) {
    iam.deleteAccessKey(
        DeleteAccessKeyRequest.builder().userName(userName).accessKeyId(accessKeyId).build());
  }

  @Override
  public AccessKey createAccessKey(final String userName) {
    final var created =
        iam.createAccessKey(CreateAccessKeyRequest.builder().userName(userName).build())
            .accessKey();
    return new AccessKey(created.accessKeyId(), created.secretAccessKey());
  }
}
