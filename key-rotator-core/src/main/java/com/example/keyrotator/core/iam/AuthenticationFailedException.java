package com.example.keyrotator.core.iam;

/**
 * Signals that a candidate credential was rejected by the identity check. This is the only failure
 * {@link AccessKeyVerifier} retries, since freshly created keys take a few seconds to propagate.
 */
public class AuthenticationFailedException extends Exception {

  private static final long serialVersionUID = 1L;

  public AuthenticationFailedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
