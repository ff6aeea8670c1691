package com.example.keyrotator.core.iam;

/** Thrown when a candidate access key never authenticated within the retry budget. */
public class AccessKeyVerificationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final int attempts;

  public AccessKeyVerificationException(final int attempts, final Throwable cause) {
    super("Unable to authenticate using access key after " + attempts + " attempt(s)", cause);
    this.attempts = attempts;
  }

  /**
   * @return number of attempts made before giving up
   */
  public int attempts() {
    return attempts;
  }
}
