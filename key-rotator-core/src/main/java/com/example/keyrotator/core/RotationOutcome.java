package com.example.keyrotator.core;

/** How a successful rotation step ended. */
public enum RotationOutcome {
  /** The step did its work. */
  COMPLETED,
  /** The version is already current; nothing was done. */
  ALREADY_CURRENT,
  /** createSecret found a pending value for the token and minted no key. */
  PENDING_EXISTS,
  /** setSecret has nothing to push because IAM issues the credential. */
  NOTHING_TO_SET
}
