/**
 * Secrets Manager rotation of an IAM access key used as Amazon SES SMTP credentials.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.keyrotator.core.KeyRotator} – runs one rotation step (create, set, test,
 *       finish) for a secret version.
 *   <li>{@link com.example.keyrotator.core.RotationHandler} – entry point taking the rotation event
 *       map.
 *   <li>{@link com.example.keyrotator.core.RotationContext} – the store, identity provider and
 *       verifier a rotator works with.
 *   <li>{@link com.example.keyrotator.core.RotationConfig} – settings from system properties and
 *       environment variables.
 *   <li>{@link com.example.keyrotator.core.RotationException} – step failure with a reason, the
 *       secret id and the version token.
 * </ul>
 *
 * <p>Subpackages: {@code secrets} (secret payload and storage), {@code iam} (access keys and live
 * verification), {@code smtp} (SMTP password derivation).
 */
package com.example.keyrotator.core;
