package com.example.keyrotator.core.smtp;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Converts an IAM secret access key into an Amazon SES SMTP password.
 *
 * <p>The password is a SigV4-style signing key chain: {@code "AWS4" + secret} keys an HMAC-SHA256
 * over a fixed date, the region, the {@code ses} service name, the {@code aws4_request} terminator
 * and finally the {@code SendRawEmail} message. The 32-byte result is prefixed with a version byte
 * and Base64-encoded.
 *
 * <p>All constants below are fixed by SES; changing any of them produces passwords the SMTP
 * endpoint rejects.
 */
public final class SmtpPasswordDeriver {

  private static final String ALGORITHM = "HmacSHA256";
  private static final String KEY_PREFIX = "AWS4";
  private static final String DATE = "11111111";
  private static final String SERVICE = "ses";
  private static final String TERMINAL = "aws4_request";
  private static final String MESSAGE = "SendRawEmail";
  private static final byte VERSION = 0x04;

  /** Length of the decoded password: the version byte plus a SHA-256 digest. */
  public static final int PASSWORD_BYTES = 33;

  private SmtpPasswordDeriver() {}

  /**
   * Derives the SES SMTP password for a secret access key.
   *
   * @param secretAccessKey the IAM secret access key
   * @param region the SES region the password is valid for (e.g. {@code us-east-1})
   * @return the Base64-encoded SMTP password
   * @throws NullPointerException if either argument is null
   */
  public static String derive(final String secretAccessKey, final String region) {
    Objects.requireNonNull(secretAccessKey, "secretAccessKey");
    Objects.requireNonNull(region, "region");

    var signature = sign((KEY_PREFIX + secretAccessKey).getBytes(StandardCharsets.UTF_8), DATE);
    signature = sign(signature, region);
    signature = sign(signature, SERVICE);
    signature = sign(signature, TERMINAL);
    signature = sign(signature, MESSAGE);

    final var versioned = new byte[signature.length + 1];
    versioned[0] = VERSION;
    System.arraycopy(signature, 0, versioned, 1, signature.length);
    return Base64.getEncoder().encodeToString(versioned);
  }

  private static byte[] sign(final byte[] key, final String message) {
    try {
      final var mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(key, ALGORITHM));
      return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
    } catch (final GeneralSecurityException e) {
      // HmacSHA256 is mandatory on every Java platform
      throw new IllegalStateException("HmacSHA256 unavailable", e);
    }
  }
}
