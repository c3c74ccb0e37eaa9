package relay.signature;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 signing and verification of webhook bodies with an account's shared secret.
 *
 * <p>Signatures are lowercase hex. The transport header carries them as
 * {@code sha256=<hex>} in {@value #HEADER}.
 *
 * <p>{@link #verify} never throws and takes the same path for malformed and wrong
 * signatures: a malformed value is compared against a dummy digest of the same length.
 */
public final class WebhookSigner {
  public static final String HEADER = "X-Hub-Signature-256";
  public static final String PREFIX = "sha256=";

  private static final String ALGORITHM = "HmacSHA256";
  private static final int DIGEST_LENGTH = 32;
  private static final HexFormat HEX = HexFormat.of();

  private WebhookSigner() {
  }

  /**
   * Computes the hex HMAC-SHA256 of {@code payload}.
   *
   * @param payload raw body bytes
   * @param secret  shared secret, must not be empty
   * @return 64 lowercase hex characters
   */
  public static String sign(byte[] payload, String secret) {
    return HEX.formatHex(digest(payload, secret));
  }

  /**
   * Returns the header value {@code sha256=<hex>} for {@code payload}.
   */
  public static String header(byte[] payload, String secret) {
    return PREFIX + sign(payload, secret);
  }

  /**
   * Checks a signature in either bare hex or {@code sha256=<hex>} form.
   *
   * @return {@code true} only if the signature matches; {@code false} for any
   *         mismatch, malformed value, or missing argument
   */
  public static boolean verify(byte[] payload, String secret, String signature) {
    if (payload == null || secret == null || secret.isEmpty()) {
      return false;
    }
    byte[] expected = digest(payload, secret);
    byte[] provided = decode(signature);
    boolean wellFormed = provided != null;
    if (!wellFormed) {
      provided = new byte[DIGEST_LENGTH];
    }
    return MessageDigest.isEqual(expected, provided) && wellFormed;
  }

  private static byte[] decode(String signature) {
    if (signature == null) {
      return null;
    }
    String hex = signature.trim();
    if (hex.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
      hex = hex.substring(PREFIX.length());
    }
    if (hex.length() != DIGEST_LENGTH * 2) {
      return null;
    }
    try {
      return HEX.parseHex(hex);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static byte[] digest(byte[] payload, String secret) {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(secret, "secret");
    if (secret.isEmpty()) {
      throw new IllegalArgumentException("secret must not be empty");
    }
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return mac.doFinal(payload);
    } catch (GeneralSecurityException e) {
      // HmacSHA256 is a mandatory JCA algorithm
      throw new IllegalStateException(ALGORITHM + " unavailable", e);
    }
  }
}
