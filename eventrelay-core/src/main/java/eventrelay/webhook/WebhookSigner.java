package eventrelay.webhook;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 signatures in the {@code X-Hub-Signature-256} format ({@code sha256=<hex>}).
 */
public final class WebhookSigner {

  public static final String SIGNATURE_HEADER = "X-Hub-Signature-256";
  private static final String ALGORITHM = "HmacSHA256";
  private static final String PREFIX = "sha256=";

  private WebhookSigner() {}

  /**
   * Signs a body.
   *
   * @param secret the shared secret (UTF-8 encoded as the key)
   * @param body   the exact bytes sent
   * @return {@code sha256=} followed by the lowercase hex digest
   */
  public static String sign(String secret, byte[] body) {
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(body, "body");
    return PREFIX + HexFormat.of().formatHex(hmac(secret, body));
  }

  /**
   * Checks a received signature header in constant time.
   *
   * @return {@code true} if {@code signatureHeader} is the signature of {@code body}
   */
  public static boolean verify(String secret, byte[] body, String signatureHeader) {
    if (signatureHeader == null || !signatureHeader.startsWith(PREFIX)) {
      return false;
    }
    byte[] expected = sign(secret, body).getBytes(StandardCharsets.US_ASCII);
    byte[] actual = signatureHeader.getBytes(StandardCharsets.US_ASCII);
    return MessageDigest.isEqual(expected, actual);
  }

  private static byte[] hmac(String secret, byte[] body) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return mac.doFinal(body);
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      // HmacSHA256 ships with every JRE
      throw new IllegalArgumentException("Cannot compute " + ALGORITHM + " signature", e);
    }
  }
}
