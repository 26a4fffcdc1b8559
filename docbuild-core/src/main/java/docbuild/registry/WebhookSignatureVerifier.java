package docbuild.registry;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Verifies {@code sha256=<hex>} HMAC signatures of registry push notifications.
 *
 * <p>Only the arrival of a verified notification matters; its body is never
 * interpreted.
 */
public final class WebhookSignatureVerifier {
  private static final String ALGORITHM = "HmacSHA256";
  private static final String PREFIX = "sha256=";

  private final SecretKeySpec key;

  public WebhookSignatureVerifier(String secret) {
    Objects.requireNonNull(secret, "secret");
    if (secret.isEmpty()) {
      throw new IllegalArgumentException("secret must not be empty");
    }
    this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
  }

  /**
   * @param body      raw request body
   * @param signature header value, e.g. {@code sha256=3f2a...}
   * @return {@code true} if the signature matches
   */
  public boolean verify(byte[] body, String signature) {
    if (body == null || signature == null || !signature.startsWith(PREFIX)) {
      return false;
    }
    byte[] expected;
    try {
      expected = HexFormat.of().parseHex(signature.substring(PREFIX.length()).trim());
    } catch (IllegalArgumentException e) {
      return false;
    }
    return MessageDigest.isEqual(sign(body), expected);
  }

  /**
   * Computes the header value for {@code body}.
   */
  public String signatureFor(byte[] body) {
    return PREFIX + HexFormat.of().formatHex(sign(body));
  }

  private byte[] sign(byte[] body) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(key);
      return mac.doFinal(body);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(ALGORITHM + " unavailable", e);
    }
  }
}
