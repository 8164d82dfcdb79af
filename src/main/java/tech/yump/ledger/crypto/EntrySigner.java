package tech.yump.ledger.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import javax.crypto.Mac;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

/**
 * HMAC-SHA256 signature over {@code (canonicalLog, hash)}, keyed with the ledger signing key.
 * Only holders of the key can produce entries that verify, even with write access to the store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntrySigner {

  private final KeyRing keyRing;

  /**
   * @throws KeyUnavailableException if no signing key is loaded.
   * @throws CryptoException         if the MAC cannot be computed.
   */
  public String sign(byte[] canonicalLog, String hash) {
    if (canonicalLog == null || hash == null) {
      throw new CryptoException("Log bytes and hash are required to sign an entry.");
    }
    return Hex.toHexString(mac(canonicalLog, hash));
  }

  /**
   * Recomputes the signature and compares it in constant time.
   *
   * @return false for a mismatching or malformed signature.
   * @throws KeyUnavailableException if no signing key is loaded.
   */
  public boolean verify(byte[] canonicalLog, String hash, String signature) {
    if (canonicalLog == null || hash == null || signature == null) {
      return false;
    }
    String expected = Hex.toHexString(mac(canonicalLog, hash));
    if (expected.length() != signature.length()) {
      log.debug("Signature has unexpected length {}.", signature.length());
      return false;
    }
    return Arrays.constantTimeAreEqual(
        expected.getBytes(StandardCharsets.US_ASCII),
        signature.getBytes(StandardCharsets.US_ASCII));
  }

  private byte[] mac(byte[] canonicalLog, String hash) {
    try {
      Mac mac = Mac.getInstance(KeyRing.HMAC_SHA256);
      mac.init(keyRing.getSigningKey());
      mac.update(canonicalLog);
      mac.update(hash.getBytes(StandardCharsets.UTF_8));
      return mac.doFinal();
    } catch (GeneralSecurityException e) {
      log.error("HMAC computation failed: {}", e.getMessage(), e);
      throw new CryptoException("Failed to compute entry signature.", e);
    }
  }
}
