package tech.yump.ledger.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;
import tech.yump.ledger.event.AuditLog;
import tech.yump.ledger.event.AuditLogCodec;

/**
 * Computes the digest that binds a block's log body to its predecessor:
 * {@code SHA-256(canonicalLog || previousHash)}, as lower-case hex.
 */
@Component
public class ChainHasher {

  private static final String HASH_ALGORITHM = "SHA-256";

  public String hash(AuditLog log, String previousHash) {
    return hash(AuditLogCodec.encode(log), previousHash);
  }

  /**
   * Hashes already-canonical log bytes. The verifier uses this form on decrypted bodies so
   * nothing is re-serialized between append and verification.
   */
  public String hash(byte[] canonicalLog, String previousHash) {
    if (canonicalLog == null || previousHash == null) {
      throw new CryptoException("Log bytes and previous hash are required to compute a block hash.");
    }
    MessageDigest digest = newDigest();
    digest.update(canonicalLog);
    digest.update(previousHash.getBytes(StandardCharsets.UTF_8));
    return Hex.toHexString(digest.digest());
  }

  /**
   * Plain SHA-256 of arbitrary bytes, hex encoded. Used for export payload digests.
   */
  public String digest(byte[] data) {
    return Hex.toHexString(newDigest().digest(data));
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(HASH_ALGORITHM);
    } catch (NoSuchAlgorithmException e) {
      throw new CryptoException("Hash algorithm not available: " + HASH_ALGORITHM, e);
    }
  }
}
