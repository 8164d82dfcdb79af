package tech.yump.ledger.crypto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AES-GCM ciphertext together with the nonce it was produced with.
 *
 * <pre>
 * {
 *   "v": 1,
 *   "n": "BASE64_NONCE",
 *   "c": "BASE64_CIPHERTEXT_AND_TAG"
 * }
 * </pre>
 */
@Data
@NoArgsConstructor // Jackson
@AllArgsConstructor
public class EncryptedData {

  public static final int CURRENT_VERSION = 1;

  @JsonProperty("v")
  private int version = CURRENT_VERSION;

  @JsonProperty("n")
  private String nonceBase64;

  @JsonProperty("c")
  private String ciphertextBase64;

  public EncryptedData(byte[] nonce, byte[] ciphertext) {
    if (nonce == null || ciphertext == null) {
      throw new IllegalArgumentException("Nonce and ciphertext cannot be null.");
    }
    this.version = CURRENT_VERSION;
    this.nonceBase64 = Base64.getEncoder().encodeToString(nonce);
    this.ciphertextBase64 = Base64.getEncoder().encodeToString(ciphertext);
  }

  /**
   * Parses the compact {@code nonce:ciphertext} form used by column-oriented stores.
   */
  public static EncryptedData fromCompact(String compact) {
    if (compact == null) {
      throw new IllegalArgumentException("Compact encrypted value cannot be null.");
    }
    int separator = compact.indexOf(':');
    if (separator <= 0 || separator == compact.length() - 1) {
      throw new IllegalArgumentException("Compact encrypted value must have the form nonce:ciphertext.");
    }
    return new EncryptedData(CURRENT_VERSION, compact.substring(0, separator), compact.substring(separator + 1));
  }

  public String toCompact() {
    return nonceBase64 + ":" + ciphertextBase64;
  }

  @JsonIgnore
  public byte[] getNonceBytes() {
    if (this.nonceBase64 == null) {
      throw new IllegalStateException("Nonce Base64 string is null.");
    }
    return Base64.getDecoder().decode(this.nonceBase64);
  }

  @JsonIgnore
  public byte[] getCiphertextBytes() {
    if (this.ciphertextBase64 == null) {
      throw new IllegalStateException("Ciphertext Base64 string is null.");
    }
    return Base64.getDecoder().decode(this.ciphertextBase64);
  }
}
