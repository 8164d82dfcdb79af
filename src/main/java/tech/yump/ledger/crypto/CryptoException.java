package tech.yump.ledger.crypto;

/**
 * Runtime exception for hashing, signing, encryption and decryption failures.
 */
public class CryptoException extends RuntimeException {

  public CryptoException(String message) {
    super(message);
  }

  public CryptoException(String message, Throwable cause) {
    super(message, cause);
  }
}
