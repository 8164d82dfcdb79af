package tech.yump.ledger.crypto;

/**
 * Thrown when an operation needs the signing or encryption key but the key ring holds none.
 */
public class KeyUnavailableException extends CryptoException {
  public KeyUnavailableException(String message) {
    super(message);
  }
}
