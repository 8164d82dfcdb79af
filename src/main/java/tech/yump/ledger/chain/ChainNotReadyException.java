package tech.yump.ledger.chain;

/**
 * Thrown when the chain head is needed before it has been read from the store.
 */
public class ChainNotReadyException extends RuntimeException {
  public ChainNotReadyException(String message) {
    super(message);
  }

  public ChainNotReadyException(String message, Throwable cause) {
    super(message, cause);
  }
}
