package tech.yump.ledger.store;

/**
 * Runtime exception for failures inside an {@link AuditStore} implementation.
 */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
