package tech.yump.ledger.ledger;

/**
 * An append could not be completed: the store stayed unavailable through all retries, the
 * target block was already taken, or signing/encryption failed. The chain head did not move.
 */
public class AuditAppendException extends RuntimeException {
  public AuditAppendException(String message, Throwable cause) {
    super(message, cause);
  }
}
