package tech.yump.ledger.ledger;

import java.util.List;
import lombok.Getter;

/**
 * Thrown to the immediate caller when an audit event (or an export request) is malformed.
 * Nothing has been written when this is raised.
 */
@Getter
public class AuditValidationException extends RuntimeException {

  private final List<String> violations;

  public AuditValidationException(String message) {
    this(message, List.of());
  }

  public AuditValidationException(String message, List<String> violations) {
    super(message);
    this.violations = List.copyOf(violations);
  }

  public AuditValidationException(String message, Throwable cause) {
    super(message, cause);
    this.violations = List.of();
  }
}
