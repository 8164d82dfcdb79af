package tech.yump.ledger.export;

import lombok.Getter;
import tech.yump.ledger.verify.VerificationResult;

/**
 * Thrown when a range cannot be exported because the chain leading up to it does not verify.
 */
@Getter
public class ExportRefusedException extends RuntimeException {

  private final transient VerificationResult verificationResult;

  public ExportRefusedException(String message, VerificationResult verificationResult) {
    super(message);
    this.verificationResult = verificationResult;
  }
}
