package tech.yump.ledger.report;

import java.time.Instant;
import java.util.List;
import tech.yump.ledger.event.ComplianceTag;
import tech.yump.ledger.verify.VerificationResult;

/**
 * Counts of audit entries carrying one compliance tag within a time window.
 * <p>
 * Only blocks that verified are counted. When {@code verification.ok()} is false the rows
 * cover the intact prefix before {@code verification.brokenAtBlock()}.
 */
public record ComplianceReport(
    ComplianceTag complianceTag,
    Instant from,
    Instant to,
    Instant generatedAt,
    long totalEntries,
    List<ReportRow> rows,
    VerificationResult verification
) {

  public ComplianceReport {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }

  public boolean chainIntact() {
    return verification != null && verification.ok();
  }
}
