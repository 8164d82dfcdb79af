package tech.yump.ledger.verify;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a verification scan.
 * <p>
 * {@code ok=false} means the chain is broken at {@code brokenAtBlock}; everything from there on
 * is untrusted. {@code ok=true, complete=false} means the scan was cut short (cancelled or
 * capped) and the range up to {@code lastVerifiedBlock} is intact. {@code anchored=false} means
 * the first block's linkage to earlier history was not checked.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationResult(
    boolean ok,
    boolean complete,
    boolean anchored,
    long startBlock,
    long endBlock,
    long entriesVerified,
    Long brokenAtBlock,
    FailureReason reason,
    String detail,
    Long lastVerifiedBlock,
    String lastVerifiedHash
) {

  static VerificationResult intact(long startBlock, long endBlock, boolean anchored, long entriesVerified,
      Long lastVerifiedBlock, String lastVerifiedHash) {
    return new VerificationResult(true, true, anchored, startBlock, endBlock, entriesVerified,
        null, null, null, lastVerifiedBlock, lastVerifiedHash);
  }

  static VerificationResult partial(long startBlock, long endBlock, boolean anchored, long entriesVerified,
      Long lastVerifiedBlock, String lastVerifiedHash, String detail) {
    return new VerificationResult(true, false, anchored, startBlock, endBlock, entriesVerified,
        null, null, detail, lastVerifiedBlock, lastVerifiedHash);
  }

  static VerificationResult broken(long startBlock, long endBlock, boolean anchored, long entriesVerified,
      long brokenAtBlock, FailureReason reason, String detail, Long lastVerifiedBlock, String lastVerifiedHash) {
    return new VerificationResult(false, true, anchored, startBlock, endBlock, entriesVerified,
        brokenAtBlock, reason, detail, lastVerifiedBlock, lastVerifiedHash);
  }
}
