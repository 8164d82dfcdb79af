package tech.yump.ledger.verify;

import lombok.Builder;

/**
 * A verification scan over {@code [startBlock, endBlock]}.
 *
 * @param expectedPreviousHash anchor for the first block when {@code startBlock > 1}; without
 *                             it the first block's linkage to history is not checked.
 * @param maxEntries           per-call cap, null for the configured default.
 * @param cancellation         optional stop token.
 */
@Builder
public record VerificationRequest(
    long startBlock,
    long endBlock,
    String expectedPreviousHash,
    Integer maxEntries,
    VerificationCancellation cancellation
) {

  public static VerificationRequest of(long startBlock, long endBlock) {
    return VerificationRequest.builder().startBlock(startBlock).endBlock(endBlock).build();
  }

  /**
   * The request that continues a partial result: starts after its last verified block and is
   * anchored on that block's hash.
   */
  public VerificationRequest resumeFrom(VerificationResult partial) {
    if (partial.lastVerifiedBlock() == null) {
      return this;
    }
    return new VerificationRequest(partial.lastVerifiedBlock() + 1, endBlock, partial.lastVerifiedHash(),
        maxEntries, cancellation);
  }
}
