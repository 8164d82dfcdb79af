package tech.yump.ledger.verify;

/**
 * Why verification stopped at a block.
 */
public enum FailureReason {
  /** A block number inside the range has no persisted entry. */
  MISSING_BLOCK,
  /** The store returned a block number lower than the next expected one. */
  OUT_OF_ORDER_BLOCK,
  /** {@code previousHash} does not equal the hash of the preceding block (or the anchor). */
  LINKAGE_MISMATCH,
  /** The encrypted body or its clear columns failed GCM authentication, or the body is malformed. */
  DECRYPTION_FAILED,
  /** The stored hash differs from the one recomputed over the decrypted body. */
  HASH_MISMATCH,
  /** The HMAC signature does not verify. */
  SIGNATURE_INVALID,
  /** The last block's hash differs from the live chain head. */
  HEAD_MISMATCH
}
