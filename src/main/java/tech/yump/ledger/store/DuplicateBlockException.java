package tech.yump.ledger.store;

import lombok.Getter;

/**
 * Thrown when an insert targets a block number that is already persisted.
 * Stores are append-only, so the existing block is never replaced.
 */
@Getter
public class DuplicateBlockException extends StoreException {

  private final long blockNumber;

  public DuplicateBlockException(long blockNumber) {
    super("Block " + blockNumber + " is already persisted; audit blocks are never overwritten.");
    this.blockNumber = blockNumber;
  }

  public DuplicateBlockException(long blockNumber, Throwable cause) {
    super("Block " + blockNumber + " is already persisted; audit blocks are never overwritten.", cause);
    this.blockNumber = blockNumber;
  }
}
