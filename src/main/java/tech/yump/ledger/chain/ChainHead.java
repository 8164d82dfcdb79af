package tech.yump.ledger.chain;

import java.util.Objects;

/**
 * Block number and hash of the last block of a chain.
 */
public record ChainHead(long blockNumber, String hash) {

  /** {@code previousHash} of block 1. */
  public static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";

  /** Head of a chain with no blocks. */
  public static final ChainHead GENESIS = new ChainHead(0, GENESIS_HASH);

  public ChainHead {
    if (blockNumber < 0) {
      throw new IllegalArgumentException("Block number cannot be negative: " + blockNumber);
    }
    Objects.requireNonNull(hash, "hash");
  }

  public long nextBlockNumber() {
    return blockNumber + 1;
  }

  public boolean isGenesis() {
    return blockNumber == 0;
  }
}
