package tech.yump.ledger.chain;

public enum ChainStatus {
  UNINITIALIZED,
  READY
}
