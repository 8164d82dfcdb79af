package tech.yump.ledger.crypto;

public enum KeyRingStatus {
  EMPTY,
  LOADED
}
