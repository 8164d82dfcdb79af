package tech.yump.ledger.event;

public enum EventResult {
    SUCCESS,
    FAILURE
}
