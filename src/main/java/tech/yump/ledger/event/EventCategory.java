package tech.yump.ledger.event;

/**
 * Business area an audit event belongs to.
 */
public enum EventCategory {
    PAYMENT,
    AUTH,
    DATA_ACCESS,
    ADMIN
}
