package tech.yump.ledger.event;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
