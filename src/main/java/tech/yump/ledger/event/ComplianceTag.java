package tech.yump.ledger.event;

/**
 * Regulatory labels attached to an event for filtered reporting.
 */
public enum ComplianceTag {
    PCI_DSS,
    SOX,
    GDPR,
    AML,
    FINANCIAL_RECORD,
    PRIVACY_DATA
}
