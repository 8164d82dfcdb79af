package tech.yump.ledger.report;

import java.time.Instant;
import tech.yump.ledger.event.EventCategory;
import tech.yump.ledger.event.EventResult;
import tech.yump.ledger.event.RiskLevel;

/**
 * Number of matching entries sharing one (category, action, resource, result, risk level) combination.
 */
public record ReportRow(
    EventCategory category,
    String action,
    String resource,
    EventResult result,
    RiskLevel riskLevel,
    long count,
    Instant firstEventAt,
    Instant lastEventAt
) {}
