package tech.yump.ledger.event;

/**
 * An {@link AuditEvent} whose metadata and change snapshot have been redacted.
 */
public record SanitizedEvent(AuditEvent event) {}
