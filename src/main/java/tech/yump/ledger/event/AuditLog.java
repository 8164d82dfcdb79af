package tech.yump.ledger.event;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * The log body stored in each block: a sanitized event plus the server-assigned timestamp.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditLog(
        Instant timestamp,
        EventCategory category,
        String actorId,
        String action,
        String resource,
        EventResult result,
        String sourceAddress,
        String userAgent,
        String deviceId,
        String correlationId,
        Boolean sensitiveDataAccessed,
        RiskLevel riskLevel,
        Set<ComplianceTag> complianceTags,
        ChangeSnapshot changes,
        Map<String, Object> metadata
) {

    public AuditLog {
        // EnumSet keeps declaration order, so the serialized form is stable
        complianceTags = (complianceTags == null || complianceTags.isEmpty())
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(complianceTags));
    }

    /**
     * Builds the log body for a sanitized event. Fills in the correlation id and the
     * default risk level when the caller left them out.
     */
    public static AuditLog of(SanitizedEvent sanitized, Instant timestamp) {
        AuditEvent e = sanitized.event();
        return new AuditLog(
                timestamp,
                e.category(),
                e.actorId(),
                e.action(),
                e.resource(),
                e.result(),
                e.sourceAddress(),
                e.userAgent(),
                e.deviceId(),
                e.correlationId() != null ? e.correlationId() : UUID.randomUUID().toString(),
                e.sensitiveDataAccessed(),
                e.riskLevel() != null ? e.riskLevel() : RiskLevel.MEDIUM,
                e.complianceTags(),
                e.changes(),
                e.metadata() != null && !e.metadata().isEmpty() ? e.metadata() : null);
    }
}
