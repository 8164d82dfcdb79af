package tech.yump.ledger.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.util.Map;
import java.util.Set;

/**
 * Raw audit event as produced by calling code.
 * Never persisted as-is: it always goes through the {@link tech.yump.ledger.sanitize.Sanitizer} first.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        @NotNull(message = "Audit event category is required.")
        EventCategory category,

        @NotBlank(message = "Audit event actor id is required.")
        String actorId,

        String action,          // e.g. "payment_attempt", "login", "config_change"

        @NotBlank(message = "Audit event resource is required.")
        String resource,

        @NotNull(message = "Audit event result is required.")
        EventResult result,

        // Network origin
        String sourceAddress,
        String userAgent,
        String deviceId,

        String correlationId,
        Boolean sensitiveDataAccessed,
        RiskLevel riskLevel,
        Set<ComplianceTag> complianceTags,

        ChangeSnapshot changes,
        Map<String, Object> metadata
) {}
