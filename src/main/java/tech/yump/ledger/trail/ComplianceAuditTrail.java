package tech.yump.ledger.trail;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import tech.yump.ledger.chain.ChainNotReadyException;
import tech.yump.ledger.event.AuditEvent;
import tech.yump.ledger.event.ChangeSnapshot;
import tech.yump.ledger.event.ComplianceTag;
import tech.yump.ledger.event.EventCategory;
import tech.yump.ledger.event.EventResult;
import tech.yump.ledger.event.RiskLevel;
import tech.yump.ledger.export.ArchiveExporter;
import tech.yump.ledger.export.EncryptedBundle;
import tech.yump.ledger.ledger.AuditLedger;
import tech.yump.ledger.ledger.AuditValidationException;
import tech.yump.ledger.ledger.SecureAuditEntry;
import tech.yump.ledger.report.ComplianceReport;
import tech.yump.ledger.report.ComplianceReportService;
import tech.yump.ledger.verify.IntegrityVerifier;
import tech.yump.ledger.verify.VerificationResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Entry point for application code that needs to record or inspect compliance audit events.
 * <p>
 * Recording never breaks the caller's business logic: a malformed event is rejected with
 * {@link AuditValidationException}, while store or crypto failures are logged and reported as
 * an empty result.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ComplianceAuditTrail {

    static final String ANONYMOUS_ACTOR = "anonymous";

    private final AuditLedger auditLedger;
    private final IntegrityVerifier integrityVerifier;
    private final ArchiveExporter archiveExporter;
    private final ComplianceReportService complianceReportService;

    /**
     * Records a minimal event.
     *
     * @return the id of the persisted entry, or empty if it could not be persisted.
     * @throws AuditValidationException if a required field is missing.
     */
    public Optional<UUID> logEvent(
            EventCategory category,
            String actorId,
            String resource,
            EventResult result,
            @Nullable Map<String, Object> metadata) {

        return logEvent(AuditEvent.builder()
                .category(category)
                .actorId(actorId)
                .resource(resource)
                .result(result)
                .metadata(metadata)
                .build());
    }

    /**
     * Records a fully populated event.
     *
     * @return the id of the persisted entry, or empty if it could not be persisted.
     * @throws AuditValidationException if a required field is missing.
     */
    public Optional<UUID> logEvent(AuditEvent event) {
        try {
            SecureAuditEntry entry = auditLedger.append(event);
            return Optional.of(entry.id());
        } catch (AuditValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to record audit event: Category={}, Action={}, Resource={}, Error={}",
                    event.category(), event.action(), event.resource(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Payment processing events, tagged PCI DSS and treated as high risk.
     */
    public Optional<UUID> logPaymentEvent(
            PaymentAction action,
            @Nullable String actorId,
            RequestContext context,
            @Nullable String transactionId,
            @Nullable BigDecimal amount,
            @Nullable String currency,
            @Nullable String errorCode) {

        Map<String, Object> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, "transaction_id", transactionId);
        putIfPresent(metadata, "amount", amount);
        putIfPresent(metadata, "currency", currency);
        putIfPresent(metadata, "error_code", errorCode);

        return logEvent(withContext(AuditEvent.builder(), context)
                .category(EventCategory.PAYMENT)
                .actorId(orAnonymous(actorId))
                .action(action.action())
                .resource("payment")
                .result(action.result())
                .sensitiveDataAccessed(true)
                .riskLevel(RiskLevel.HIGH)
                .complianceTags(Set.of(ComplianceTag.PCI_DSS))
                .metadata(metadata)
                .build());
    }

    /**
     * Authentication events, tagged GDPR. Failed logins are high risk.
     */
    public Optional<UUID> logAuthEvent(
            AuthAction action,
            @Nullable String actorId,
            RequestContext context,
            @Nullable List<String> riskFactors) {

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (riskFactors != null && !riskFactors.isEmpty()) {
            metadata.put("risk_factors", List.copyOf(riskFactors));
        }

        return logEvent(withContext(AuditEvent.builder(), context)
                .category(EventCategory.AUTH)
                .actorId(orAnonymous(actorId))
                .action(action.action())
                .resource("authentication")
                .result(action.result())
                .sensitiveDataAccessed(false)
                .riskLevel(action.riskLevel())
                .complianceTags(Set.of(ComplianceTag.GDPR))
                .metadata(metadata)
                .build());
    }

    /**
     * Access to personal data, tagged GDPR and privacy data.
     */
    public Optional<UUID> logDataAccessEvent(
            DataAccessAction action,
            @Nullable String actorId,
            RequestContext context,
            String dataType,
            @Nullable String legalBasis) {

        Map<String, Object> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, "data_type", dataType);
        putIfPresent(metadata, "legal_basis", legalBasis);

        return logEvent(withContext(AuditEvent.builder(), context)
                .category(EventCategory.DATA_ACCESS)
                .actorId(orAnonymous(actorId))
                .action(action.action())
                .resource("personal_data")
                .result(EventResult.SUCCESS)
                .sensitiveDataAccessed(true)
                .riskLevel(RiskLevel.HIGH)
                .complianceTags(Set.of(ComplianceTag.GDPR, ComplianceTag.PRIVACY_DATA))
                .metadata(metadata)
                .build());
    }

    /**
     * Administrative actions, tagged SOX. The actor is mandatory.
     */
    public Optional<UUID> logAdminEvent(
            AdminAction action,
            String actorId,
            String resource,
            RequestContext context,
            @Nullable ChangeSnapshot changes) {

        return logEvent(withContext(AuditEvent.builder(), context)
                .category(EventCategory.ADMIN)
                .actorId(actorId)
                .action(action.action())
                .resource(resource)
                .result(EventResult.SUCCESS)
                .sensitiveDataAccessed(true)
                .riskLevel(RiskLevel.HIGH)
                .complianceTags(Set.of(ComplianceTag.SOX))
                .changes(changes)
                .build());
    }

    /**
     * Records that a retention policy was applied. Entries older than {@code cutoff} are from
     * then on logically deleted; no block is modified or removed.
     */
    public Optional<UUID> recordRetentionSweep(String actorId, String policyName, Instant cutoff) {
        if (policyName == null || policyName.isBlank() || cutoff == null) {
            throw new AuditValidationException("Retention sweep requires a policy name and a cutoff.");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("policy", policyName);
        metadata.put("cutoff", cutoff.toString());

        return logEvent(AuditEvent.builder()
                .category(EventCategory.ADMIN)
                .actorId(actorId)
                .action(AdminAction.RETENTION_SWEEP.action())
                .resource("audit_ledger")
                .result(EventResult.SUCCESS)
                .riskLevel(RiskLevel.MEDIUM)
                .complianceTags(Set.of(ComplianceTag.SOX, ComplianceTag.GDPR))
                .metadata(metadata)
                .build());
    }

    /**
     * Verifies {@code [startBlock, endBlock]}; null bounds mean block 1 and the current head.
     *
     * @throws ChainNotReadyException if the head is needed and cannot be read from the store.
     */
    public VerificationResult verifyChain(@Nullable Long startBlock, @Nullable Long endBlock) {
        long start = startBlock != null ? startBlock : 1L;
        long end = endBlock != null
                ? endBlock
                : auditLedger.requireHead().blockNumber();
        return integrityVerifier.verify(start, end);
    }

    public EncryptedBundle exportRange(long startBlock, long endBlock, String accessKeyB64) {
        return archiveExporter.exportRange(startBlock, endBlock, accessKeyB64);
    }

    public ComplianceReport generateReport(ComplianceTag tag, Instant from, Instant to) {
        return complianceReportService.generateReport(tag, from, to);
    }

    // --- Internal Helper Methods ---

    private static AuditEvent.AuditEventBuilder withContext(AuditEvent.AuditEventBuilder builder, RequestContext context) {
        RequestContext ctx = context != null ? context : RequestContext.NONE;
        return builder
                .sourceAddress(ctx.sourceAddress())
                .userAgent(ctx.userAgent())
                .deviceId(ctx.deviceId())
                .correlationId(ctx.correlationId());
    }

    private static String orAnonymous(@Nullable String actorId) {
        return actorId != null && !actorId.isBlank() ? actorId : ANONYMOUS_ACTOR;
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, @Nullable Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }
}
