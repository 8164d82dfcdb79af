package tech.yump.ledger.trail;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.ledger.chain.ChainHead;
import tech.yump.ledger.chain.ChainNotReadyException;
import tech.yump.ledger.event.AuditLog;
import tech.yump.ledger.event.ChangeSnapshot;
import tech.yump.ledger.event.ComplianceTag;
import tech.yump.ledger.event.EventCategory;
import tech.yump.ledger.event.EventResult;
import tech.yump.ledger.event.RiskLevel;
import tech.yump.ledger.export.EncryptedBundle;
import tech.yump.ledger.ledger.AuditValidationException;
import tech.yump.ledger.report.ComplianceReport;
import tech.yump.ledger.store.AuditStore;
import tech.yump.ledger.store.StoreException;
import tech.yump.ledger.support.TamperableAuditStore;
import tech.yump.ledger.support.TestKeys;
import tech.yump.ledger.support.TestLedger;
import tech.yump.ledger.verify.FailureReason;
import tech.yump.ledger.verify.VerificationResult;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ComplianceAuditTrailTest {

    private static final RequestContext CONTEXT = RequestContext.builder()
            .sourceAddress("203.0.113.7")
            .userAgent("checkout-web/4.2")
            .deviceId("device-42")
            .correlationId("req-123")
            .build();

    private TamperableAuditStore store;
    private TestLedger t;
    private ComplianceAuditTrail trail;

    @BeforeEach
    void setUp() {
        store = new TamperableAuditStore();
        t = TestLedger.over(store);
        trail = t.trail;
    }

    private AuditLog logOfBlock(long blockNumber) {
        return t.ledger.open(store.get(blockNumber)).log();
    }

    @Test
    @DisplayName("logPaymentEvent: Should record a high-risk PCI DSS payment entry")
    void logPaymentEvent_Success() {
        // Act
        Optional<UUID> id = trail.logPaymentEvent(PaymentAction.PAYMENT_FAILURE, "user-1", CONTEXT,
                "txn-991", new BigDecimal("19.99"), "EUR", "insufficient_funds");

        // Assert
        assertThat(id).contains(store.get(1).id());
        AuditLog log = logOfBlock(1);
        assertThat(log.category()).isEqualTo(EventCategory.PAYMENT);
        assertThat(log.actorId()).isEqualTo("user-1");
        assertThat(log.action()).isEqualTo("payment_failure");
        assertThat(log.resource()).isEqualTo("payment");
        assertThat(log.result()).isEqualTo(EventResult.FAILURE);
        assertThat(log.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(log.sensitiveDataAccessed()).isTrue();
        assertThat(log.complianceTags()).containsExactly(ComplianceTag.PCI_DSS);
        assertThat(log.sourceAddress()).isEqualTo("203.0.113.7");
        assertThat(log.userAgent()).isEqualTo("checkout-web/4.2");
        assertThat(log.deviceId()).isEqualTo("device-42");
        assertThat(log.correlationId()).isEqualTo("req-123");
        assertThat(log.metadata())
                .containsEntry("transaction_id", "txn-991")
                .containsEntry("currency", "EUR")
                .containsEntry("error_code", "insufficient_funds")
                .containsKey("amount");
    }

    @Test
    @DisplayName("logPaymentEvent: Should fall back to the anonymous actor and omit absent fields")
    void logPaymentEvent_AnonymousActor() {
        trail.logPaymentEvent(PaymentAction.PAYMENT_ATTEMPT, null, null, null, null, null, null);

        AuditLog log = logOfBlock(1);
        assertThat(log.actorId()).isEqualTo(ComplianceAuditTrail.ANONYMOUS_ACTOR);
        assertThat(log.result()).isEqualTo(EventResult.SUCCESS);
        assertThat(log.metadata()).isNull();
        assertThat(log.correlationId()).isNotBlank();
    }

    @Test
    @DisplayName("logAuthEvent: Should record failed logins as high-risk GDPR failures")
    void logAuthEvent_FailedLogin() {
        trail.logAuthEvent(AuthAction.FAILED_LOGIN, "user-7", RequestContext.NONE, List.of("new_device", "tor_exit_node"));

        AuditLog log = logOfBlock(1);
        assertThat(log.category()).isEqualTo(EventCategory.AUTH);
        assertThat(log.action()).isEqualTo("failed_login");
        assertThat(log.resource()).isEqualTo("authentication");
        assertThat(log.result()).isEqualTo(EventResult.FAILURE);
        assertThat(log.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(log.sensitiveDataAccessed()).isFalse();
        assertThat(log.complianceTags()).containsExactly(ComplianceTag.GDPR);
        assertThat(log.metadata()).containsEntry("risk_factors", List.of("new_device", "tor_exit_node"));
    }

    @Test
    @DisplayName("logDataAccessEvent: Should tag personal data access with GDPR and privacy data")
    void logDataAccessEvent_Success() {
        trail.logDataAccessEvent(DataAccessAction.DATA_EXPORT, "dpo-1", CONTEXT, "customer_profile", "legal_obligation");

        AuditLog log = logOfBlock(1);
        assertThat(log.category()).isEqualTo(EventCategory.DATA_ACCESS);
        assertThat(log.action()).isEqualTo("data_export");
        assertThat(log.resource()).isEqualTo("personal_data");
        assertThat(log.complianceTags()).containsExactlyInAnyOrder(ComplianceTag.GDPR, ComplianceTag.PRIVACY_DATA);
        assertThat(log.metadata())
                .containsEntry("data_type", "customer_profile")
                .containsEntry("legal_basis", "legal_obligation");
    }

    @Test
    @DisplayName("logAdminEvent: Should record a SOX change snapshot with secrets redacted")
    void logAdminEvent_RedactsChanges() {
        ChangeSnapshot changes = new ChangeSnapshot(
                Map.of("retention_days", 30, "api_key", "old-key-value"),
                Map.of("retention_days", 90, "api_key", "new-key-value"));

        trail.logAdminEvent(AdminAction.CONFIG_CHANGE, "admin-1", "config/retention", CONTEXT, changes);

        AuditLog log = logOfBlock(1);
        assertThat(log.category()).isEqualTo(EventCategory.ADMIN);
        assertThat(log.resource()).isEqualTo("config/retention");
        assertThat(log.complianceTags()).containsExactly(ComplianceTag.SOX);
        assertThat(log.changes().before()).isEqualTo(Map.of("retention_days", 30, "api_key", "[REDACTED]"));
        assertThat(log.changes().after()).isEqualTo(Map.of("retention_days", 90, "api_key", "[REDACTED]"));
    }

    @Test
    @DisplayName("logAdminEvent: Should reject a missing administrator")
    void logAdminEvent_MissingActor() {
        assertThatThrownBy(() -> trail.logAdminEvent(AdminAction.SYSTEM_ACCESS, null, "console", CONTEXT, null))
                .isInstanceOf(AuditValidationException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("recordRetentionSweep: Should append a sweep entry and leave earlier blocks untouched")
    void recordRetentionSweep_AppendsOnly() {
        t.appendPayments(3);
        String hashBefore = store.get(1).hash();
        Instant cutoff = Instant.parse("2024-01-01T00:00:00Z");

        Optional<UUID> id = trail.recordRetentionSweep("dpo-1", "gdpr-7y", cutoff);

        assertThat(id).isPresent();
        assertThat(store.size()).isEqualTo(4);
        assertThat(store.get(1).hash()).isEqualTo(hashBefore);
        AuditLog log = logOfBlock(4);
        assertThat(log.action()).isEqualTo("retention_sweep");
        assertThat(log.resource()).isEqualTo("audit_ledger");
        assertThat(log.complianceTags()).containsExactlyInAnyOrder(ComplianceTag.SOX, ComplianceTag.GDPR);
        assertThat(log.metadata()).containsEntry("policy", "gdpr-7y").containsEntry("cutoff", cutoff.toString());
        assertThat(trail.verifyChain(null, null).ok()).isTrue();

        assertThatThrownBy(() -> trail.recordRetentionSweep("dpo-1", " ", cutoff))
                .isInstanceOf(AuditValidationException.class);
    }

    @Test
    @DisplayName("logEvent: Should rethrow validation errors to the caller")
    void logEvent_InvalidEvent_Rethrows() {
        assertThatThrownBy(() -> trail.logEvent(EventCategory.ADMIN, "", "console", EventResult.SUCCESS, null))
                .isInstanceOf(AuditValidationException.class);
    }

    @Test
    @DisplayName("logEvent: Should swallow store failures into an empty result")
    void logEvent_StoreFailure_ReturnsEmpty() {
        // Arrange
        AuditStore failingStore = mock(AuditStore.class);
        when(failingStore.getLastBlock()).thenReturn(Optional.empty());
        doThrow(new StoreException("database unavailable")).when(failingStore).insert(any());
        TestLedger failing = TestLedger.over(failingStore, TestKeys.properties(1));

        // Act
        Optional<UUID> id = failing.trail.logEvent(EventCategory.AUTH, "user-1", "authentication",
                EventResult.SUCCESS, Map.of("method", "password_less"));

        // Assert
        assertThat(id).isEmpty();
    }

    @Test
    @DisplayName("verifyChain: Null bounds should cover the whole chain")
    void verifyChain_Defaults() {
        assertThat(trail.verifyChain(null, null).entriesVerified()).isZero();

        t.appendPayments(3);
        VerificationResult whole = trail.verifyChain(null, null);
        VerificationResult tail = trail.verifyChain(2L, null);

        assertThat(whole.ok()).isTrue();
        assertThat(whole.entriesVerified()).isEqualTo(3);
        assertThat(tail.entriesVerified()).isEqualTo(2);
        assertThat(tail.anchored()).isFalse();
    }

    @Test
    @DisplayName("verifyChain: Should read the head from the store when startup could not, and find tampering")
    void verifyChain_HeadUnavailableAtStartup_VerifiesStoredChain() {
        // Arrange
        t.appendPayments(5);
        store.tamper(3, e -> e.toBuilder().hash("0".repeat(64)).build());
        AtomicInteger headReads = new AtomicInteger();
        TamperableAuditStore flaky = new TamperableAuditStore() {
            @Override
            public Optional<ChainHead> getLastBlock() {
                if (headReads.getAndIncrement() == 0) {
                    throw new StoreException("connection refused");
                }
                return super.getLastBlock();
            }
        };
        for (long block = 1; block <= 5; block++) {
            flaky.insert(store.get(block));
        }
        TestLedger restarted = TestLedger.over(flaky);
        assertThat(restarted.ledger.currentHead()).isEmpty();

        // Act
        VerificationResult result = restarted.trail.verifyChain(null, null);

        // Assert
        assertThat(result.ok()).isFalse();
        assertThat(result.endBlock()).isEqualTo(5L);
        assertThat(result.brokenAtBlock()).isEqualTo(3L);
        assertThat(result.reason()).isEqualTo(FailureReason.HASH_MISMATCH);
        assertThat(restarted.ledger.currentHead()).isPresent();
    }

    @Test
    @DisplayName("verifyChain: Should fail rather than report an empty chain when the head cannot be read")
    void verifyChain_HeadStillUnavailable_Throws() {
        AuditStore down = mock(AuditStore.class);
        when(down.getLastBlock()).thenThrow(new StoreException("connection refused"));
        TestLedger unavailable = TestLedger.over(down);

        assertThatThrownBy(() -> unavailable.trail.verifyChain(null, null))
                .isInstanceOf(ChainNotReadyException.class)
                .hasCauseInstanceOf(StoreException.class);
        assertThatThrownBy(() -> unavailable.trail.generateReport(ComplianceTag.SOX,
                Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-05-02T00:00:00Z")))
                .isInstanceOf(ChainNotReadyException.class);
    }

    @Test
    @DisplayName("exportRange and generateReport: Should delegate to the ledger's services")
    void exportAndReport() {
        t.appendPayments(2);

        EncryptedBundle bundle = trail.exportRange(1, 2, TestKeys.ACCESS_KEY_B64);
        ComplianceReport report = trail.generateReport(ComplianceTag.PCI_DSS,
                Instant.parse("2024-05-01T00:00:00Z"), t.clock.instant().plus(Duration.ofDays(1)));

        assertThat(bundle.entryCount()).isEqualTo(2);
        assertThat(report.totalEntries()).isEqualTo(2);
        assertThat(report.rows()).singleElement()
                .satisfies(row -> assertThat(row.action()).isEqualTo("payment_success"));
    }
}
