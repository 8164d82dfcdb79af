package tech.yump.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;
import tech.yump.ledger.crypto.KeyRing;
import tech.yump.ledger.crypto.KeyRingStatus;
import tech.yump.ledger.monitor.ComplianceMonitor;
import tech.yump.ledger.monitor.LogComplianceMonitor;
import tech.yump.ledger.store.AuditStore;
import tech.yump.ledger.store.InMemoryAuditStore;
import tech.yump.ledger.trail.AuthAction;
import tech.yump.ledger.trail.ComplianceAuditTrail;
import tech.yump.ledger.trail.RequestContext;
import tech.yump.ledger.verify.VerificationResult;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the application with the test profile (in-memory store, SLF4j monitor).
 */
@SpringBootTest
@ActiveProfiles("test")
@ExtendWith(OutputCaptureExtension.class)
@DisplayName("Integration Test: Audit Ledger")
class AuditLedgerIntegrationTest {

    @Autowired
    private ComplianceAuditTrail complianceAuditTrail;
    @Autowired
    private AuditStore auditStore;
    @Autowired
    private ComplianceMonitor complianceMonitor;
    @Autowired
    private KeyRing keyRing;

    @Test
    void shouldRecordVerifyAndReportThroughTheMonitor(CapturedOutput output) {
        // 1. Wiring from the test profile
        assertThat(auditStore).isInstanceOf(InMemoryAuditStore.class);
        assertThat(complianceMonitor).isInstanceOf(LogComplianceMonitor.class);
        assertThat(keyRing.getStatus()).isEqualTo(KeyRingStatus.LOADED);

        // 2. Record an event
        String correlationId = UUID.randomUUID().toString();
        Optional<UUID> id = complianceAuditTrail.logAuthEvent(AuthAction.FAILED_LOGIN, "integration-user",
                RequestContext.builder().correlationId(correlationId).build(), List.of("password_spray"));
        assertThat(id).isPresent();

        // 3. Verify the chain
        VerificationResult result = complianceAuditTrail.verifyChain(null, null);
        assertThat(result.ok()).isTrue();
        assertThat(result.entriesVerified()).isGreaterThanOrEqualTo(1);

        // 4. Monitor output went to the console, without key material
        assertThat(output.getOut())
                .contains("LEDGER_EVENT:")
                .contains("\"type\":\"ledger_append\"")
                .contains(correlationId)
                .contains("\"type\":\"chain_verification\"")
                .doesNotContain("AQIDBAUGBwgJCgsMDQ4PEBESExQVFhcYGRobHB0eHyA=");
    }
}
