package tech.yump.ledger.report;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.ledger.chain.ChainNotReadyException;
import tech.yump.ledger.event.AuditLog;
import tech.yump.ledger.event.ComplianceTag;
import tech.yump.ledger.event.EventCategory;
import tech.yump.ledger.event.EventResult;
import tech.yump.ledger.event.RiskLevel;
import tech.yump.ledger.ledger.AuditLedger;
import tech.yump.ledger.ledger.AuditValidationException;
import tech.yump.ledger.store.AuditStore;
import tech.yump.ledger.store.StoredAuditEntry;
import tech.yump.ledger.verify.IntegrityVerifier;
import tech.yump.ledger.verify.VerificationRequest;
import tech.yump.ledger.verify.VerificationResult;

@Slf4j
@Service
@RequiredArgsConstructor
public class ComplianceReportService {

  private final IntegrityVerifier integrityVerifier;
  private final AuditStore auditStore;
  private final AuditLedger auditLedger;
  private final Clock clock;

  /**
   * Verifies the whole chain, then counts the entries tagged {@code tag} whose timestamp lies
   * in {@code [from, to]}, grouped and ordered by count descending.
   *
   * @throws AuditValidationException if the tag is missing or the window is inverted.
   * @throws ChainNotReadyException   if the chain head cannot be read from the store.
   */
  public ComplianceReport generateReport(ComplianceTag tag, Instant from, Instant to) {
    if (tag == null || from == null || to == null || from.isAfter(to)) {
      throw new AuditValidationException("A compliance tag and a window with from <= to are required.");
    }

    long head = auditLedger.requireHead().blockNumber();
    VerificationResult verification = integrityVerifier.verify(VerificationRequest.builder()
        .startBlock(1)
        .endBlock(head)
        .maxEntries(Integer.MAX_VALUE)
        .build());
    long lastTrusted = verification.ok() ? head : verification.brokenAtBlock() - 1;
    if (!verification.ok()) {
      log.warn("Generating {} report over the intact prefix [1, {}] only; chain broken at block {}.",
          tag, lastTrusted, verification.brokenAtBlock());
    }

    Map<GroupKey, Accumulator> groups = new LinkedHashMap<>();
    try (Stream<StoredAuditEntry> entries = auditStore.queryRange(1, lastTrusted)) {
      entries
          .map(e -> auditLedger.open(e).log())
          .filter(auditLog -> auditLog.complianceTags().contains(tag))
          .filter(auditLog -> !auditLog.timestamp().isBefore(from) && !auditLog.timestamp().isAfter(to))
          .forEach(auditLog -> groups.computeIfAbsent(GroupKey.of(auditLog), k -> new Accumulator())
              .add(auditLog.timestamp()));
    }

    List<ReportRow> rows = groups.entrySet().stream()
        .map(e -> e.getValue().toRow(e.getKey()))
        .sorted(Comparator.comparingLong(ReportRow::count).reversed())
        .toList();
    long total = rows.stream().mapToLong(ReportRow::count).sum();
    log.info("{} report for [{}, {}]: {} entries in {} groups.", tag, from, to, total, rows.size());
    return new ComplianceReport(tag, from, to, clock.instant(), total, rows, verification);
  }

  private record GroupKey(EventCategory category, String action, String resource, EventResult result,
      RiskLevel riskLevel) {

    static GroupKey of(AuditLog auditLog) {
      return new GroupKey(auditLog.category(), auditLog.action(), auditLog.resource(), auditLog.result(),
          auditLog.riskLevel());
    }
  }

  private static final class Accumulator {
    private long count;
    private Instant first;
    private Instant last;

    void add(Instant timestamp) {
      count++;
      if (first == null || timestamp.isBefore(first)) {
        first = timestamp;
      }
      if (last == null || timestamp.isAfter(last)) {
        last = timestamp;
      }
    }

    ReportRow toRow(GroupKey key) {
      return new ReportRow(key.category(), key.action(), key.resource(), key.result(), key.riskLevel(),
          count, first, last);
    }
  }
}
