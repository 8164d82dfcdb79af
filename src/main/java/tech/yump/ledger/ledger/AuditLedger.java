package tech.yump.ledger.ledger;

import jakarta.annotation.PostConstruct;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.ledger.chain.ChainHead;
import tech.yump.ledger.chain.ChainNotReadyException;
import tech.yump.ledger.chain.ChainState;
import tech.yump.ledger.config.LedgerProperties;
import tech.yump.ledger.crypto.ChainHasher;
import tech.yump.ledger.crypto.CryptoException;
import tech.yump.ledger.crypto.EncryptedData;
import tech.yump.ledger.crypto.EncryptionService;
import tech.yump.ledger.crypto.EntrySigner;
import tech.yump.ledger.event.AuditEvent;
import tech.yump.ledger.event.AuditLog;
import tech.yump.ledger.event.AuditLogCodec;
import tech.yump.ledger.event.SanitizedEvent;
import tech.yump.ledger.monitor.ComplianceMonitor;
import tech.yump.ledger.monitor.MonitorEvent;
import tech.yump.ledger.sanitize.Sanitizer;
import tech.yump.ledger.store.AuditStore;
import tech.yump.ledger.store.DuplicateBlockException;
import tech.yump.ledger.store.StoreException;
import tech.yump.ledger.store.StoredAuditEntry;

/**
 * Appends audit events to the chain.
 * <p>
 * Validation, sanitization and canonical serialization happen outside the lock. The critical
 * section (read head, hash, sign, encrypt, persist, advance) runs under a single fair lock, so
 * concurrent callers are serialized and never build on the same head. The head only advances
 * after the store confirmed the insert.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLedger {

  private final AuditStore auditStore;
  private final ChainState chainState;
  private final Sanitizer sanitizer;
  private final ChainHasher chainHasher;
  private final EntrySigner entrySigner;
  private final EncryptionService encryptionService;
  private final ComplianceMonitor complianceMonitor;
  private final Validator validator;
  private final Clock clock;
  private final LedgerProperties ledgerProperties;

  private final ReentrantLock appendLock = new ReentrantLock(true);

  /**
   * Reads the last persisted block and makes the chain READY. A store failure is logged and
   * initialization is attempted again by the next append.
   */
  @PostConstruct
  public void initialize() {
    appendLock.lock();
    try {
      if (chainState.isReady()) {
        log.debug("Chain state already initialized.");
        return;
      }
      chainState.initialize(auditStore.getLastBlock());
    } catch (StoreException e) {
      log.error("Could not read the last persisted block at startup: {}. Initialization will be retried on the next append.",
          e.getMessage(), e);
    } finally {
      appendLock.unlock();
    }
  }

  /**
   * Appends one event as the next block.
   *
   * @throws AuditValidationException if the event is malformed; nothing is written.
   * @throws ChainNotReadyException   if the chain head cannot be read from the store.
   * @throws AuditAppendException     if crypto fails or the store rejects the block after all retries.
   */
  public SecureAuditEntry append(AuditEvent event) {
    validate(event);
    SanitizedEvent sanitized = sanitizer.sanitize(event);
    AuditLog auditLog = AuditLog.of(sanitized, clock.instant());
    byte[] canonical;
    try {
      canonical = AuditLogCodec.encode(auditLog);
    } catch (IllegalArgumentException e) {
      throw new AuditValidationException("Audit event cannot be serialized: " + e.getMessage(), e);
    }

    appendLock.lock();
    try {
      ChainHead head = currentHeadOrInitialize();
      long blockNumber = head.nextBlockNumber();

      UUID id = UUID.randomUUID();
      // Stores keep microsecond precision at most
      Instant createdAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
      String hash;
      String signature;
      EncryptedData encrypted;
      try {
        hash = chainHasher.hash(canonical, head.hash());
        signature = entrySigner.sign(canonical, hash);
        encrypted = encryptionService.encrypt(canonical,
            StoredAuditEntry.associatedData(id, blockNumber, createdAt, auditLog.complianceTags()));
      } catch (CryptoException e) {
        log.error("Cannot seal block {}: {}. Nothing was persisted.", blockNumber, e.getMessage());
        reportFailure(blockNumber, auditLog, e);
        throw new AuditAppendException("Failed to seal audit block " + blockNumber + ".", e);
      }

      StoredAuditEntry stored = StoredAuditEntry.builder()
          .id(id)
          .blockNumber(blockNumber)
          .encryptedLog(encrypted)
          .hash(hash)
          .previousHash(head.hash())
          .signature(signature)
          .createdAt(createdAt)
          .complianceTags(auditLog.complianceTags())
          .build();

      try {
        insertWithRetry(stored);
      } catch (AuditAppendException e) {
        reportFailure(blockNumber, auditLog, e.getCause() != null ? e.getCause() : e);
        throw e;
      }
      chainState.advance(head, new ChainHead(blockNumber, hash));

      log.debug("Appended block {} ({} / {}).", blockNumber, auditLog.category(), auditLog.action());
      complianceMonitor.record(MonitorEvent.builder()
          .timestamp(stored.createdAt())
          .type(MonitorEvent.TYPE_APPEND)
          .outcome(MonitorEvent.OUTCOME_SUCCESS)
          .blockNumber(blockNumber)
          .correlationId(auditLog.correlationId())
          .data(Map.of(
              "category", auditLog.category().name(),
              "riskLevel", auditLog.riskLevel().name(),
              "complianceTags", auditLog.complianceTags()))
          .build());

      return SecureAuditEntry.builder()
          .id(stored.id())
          .log(auditLog)
          .blockNumber(blockNumber)
          .previousHash(stored.previousHash())
          .hash(hash)
          .signature(signature)
          .createdAt(stored.createdAt())
          .build();
    } finally {
      appendLock.unlock();
    }
  }

  /**
   * Decrypts a stored block for an authorized read. Does not verify the chain.
   *
   * @throws CryptoException if the body cannot be decrypted or its clear columns were altered.
   */
  public SecureAuditEntry open(StoredAuditEntry stored) {
    byte[] canonical = encryptionService.decrypt(stored.encryptedLog(), stored.associatedData());
    AuditLog auditLog;
    try {
      auditLog = AuditLogCodec.decode(canonical);
    } catch (IllegalArgumentException e) {
      throw new CryptoException("Decrypted body of block " + stored.blockNumber() + " is not a valid audit log.", e);
    }
    return SecureAuditEntry.builder()
        .id(stored.id())
        .log(auditLog)
        .blockNumber(stored.blockNumber())
        .previousHash(stored.previousHash())
        .hash(stored.hash())
        .signature(stored.signature())
        .createdAt(stored.createdAt())
        .build();
  }

  public Optional<ChainHead> currentHead() {
    return chainState.currentHead();
  }

  /**
   * The current chain head, read from the store first when startup could not read it.
   *
   * @throws ChainNotReadyException if the store still cannot be read.
   */
  public ChainHead requireHead() {
    Optional<ChainHead> head = chainState.currentHead();
    if (head.isPresent()) {
      return head.get();
    }
    appendLock.lock();
    try {
      return currentHeadOrInitialize();
    } finally {
      appendLock.unlock();
    }
  }

  private void validate(AuditEvent event) {
    if (event == null) {
      throw new AuditValidationException("Audit event cannot be null.");
    }
    Set<ConstraintViolation<AuditEvent>> violations = validator.validate(event);
    if (!violations.isEmpty()) {
      List<String> messages = violations.stream()
          .map(ConstraintViolation::getMessage)
          .sorted(Comparator.naturalOrder())
          .toList();
      log.warn("Rejected malformed audit event: {}", messages);
      throw new AuditValidationException("Invalid audit event: " + String.join(" ", messages), messages);
    }
  }

  private ChainHead currentHeadOrInitialize() {
    if (!chainState.isReady()) {
      log.info("Chain state not initialized yet; reading last persisted block.");
      try {
        chainState.initialize(auditStore.getLastBlock());
      } catch (StoreException e) {
        log.error("Chain state initialization failed: {}", e.getMessage());
        throw new ChainNotReadyException("Chain head unavailable: the last persisted block could not be read.", e);
      }
    }
    return chainState.head();
  }

  private void insertWithRetry(StoredAuditEntry entry) {
    LedgerProperties.AppendProperties retry = ledgerProperties.append();
    int maxAttempts = retry.maxAttempts();
    Duration backoff = retry.initialBackoff();
    for (int attempt = 1; ; attempt++) {
      try {
        auditStore.insert(entry);
        return;
      } catch (DuplicateBlockException e) {
        // Someone else wrote this block; retrying cannot help
        log.error("Block {} already exists in the store. Chain state is out of sync with persisted blocks.",
            entry.blockNumber());
        throw new AuditAppendException("Block " + entry.blockNumber() + " is already persisted.", e);
      } catch (StoreException e) {
        if (attempt >= maxAttempts) {
          log.error("Insert of block {} failed after {} attempts: {}", entry.blockNumber(), attempt, e.getMessage());
          throw new AuditAppendException(
              "Failed to persist audit block " + entry.blockNumber() + " after " + attempt + " attempts.", e);
        }
        log.warn("Insert of block {} failed (attempt {}/{}): {}. Retrying in {} ms.",
            entry.blockNumber(), attempt, maxAttempts, e.getMessage(), backoff.toMillis());
        sleep(backoff, entry.blockNumber(), e);
        backoff = backoff.multipliedBy(2);
        if (backoff.compareTo(retry.maxBackoff()) > 0) {
          backoff = retry.maxBackoff();
        }
      }
    }
  }

  private static void sleep(Duration backoff, long blockNumber, StoreException lastFailure) {
    try {
      Thread.sleep(backoff.toMillis());
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      AuditAppendException failure = new AuditAppendException(
          "Interrupted while retrying insert of audit block " + blockNumber + ".", lastFailure);
      failure.addSuppressed(ie);
      throw failure;
    }
  }

  private void reportFailure(long blockNumber, AuditLog auditLog, Throwable cause) {
    complianceMonitor.record(MonitorEvent.builder()
        .timestamp(clock.instant())
        .type(MonitorEvent.TYPE_APPEND_FAILURE)
        .outcome(MonitorEvent.OUTCOME_FAILURE)
        .blockNumber(blockNumber)
        .correlationId(auditLog.correlationId())
        .reason(cause.getClass().getSimpleName() + ": " + cause.getMessage())
        .data(Map.of("category", auditLog.category().name()))
        .build());
  }
}
