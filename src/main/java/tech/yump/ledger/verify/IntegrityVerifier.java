package tech.yump.ledger.verify;

import java.time.Clock;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.ledger.chain.ChainHead;
import tech.yump.ledger.chain.ChainState;
import tech.yump.ledger.config.LedgerProperties;
import tech.yump.ledger.crypto.ChainHasher;
import tech.yump.ledger.crypto.CryptoException;
import tech.yump.ledger.crypto.EncryptionService;
import tech.yump.ledger.crypto.EntrySigner;
import tech.yump.ledger.crypto.KeyUnavailableException;
import tech.yump.ledger.monitor.ComplianceMonitor;
import tech.yump.ledger.monitor.MonitorEvent;
import tech.yump.ledger.store.AuditStore;
import tech.yump.ledger.store.StoreException;
import tech.yump.ledger.store.StoredAuditEntry;

/**
 * Replays a block range and reports the first block at which the chain is broken.
 * <p>
 * Each block is checked, in ascending order, for sequence, linkage to the block before it,
 * GCM authenticity of its body and clear columns, the recomputed hash and the HMAC signature. The scan stops at
 * the first failure. It does not take the append lock: it covers exactly the range it is given,
 * as persisted when each block is read. Integrity violations are returned, never thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntegrityVerifier {

  private final AuditStore auditStore;
  private final ChainState chainState;
  private final ChainHasher chainHasher;
  private final EntrySigner entrySigner;
  private final EncryptionService encryptionService;
  private final ComplianceMonitor complianceMonitor;
  private final Clock clock;
  private final LedgerProperties ledgerProperties;

  public VerificationResult verify(long startBlock, long endBlock) {
    return verify(VerificationRequest.of(startBlock, endBlock));
  }

  /**
   * @throws IllegalArgumentException if {@code startBlock < 1}.
   * @throws StoreException           if the store cannot be read.
   * @throws KeyUnavailableException  if the ledger keys are not loaded.
   */
  public VerificationResult verify(VerificationRequest request) {
    long start = request.startBlock();
    long end = request.endBlock();
    if (start < 1) {
      throw new IllegalArgumentException("Start block must be at least 1 but was " + start + ".");
    }

    String anchor = start == 1 ? ChainHead.GENESIS_HASH : request.expectedPreviousHash();
    boolean anchored = anchor != null;
    if (end < start) {
      log.debug("Empty verification range [{}, {}].", start, end);
      return VerificationResult.intact(start, end, anchored, 0, null, null);
    }
    if (!anchored) {
      log.warn("Verifying [{}, {}] without an anchor: linkage of block {} to earlier history is not checked.",
          start, end, start);
    }

    int maxEntries = request.maxEntries() != null
        ? request.maxEntries()
        : ledgerProperties.verification().maxEntriesPerCall();
    VerificationCancellation cancellation = request.cancellation();
    // Blocks up to this head were persisted before the scan began
    Optional<ChainHead> headAtStart = chainState.isReady() ? chainState.currentHead() : auditStore.getLastBlock();

    log.info("Verifying audit chain blocks [{}, {}] (anchored={}).", start, end, anchored);
    long expectedBlock = start;
    String priorHash = anchor;
    long verified = 0;
    Long lastBlock = null;
    String lastHash = null;

    try (Stream<StoredAuditEntry> entries = auditStore.queryRange(start, end)) {
      Iterator<StoredAuditEntry> iterator = entries.iterator();
      while (iterator.hasNext()) {
        if (cancellation != null && cancellation.isCancelled()) {
          log.info("Verification cancelled after {} blocks (last verified: {}).", verified, lastBlock);
          return VerificationResult.partial(start, end, anchored, verified, lastBlock, lastHash, "Cancelled by caller.");
        }
        if (verified >= maxEntries) {
          log.info("Verification reached its cap of {} blocks (last verified: {}).", maxEntries, lastBlock);
          return VerificationResult.partial(start, end, anchored, verified, lastBlock, lastHash,
              "Stopped after " + maxEntries + " blocks.");
        }

        StoredAuditEntry entry = iterator.next();
        if (entry.blockNumber() > expectedBlock) {
          return violation(VerificationResult.broken(start, end, anchored, verified, expectedBlock,
              FailureReason.MISSING_BLOCK, "Block " + expectedBlock + " is missing; next stored block is "
                  + entry.blockNumber() + ".", lastBlock, lastHash));
        }
        if (entry.blockNumber() < expectedBlock) {
          return violation(VerificationResult.broken(start, end, anchored, verified, entry.blockNumber(),
              FailureReason.OUT_OF_ORDER_BLOCK, "Block " + entry.blockNumber() + " returned where block "
                  + expectedBlock + " was expected.", lastBlock, lastHash));
        }

        Optional<Failure> failure = check(entry, priorHash);
        if (failure.isPresent()) {
          return violation(VerificationResult.broken(start, end, anchored, verified, entry.blockNumber(),
              failure.get().reason(), failure.get().detail(), lastBlock, lastHash));
        }

        priorHash = entry.hash();
        lastBlock = entry.blockNumber();
        lastHash = entry.hash();
        expectedBlock++;
        verified++;
      }
    }

    if (headAtStart.isPresent()) {
      ChainHead head = headAtStart.get();
      if (expectedBlock <= end && expectedBlock <= head.blockNumber()) {
        return violation(VerificationResult.broken(start, end, anchored, verified, expectedBlock,
            FailureReason.MISSING_BLOCK, "Block " + expectedBlock + " is missing; the chain head is block "
                + head.blockNumber() + ".", lastBlock, lastHash));
      }
      if (lastBlock != null && lastBlock == head.blockNumber() && !head.hash().equals(lastHash)) {
        return violation(VerificationResult.broken(start, end, anchored, verified, lastBlock,
            FailureReason.HEAD_MISMATCH, "Stored hash of block " + lastBlock + " differs from the live chain head.",
            null, null));
      }
    }

    log.info("Audit chain blocks [{}, {}] verified: {} blocks intact.", start, end, verified);
    complianceMonitor.record(MonitorEvent.builder()
        .timestamp(clock.instant())
        .type(MonitorEvent.TYPE_VERIFICATION)
        .outcome(MonitorEvent.OUTCOME_SUCCESS)
        .blockNumber(lastBlock)
        .data(Map.of("startBlock", start, "endBlock", end, "entriesVerified", verified, "anchored", anchored))
        .build());
    return VerificationResult.intact(start, end, anchored, verified, lastBlock, lastHash);
  }

  private Optional<Failure> check(StoredAuditEntry entry, String priorHash) {
    long block = entry.blockNumber();
    if (entry.previousHash() == null || (priorHash != null && !priorHash.equals(entry.previousHash()))) {
      return Optional.of(new Failure(FailureReason.LINKAGE_MISMATCH,
          "previousHash of block " + block + " does not match the hash of the block before it."));
    }

    byte[] canonical;
    try {
      canonical = encryptionService.decrypt(entry.encryptedLog(), entry.associatedData());
    } catch (KeyUnavailableException e) {
      // Not a property of the block
      throw e;
    } catch (CryptoException e) {
      return Optional.of(new Failure(FailureReason.DECRYPTION_FAILED,
          "Body of block " + block + " could not be decrypted or its clear columns were altered: "
              + e.getMessage()));
    }

    String recomputed = chainHasher.hash(canonical, entry.previousHash());
    if (!recomputed.equals(entry.hash())) {
      return Optional.of(new Failure(FailureReason.HASH_MISMATCH,
          "Stored hash of block " + block + " does not match its contents."));
    }
    if (!entrySigner.verify(canonical, entry.hash(), entry.signature())) {
      return Optional.of(new Failure(FailureReason.SIGNATURE_INVALID,
          "Signature of block " + block + " does not verify."));
    }
    return Optional.empty();
  }

  private VerificationResult violation(VerificationResult result) {
    log.error("INTEGRITY VIOLATION: audit chain broken at block {} ({}): {}",
        result.brokenAtBlock(), result.reason(), result.detail());
    complianceMonitor.record(MonitorEvent.builder()
        .timestamp(clock.instant())
        .type(MonitorEvent.TYPE_INTEGRITY_VIOLATION)
        .outcome(MonitorEvent.OUTCOME_FAILURE)
        .blockNumber(result.brokenAtBlock())
        .reason(result.reason().name())
        .data(Map.of("startBlock", result.startBlock(), "endBlock", result.endBlock(), "detail", result.detail()))
        .build());
    return result;
  }

  private record Failure(FailureReason reason, String detail) {}
}
