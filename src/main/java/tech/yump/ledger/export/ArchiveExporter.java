package tech.yump.ledger.export;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tech.yump.ledger.crypto.ChainHasher;
import tech.yump.ledger.crypto.CryptoException;
import tech.yump.ledger.crypto.EncryptedData;
import tech.yump.ledger.crypto.EncryptionService;
import tech.yump.ledger.event.AuditLogCodec;
import tech.yump.ledger.ledger.AuditLedger;
import tech.yump.ledger.ledger.AuditValidationException;
import tech.yump.ledger.monitor.ComplianceMonitor;
import tech.yump.ledger.monitor.MonitorEvent;
import tech.yump.ledger.store.AuditStore;
import tech.yump.ledger.store.StoredAuditEntry;
import tech.yump.ledger.verify.IntegrityVerifier;
import tech.yump.ledger.verify.VerificationRequest;
import tech.yump.ledger.verify.VerificationResult;

/**
 * Re-encrypts a verified block range under a caller-supplied AES-256 access key.
 * <p>
 * Blocks {@code [1, end]} are verified in full before anything is decrypted for export; a
 * broken chain refuses the export.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArchiveExporter {

  private static final int ACCESS_KEY_LENGTH = 32;
  private static final ObjectMapper BUNDLE_MAPPER = AuditLogCodec.mapper();
  private static final TypeReference<List<ArchivedEntry>> ENTRY_LIST = new TypeReference<>() {};

  private final IntegrityVerifier integrityVerifier;
  private final AuditStore auditStore;
  private final AuditLedger auditLedger;
  private final EncryptionService encryptionService;
  private final ChainHasher chainHasher;
  private final ComplianceMonitor complianceMonitor;
  private final Clock clock;

  /**
   * @throws AuditValidationException if the range or the access key is malformed, or the range
   *                                  extends past the chain head.
   * @throws ExportRefusedException   if blocks {@code [1, endBlock]} do not verify.
   */
  public EncryptedBundle exportRange(long startBlock, long endBlock, String accessKeyB64) {
    if (startBlock < 1 || endBlock < startBlock) {
      throw new AuditValidationException("Invalid export range [" + startBlock + ", " + endBlock + "].");
    }
    SecretKey accessKey = decodeAccessKey(accessKeyB64);

    VerificationResult verification = integrityVerifier.verify(VerificationRequest.builder()
        .startBlock(1)
        .endBlock(endBlock)
        .maxEntries(Integer.MAX_VALUE)
        .build());
    if (!verification.ok()) {
      log.error("Export of [{}, {}] refused: chain broken at block {} ({}).",
          startBlock, endBlock, verification.brokenAtBlock(), verification.reason());
      throw new ExportRefusedException("Audit chain is broken at block " + verification.brokenAtBlock()
          + "; range [" + startBlock + ", " + endBlock + "] cannot be exported.", verification);
    }
    if (verification.lastVerifiedBlock() == null || verification.lastVerifiedBlock() < endBlock) {
      throw new AuditValidationException("Export range [" + startBlock + ", " + endBlock
          + "] extends past the last persisted block " + verification.lastVerifiedBlock() + ".");
    }

    List<ArchivedEntry> entries;
    try (Stream<StoredAuditEntry> stored = auditStore.queryRange(startBlock, endBlock)) {
      entries = stored.map(auditLedger::open).map(ArchivedEntry::from).toList();
    }
    ArchivedEntry last = entries.isEmpty() ? null : entries.get(entries.size() - 1);
    if (entries.size() != endBlock - startBlock + 1 || !verification.lastVerifiedHash().equals(last.hash())) {
      // The store changed between verification and read
      throw new ExportRefusedException("Blocks [" + startBlock + ", " + endBlock
          + "] changed after verification; export aborted.", verification);
    }

    byte[] payload;
    try {
      payload = BUNDLE_MAPPER.writeValueAsBytes(entries);
    } catch (IOException e) {
      throw new CryptoException("Failed to serialize export payload.", e);
    }

    Instant now = clock.instant();
    EncryptedBundle bundle = EncryptedBundle.builder()
        .bundleId(UUID.randomUUID())
        .startBlock(startBlock)
        .endBlock(endBlock)
        .entryCount(entries.size())
        .anchorPreviousHash(entries.get(0).previousHash())
        .lastHash(last.hash())
        .payloadSha256(chainHasher.digest(payload))
        .createdAt(now)
        .payload(encryptionService.encrypt(payload, accessKey))
        .build();
    Arrays.fill(payload, (byte) 0);

    log.info("Exported audit blocks [{}, {}] as bundle {}.", startBlock, endBlock, bundle.bundleId());
    complianceMonitor.record(MonitorEvent.builder()
        .timestamp(now)
        .type(MonitorEvent.TYPE_EXPORT)
        .outcome(MonitorEvent.OUTCOME_SUCCESS)
        .blockNumber(endBlock)
        .data(Map.of("bundleId", bundle.bundleId().toString(), "startBlock", startBlock,
            "entryCount", bundle.entryCount()))
        .build());
    return bundle;
  }

  /**
   * Decrypts a bundle and checks its payload digest.
   *
   * @throws AuditValidationException if the access key is malformed.
   * @throws CryptoException          if the key is wrong or the bundle was modified.
   */
  public List<ArchivedEntry> openBundle(EncryptedBundle bundle, String accessKeyB64) {
    if (bundle == null || bundle.payload() == null) {
      throw new AuditValidationException("Bundle and its payload are required.");
    }
    byte[] payload = encryptionService.decrypt(bundle.payload(), decodeAccessKey(accessKeyB64));
    String digest = chainHasher.digest(payload);
    if (!digest.equals(bundle.payloadSha256())) {
      throw new CryptoException("Bundle " + bundle.bundleId() + " payload digest does not match its header.");
    }
    try {
      List<ArchivedEntry> entries = BUNDLE_MAPPER.readValue(payload, ENTRY_LIST);
      if (entries.size() != bundle.entryCount()) {
        throw new CryptoException("Bundle " + bundle.bundleId() + " holds " + entries.size()
            + " entries but its header declares " + bundle.entryCount() + ".");
      }
      return entries;
    } catch (IOException e) {
      throw new CryptoException("Bundle " + bundle.bundleId() + " payload is not a valid entry list.", e);
    } finally {
      Arrays.fill(payload, (byte) 0);
    }
  }

  private static SecretKey decodeAccessKey(String accessKeyB64) {
    if (!StringUtils.hasText(accessKeyB64)) {
      throw new AuditValidationException("An access key is required to export or open an archive bundle.");
    }
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(accessKeyB64.trim().getBytes(StandardCharsets.US_ASCII));
    } catch (IllegalArgumentException e) {
      throw new AuditValidationException("Access key is not valid Base64.", e);
    }
    try {
      if (keyBytes.length != ACCESS_KEY_LENGTH) {
        throw new AuditValidationException("Access key must be " + ACCESS_KEY_LENGTH + " bytes for AES-256.");
      }
      return new SecretKeySpec(keyBytes, "AES");
    } finally {
      Arrays.fill(keyBytes, (byte) 0);
    }
  }
}
