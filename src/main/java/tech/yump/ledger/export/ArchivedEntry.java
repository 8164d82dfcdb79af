package tech.yump.ledger.export;

import java.time.Instant;
import java.util.UUID;
import tech.yump.ledger.event.AuditLog;
import tech.yump.ledger.ledger.SecureAuditEntry;

/**
 * One block as carried inside an export bundle: chain coordinates plus the decrypted log body.
 */
public record ArchivedEntry(
    UUID id,
    long blockNumber,
    String previousHash,
    String hash,
    String signature,
    Instant createdAt,
    AuditLog log
) {

  static ArchivedEntry from(SecureAuditEntry entry) {
    return new ArchivedEntry(entry.id(), entry.blockNumber(), entry.previousHash(), entry.hash(),
        entry.signature(), entry.createdAt(), entry.log());
  }
}
