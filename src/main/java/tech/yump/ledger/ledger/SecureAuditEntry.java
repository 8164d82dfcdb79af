package tech.yump.ledger.ledger;

import java.time.Instant;
import java.util.UUID;
import lombok.Builder;
import tech.yump.ledger.event.AuditLog;

/**
 * A block of the chain in clear form.
 */
@Builder
public record SecureAuditEntry(
    UUID id,
    AuditLog log,
    long blockNumber,
    String previousHash,
    String hash,
    String signature,
    Instant createdAt
) {}
