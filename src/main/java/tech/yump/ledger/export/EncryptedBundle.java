package tech.yump.ledger.export;

import java.time.Instant;
import java.util.UUID;
import lombok.Builder;
import tech.yump.ledger.crypto.EncryptedData;

/**
 * A verified block range re-encrypted under a caller-supplied access key for off-system archival.
 * <p>
 * The header fields are in clear; {@code payload} holds the JSON array of {@link ArchivedEntry}
 * and {@code payloadSha256} is the digest of that plaintext.
 */
@Builder
public record EncryptedBundle(
    UUID bundleId,
    long startBlock,
    long endBlock,
    int entryCount,
    String anchorPreviousHash,
    String lastHash,
    String payloadSha256,
    Instant createdAt,
    EncryptedData payload
) {}
