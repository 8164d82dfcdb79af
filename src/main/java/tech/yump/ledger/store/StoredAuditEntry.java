package tech.yump.ledger.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.Builder;
import tech.yump.ledger.crypto.EncryptedData;
import tech.yump.ledger.event.ComplianceTag;

/**
 * Persisted form of a block. The log body is only held encrypted; id, block number, creation
 * time and compliance tags stay in clear so stores can filter on them without decrypting.
 * Those clear columns are bound to the body as GCM associated data (see
 * {@link #associatedData()}), so altering any of them fails decryption.
 */
@Builder(toBuilder = true)
public record StoredAuditEntry(
    UUID id,
    long blockNumber,
    EncryptedData encryptedLog,
    String hash,
    String previousHash,
    String signature,
    Instant createdAt,
    Set<ComplianceTag> complianceTags
) {
  public StoredAuditEntry {
    complianceTags = complianceTags == null ? Set.of() : Set.copyOf(complianceTags);
  }

  /**
   * The clear columns of this entry in the form authenticated by the body's GCM tag.
   */
  @JsonIgnore
  public byte[] associatedData() {
    return associatedData(id, blockNumber, createdAt, complianceTags);
  }

  public static byte[] associatedData(UUID id, long blockNumber, Instant createdAt, Set<ComplianceTag> tags) {
    // Tags in declaration order so the bytes do not depend on set iteration order
    String tagList = tags == null || tags.isEmpty()
        ? ""
        : EnumSet.copyOf(tags).stream().map(ComplianceTag::name).collect(Collectors.joining(","));
    String header = "v1|" + id + "|" + blockNumber + "|" + createdAt + "|" + tagList;
    return header.getBytes(StandardCharsets.UTF_8);
  }
}
