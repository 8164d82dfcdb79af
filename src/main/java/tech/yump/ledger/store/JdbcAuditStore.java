package tech.yump.ledger.store;

import jakarta.annotation.PostConstruct;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import tech.yump.ledger.chain.ChainHead;
import tech.yump.ledger.crypto.EncryptedData;
import tech.yump.ledger.event.ComplianceTag;

/**
 * {@link AuditStore} backed by a PostgreSQL table (default {@code secure_audit_logs}).
 * <p>
 * The unique constraint on {@code block_number} enforces one entry per block; the store only
 * ever issues INSERT and SELECT statements.
 */
@Slf4j
public class JdbcAuditStore implements AuditStore {

  private static final String COLUMNS =
      "id, block_number, encrypted_log, hash, previous_hash, signature, created_at, compliance_flags";

  private final JdbcTemplate jdbcTemplate;
  private final String tableName;
  private final boolean initializeSchema;

  private final RowMapper<StoredAuditEntry> entryRowMapper = this::mapEntry;

  public JdbcAuditStore(JdbcTemplate jdbcTemplate, String tableName, boolean initializeSchema) {
    this.jdbcTemplate = jdbcTemplate;
    this.tableName = tableName;
    this.initializeSchema = initializeSchema;
  }

  /**
   * Creates the table when {@code ledger.store.jdbc.initialize-schema} is enabled.
   */
  @PostConstruct
  public void createTableIfMissing() {
    if (!initializeSchema) {
      log.debug("Schema initialization disabled; expecting table '{}' to exist.", tableName);
      return;
    }
    log.info("Ensuring audit table '{}' exists...", tableName);
    try {
      jdbcTemplate.execute(
          "CREATE TABLE IF NOT EXISTS " + tableName + " ("
              + "id UUID PRIMARY KEY, "
              + "block_number BIGINT NOT NULL UNIQUE, "
              + "encrypted_log TEXT NOT NULL, "
              + "hash VARCHAR(64) NOT NULL, "
              + "previous_hash VARCHAR(64) NOT NULL, "
              + "signature VARCHAR(64) NOT NULL, "
              + "created_at TIMESTAMP WITH TIME ZONE NOT NULL, "
              + "compliance_flags TEXT NOT NULL DEFAULT ''"
              + ")");
    } catch (DataAccessException e) {
      log.error("Failed to create audit table '{}': {}", tableName, e.getMessage(), e);
      throw new StoreException("Failed to initialize audit table " + tableName, e);
    }
  }

  @Override
  public void insert(StoredAuditEntry entry) throws StoreException {
    if (entry == null || entry.blockNumber() < 1) {
      throw new IllegalArgumentException("Entry cannot be null and its block number must be positive.");
    }
    String sql = "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    try {
      jdbcTemplate.update(sql,
          entry.id(),
          entry.blockNumber(),
          entry.encryptedLog().toCompact(),
          entry.hash(),
          entry.previousHash(),
          entry.signature(),
          Timestamp.from(entry.createdAt()),
          formatTags(entry.complianceTags()));
      log.debug("Inserted block {} into '{}'.", entry.blockNumber(), tableName);
    } catch (DuplicateKeyException e) {
      throw new DuplicateBlockException(entry.blockNumber(), e);
    } catch (DataAccessException e) {
      log.error("Failed to insert block {} into '{}': {}", entry.blockNumber(), tableName, e.getMessage());
      throw new StoreException("Failed to insert audit block " + entry.blockNumber(), e);
    }
  }

  @Override
  public Stream<StoredAuditEntry> queryRange(long startBlock, long endBlock) throws StoreException {
    if (startBlock > endBlock) {
      return Stream.empty();
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName
        + " WHERE block_number >= ? AND block_number <= ? ORDER BY block_number ASC";
    try {
      return jdbcTemplate.queryForStream(sql, entryRowMapper, startBlock, endBlock);
    } catch (DataAccessException e) {
      log.error("Failed to query blocks [{}, {}] from '{}': {}", startBlock, endBlock, tableName, e.getMessage());
      throw new StoreException("Failed to query audit blocks " + startBlock + ".." + endBlock, e);
    }
  }

  @Override
  public Optional<ChainHead> getLastBlock() throws StoreException {
    String sql = "SELECT block_number, hash FROM " + tableName + " ORDER BY block_number DESC LIMIT 1";
    try {
      List<ChainHead> heads = jdbcTemplate.query(sql,
          (rs, rowNum) -> new ChainHead(rs.getLong("block_number"), rs.getString("hash")));
      return heads.stream().findFirst();
    } catch (DataAccessException e) {
      log.error("Failed to read last block from '{}': {}", tableName, e.getMessage());
      throw new StoreException("Failed to read the last audit block", e);
    }
  }

  private StoredAuditEntry mapEntry(ResultSet rs, int rowNum) throws SQLException {
    Timestamp createdAt = rs.getTimestamp("created_at");
    return StoredAuditEntry.builder()
        .id(rs.getObject("id", UUID.class))
        .blockNumber(rs.getLong("block_number"))
        .encryptedLog(parseEncryptedLog(rs.getLong("block_number"), rs.getString("encrypted_log")))
        .hash(rs.getString("hash"))
        .previousHash(rs.getString("previous_hash"))
        .signature(rs.getString("signature"))
        .createdAt(createdAt != null ? createdAt.toInstant() : null)
        .complianceTags(parseTags(rs.getString("compliance_flags")))
        .build();
  }

  private static EncryptedData parseEncryptedLog(long blockNumber, String compact) {
    try {
      return EncryptedData.fromCompact(compact);
    } catch (IllegalArgumentException e) {
      // Keep the row readable; decryption of the malformed value fails and the verifier reports the block
      log.warn("Block {} has a malformed encrypted_log column: {}", blockNumber, e.getMessage());
      return new EncryptedData(EncryptedData.CURRENT_VERSION, null, compact);
    }
  }

  static String formatTags(Set<ComplianceTag> tags) {
    if (tags == null || tags.isEmpty()) {
      return "";
    }
    return EnumSet.copyOf(tags).stream().map(Enum::name).collect(Collectors.joining(","));
  }

  static Set<ComplianceTag> parseTags(String value) {
    if (value == null || value.isBlank()) {
      return Set.of();
    }
    Set<ComplianceTag> tags = EnumSet.noneOf(ComplianceTag.class);
    Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .forEach(name -> {
          try {
            tags.add(ComplianceTag.valueOf(name));
          } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown compliance flag '{}' read from the audit table.", name);
          }
        });
    return tags;
  }
}
