package tech.yump.ledger.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import tech.yump.ledger.chain.ChainHead;
import tech.yump.ledger.crypto.EncryptedData;
import tech.yump.ledger.event.ComplianceTag;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcAuditStoreTest {

  private static final String TABLE = "secure_audit_logs";

  @Mock
  private JdbcTemplate jdbcTemplate;

  private JdbcAuditStore store;

  @BeforeEach
  void setUp() {
    store = new JdbcAuditStore(jdbcTemplate, TABLE, false);
  }

  @Test
  @DisplayName("insert should issue a single INSERT for the block")
  void insert_Success() {
    // Act
    store.insert(FileSystemAuditStoreTest.entry(1));

    // Assert
    verify(jdbcTemplate).update(startsWith("INSERT INTO " + TABLE + " ("), any(Object[].class));
  }

  @Test
  @DisplayName("insert should map a unique-key violation to DuplicateBlockException")
  void insert_DuplicateKey_ThrowsDuplicateBlock() {
    // Arrange
    doThrow(new DuplicateKeyException("duplicate key value violates unique constraint"))
        .when(jdbcTemplate).update(anyString(), any(Object[].class));

    // Act & Assert
    assertThatThrownBy(() -> store.insert(FileSystemAuditStoreTest.entry(4)))
        .isInstanceOf(DuplicateBlockException.class)
        .extracting(e -> ((DuplicateBlockException) e).getBlockNumber())
        .isEqualTo(4L);
  }

  @Test
  @DisplayName("insert should wrap other database failures in StoreException")
  void insert_DatabaseDown_ThrowsStoreException() {
    doThrow(new DataAccessResourceFailureException("connection refused"))
        .when(jdbcTemplate).update(anyString(), any(Object[].class));

    assertThatThrownBy(() -> store.insert(FileSystemAuditStoreTest.entry(2)))
        .isInstanceOf(StoreException.class)
        .isNotInstanceOf(DuplicateBlockException.class)
        .hasMessageContaining("block 2");
  }

  @Test
  @DisplayName("getLastBlock should return the highest row, or empty when the table is empty")
  @SuppressWarnings("unchecked")
  void getLastBlock() {
    when(jdbcTemplate.query(contains("ORDER BY block_number DESC LIMIT 1"), any(RowMapper.class)))
        .thenReturn(List.of(new ChainHead(9, "a".repeat(64))))
        .thenReturn(List.of());

    assertThat(store.getLastBlock()).contains(new ChainHead(9, "a".repeat(64)));
    assertThat(store.getLastBlock()).isEmpty();
  }

  @Test
  @DisplayName("queryRange should map rows, keeping a malformed encrypted_log readable for the verifier")
  @SuppressWarnings("unchecked")
  void queryRange_MapsRows() throws Exception {
    // Arrange
    UUID id = UUID.randomUUID();
    ResultSet rs = mock(ResultSet.class);
    when(rs.getObject("id", UUID.class)).thenReturn(id);
    when(rs.getLong("block_number")).thenReturn(3L);
    when(rs.getString("encrypted_log")).thenReturn("garbage-without-separator");
    when(rs.getString("hash")).thenReturn("b".repeat(64));
    when(rs.getString("previous_hash")).thenReturn("c".repeat(64));
    when(rs.getString("signature")).thenReturn("d".repeat(64));
    when(rs.getTimestamp("created_at")).thenReturn(Timestamp.from(Instant.parse("2024-05-01T10:00:00Z")));
    when(rs.getString("compliance_flags")).thenReturn("SOX,GDPR");
    when(jdbcTemplate.queryForStream(contains("WHERE block_number >= ?"), any(RowMapper.class), any(Object[].class)))
        .thenAnswer(invocation -> {
          RowMapper<StoredAuditEntry> mapper = invocation.getArgument(1);
          return Stream.of(mapper.mapRow(rs, 0));
        });

    // Act
    List<StoredAuditEntry> entries;
    try (Stream<StoredAuditEntry> stream = store.queryRange(3, 3)) {
      entries = stream.toList();
    }

    // Assert
    assertThat(entries).hasSize(1);
    StoredAuditEntry entry = entries.get(0);
    assertThat(entry.id()).isEqualTo(id);
    assertThat(entry.blockNumber()).isEqualTo(3L);
    assertThat(entry.createdAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    assertThat(entry.complianceTags()).containsExactlyInAnyOrder(ComplianceTag.SOX, ComplianceTag.GDPR);
    assertThat(entry.encryptedLog().getNonceBase64()).isNull();
    assertThat(entry.encryptedLog().getCiphertextBase64()).isEqualTo("garbage-without-separator");
  }

  @Test
  @DisplayName("queryRange should not touch the database for an empty range")
  void queryRange_EmptyRange() {
    try (Stream<StoredAuditEntry> stream = store.queryRange(5, 4)) {
      assertThat(stream).isEmpty();
    }
    verifyNoInteractions(jdbcTemplate);
  }

  @Test
  @DisplayName("createTableIfMissing should only run DDL when schema initialization is enabled")
  void createTableIfMissing() {
    store.createTableIfMissing();
    verifyNoInteractions(jdbcTemplate);

    new JdbcAuditStore(jdbcTemplate, TABLE, true).createTableIfMissing();
    verify(jdbcTemplate).execute(contains("CREATE TABLE IF NOT EXISTS " + TABLE));
  }

  @Test
  @DisplayName("Compliance flags should be stored as a comma-separated list of names")
  void formatAndParseTags() {
    assertThat(JdbcAuditStore.formatTags(Set.of(ComplianceTag.GDPR, ComplianceTag.PCI_DSS))).isEqualTo("PCI_DSS,GDPR");
    assertThat(JdbcAuditStore.formatTags(Set.of())).isEmpty();
    assertThat(JdbcAuditStore.parseTags(" SOX , AML,UNKNOWN_FLAG,")).isEqualTo(EnumSet.of(ComplianceTag.SOX, ComplianceTag.AML));
    assertThat(JdbcAuditStore.parseTags(null)).isEmpty();
  }

  @Test
  @DisplayName("The compact column form should carry nonce and ciphertext")
  void encryptedLog_CompactForm() {
    EncryptedData data = new EncryptedData(new byte[12], new byte[] {1, 2, 3});
    assertThat(EncryptedData.fromCompact(data.toCompact())).isEqualTo(data);
  }
}
