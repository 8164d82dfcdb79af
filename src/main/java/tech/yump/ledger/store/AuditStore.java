package tech.yump.ledger.store;

import java.util.Optional;
import java.util.stream.Stream;
import tech.yump.ledger.chain.ChainHead;

/**
 * Append-only persistence for audit blocks.
 * Implementations store the entries, never update or delete them.
 */
public interface AuditStore {

  /**
   * Persists a new block.
   *
   * @param entry The block to store. Must not be null.
   * @throws DuplicateBlockException If a block with the same number already exists.
   * @throws StoreException          If the store is unavailable or the write fails.
   */
  void insert(StoredAuditEntry entry) throws StoreException;

  /**
   * Streams the persisted blocks with {@code startBlock <= blockNumber <= endBlock} in
   * ascending block order. Missing blocks are simply absent from the stream.
   * The caller must close the stream.
   *
   * @throws StoreException If the store cannot be read.
   */
  Stream<StoredAuditEntry> queryRange(long startBlock, long endBlock) throws StoreException;

  /**
   * Number and hash of the highest persisted block, or empty for an empty store.
   *
   * @throws StoreException If the store cannot be read.
   */
  Optional<ChainHead> getLastBlock() throws StoreException;
}
