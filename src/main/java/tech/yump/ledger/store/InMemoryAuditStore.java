package tech.yump.ledger.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import tech.yump.ledger.chain.ChainHead;

/**
 * Non-durable {@link AuditStore} for development and tests ({@code ledger.store.type=memory}).
 * Everything is lost when the process exits.
 */
@Slf4j
public class InMemoryAuditStore implements AuditStore {

  protected final ConcurrentNavigableMap<Long, StoredAuditEntry> blocks = new ConcurrentSkipListMap<>();

  public InMemoryAuditStore() {
    log.warn("Using the in-memory audit store. Audit blocks will NOT survive a restart.");
  }

  @Override
  public void insert(StoredAuditEntry entry) throws StoreException {
    if (entry == null || entry.blockNumber() < 1) {
      throw new IllegalArgumentException("Entry cannot be null and its block number must be positive.");
    }
    if (blocks.putIfAbsent(entry.blockNumber(), entry) != null) {
      throw new DuplicateBlockException(entry.blockNumber());
    }
    log.trace("Stored block {} in memory.", entry.blockNumber());
  }

  @Override
  public Stream<StoredAuditEntry> queryRange(long startBlock, long endBlock) throws StoreException {
    if (startBlock > endBlock) {
      return Stream.empty();
    }
    // Snapshot, so concurrent appends do not leak into a running scan
    List<StoredAuditEntry> snapshot = List.copyOf(blocks.subMap(startBlock, true, endBlock, true).values());
    return snapshot.stream();
  }

  @Override
  public Optional<ChainHead> getLastBlock() throws StoreException {
    Map.Entry<Long, StoredAuditEntry> last = blocks.lastEntry();
    if (last == null) {
      return Optional.empty();
    }
    return Optional.of(new ChainHead(last.getKey(), last.getValue().hash()));
  }

  public int size() {
    return blocks.size();
  }
}
