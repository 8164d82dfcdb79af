package tech.yump.ledger.chain;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * In-memory cursor over the chain: the {@code (blockNumber, lastHash)} the next append builds on.
 * <p>
 * Starts {@link ChainStatus#UNINITIALIZED}; {@link #initialize(Optional)} adopts the head read
 * from the store (or genesis) and moves to {@link ChainStatus#READY} exactly once. Afterwards
 * the head only moves forward one block at a time through {@link #advance(ChainHead, ChainHead)}.
 */
@Slf4j
@Component
public class ChainState {

  private final AtomicReference<ChainStatus> status = new AtomicReference<>(ChainStatus.UNINITIALIZED);
  private final AtomicReference<ChainHead> head = new AtomicReference<>(null);

  /**
   * Adopts the last persisted block, or genesis when the store is empty.
   *
   * @throws IllegalStateException if the state is already READY.
   */
  public synchronized void initialize(Optional<ChainHead> lastPersisted) {
    if (status.get() == ChainStatus.READY) {
      throw new IllegalStateException("Chain state is already initialized at block " + head.get().blockNumber() + ".");
    }
    ChainHead initial = lastPersisted.orElse(ChainHead.GENESIS);
    head.set(initial);
    status.set(ChainStatus.READY);
    if (initial.isGenesis()) {
      log.info("Chain state READY: empty chain, next block is 1.");
    } else {
      log.info("Chain state READY: resuming after block {}.", initial.blockNumber());
    }
  }

  /**
   * @throws ChainNotReadyException if {@link #initialize(Optional)} has not completed.
   */
  public ChainHead head() throws ChainNotReadyException {
    ChainHead current = head.get();
    if (current == null || status.get() != ChainStatus.READY) {
      throw new ChainNotReadyException("Chain state is not initialized. The last persisted block has not been read yet.");
    }
    return current;
  }

  /**
   * Moves the head from {@code expected} to {@code next}. Only called after {@code next} has
   * been persisted.
   *
   * @throws IllegalStateException if the head is no longer {@code expected}, or {@code next}
   *                               is not its immediate successor.
   */
  public void advance(ChainHead expected, ChainHead next) {
    if (next.blockNumber() != expected.blockNumber() + 1) {
      throw new IllegalStateException("Block " + next.blockNumber() + " does not follow block " + expected.blockNumber() + ".");
    }
    if (!head.compareAndSet(expected, next)) {
      // Two writers built on the same head; the chain would fork
      log.error("Chain head moved concurrently. Expected block {}, found {}.", expected.blockNumber(), head.get());
      throw new IllegalStateException("Chain head changed concurrently; refusing to advance to block " + next.blockNumber() + ".");
    }
    log.debug("Chain head advanced to block {}.", next.blockNumber());
  }

  public ChainStatus getStatus() {
    return status.get();
  }

  public boolean isReady() {
    return status.get() == ChainStatus.READY;
  }

  public Optional<ChainHead> currentHead() {
    return isReady() ? Optional.ofNullable(head.get()) : Optional.empty();
  }
}
