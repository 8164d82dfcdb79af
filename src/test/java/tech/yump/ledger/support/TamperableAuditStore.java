package tech.yump.ledger.support;

import tech.yump.ledger.store.InMemoryAuditStore;
import tech.yump.ledger.store.StoredAuditEntry;

import java.util.function.UnaryOperator;

/**
 * In-memory store that lets tests do what an attacker with write access to the store could:
 * rewrite or drop persisted blocks.
 */
public class TamperableAuditStore extends InMemoryAuditStore {

    public void tamper(long blockNumber, UnaryOperator<StoredAuditEntry> change) {
        StoredAuditEntry original = blocks.get(blockNumber);
        if (original == null) {
            throw new IllegalArgumentException("No block " + blockNumber + " to tamper with.");
        }
        blocks.put(blockNumber, change.apply(original));
    }

    public void drop(long blockNumber) {
        blocks.remove(blockNumber);
    }

    public StoredAuditEntry get(long blockNumber) {
        return blocks.get(blockNumber);
    }
}
