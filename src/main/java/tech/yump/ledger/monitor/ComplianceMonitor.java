package tech.yump.ledger.monitor;

/**
 * Destination for ledger monitoring events: appends, append failures, integrity violations
 * and exports. Separate from the chain itself; losing a monitoring event never affects the ledger.
 */
public interface ComplianceMonitor {

    /**
     * Records a monitoring event.
     * Implementations determine *where* the event goes (application log, dedicated file, ...).
     *
     * @param event The MonitorEvent to record. Must not be null.
     */
    void record(MonitorEvent event);

}
