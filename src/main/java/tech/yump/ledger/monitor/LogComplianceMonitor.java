package tech.yump.ledger.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes monitoring events as JSON to the application log, prefixed with {@code LEDGER_EVENT:}.
 * Integrity violations go out at ERROR, everything else at INFO.
 */
@Slf4j
@RequiredArgsConstructor
public class LogComplianceMonitor implements ComplianceMonitor {

    private final ObjectMapper objectMapper;

    @Override
    public void record(MonitorEvent event) {
        if (event == null) {
            log.warn("Attempted to record a null monitor event.");
            return;
        }

        boolean violation = MonitorEvent.TYPE_INTEGRITY_VIOLATION.equals(event.type());
        try {
            String jsonEvent = objectMapper.writeValueAsString(event);
            if (violation) {
                log.error("LEDGER_EVENT: {}", jsonEvent);
            } else {
                log.info("LEDGER_EVENT: {}", jsonEvent);
            }
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize MonitorEvent to JSON. Logging raw event details.", e);
            log.info("LEDGER_EVENT_FALLBACK: {}", event);
        }
    }
}
