package tech.yump.ledger.monitor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes monitoring events as bare JSON lines to a dedicated logger, which
 * {@code logback-spring.xml} routes to its own file under the {@code monitor-file} profile.
 */
@RequiredArgsConstructor
@Slf4j
public class FileComplianceMonitor implements ComplianceMonitor {

    public static final String MONITOR_LOGGER_NAME = "tech.yump.ledger.monitor.FILE_MONITOR";
    private static final Logger monitorLogger = LoggerFactory.getLogger(MONITOR_LOGGER_NAME);

    private final ObjectMapper objectMapper;

    @Override
    public void record(MonitorEvent event) {
        if (event == null) {
            log.warn("Attempted to record a null monitor event.");
            return;
        }

        try {
            monitorLogger.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            // Keep the monitor file pure JSON; report the failure in the application log
            log.error("Failed to serialize MonitorEvent to JSON for file monitoring. Type={}, Block={}",
                    event.type(), event.blockNumber(), e);
        }
    }
}
