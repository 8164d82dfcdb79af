package tech.yump.ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.ledger.monitor.ComplianceMonitor;
import tech.yump.ledger.monitor.FileComplianceMonitor;
import tech.yump.ledger.monitor.LogComplianceMonitor;

@Configuration
@Slf4j
public class MonitorConfiguration {

    private final ObjectMapper objectMapper;

    public MonitorConfiguration(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.monitor.backend", havingValue = "slf4j", matchIfMissing = true)
    public ComplianceMonitor logComplianceMonitor() {
        log.info("Configuring SLF4j compliance monitor");
        return new LogComplianceMonitor(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.monitor.backend", havingValue = "file")
    public ComplianceMonitor fileComplianceMonitor() {
        // Logback owns the file; the path is only read by logback-spring.xml
        log.info("Configuring file compliance monitor. Ensure Logback is configured for logger '{}' and path property '{}'.",
                FileComplianceMonitor.MONITOR_LOGGER_NAME, LedgerProperties.MonitorProperties.PATH_PROPERTY);
        return new FileComplianceMonitor(objectMapper);
    }
}
