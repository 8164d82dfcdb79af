package tech.yump.ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import tech.yump.ledger.store.AuditStore;
import tech.yump.ledger.store.FileSystemAuditStore;
import tech.yump.ledger.store.InMemoryAuditStore;
import tech.yump.ledger.store.JdbcAuditStore;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Selects the {@link AuditStore} from {@code ledger.store.type} and provides the ledger clock.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LedgerConfiguration {

    private final LedgerProperties ledgerProperties;

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.store.type", havingValue = "filesystem", matchIfMissing = true)
    public AuditStore fileSystemAuditStore(ObjectMapper objectMapper) {
        String path = ledgerProperties.store().filesystem().path();
        log.info("Configuring filesystem audit store at '{}'.", path);
        return new FileSystemAuditStore(objectMapper, path);
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.store.type", havingValue = "jdbc")
    public AuditStore jdbcAuditStore(DataSource dataSource) {
        LedgerProperties.JdbcProperties jdbc = ledgerProperties.store().jdbc();
        log.info("Configuring JDBC audit store on table '{}'.", jdbc.tableName());
        return new JdbcAuditStore(new JdbcTemplate(dataSource), jdbc.tableName(), jdbc.initializeSchema());
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.store.type", havingValue = "memory")
    public AuditStore inMemoryAuditStore() {
        log.info("Configuring in-memory audit store.");
        return new InMemoryAuditStore();
    }
}
