package tech.yump.ledger.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.Arrays;

/**
 * Hikari pool for the JDBC audit store. Only active with {@code ledger.store.type=jdbc}.
 */
@Configuration
@ConditionalOnProperty(name = "ledger.store.type", havingValue = "jdbc")
@RequiredArgsConstructor
@Slf4j
public class DataSourceConfig {

    private final LedgerProperties ledgerProperties;

    @Bean(destroyMethod = "close")
    public DataSource ledgerDataSource() {
        log.info("Configuring Hikari DataSource for the audit store...");

        LedgerProperties.JdbcProperties jdbc = ledgerProperties.store().jdbc();
        if (jdbc == null) {
            log.error("JDBC store configuration (ledger.store.jdbc) is missing. Cannot configure DataSource.");
            throw new IllegalStateException("Missing JDBC configuration for the audit store.");
        }

        char[] passwordChars = null;
        try {
            passwordChars = jdbc.password() != null ? jdbc.password().clone() : null;
            if (passwordChars == null || passwordChars.length == 0) {
                log.error("Audit store database password is empty or null in configuration.");
                throw new IllegalStateException("Audit store database password cannot be empty.");
            }

            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(jdbc.connectionUrl());
            config.setUsername(jdbc.username());
            // HikariConfig has no char[] setter
            config.setPassword(new String(passwordChars));
            config.setDriverClassName("org.postgresql.Driver");
            config.setPoolName("AuditLedgerPool");
            config.setMaximumPoolSize(jdbc.maximumPoolSize());
            config.setMinimumIdle(Math.min(2, jdbc.maximumPoolSize()));

            log.info("Creating HikariDataSource for URL: {}, User: {}", config.getJdbcUrl(), config.getUsername());
            return new HikariDataSource(config);
        } finally {
            if (passwordChars != null) {
                Arrays.fill(passwordChars, '\0');
                log.debug("Local copy of audit store DB password cleared from memory.");
            }
        }
    }
}
