package tech.yump.ledger.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.annotation.UserConfigurations;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import tech.yump.ledger.monitor.ComplianceMonitor;
import tech.yump.ledger.monitor.FileComplianceMonitor;
import tech.yump.ledger.monitor.LogComplianceMonitor;
import tech.yump.ledger.store.AuditStore;
import tech.yump.ledger.store.FileSystemAuditStore;
import tech.yump.ledger.store.InMemoryAuditStore;
import tech.yump.ledger.store.JdbcAuditStore;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class LedgerConfigurationTest {

    @TempDir
    Path tempDir;

    @EnableConfigurationProperties(LedgerProperties.class)
    static class PropertiesConfig {}

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withConfiguration(UserConfigurations.of(PropertiesConfig.class, LedgerConfiguration.class,
                    MonitorConfiguration.class))
            .withPropertyValues(
                    "ledger.keys.signing-key-b64=AQIDBAUGBwgJCgsMDQ4PEBESExQVFhcYGRobHB0eHyA=",
                    "ledger.keys.encryption-key-b64=ZWZnaGlqa2xtbm9wcXJzdHV2d3h5ent8fX5/gIGCg4Q="
            );

    @Test
    @DisplayName("Memory store type should select the in-memory store and the SLF4j monitor by default")
    void memoryStore_DefaultMonitor() {
        contextRunner
                .withPropertyValues("ledger.store.type=memory")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(AuditStore.class);
                    assertThat(context.getBean(AuditStore.class)).isInstanceOf(InMemoryAuditStore.class);
                    assertThat(context.getBean(ComplianceMonitor.class)).isInstanceOf(LogComplianceMonitor.class);
                    assertThat(context.getBean(Clock.class).getZone().getId()).isEqualTo("Z");
                });
    }

    @Test
    @DisplayName("Filesystem store type should create the block directory on startup")
    void filesystemStore_CreatesDirectory() {
        Path base = tempDir.resolve("ledger-data");
        contextRunner
                .withPropertyValues("ledger.store.type=filesystem", "ledger.store.filesystem.path=" + base)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(AuditStore.class)).isInstanceOf(FileSystemAuditStore.class);
                    assertThat(Files.isDirectory(base.resolve("blocks"))).isTrue();
                });
    }

    @Test
    @DisplayName("JDBC store type should build the JDBC store on the provided DataSource")
    void jdbcStore_UsesDataSource() {
        contextRunner
                .withBean(DataSource.class, () -> mock(DataSource.class))
                .withPropertyValues(
                        "ledger.store.type=jdbc",
                        "ledger.store.jdbc.connection-url=jdbc:postgresql://localhost:5432/audit",
                        "ledger.store.jdbc.username=audit_writer",
                        "ledger.store.jdbc.password=secret"
                )
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(AuditStore.class)).isInstanceOf(JdbcAuditStore.class);
                });
    }

    @Test
    @DisplayName("File monitor backend should select the file compliance monitor")
    void fileMonitorBackend() {
        contextRunner
                .withPropertyValues("ledger.store.type=memory", "ledger.monitor.backend=file")
                .run(context -> {
                    assertThat(context).hasSingleBean(ComplianceMonitor.class);
                    assertThat(context.getBean(ComplianceMonitor.class)).isInstanceOf(FileComplianceMonitor.class);
                });
    }
}
