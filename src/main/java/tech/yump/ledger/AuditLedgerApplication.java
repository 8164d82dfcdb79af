package tech.yump.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.ledger.config.LedgerProperties;

@Slf4j
@SpringBootApplication(
        exclude = { DataSourceAutoConfiguration.class }
)
@EnableConfigurationProperties(LedgerProperties.class)
public class AuditLedgerApplication {

  public static void main(String[] args) {
    SpringApplication.run(AuditLedgerApplication.class, args);
    log.info(">>> Audit Ledger Started <<<");
  }
}
