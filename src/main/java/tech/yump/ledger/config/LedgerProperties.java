package tech.yump.ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Configuration properties for the audit ledger under the 'ledger' prefix.
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
public record LedgerProperties(

        @Valid
        @NotNull(message = "Key configuration (ledger.keys) is required.")
        KeyProperties keys,

        @Valid
        StoreProperties store,

        @Valid
        SanitizerProperties sanitizer,

        @Valid
        AppendProperties append,

        @Valid
        VerificationProperties verification,

        @Valid
        MonitorProperties monitor
) {

    public LedgerProperties {
        if (store == null) {
            store = new StoreProperties(null, null, null);
        }
        if (sanitizer == null) {
            sanitizer = new SanitizerProperties(null, null);
        }
        if (append == null) {
            append = new AppendProperties(null, null, null);
        }
        if (verification == null) {
            verification = new VerificationProperties(null);
        }
        if (monitor == null) {
            monitor = new MonitorProperties(null);
        }
    }

    // --- KeyProperties ---
    /**
     * Key material supplied by the external secret store (usually through environment variables).
     */
    @Validated
    public record KeyProperties(
            @NotBlank(message = "Signing key (ledger.keys.signing-key-b64) must be provided.")
            String signingKeyB64,

            @NotBlank(message = "Encryption key (ledger.keys.encryption-key-b64) must be provided.")
            String encryptionKeyB64
    ) {
        @Override
        public String toString() {
            // Never print key material
            return "KeyProperties[signingKeyB64=******, encryptionKeyB64=******]";
        }
    }

    public enum StoreType {
        FILESYSTEM, JDBC, MEMORY
    }

    // --- StoreProperties ---
    @Validated
    public record StoreProperties(
            StoreType type,

            @Valid
            FileSystemProperties filesystem,

            @Valid
            JdbcProperties jdbc
    ) {
        public StoreProperties {
            if (type == null) {
                type = StoreType.FILESYSTEM;
            }
        }

        @AssertTrue(message = "Filesystem store path (ledger.store.filesystem.path) must be provided when ledger.store.type=filesystem.")
        public boolean isFilesystemConfigValid() {
            return type != StoreType.FILESYSTEM || (filesystem != null && StringUtils.hasText(filesystem.path()));
        }

        @AssertTrue(message = "JDBC store settings (ledger.store.jdbc) must be provided when ledger.store.type=jdbc.")
        public boolean isJdbcConfigValid() {
            return type != StoreType.JDBC || jdbc != null;
        }

        @Validated
        public record FileSystemProperties(
                @NotBlank(message = "Filesystem store path (ledger.store.filesystem.path) must be provided.")
                String path
        ) {}
    }

    @Validated
    public record JdbcProperties(
            @NotBlank(message = "JDBC connection URL (ledger.store.jdbc.connection-url) must be provided.")
            String connectionUrl,

            @NotBlank(message = "JDBC username (ledger.store.jdbc.username) must be provided.")
            String username,

            @NotNull(message = "JDBC password (ledger.store.jdbc.password) must be provided.")
            char[] password,

            String tableName,

            boolean initializeSchema,

            Integer maximumPoolSize
    ) {
        public static final String DEFAULT_TABLE_NAME = "secure_audit_logs";

        public JdbcProperties {
            if (!StringUtils.hasText(tableName)) {
                tableName = DEFAULT_TABLE_NAME;
            }
            if (maximumPoolSize == null) {
                maximumPoolSize = 10;
            }
        }

        @AssertTrue(message = "JDBC table name (ledger.store.jdbc.table-name) must be a plain SQL identifier.")
        public boolean isTableNameValid() {
            return tableName.matches("[A-Za-z_][A-Za-z0-9_]{0,62}");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            JdbcProperties that = (JdbcProperties) o;
            return initializeSchema == that.initializeSchema &&
                    Objects.equals(connectionUrl, that.connectionUrl) &&
                    Objects.equals(username, that.username) &&
                    Arrays.equals(password, that.password) &&
                    Objects.equals(tableName, that.tableName) &&
                    Objects.equals(maximumPoolSize, that.maximumPoolSize);
        }

        @Override
        public int hashCode() {
            int result = Objects.hash(connectionUrl, username, tableName, initializeSchema, maximumPoolSize);
            result = 31 * result + Arrays.hashCode(password);
            return result;
        }

        @Override
        public String toString() {
            return "JdbcProperties[" +
                    "connectionUrl='" + connectionUrl + '\'' +
                    ", username='" + username + '\'' +
                    ", password=******" +
                    ", tableName='" + tableName + '\'' +
                    ", initializeSchema=" + initializeSchema +
                    ", maximumPoolSize=" + maximumPoolSize +
                    ']';
        }
    }

    // --- SanitizerProperties ---
    @Validated
    public record SanitizerProperties(
            List<String> sensitiveFields,
            String redactionToken
    ) {
        public static final List<String> DEFAULT_SENSITIVE_FIELDS = List.of(
                "password", "secret", "token", "key", "card", "ssn", "cvv", "authorization");
        public static final String DEFAULT_REDACTION_TOKEN = "[REDACTED]";

        public SanitizerProperties {
            if (sensitiveFields == null || sensitiveFields.isEmpty()) {
                sensitiveFields = DEFAULT_SENSITIVE_FIELDS;
            }
            if (!StringUtils.hasText(redactionToken)) {
                redactionToken = DEFAULT_REDACTION_TOKEN;
            }
        }
    }

    // --- AppendProperties ---
    /**
     * Bounded retry applied to store inserts on the append path.
     */
    @Validated
    public record AppendProperties(
            @Min(value = 1, message = "ledger.append.max-attempts must be at least 1.")
            Integer maxAttempts,

            Duration initialBackoff,

            Duration maxBackoff
    ) {
        public AppendProperties {
            if (maxAttempts == null) {
                maxAttempts = 3;
            }
            if (initialBackoff == null) {
                initialBackoff = Duration.ofMillis(100);
            }
            if (maxBackoff == null) {
                maxBackoff = Duration.ofSeconds(2);
            }
        }

        @AssertTrue(message = "ledger.append.max-backoff must not be shorter than ledger.append.initial-backoff.")
        public boolean isBackoffRangeValid() {
            return !initialBackoff.isNegative() && maxBackoff.compareTo(initialBackoff) >= 0;
        }
    }

    // --- VerificationProperties ---
    @Validated
    public record VerificationProperties(
            @Min(value = 1, message = "ledger.verification.max-entries-per-call must be at least 1.")
            Integer maxEntriesPerCall
    ) {
        public VerificationProperties {
            if (maxEntriesPerCall == null) {
                maxEntriesPerCall = 10_000;
            }
        }
    }

    // --- MonitorProperties ---
    @Validated
    public record MonitorProperties(
            String backend // "slf4j" (default) or "file"
    ) {
        public static final String PATH_PROPERTY = "ledger.monitor.file.path";

        public MonitorProperties {
            if (!StringUtils.hasText(backend)) {
                backend = "slf4j";
            }
        }
    }
}
