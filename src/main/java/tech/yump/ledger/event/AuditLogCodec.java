package tech.yump.ledger.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Canonical JSON form of an {@link AuditLog}.
 * <p>
 * The canonical bytes are what gets hashed, signed and encrypted, so this mapper is
 * independent of the application's Spring-managed {@code ObjectMapper}:
 * keys are sorted, dates are ISO-8601 strings and null fields are omitted.
 */
@Slf4j
public final class AuditLogCodec {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    private AuditLogCodec() {
    }

    public static byte[] encode(AuditLog auditLog) {
        try {
            return CANONICAL_MAPPER.writeValueAsBytes(auditLog);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit log to canonical JSON: {}", e.getMessage());
            throw new IllegalArgumentException("Audit log cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    public static AuditLog decode(byte[] canonical) {
        try {
            return CANONICAL_MAPPER.readValue(canonical, AuditLog.class);
        } catch (IOException e) {
            log.error("Failed to parse canonical audit log JSON: {}", e.getMessage());
            throw new IllegalArgumentException("Audit log bytes are not valid canonical JSON.", e);
        }
    }

    /**
     * A copy of the canonical mapper, for components that must inspect values the way the codec sees them.
     */
    public static ObjectMapper mapper() {
        return CANONICAL_MAPPER.copy();
    }
}
