package tech.yump.ledger.sanitize;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tech.yump.ledger.config.LedgerProperties;
import tech.yump.ledger.event.AuditEvent;
import tech.yump.ledger.event.AuditLogCodec;
import tech.yump.ledger.event.ChangeSnapshot;
import tech.yump.ledger.event.SanitizedEvent;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Redacts sensitive fields from audit events before they reach the chain.
 * <p>
 * Any map key whose lower-cased name contains one of the configured patterns is replaced
 * with the redaction token, at any nesting depth in the metadata and the change snapshot.
 * Patterns match anywhere in the key, so short patterns redact more than their name suggests.
 * Objects that are neither maps nor collections are inspected through Jackson; anything that
 * cannot be converted passes through unchanged.
 * <p>
 * Nesting deeper than {@value #MAX_DEPTH} levels is not followed: the whole subtree below
 * that depth is replaced with the redaction token, whatever its keys.
 */
@Slf4j
@Component
public class Sanitizer {

    private static final int MAX_DEPTH = 32;

    private final List<String> sensitivePatterns;
    private final String redactionToken;
    private final ObjectMapper inspector = AuditLogCodec.mapper();

    @Autowired
    public Sanitizer(LedgerProperties properties) {
        this(properties.sanitizer().sensitiveFields(), properties.sanitizer().redactionToken());
    }

    public Sanitizer(List<String> sensitivePatterns, String redactionToken) {
        this.sensitivePatterns = sensitivePatterns.stream()
                .filter(Objects::nonNull)
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .filter(p -> !p.isEmpty())
                .distinct()
                .toList();
        this.redactionToken = redactionToken;
        log.info("Sanitizer configured with {} sensitive field patterns.", this.sensitivePatterns.size());
    }

    public SanitizedEvent sanitize(AuditEvent event) {
        Objects.requireNonNull(event, "event");
        AuditEvent.AuditEventBuilder builder = event.toBuilder();
        if (event.metadata() != null) {
            builder.metadata(redactMap(event.metadata(), 0));
        }
        if (event.changes() != null) {
            builder.changes(new ChangeSnapshot(
                    redactValue(event.changes().before(), 0),
                    redactValue(event.changes().after(), 0)));
        }
        return new SanitizedEvent(builder.build());
    }

    /**
     * Whether a field name matches one of the configured patterns (case-insensitive substring match).
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        String lower = fieldName.toLowerCase(Locale.ROOT);
        for (String pattern : sensitivePatterns) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    public String redactionToken() {
        return redactionToken;
    }

    private Map<String, Object> redactMap(Map<?, ?> source, int depth) {
        Map<String, Object> redacted = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (isSensitive(key)) {
                redacted.put(key, redactionToken);
            } else {
                redacted.put(key, redactValue(entry.getValue(), depth + 1));
            }
        }
        return redacted;
    }

    private Object redactValue(Object value, int depth) {
        if (value == null || isScalar(value)) {
            return value;
        }
        if (depth > MAX_DEPTH) {
            // Self-referencing or absurdly deep structures are cut off rather than followed
            log.warn("Metadata nesting exceeds {} levels; deeper content replaced by redaction token.", MAX_DEPTH);
            return redactionToken;
        }
        if (value instanceof Map<?, ?> map) {
            return redactMap(map, depth);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(redactValue(item, depth + 1));
            }
            return items;
        }
        if (value instanceof Object[] array) {
            List<Object> items = new ArrayList<>(array.length);
            for (Object item : array) {
                items.add(redactValue(item, depth + 1));
            }
            return items;
        }
        return inspect(value, depth);
    }

    private Object inspect(Object value, int depth) {
        try {
            Object tree = inspector.convertValue(value, Object.class);
            if (tree instanceof Map<?, ?> || tree instanceof Collection<?>) {
                return redactValue(tree, depth);
            }
            return tree;
        } catch (IllegalArgumentException e) {
            log.debug("Value of type {} cannot be inspected for sensitive fields; passing through.",
                    value.getClass().getName());
            return value;
        }
    }

    private static boolean isScalar(Object value) {
        return value instanceof CharSequence
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum<?>
                || value instanceof UUID
                || value instanceof TemporalAccessor;
    }
}
