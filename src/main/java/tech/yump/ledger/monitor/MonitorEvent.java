package tech.yump.ledger.monitor;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single monitoring record, written as one JSON line.
 * Carries block coordinates and classification only, never log bodies or key material.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MonitorEvent(
        Instant timestamp,
        String type,            // e.g. "ledger_append", "integrity_violation"
        String outcome,         // "success" or "failure"
        Long blockNumber,
        String correlationId,
        String reason,
        Map<String, Object> data
) {

    public static final String TYPE_APPEND = "ledger_append";
    public static final String TYPE_APPEND_FAILURE = "ledger_append_failure";
    public static final String TYPE_INTEGRITY_VIOLATION = "integrity_violation";
    public static final String TYPE_VERIFICATION = "chain_verification";
    public static final String TYPE_EXPORT = "archive_export";

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";
}
