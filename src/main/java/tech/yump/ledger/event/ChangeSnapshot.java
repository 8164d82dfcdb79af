package tech.yump.ledger.event;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * State of a changed resource before and after an administrative action.
 * Either side may be a map, a list or a plain value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChangeSnapshot(
        Object before,
        Object after
) {}
