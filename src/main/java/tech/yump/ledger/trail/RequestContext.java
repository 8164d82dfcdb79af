package tech.yump.ledger.trail;

import lombok.Builder;

/**
 * Where a call came from. Every field is optional.
 */
@Builder
public record RequestContext(
        String sourceAddress,
        String userAgent,
        String deviceId,
        String correlationId
) {
    public static final RequestContext NONE = new RequestContext(null, null, null, null);
}
