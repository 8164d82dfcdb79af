package tech.yump.ledger.trail;

import tech.yump.ledger.event.EventResult;

public enum PaymentAction {
    PAYMENT_ATTEMPT("payment_attempt", EventResult.SUCCESS),
    PAYMENT_SUCCESS("payment_success", EventResult.SUCCESS),
    PAYMENT_FAILURE("payment_failure", EventResult.FAILURE),
    REFUND("refund", EventResult.SUCCESS);

    private final String action;
    private final EventResult result;

    PaymentAction(String action, EventResult result) {
        this.action = action;
        this.result = result;
    }

    public String action() {
        return action;
    }

    public EventResult result() {
        return result;
    }
}
