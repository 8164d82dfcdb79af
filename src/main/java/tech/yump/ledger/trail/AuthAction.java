package tech.yump.ledger.trail;

import tech.yump.ledger.event.EventResult;
import tech.yump.ledger.event.RiskLevel;

public enum AuthAction {
    LOGIN("login", EventResult.SUCCESS, RiskLevel.MEDIUM),
    LOGOUT("logout", EventResult.SUCCESS, RiskLevel.MEDIUM),
    FAILED_LOGIN("failed_login", EventResult.FAILURE, RiskLevel.HIGH),
    PASSWORD_CHANGE("password_change", EventResult.SUCCESS, RiskLevel.MEDIUM),
    ACCOUNT_LOCKED("account_locked", EventResult.FAILURE, RiskLevel.MEDIUM);

    private final String action;
    private final EventResult result;
    private final RiskLevel riskLevel;

    AuthAction(String action, EventResult result, RiskLevel riskLevel) {
        this.action = action;
        this.result = result;
        this.riskLevel = riskLevel;
    }

    public String action() {
        return action;
    }

    public EventResult result() {
        return result;
    }

    public RiskLevel riskLevel() {
        return riskLevel;
    }
}
