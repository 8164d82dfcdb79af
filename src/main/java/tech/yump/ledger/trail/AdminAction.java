package tech.yump.ledger.trail;

public enum AdminAction {
    CONFIG_CHANGE("config_change"),
    USER_PRIVILEGE_CHANGE("user_privilege_change"),
    SYSTEM_ACCESS("system_access"),
    DATA_BACKUP("data_backup"),
    RETENTION_SWEEP("retention_sweep");

    private final String action;

    AdminAction(String action) {
        this.action = action;
    }

    public String action() {
        return action;
    }
}
