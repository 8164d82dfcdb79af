package tech.yump.ledger.trail;

public enum DataAccessAction {
    DATA_ACCESS("data_access"),
    DATA_EXPORT("data_export"),
    DATA_DELETION("data_deletion"),
    CONSENT_UPDATE("consent_update");

    private final String action;

    DataAccessAction(String action) {
        this.action = action;
    }

    public String action() {
        return action;
    }
}
