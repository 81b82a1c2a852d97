package io.shardguard.alert;

public enum AlertSeverity {
    WARNING("warning"),
    HIGH("high"),
    CRITICAL("critical");

    private final String wireName;

    AlertSeverity(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
