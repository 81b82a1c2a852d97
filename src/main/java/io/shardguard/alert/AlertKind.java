package io.shardguard.alert;

public enum AlertKind {
    ENTROPY_VIOLATION("entropy_violation"),
    TEMPERATURE_VIOLATION("temperature_violation"),
    REGULARITY_DETECTED("regularity_detected"),
    CRYPTOGRAPHIC_APOPTOSIS("cryptographic_apoptosis");

    private final String wireName;

    AlertKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static AlertKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("alert kind cannot be empty");
        }
        for (AlertKind value : values()) {
            if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown alert kind: " + raw);
    }
}
