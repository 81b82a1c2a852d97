package io.shardguard.alert;

/**
 * Why a shard was destroyed. The overwrite size grows with the assumed severity.
 */
public enum ApoptosisReason {
    ENTROPY_VIOLATION("entropy_violation", 1024),
    MATHEMATICAL_BACKDOOR("mathematical_backdoor", 2048);

    private final String wireName;
    private final int overwriteBytes;

    ApoptosisReason(String wireName, int overwriteBytes) {
        this.wireName = wireName;
        this.overwriteBytes = overwriteBytes;
    }

    public String wireName() {
        return wireName;
    }

    public int overwriteBytes() {
        return overwriteBytes;
    }
}
