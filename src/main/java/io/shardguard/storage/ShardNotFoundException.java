package io.shardguard.storage;

import java.io.IOException;

public final class ShardNotFoundException extends IOException {
    private final String shardId;

    public ShardNotFoundException(String shardId) {
        super("Shard not found: " + shardId);
        this.shardId = shardId;
    }

    public String shardId() {
        return shardId;
    }
}
