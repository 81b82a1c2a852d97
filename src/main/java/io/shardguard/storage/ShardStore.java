package io.shardguard.storage;

import java.io.IOException;

/**
 * Read and destructive-overwrite access to named shard locations.
 */
public interface ShardStore {
    /**
     * @throws ShardNotFoundException when {@code shardId} does not resolve to existing content
     * @throws IOException            when the content exists but cannot be read
     */
    byte[] readAll(String shardId) throws IOException;

    /**
     * Replaces the full content of {@code shardId}. There is no backup of the prior content.
     */
    void overwrite(String shardId, byte[] content) throws IOException;
}
