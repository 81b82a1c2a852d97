package io.shardguard.sharding;

import io.shardguard.storage.ShardStore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Persists encoded shares through a {@link ShardStore}, one shard location per share, so
 * the same locations can be handed to the enforcer for monitoring.
 */
public final class KeyShareRepository {
    private final ShardStore store;

    public KeyShareRepository(ShardStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public static String shareId(String prefix, int index) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("share prefix cannot be empty");
        }
        return prefix.trim() + ".share-" + index;
    }

    public List<String> save(String prefix, List<KeyShare> shares) throws IOException {
        List<String> ids = new ArrayList<>(shares.size());
        for (KeyShare share : shares) {
            String id = shareId(prefix, share.index());
            store.overwrite(id, share.encode());
            ids.add(id);
        }
        return ids;
    }

    public List<KeyShare> load(List<String> shareIds) throws IOException {
        List<KeyShare> out = new ArrayList<>(shareIds.size());
        for (String id : shareIds) {
            byte[] raw = store.readAll(id);
            try {
                out.add(KeyShare.decode(raw));
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid key share at " + id + ": " + e.getMessage(), e);
            }
        }
        return out;
    }
}
