package io.shardguard.storage;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Shards as plain files. Relative ids resolve against the base directory, absolute ids
 * are used as-is. Overwrites go through a sibling temp file and a move so a failed write
 * never leaves a half-written shard.
 */
public final class FileShardStore implements ShardStore {
    private final Path baseDir;

    public FileShardStore() {
        this(null);
    }

    public FileShardStore(Path baseDir) {
        this.baseDir = baseDir == null ? null : baseDir.toAbsolutePath().normalize();
    }

    public Path resolve(String shardId) {
        if (shardId == null || shardId.isBlank()) {
            throw new IllegalArgumentException("shard id cannot be empty");
        }
        Path raw = Path.of(shardId.trim());
        if (raw.isAbsolute() || baseDir == null) {
            return raw.toAbsolutePath().normalize();
        }
        return baseDir.resolve(raw).normalize();
    }

    @Override
    public byte[] readAll(String shardId) throws IOException {
        Path path = resolve(shardId);
        if (!Files.isRegularFile(path)) {
            throw new ShardNotFoundException(shardId);
        }
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new ShardNotFoundException(shardId);
        }
    }

    @Override
    public void overwrite(String shardId, byte[] content) throws IOException {
        Path path = resolve(shardId);
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = Files.createTempFile(parent, path.getFileName().toString() + ".", ".tmp");
        try {
            Files.write(tmp, content == null ? new byte[0] : content);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
