package io.shardguard.storage;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class FileShardStoreTest {

    @Test
    void missingShardRaisesNotFound() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-store-missing-");
        try {
            FileShardStore store = new FileShardStore(root);
            ShardNotFoundException error = Assertions.assertThrows(
                    ShardNotFoundException.class, () -> store.readAll("absent.bin"));
            Assertions.assertEquals("absent.bin", error.shardId());

            Files.createDirectories(root.resolve("dir.bin"));
            Assertions.assertThrows(ShardNotFoundException.class, () -> store.readAll("dir.bin"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void overwriteReplacesContentWithoutLeavingTempFiles() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-store-overwrite-");
        try {
            FileShardStore store = new FileShardStore(root);
            Path shard = root.resolve("keys").resolve("shard-1.bin");
            Files.createDirectories(shard.getParent());
            Files.write(shard, new byte[]{1, 2, 3});

            Assertions.assertArrayEquals(new byte[]{1, 2, 3}, store.readAll("keys/shard-1.bin"));
            byte[] replacement = new byte[1024];
            replacement[7] = 42;
            store.overwrite("keys/shard-1.bin", replacement);

            Assertions.assertArrayEquals(replacement, Files.readAllBytes(shard));
            try (Stream<Path> listing = Files.list(shard.getParent())) {
                List<Path> files = listing.toList();
                Assertions.assertEquals(1, files.size());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void absoluteIdsIgnoreBaseDirectory() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-store-abs-");
        Path other = Files.createTempDirectory("shardguard-test-store-other-");
        try {
            Path shard = other.resolve("outside.bin");
            Files.write(shard, new byte[]{9});
            FileShardStore store = new FileShardStore(root);
            Assertions.assertEquals(shard.toAbsolutePath().normalize(), store.resolve(shard.toString()));
            Assertions.assertArrayEquals(new byte[]{9}, store.readAll(shard.toString()));
            Assertions.assertThrows(IllegalArgumentException.class, () -> store.resolve("  "));
        } finally {
            deleteRecursively(root);
            deleteRecursively(other);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
