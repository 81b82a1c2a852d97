package io.shardguard.security;

/**
 * Encryption seam in front of shard storage. A sealer either returns a ciphertext whose
 * byte entropy meets its gate or refuses with {@link EntropyGateException}.
 */
public interface ShardSealer {
    SealedShard seal(byte[] plaintext) throws EntropyGateException;

    byte[] open(SealedShard sealed);
}
