package io.shardguard.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shardguard.analysis.EntropyAnalyzer;
import io.shardguard.util.Jsons;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AES-256-GCM sealer backed by a JSON keyring file. Rotation adds a key and makes it
 * active; older keys stay in the ring so earlier shards remain openable.
 */
public final class AesGcmShardSealer implements ShardSealer {
    public static final String SCHEMA = "shardguard.aesgcm.v1";
    public static final double DEFAULT_ENTROPY_GATE = 7.9;
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    private static final int KEY_BYTES = 32;

    private final Path keyFile;
    private final double entropyGate;
    private final SecureRandom secureRandom;
    private volatile Keyring keyring;

    public AesGcmShardSealer(Path keyFile) {
        this(keyFile, DEFAULT_ENTROPY_GATE);
    }

    public AesGcmShardSealer(Path keyFile, double entropyGate) {
        if (!Double.isFinite(entropyGate) || entropyGate < 0.0 || entropyGate > 8.0) {
            throw new IllegalArgumentException("entropyGate must be within [0, 8]: " + entropyGate);
        }
        this.keyFile = keyFile;
        this.entropyGate = entropyGate;
        this.secureRandom = new SecureRandom();
        this.keyring = loadOrCreateKeyring();
    }

    @Override
    public SealedShard seal(byte[] plaintext) throws EntropyGateException {
        Keyring ring = keyring;
        SecretKeySpec key = ring.keys.get(ring.activeKid);
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        byte[] cipherText;
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipherText = cipher.doFinal(plaintext == null ? new byte[0] : plaintext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to seal shard", e);
        }
        double entropy = EntropyAnalyzer.entropy(cipherText);
        if (entropy < entropyGate) {
            throw new EntropyGateException(entropy, entropyGate);
        }
        return new SealedShard(SCHEMA, ring.activeKid, iv, cipherText, entropy);
    }

    @Override
    public byte[] open(SealedShard sealed) {
        if (!SCHEMA.equals(sealed.schema())) {
            throw new IllegalArgumentException("Unsupported sealed shard schema: " + sealed.schema());
        }
        Keyring ring = keyring;
        String kid = sealed.kid();
        if (kid != null && !kid.isBlank()) {
            SecretKeySpec exact = ring.keys.get(kid);
            if (exact != null) {
                return decrypt(sealed, exact);
            }
        }
        for (SecretKeySpec key : ring.keys.values()) {
            try {
                return decrypt(sealed, key);
            } catch (IllegalStateException ignored) {
                // Try next key in rotation.
            }
        }
        throw new IllegalStateException("Unable to open sealed shard with current keyring");
    }

    public synchronized String rotate() {
        LinkedHashMap<String, SecretKeySpec> next = new LinkedHashMap<>(keyring.keys);
        String kid = newKid(next);
        next.put(kid, newKey());
        Keyring rotated = new Keyring(kid, next);
        persistKeyring(rotated);
        keyring = rotated;
        return kid;
    }

    public String activeKid() {
        return keyring.activeKid;
    }

    public int keyCount() {
        return keyring.keys.size();
    }

    public double entropyGate() {
        return entropyGate;
    }

    private byte[] decrypt(SealedShard sealed, SecretKeySpec key) {
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, sealed.iv()));
            return cipher.doFinal(sealed.ciphertext());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to open sealed shard", e);
        }
    }

    private synchronized Keyring loadOrCreateKeyring() {
        if (!Files.exists(keyFile)) {
            Keyring created = bootstrapKeyring();
            persistKeyring(created);
            return created;
        }
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(keyFile, StandardCharsets.UTF_8));
            String active = node.path("active_kid").asText("");
            JsonNode keysNode = node.path("keys");
            LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
            if (keysNode.isObject()) {
                keysNode.fieldNames().forEachRemaining(kid -> {
                    String rawBase64 = keysNode.path(kid).asText("");
                    if (kid.isBlank() || rawBase64.isBlank()) {
                        return;
                    }
                    keys.put(kid, new SecretKeySpec(Base64.getDecoder().decode(rawBase64), "AES"));
                });
            }
            if (keys.isEmpty()) {
                Keyring created = bootstrapKeyring();
                persistKeyring(created);
                return created;
            }
            if (!keys.containsKey(active)) {
                active = keys.keySet().iterator().next();
            }
            return new Keyring(active, keys);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to load sealer keyring: " + keyFile, e);
        }
    }

    private Keyring bootstrapKeyring() {
        LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
        String kid = newKid(keys);
        keys.put(kid, newKey());
        return new Keyring(kid, keys);
    }

    private SecretKeySpec newKey() {
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        return new SecretKeySpec(raw, "AES");
    }

    private static String newKid(Map<String, SecretKeySpec> existing) {
        long ms = Instant.now().toEpochMilli();
        String kid = "k" + ms;
        while (existing.containsKey(kid)) {
            ms++;
            kid = "k" + ms;
        }
        return kid;
    }

    private void persistKeyring(Keyring ring) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            LinkedHashMap<String, String> keys = new LinkedHashMap<>();
            for (Map.Entry<String, SecretKeySpec> entry : ring.keys.entrySet()) {
                keys.put(entry.getKey(), Base64.getEncoder().encodeToString(entry.getValue().getEncoded()));
            }
            ObjectNode root = Jsons.mapper().createObjectNode();
            root.put("schema", "shardguard.sealer.keys.v1");
            root.put("active_kid", ring.activeKid);
            root.set("keys", Jsons.mapper().valueToTree(keys));
            Files.writeString(keyFile, Jsons.toJson(root), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist sealer keyring: " + keyFile, e);
        }
    }

    private record Keyring(String activeKid, LinkedHashMap<String, SecretKeySpec> keys) {
    }
}
