package io.shardguard.decoy;

import io.shardguard.util.Hashing;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Mixes deterministic decoy content into a payload and detects it again.
 *
 * <p>The decoy is derived from the SHA-256 of the payload: the first four digest bytes
 * seed a trap generator whose output (sized by {@code ratio}) is placed, together with a
 * 5-byte marker, before, after or inside the payload. Stateless; the same input always
 * produces the same output.
 */
public final class DecoyMixer {
    public static final double DEFAULT_RATIO = 0.1;
    public static final int DEFAULT_COMPLEXITY = 3;
    private static final byte[][] MARKERS = {
            {(byte) 0x00, (byte) 0xDE, (byte) 0xAD, (byte) 0xFA, (byte) 0x11},
            {(byte) 0xCA, (byte) 0xFE, (byte) 0xBA, (byte) 0xBE, (byte) 0x01},
            {(byte) 0xFE, (byte) 0xED, (byte) 0xFA, (byte) 0xCE, (byte) 0x02},
            {(byte) 0xC0, (byte) 0xDE, (byte) 0xC0, (byte) 0xDE, (byte) 0x03},
            {(byte) 0x10, (byte) 0xAD, (byte) 0xBA, (byte) 0x11, (byte) 0x04}
    };

    private final double ratio;
    private final int complexity;

    public DecoyMixer() {
        this(DEFAULT_RATIO, DEFAULT_COMPLEXITY);
    }

    public DecoyMixer(double ratio, int complexity) {
        if (!Double.isFinite(ratio) || ratio < 0.0 || ratio > 1.0) {
            throw new IllegalArgumentException("ratio must be within [0, 1]: " + ratio);
        }
        this.ratio = ratio;
        this.complexity = Math.min(5, Math.max(1, complexity));
    }

    public int complexity() {
        return complexity;
    }

    public byte[] mix(byte[] data) {
        byte[] payload = data == null ? new byte[0] : data;
        long seed = seedOf(payload);
        byte[] chunk = trap(seed, (int) (payload.length * ratio));
        byte[] marker = MARKERS[(int) (seed % MARKERS.length)];
        ByteArrayOutputStream out = new ByteArrayOutputStream(payload.length + marker.length + chunk.length);
        switch ((int) (seed % 3)) {
            case 0 -> {
                out.writeBytes(chunk);
                out.writeBytes(marker);
                out.writeBytes(payload);
            }
            case 1 -> {
                out.writeBytes(payload);
                out.writeBytes(marker);
                out.writeBytes(chunk);
            }
            default -> {
                int insertAt = payload.length == 0 ? 0 : (int) (seed % payload.length);
                out.write(payload, 0, insertAt);
                out.writeBytes(marker);
                out.writeBytes(chunk);
                out.write(payload, insertAt, payload.length - insertAt);
            }
        }
        return out.toByteArray();
    }

    public static boolean containsDecoy(byte[] data) {
        if (data == null) {
            return false;
        }
        for (byte[] marker : MARKERS) {
            if (indexOf(data, marker) >= 0) {
                return true;
            }
        }
        return false;
    }

    static long seedOf(byte[] payload) {
        byte[] digest = Hashing.sha256(payload);
        return ((digest[0] & 0xFFL) << 24) | ((digest[1] & 0xFFL) << 16) | ((digest[2] & 0xFFL) << 8) | (digest[3] & 0xFFL);
    }

    byte[] trap(long seed, int size) {
        if (size <= 0) {
            return new byte[0];
        }
        List<Integer> primes = primes(size / 4);
        switch (complexity) {
            case 1: {
                byte[] out = new byte[primes.size()];
                for (int i = 0; i < out.length; i++) {
                    out[i] = (byte) (primes.get(i) ^ (seed & 0xFF));
                }
                return out;
            }
            case 2: {
                byte[] out = new byte[primes.size()];
                for (int i = 0; i < out.length; i++) {
                    int p = primes.get(i);
                    out[i] = (byte) ((p + (p >> 1)) & 0xFF);
                }
                return out;
            }
            case 3: {
                // Logistic map in its chaotic regime.
                byte[] out = new byte[size];
                double x = (seed & 0xFF) / 255.0;
                for (int i = 0; i < size; i++) {
                    x = 3.9 * x * (1 - x);
                    out[i] = (byte) Math.max(0, Math.min(255, (int) (x * 255)));
                }
                return out;
            }
            case 4: {
                byte[] out = new byte[size];
                long x = seed;
                for (int i = 0; i < size; i++) {
                    x = (x * 1664525L + 1013904223L) & 0xFFFFFFFFL;
                    out[i] = (byte) (x % 256);
                }
                return out;
            }
            default: {
                ByteBuffer buffer = ByteBuffer.allocate(primes.size() * 4);
                for (int p : primes) {
                    buffer.putFloat((float) p / (float) (seed + 1));
                }
                byte[] packed = buffer.array();
                byte[] out = new byte[Math.min(size, packed.length)];
                System.arraycopy(packed, 0, out, 0, out.length);
                return out;
            }
        }
    }

    private static List<Integer> primes(int count) {
        List<Integer> out = new ArrayList<>(Math.max(0, count));
        int n = 1;
        while (out.size() < count) {
            n++;
            boolean prime = true;
            for (int i = 2; (long) i * i <= n; i++) {
                if (n % i == 0) {
                    prime = false;
                    break;
                }
            }
            if (prime) {
                out.add(n);
            }
        }
        return out;
    }

    private static int indexOf(byte[] data, byte[] needle) {
        outer:
        for (int i = 0; i + needle.length <= data.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (data[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
