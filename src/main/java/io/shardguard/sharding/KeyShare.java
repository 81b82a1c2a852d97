package io.shardguard.sharding;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * One share of a threshold-split key. Encoded as {@code [threshold][index][payload...]};
 * the payload has the same length as the key.
 *
 * @param threshold number of distinct shares needed to rebuild the key
 * @param index     x coordinate of the share, 1..255
 * @param payload   polynomial values, one byte per key byte
 */
public record KeyShare(int threshold, int index, byte[] payload) {
    static final int HEADER_BYTES = 2;

    public KeyShare {
        if (threshold < ThresholdKeySharder.MIN_THRESHOLD || threshold > ThresholdKeySharder.MAX_SHARES) {
            throw new IllegalArgumentException("threshold out of range: " + threshold);
        }
        if (index < 1 || index > ThresholdKeySharder.MAX_SHARES) {
            throw new IllegalArgumentException("share index out of range: " + index);
        }
        if (payload == null || payload.length == 0) {
            throw new IllegalArgumentException("share payload cannot be empty");
        }
        payload = payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public byte[] encode() {
        byte[] out = new byte[HEADER_BYTES + payload.length];
        out[0] = (byte) threshold;
        out[1] = (byte) index;
        System.arraycopy(payload, 0, out, HEADER_BYTES, payload.length);
        return out;
    }

    public static KeyShare decode(byte[] raw) {
        if (raw == null || raw.length <= HEADER_BYTES) {
            throw new IllegalArgumentException("encoded share too short");
        }
        return new KeyShare(raw[0] & 0xFF, raw[1] & 0xFF, Arrays.copyOfRange(raw, HEADER_BYTES, raw.length));
    }

    public String toHex() {
        return HexFormat.of().formatHex(encode());
    }

    public static KeyShare fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex share cannot be null");
        }
        return decode(HexFormat.of().parseHex(hex.trim()));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof KeyShare)) {
            return false;
        }
        KeyShare that = (KeyShare) other;
        return threshold == that.threshold && index == that.index && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * threshold + index) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "KeyShare[threshold=" + threshold + ", index=" + index + ", bytes=" + payload.length + "]";
    }
}
