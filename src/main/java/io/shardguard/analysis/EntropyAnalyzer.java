package io.shardguard.analysis;

/**
 * Shannon entropy over the byte-value distribution of a block, in bits per byte.
 */
public final class EntropyAnalyzer {
    public static final int BYTE_VALUES = 256;

    private EntropyAnalyzer() {
    }

    public static long[] byteFrequencies(byte[] data) {
        long[] counts = new long[BYTE_VALUES];
        if (data == null) {
            return counts;
        }
        for (byte b : data) {
            counts[b & 0xFF]++;
        }
        return counts;
    }

    /**
     * @return entropy in [0, 8]; 0.0 for empty or null input
     */
    public static double entropy(byte[] data) {
        if (data == null || data.length == 0) {
            return 0.0;
        }
        long[] counts = byteFrequencies(data);
        double length = data.length;
        double entropy = 0.0;
        for (long count : counts) {
            if (count == 0) {
                continue;
            }
            double p = count / length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        // Rounding can leave -0.0 for single-valued input.
        return Math.max(0.0, Math.min(8.0, entropy));
    }
}
