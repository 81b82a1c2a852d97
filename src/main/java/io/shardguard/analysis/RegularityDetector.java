package io.shardguard.analysis;

import java.util.HashMap;
import java.util.Map;

/**
 * Screens a block for regularities that genuine key material should not show.
 *
 * <p>Two independent heuristics, evaluated in order with short-circuit:
 * <ul>
 *   <li>bit balance: a set-bit fraction within {@value #BIT_BALANCE_TOLERANCE} of exactly 0.5 is
 *   treated as too perfect;</li>
 *   <li>repetition: for window lengths 2..4, any substring seen more than
 *   {@value #REPETITION_FACTOR} times the count expected for uniform data.</li>
 * </ul>
 * Inputs shorter than {@value #MIN_LENGTH} bytes are never flagged.
 */
public final class RegularityDetector {
    public static final int MIN_LENGTH = 100;
    public static final double BIT_BALANCE_TOLERANCE = 0.01;
    public static final double REPETITION_FACTOR = 10.0;
    private static final int[] PATTERN_LENGTHS = {2, 3, 4};

    private RegularityDetector() {
    }

    public static boolean detect(byte[] data) {
        return inspect(data).detected();
    }

    public static RegularityFinding inspect(byte[] data) {
        if (data == null || data.length < MIN_LENGTH) {
            return RegularityFinding.insufficient();
        }
        double bitRatio = setBitRatio(data);
        if (Math.abs(bitRatio - 0.5) < BIT_BALANCE_TOLERANCE) {
            return new RegularityFinding(RegularityFinding.Heuristic.BIT_BALANCE, bitRatio, 0, 0L, 0.0);
        }
        for (int patternLength : PATTERN_LENGTHS) {
            RegularityFinding repeated = repeatedPattern(data, patternLength, bitRatio);
            if (repeated != null) {
                return repeated;
            }
        }
        return RegularityFinding.clean(bitRatio);
    }

    public static double setBitRatio(byte[] data) {
        if (data == null || data.length == 0) {
            return 0.0;
        }
        long setBits = 0L;
        for (byte b : data) {
            setBits += Integer.bitCount(b & 0xFF);
        }
        return setBits / (data.length * 8.0);
    }

    public static double expectedOccurrences(int dataLength, int patternLength) {
        return dataLength / Math.pow(256.0, patternLength);
    }

    private static RegularityFinding repeatedPattern(byte[] data, int patternLength, double bitRatio) {
        if (data.length < patternLength) {
            return null;
        }
        double expected = expectedOccurrences(data.length, patternLength);
        double limit = expected * REPETITION_FACTOR;
        if (patternLength == 2) {
            int[] counts = new int[1 << 16];
            for (int i = 0; i + 2 <= data.length; i++) {
                int key = ((data[i] & 0xFF) << 8) | (data[i + 1] & 0xFF);
                int count = ++counts[key];
                if (count > limit) {
                    return new RegularityFinding(RegularityFinding.Heuristic.REPETITION, bitRatio, 2, count, expected);
                }
            }
            return null;
        }
        Map<Integer, Integer> counts = new HashMap<>();
        for (int i = 0; i + patternLength <= data.length; i++) {
            int key = 0;
            for (int j = 0; j < patternLength; j++) {
                key = (key << 8) | (data[i + j] & 0xFF);
            }
            int count = counts.merge(key, 1, Integer::sum);
            if (count > limit) {
                return new RegularityFinding(
                        RegularityFinding.Heuristic.REPETITION, bitRatio, patternLength, count, expected);
            }
        }
        return null;
    }
}
