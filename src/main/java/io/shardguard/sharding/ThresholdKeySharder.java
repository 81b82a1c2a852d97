package io.shardguard.sharding;

import io.shardguard.analysis.EntropyAnalyzer;
import io.shardguard.analysis.RegularityDetector;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Threshold secret sharing over GF(2^8): a key is split into {@code n} shares so that any
 * {@code threshold} of them rebuild it and fewer reveal nothing. Every key byte is the
 * constant term of its own random polynomial of degree {@code threshold - 1}; share
 * {@code i} holds the polynomials evaluated at {@code x = i}.
 */
public final class ThresholdKeySharder {
    public static final int MIN_THRESHOLD = 2;
    public static final int MAX_SHARES = 255;
    public static final double DEFAULT_ENTROPY_THRESHOLD = 7.2;

    // Field arithmetic uses the AES reduction polynomial x^8 + x^4 + x^3 + x + 1 with generator 3.
    private static final int REDUCTION = 0x11B;
    private static final int[] EXP = new int[510];
    private static final int[] LOG = new int[256];

    static {
        int x = 1;
        for (int i = 0; i < 255; i++) {
            EXP[i] = x;
            LOG[x] = i;
            x ^= x << 1;
            if ((x & 0x100) != 0) {
                x ^= REDUCTION;
            }
        }
        for (int i = 255; i < EXP.length; i++) {
            EXP[i] = EXP[i - 255];
        }
    }

    private final int threshold;
    private final SecureRandom random;

    public ThresholdKeySharder(int threshold) {
        this(threshold, new SecureRandom());
    }

    ThresholdKeySharder(int threshold, SecureRandom random) {
        if (threshold < MIN_THRESHOLD || threshold > MAX_SHARES) {
            throw new IllegalArgumentException(
                    "threshold must be within [" + MIN_THRESHOLD + ", " + MAX_SHARES + "]: " + threshold);
        }
        this.threshold = threshold;
        this.random = Objects.requireNonNull(random, "random");
    }

    public int threshold() {
        return threshold;
    }

    public List<KeyShare> split(byte[] key, int shares) {
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("key cannot be empty");
        }
        if (shares < threshold || shares > MAX_SHARES) {
            throw new IllegalArgumentException(
                    "share count must be within [" + threshold + ", " + MAX_SHARES + "]: " + shares);
        }
        byte[][] payloads = new byte[shares][key.length];
        int[] coefficients = new int[threshold];
        byte[] randomCoefficients = new byte[threshold - 1];
        for (int b = 0; b < key.length; b++) {
            coefficients[0] = key[b] & 0xFF;
            random.nextBytes(randomCoefficients);
            for (int c = 1; c < threshold; c++) {
                coefficients[c] = randomCoefficients[c - 1] & 0xFF;
            }
            for (int s = 0; s < shares; s++) {
                payloads[s][b] = (byte) evaluate(coefficients, s + 1);
            }
        }
        List<KeyShare> out = new ArrayList<>(shares);
        for (int s = 0; s < shares; s++) {
            out.add(new KeyShare(threshold, s + 1, payloads[s]));
        }
        return out;
    }

    /**
     * Rebuilds the key from any {@code threshold} distinct shares; extra shares are ignored.
     *
     * @throws InsufficientSharesException when fewer distinct shares than the threshold are given
     * @throws IllegalArgumentException    when shares come from different splits or disagree on an index
     */
    public static byte[] combine(Collection<KeyShare> shares) throws InsufficientSharesException {
        if (shares == null || shares.isEmpty()) {
            throw new InsufficientSharesException(0, MIN_THRESHOLD);
        }
        KeyShare first = shares.iterator().next();
        int threshold = first.threshold();
        int length = first.payload().length;
        Map<Integer, KeyShare> distinct = new LinkedHashMap<>();
        for (KeyShare share : shares) {
            if (share.threshold() != threshold || share.payload().length != length) {
                throw new IllegalArgumentException("shares belong to different splits: " + first + " vs " + share);
            }
            KeyShare previous = distinct.putIfAbsent(share.index(), share);
            if (previous != null && !previous.equals(share)) {
                throw new IllegalArgumentException("conflicting shares for index " + share.index());
            }
        }
        if (distinct.size() < threshold) {
            throw new InsufficientSharesException(distinct.size(), threshold);
        }
        List<KeyShare> used = new ArrayList<>(distinct.values()).subList(0, threshold);
        int[] weights = lagrangeWeightsAtZero(used);
        byte[] key = new byte[length];
        for (int u = 0; u < used.size(); u++) {
            byte[] payload = used.get(u).payload();
            for (int b = 0; b < length; b++) {
                key[b] ^= (byte) multiply(payload[b] & 0xFF, weights[u]);
            }
        }
        return key;
    }

    public static List<ShareInspection> inspect(Collection<KeyShare> shares, double entropyThreshold) {
        List<ShareInspection> out = new ArrayList<>();
        for (KeyShare share : shares) {
            byte[] encoded = share.encode();
            out.add(new ShareInspection(
                    share.index(),
                    encoded.length,
                    EntropyAnalyzer.entropy(encoded),
                    entropyThreshold,
                    RegularityDetector.detect(encoded)
            ));
        }
        return out;
    }

    private static int evaluate(int[] coefficients, int x) {
        int y = 0;
        for (int c = coefficients.length - 1; c >= 0; c--) {
            y = multiply(y, x) ^ coefficients[c];
        }
        return y;
    }

    private static int[] lagrangeWeightsAtZero(List<KeyShare> shares) {
        int[] weights = new int[shares.size()];
        for (int i = 0; i < shares.size(); i++) {
            int xi = shares.get(i).index();
            int numerator = 1;
            int denominator = 1;
            for (int j = 0; j < shares.size(); j++) {
                if (i == j) {
                    continue;
                }
                int xj = shares.get(j).index();
                numerator = multiply(numerator, xj);
                denominator = multiply(denominator, xi ^ xj);
            }
            weights[i] = divide(numerator, denominator);
        }
        return weights;
    }

    static int multiply(int a, int b) {
        if (a == 0 || b == 0) {
            return 0;
        }
        return EXP[LOG[a] + LOG[b]];
    }

    static int divide(int a, int b) {
        if (b == 0) {
            throw new ArithmeticException("division by zero in GF(256)");
        }
        if (a == 0) {
            return 0;
        }
        return EXP[LOG[a] + 255 - LOG[b]];
    }
}
