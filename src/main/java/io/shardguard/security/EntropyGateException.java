package io.shardguard.security;

public final class EntropyGateException extends Exception {
    private final double measured;
    private final double threshold;

    public EntropyGateException(double measured, double threshold) {
        super(String.format("Ciphertext entropy %.4f bits/byte below required %.4f", measured, threshold));
        this.measured = measured;
        this.threshold = threshold;
    }

    public double measured() {
        return measured;
    }

    public double threshold() {
        return threshold;
    }
}
