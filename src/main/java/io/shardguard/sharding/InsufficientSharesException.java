package io.shardguard.sharding;

public final class InsufficientSharesException extends Exception {
    private final int provided;
    private final int threshold;

    public InsufficientSharesException(int provided, int threshold) {
        super("Need at least " + threshold + " distinct shares, but only " + provided + " provided");
        this.provided = provided;
        this.threshold = threshold;
    }

    public int provided() {
        return provided;
    }

    public int threshold() {
        return threshold;
    }
}
