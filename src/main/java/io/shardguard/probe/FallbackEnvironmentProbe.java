package io.shardguard.probe;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decorator that keeps monitoring alive when a provider fails: a throwing provider or
 * a non-finite reading yields the last good reading, or the fixed fallback before any
 * good reading has been seen.
 */
public final class FallbackEnvironmentProbe implements EnvironmentProbe {
    private final EnvironmentProbe delegate;
    private final double fallback;
    private final AtomicLong failures;
    private volatile double lastGood;
    private volatile boolean hasLastGood;

    public FallbackEnvironmentProbe(EnvironmentProbe delegate, double fallback) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (!Double.isFinite(fallback)) {
            throw new IllegalArgumentException("fallback must be finite: " + fallback);
        }
        this.fallback = fallback;
        this.failures = new AtomicLong(0L);
    }

    public static FallbackEnvironmentProbe wrap(EnvironmentProbe delegate) {
        if (delegate instanceof FallbackEnvironmentProbe) {
            return (FallbackEnvironmentProbe) delegate;
        }
        return new FallbackEnvironmentProbe(delegate, SyntheticTemperatureProbe.FALLBACK_CELSIUS);
    }

    @Override
    public double read() {
        double value;
        try {
            value = delegate.read();
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            System.err.println("WARN environment probe failed: " + e.getMessage());
            return degraded();
        }
        if (!Double.isFinite(value)) {
            failures.incrementAndGet();
            System.err.println("WARN environment probe returned non-finite reading: " + value);
            return degraded();
        }
        lastGood = value;
        hasLastGood = true;
        return value;
    }

    public long failures() {
        return failures.get();
    }

    private double degraded() {
        return hasLastGood ? lastGood : fallback;
    }
}
