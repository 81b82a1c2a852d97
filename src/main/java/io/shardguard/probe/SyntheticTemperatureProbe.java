package io.shardguard.probe;

import java.security.SecureRandom;

/**
 * Simulated sensor: uniformly distributed readings in [20.0, 25.0) drawn from the
 * platform entropy source.
 */
public final class SyntheticTemperatureProbe implements EnvironmentProbe {
    public static final double FLOOR_CELSIUS = 20.0;
    public static final double SPAN_CELSIUS = 5.0;
    public static final double FALLBACK_CELSIUS = 22.5;

    private final SecureRandom random;

    public SyntheticTemperatureProbe() {
        this(new SecureRandom());
    }

    SyntheticTemperatureProbe(SecureRandom random) {
        this.random = random;
    }

    @Override
    public double read() {
        try {
            return FLOOR_CELSIUS + random.nextDouble() * SPAN_CELSIUS;
        } catch (RuntimeException e) {
            System.err.println("WARN synthetic probe read failed, using fallback: " + e.getMessage());
            return FALLBACK_CELSIUS;
        }
    }
}
