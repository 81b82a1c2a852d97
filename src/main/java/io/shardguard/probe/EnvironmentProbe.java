package io.shardguard.probe;

/**
 * Source of ambient-signal readings (a temperature proxy, in degrees Celsius for the
 * bundled providers). Implementations must return promptly and should not throw;
 * wrap untrusted providers in {@link FallbackEnvironmentProbe}.
 */
@FunctionalInterface
public interface EnvironmentProbe {
    double read();
}
