package io.shardguard.probe;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.ArrayDeque;
import java.util.Deque;

final class FallbackEnvironmentProbeTest {

    @Test
    void failingProviderYieldsFixedFallbackBeforeAnyGoodReading() {
        FallbackEnvironmentProbe probe = FallbackEnvironmentProbe.wrap(() -> {
            throw new IllegalStateException("sensor offline");
        });
        Assertions.assertEquals(SyntheticTemperatureProbe.FALLBACK_CELSIUS, probe.read(), 1e-12);
        Assertions.assertEquals(1L, probe.failures());
    }

    @Test
    void nonFiniteOrFailingReadingKeepsLastGoodValue() {
        Deque<Object> script = new ArrayDeque<>();
        script.add(21.25);
        script.add(Double.NaN);
        script.add(new IllegalStateException("flaky"));
        script.add(Double.POSITIVE_INFINITY);
        FallbackEnvironmentProbe probe = new FallbackEnvironmentProbe(() -> {
            Object next = script.poll();
            if (next instanceof RuntimeException) {
                throw (RuntimeException) next;
            }
            return (Double) next;
        }, 0.0);

        Assertions.assertEquals(21.25, probe.read(), 1e-12);
        Assertions.assertEquals(21.25, probe.read(), 1e-12);
        Assertions.assertEquals(21.25, probe.read(), 1e-12);
        Assertions.assertEquals(21.25, probe.read(), 1e-12);
        Assertions.assertEquals(3L, probe.failures());
    }

    @Test
    void wrapIsIdempotent() {
        FallbackEnvironmentProbe once = FallbackEnvironmentProbe.wrap(() -> 22.0);
        Assertions.assertSame(once, FallbackEnvironmentProbe.wrap(once));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new FallbackEnvironmentProbe(() -> 1.0, Double.NaN));
    }

    @Test
    void syntheticProbeStaysInConfiguredBand() {
        SyntheticTemperatureProbe probe = new SyntheticTemperatureProbe(new SecureRandom());
        for (int i = 0; i < 1000; i++) {
            double value = probe.read();
            Assertions.assertTrue(value >= SyntheticTemperatureProbe.FLOOR_CELSIUS
                    && value < SyntheticTemperatureProbe.FLOOR_CELSIUS + SyntheticTemperatureProbe.SPAN_CELSIUS);
        }
    }
}
