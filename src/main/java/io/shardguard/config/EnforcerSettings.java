package io.shardguard.config;

import io.shardguard.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Immutable monitoring configuration: thresholds, cadence and the ordered shard set.
 *
 * <p>Values read from {@code shardguard-settings.json} are sanitized field by field;
 * a missing or out-of-range field falls back to its default instead of failing the load.
 */
public record EnforcerSettings(
        double entropyThreshold,
        double temperatureVarianceThreshold,
        int checkIntervalSeconds,
        List<String> shardIds,
        long stopTimeoutMs
) {
    public static final double DEFAULT_ENTROPY_THRESHOLD = 7.2;
    public static final double DEFAULT_TEMPERATURE_VARIANCE_THRESHOLD = 1.0;
    public static final int DEFAULT_CHECK_INTERVAL_SECONDS = 60;
    public static final long DEFAULT_STOP_TIMEOUT_MS = 5_000L;
    public static final double MAX_ENTROPY_BITS = 8.0;

    public EnforcerSettings {
        if (!Double.isFinite(entropyThreshold) || entropyThreshold < 0.0 || entropyThreshold > MAX_ENTROPY_BITS) {
            throw new IllegalArgumentException("entropyThreshold must be within [0, 8]: " + entropyThreshold);
        }
        if (!Double.isFinite(temperatureVarianceThreshold) || temperatureVarianceThreshold < 0.0) {
            throw new IllegalArgumentException(
                    "temperatureVarianceThreshold must be >= 0: " + temperatureVarianceThreshold);
        }
        if (checkIntervalSeconds < 1) {
            throw new IllegalArgumentException("checkIntervalSeconds must be >= 1: " + checkIntervalSeconds);
        }
        if (stopTimeoutMs < 1L) {
            throw new IllegalArgumentException("stopTimeoutMs must be >= 1: " + stopTimeoutMs);
        }
        shardIds = normalizeShardIds(shardIds);
    }

    public static EnforcerSettings defaults() {
        return new EnforcerSettings(
                DEFAULT_ENTROPY_THRESHOLD,
                DEFAULT_TEMPERATURE_VARIANCE_THRESHOLD,
                DEFAULT_CHECK_INTERVAL_SECONDS,
                List.of(),
                DEFAULT_STOP_TIMEOUT_MS
        );
    }

    public static EnforcerSettings of(double entropyThreshold,
                                      double temperatureVarianceThreshold,
                                      int checkIntervalSeconds,
                                      List<String> shardIds) {
        return new EnforcerSettings(
                entropyThreshold,
                temperatureVarianceThreshold,
                checkIntervalSeconds,
                shardIds,
                DEFAULT_STOP_TIMEOUT_MS
        );
    }

    public Duration checkInterval() {
        return Duration.ofSeconds(checkIntervalSeconds);
    }

    public Duration stopTimeout() {
        return Duration.ofMillis(stopTimeoutMs);
    }

    public EnforcerSettings withShardIds(List<String> ids) {
        return new EnforcerSettings(entropyThreshold, temperatureVarianceThreshold, checkIntervalSeconds, ids, stopTimeoutMs);
    }

    public EnforcerSettings withEntropyThreshold(double value) {
        return new EnforcerSettings(value, temperatureVarianceThreshold, checkIntervalSeconds, shardIds, stopTimeoutMs);
    }

    public EnforcerSettings withTemperatureVarianceThreshold(double value) {
        return new EnforcerSettings(entropyThreshold, value, checkIntervalSeconds, shardIds, stopTimeoutMs);
    }

    public EnforcerSettings withCheckIntervalSeconds(int value) {
        return new EnforcerSettings(entropyThreshold, temperatureVarianceThreshold, value, shardIds, stopTimeoutMs);
    }

    /**
     * Loads settings from a JSON file; an absent file yields {@link #defaults()}.
     */
    public static EnforcerSettings load(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        return fromFile(raw, defaults());
    }

    static EnforcerSettings fromFile(SettingsFile file, EnforcerSettings defaults) {
        if (file == null) {
            return defaults;
        }
        double entropy = sanitizeDouble(file.entropyThreshold(), defaults.entropyThreshold(), 0.0, MAX_ENTROPY_BITS);
        double variance = sanitizeDouble(
                file.temperatureVarianceThreshold(),
                defaults.temperatureVarianceThreshold(),
                0.0,
                Double.MAX_VALUE
        );
        int interval = sanitizeInt(file.checkIntervalSeconds(), defaults.checkIntervalSeconds(), 1);
        long stopTimeout = sanitizeLong(file.stopTimeoutMs(), defaults.stopTimeoutMs(), 1L);
        List<String> shards = file.shards() == null ? defaults.shardIds() : file.shards();
        return new EnforcerSettings(entropy, variance, interval, shards, stopTimeout);
    }

    private static List<String> normalizeShardIds(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<String> ordered = new LinkedHashSet<>();
        for (String id : raw) {
            if (id == null || id.isBlank()) {
                continue;
            }
            ordered.add(id.trim());
        }
        return List.copyOf(new ArrayList<>(ordered));
    }

    private static double sanitizeDouble(Double value, double fallback, double min, double max) {
        if (value == null || !Double.isFinite(value) || value < min || value > max) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    record SettingsFile(
            Double entropyThreshold,
            Double temperatureVarianceThreshold,
            Integer checkIntervalSeconds,
            List<String> shards,
            Long stopTimeoutMs
    ) {
    }
}
