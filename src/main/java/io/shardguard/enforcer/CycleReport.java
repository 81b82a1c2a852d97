package io.shardguard.enforcer;

import java.util.List;

/**
 * Summary of one completed check cycle.
 */
public record CycleReport(
        String cycleId,
        long startedAtMs,
        long durationMs,
        double ambientReading,
        double baselineBefore,
        double baselineAfter,
        boolean temperatureViolation,
        boolean probeDegraded,
        int shardsChecked,
        int alertsPublished,
        int apoptosisCount,
        int readFailures,
        int remediationFailures,
        int checkErrors,
        boolean cancelled,
        List<String> invalidatedShards
) {
}
