package io.shardguard.enforcer;

import java.util.Map;

public record EnforcerStats(
        String state,
        double baseline,
        int shardsMonitored,
        long cyclesCompleted,
        long cycleErrors,
        long alertsPublished,
        Map<String, Long> alertsByKind,
        long apoptosisTotal,
        long readFailures,
        long remediationFailures,
        long callbackFailures,
        long probeFailures,
        long lastCycleDurationMs
) {
}
