package io.shardguard.alert;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One alert as delivered to callbacks. Optional fields are null when they do not apply
 * to the kind; {@link #toPayload()} omits them.
 */
public record Alert(
        AlertKind kind,
        String shard,
        Double entropy,
        Double threshold,
        Double baseline,
        Double current,
        Double delta,
        AlertSeverity severity,
        String reason,
        String cycleId,
        Instant timestamp,
        Map<String, Object> evidence
) {
    public Alert {
        Objects.requireNonNull(kind, "kind");
        timestamp = timestamp == null ? Instant.now() : timestamp;
        evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
    }

    public static Alert temperatureViolation(
            String cycleId,
            double baseline,
            double current,
            double delta,
            double threshold,
            AlertSeverity severity
    ) {
        return new Alert(AlertKind.TEMPERATURE_VIOLATION, null, null, threshold, baseline, current, delta,
                severity, null, cycleId, null, null);
    }

    public static Alert entropyViolation(String cycleId, String shard, double entropy, double threshold) {
        return new Alert(AlertKind.ENTROPY_VIOLATION, shard, entropy, threshold, null, null, null,
                AlertSeverity.HIGH, null, cycleId, null, null);
    }

    public static Alert regularityDetected(String cycleId, String shard, Map<String, Object> evidence) {
        return new Alert(AlertKind.REGULARITY_DETECTED, shard, null, null, null, null, null,
                AlertSeverity.CRITICAL, null, cycleId, null, evidence);
    }

    public static Alert apoptosis(String cycleId, String shard, ApoptosisReason reason, Double entropy) {
        return new Alert(AlertKind.CRYPTOGRAPHIC_APOPTOSIS, shard, entropy, null, null, null, null,
                AlertSeverity.CRITICAL, reason.wireName(), cycleId, null, null);
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("kind", kind.wireName());
        putIfPresent(out, "shard", shard);
        putIfPresent(out, "entropy", entropy);
        putIfPresent(out, "threshold", threshold);
        putIfPresent(out, "baseline", baseline);
        putIfPresent(out, "current", current);
        putIfPresent(out, "delta", delta);
        putIfPresent(out, "severity", severity == null ? null : severity.wireName());
        putIfPresent(out, "reason", reason);
        out.putAll(evidence);
        putIfPresent(out, "cycle_id", cycleId);
        out.put("timestamp", timestamp.toString());
        return out;
    }

    private static void putIfPresent(Map<String, Object> out, String key, Object value) {
        if (value != null) {
            out.put(key, value);
        }
    }
}
