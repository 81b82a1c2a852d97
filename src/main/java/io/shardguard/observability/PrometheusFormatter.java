package io.shardguard.observability;

import io.shardguard.enforcer.EnforcerStats;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(EnforcerStats stats) {
        return format(stats, null);
    }

    public static String format(EnforcerStats stats, String namespace) {
        String ns = namespace == null || namespace.isBlank() ? null : namespace.trim();
        StringBuilder sb = new StringBuilder();
        appendMetric(sb, "shardguard_running", "Whether the monitoring cycle is running (1=yes,0=no)", ns, null, null,
                "RUNNING".equals(stats.state()) ? 1 : 0);
        appendMetric(sb, "shardguard_baseline", "Current ambient-signal baseline", ns, null, null, stats.baseline());
        appendMetric(sb, "shardguard_shards_monitored", "Configured shard count", ns, null, null, stats.shardsMonitored());
        appendMetric(sb, "shardguard_cycles_total", "Completed check cycles", ns, null, null, stats.cyclesCompleted());
        appendMetric(sb, "shardguard_cycle_errors_total", "Cycles aborted by an unexpected error", ns, null, null,
                stats.cycleErrors());
        appendMetric(sb, "shardguard_last_cycle_duration_ms", "Duration of the last completed cycle", ns, null, null,
                stats.lastCycleDurationMs());
        appendLabelledMetric(sb, "shardguard_alerts_total", "Published alerts grouped by kind", ns, "kind",
                stats.alertsByKind());
        appendMetric(sb, "shardguard_apoptosis_total", "Shards invalidated by remediation", ns, null, null,
                stats.apoptosisTotal());
        appendMetric(sb, "shardguard_read_failures_total", "Shard reads skipped due to missing or unreadable content",
                ns, null, null, stats.readFailures());
        appendMetric(sb, "shardguard_remediation_failures_total", "Remediation overwrites that failed", ns, null, null,
                stats.remediationFailures());
        appendMetric(sb, "shardguard_callback_failures_total", "Alert callbacks that threw", ns, null, null,
                stats.callbackFailures());
        appendMetric(sb, "shardguard_probe_failures_total", "Environment readings replaced by a fallback value", ns,
                null, null, stats.probeFailures());
        return sb.toString();
    }

    private static void appendLabelledMetric(
            StringBuilder sb,
            String metric,
            String help,
            String namespace,
            String label,
            Map<String, Long> values
    ) {
        appendHeader(sb, metric, help);
        for (Map.Entry<String, Long> e : values.entrySet()) {
            appendSample(sb, metric, namespace, label, e.getKey(), Long.toString(e.getValue()));
        }
    }

    private static void appendMetric(
            StringBuilder sb,
            String metric,
            String help,
            String namespace,
            String label,
            String labelValue,
            double value
    ) {
        appendHeader(sb, metric, help);
        String rendered = value == Math.rint(value) && !Double.isInfinite(value)
                ? Long.toString((long) value)
                : Double.toString(value);
        appendSample(sb, metric, namespace, label, labelValue, rendered);
    }

    private static void appendHeader(StringBuilder sb, String metric, String help) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(metric.endsWith("_total") ? " counter" : " gauge")
                    .append('\n');
        }
    }

    private static void appendSample(
            StringBuilder sb,
            String metric,
            String namespace,
            String label,
            String labelValue,
            String value
    ) {
        sb.append(metric);
        boolean hasLabel = label != null && labelValue != null;
        if (namespace != null || hasLabel) {
            sb.append('{');
            if (namespace != null) {
                sb.append("namespace=\"").append(escapeLabel(namespace)).append('"');
                if (hasLabel) {
                    sb.append(',');
                }
            }
            if (hasLabel) {
                sb.append(label).append("=\"").append(escapeLabel(labelValue)).append('"');
            }
            sb.append('}');
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
