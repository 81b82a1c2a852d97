package io.shardguard.enforcer;

import io.shardguard.alert.Alert;
import io.shardguard.alert.AlertBus;
import io.shardguard.alert.AlertCallback;
import io.shardguard.alert.AlertKind;
import io.shardguard.alert.AlertSeverity;
import io.shardguard.alert.ApoptosisReason;
import io.shardguard.analysis.EntropyAnalyzer;
import io.shardguard.analysis.RegularityDetector;
import io.shardguard.analysis.RegularityFinding;
import io.shardguard.config.EnforcerSettings;
import io.shardguard.config.ShardGuardConfig;
import io.shardguard.observability.AuditLogger;
import io.shardguard.observability.PrometheusFormatter;
import io.shardguard.probe.EnvironmentProbe;
import io.shardguard.probe.FallbackEnvironmentProbe;
import io.shardguard.storage.ShardNotFoundException;
import io.shardguard.storage.ShardStore;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Periodic integrity monitor for a fixed set of key shards.
 *
 * <p>Each cycle reads the ambient probe against an adaptive baseline, then makes two
 * independent passes over the shards: an entropy pass and a regularity pass. A violation
 * in either pass publishes its alert, then a {@code cryptographic_apoptosis} alert, then
 * overwrites the shard with fresh random bytes.
 *
 * <p>One background thread runs the cycle; {@link #runCycleOnce()} shares the same lock,
 * so cycles never overlap. The baseline is only written under that lock, or by
 * {@link #setBaseline(double)} while stopped.
 */
public final class ThermodynamicEnforcer implements AutoCloseable {
    private static final AtomicInteger INSTANCE_SEQ = new AtomicInteger(0);
    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final EnforcerSettings settings;
    private final ShardStore shardStore;
    private final FallbackEnvironmentProbe probe;
    private final AuditLogger auditLogger;
    private final AlertBus alertBus;
    private final String namespace;
    private final String threadName;
    private final SecureRandom random;
    private final Object lifecycleLock;
    private final ReentrantLock cycleLock;
    private final AtomicLong cyclesCompleted;
    private final AtomicLong cycleErrors;
    private final AtomicLong apoptosisTotal;
    private final AtomicLong readFailures;
    private final AtomicLong remediationFailures;
    private final AtomicLong lastCycleDurationMs;
    private final Map<AlertKind, AtomicLong> alertsByKind;
    private volatile double baseline;
    private volatile MonitoringState state;
    private Thread worker;
    private CountDownLatch stopSignal;

    public ThermodynamicEnforcer(
            EnforcerSettings settings,
            ShardStore shardStore,
            EnvironmentProbe probe,
            AuditLogger auditLogger
    ) {
        this(settings, shardStore, probe, auditLogger, ShardGuardConfig.DEFAULT_NAMESPACE);
    }

    public ThermodynamicEnforcer(
            EnforcerSettings settings,
            ShardStore shardStore,
            EnvironmentProbe probe,
            AuditLogger auditLogger,
            String namespace
    ) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.shardStore = Objects.requireNonNull(shardStore, "shardStore");
        this.probe = FallbackEnvironmentProbe.wrap(Objects.requireNonNull(probe, "probe"));
        this.auditLogger = Objects.requireNonNull(auditLogger, "auditLogger");
        this.alertBus = new AlertBus(auditLogger);
        this.namespace = namespace == null || namespace.isBlank() ? ShardGuardConfig.DEFAULT_NAMESPACE : namespace;
        this.threadName = "shardguard-enforcer-" + INSTANCE_SEQ.incrementAndGet();
        this.random = new SecureRandom();
        this.lifecycleLock = new Object();
        this.cycleLock = new ReentrantLock();
        this.cyclesCompleted = new AtomicLong(0L);
        this.cycleErrors = new AtomicLong(0L);
        this.apoptosisTotal = new AtomicLong(0L);
        this.readFailures = new AtomicLong(0L);
        this.remediationFailures = new AtomicLong(0L);
        this.lastCycleDurationMs = new AtomicLong(0L);
        this.alertsByKind = new EnumMap<>(AlertKind.class);
        for (AlertKind kind : AlertKind.values()) {
            alertsByKind.put(kind, new AtomicLong(0L));
        }
        this.state = MonitoringState.STOPPED;
        this.baseline = this.probe.read();
        audit(AuditLogger.AuditEvent.of("enforcer.init", "enforcer/" + threadName, "ok", Map.of(
                "entropy_threshold", settings.entropyThreshold(),
                "temperature_variance_threshold", settings.temperatureVarianceThreshold(),
                "check_interval_seconds", settings.checkIntervalSeconds(),
                "shards", settings.shardIds(),
                "baseline", baseline,
                "probe_failures", this.probe.failures()
        )));
    }

    /**
     * Builds an enforcer whose audit trail lives under the runtime root of {@code config}.
     */
    public static ThermodynamicEnforcer create(
            ShardGuardConfig config,
            EnforcerSettings settings,
            ShardStore shardStore,
            EnvironmentProbe probe
    ) {
        AuditLogger logger = new AuditLogger(
                config.auditFile(),
                config.namespace(),
                AuditLogger.loadOrCreateSigningSecret(config.auditSigningKeyFile())
        );
        return new ThermodynamicEnforcer(settings, shardStore, probe, logger, config.namespace());
    }

    public void registerAlertCallback(AlertCallback callback) {
        alertBus.register(callback);
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (state == MonitoringState.RUNNING) {
                audit(AuditLogger.AuditEvent.of("enforcer.start", "enforcer/" + threadName, "already_running", Map.of()));
                System.err.println("WARN monitoring is already active: " + threadName);
                return;
            }
            CountDownLatch signal = new CountDownLatch(1);
            Thread thread = new Thread(() -> monitoringLoop(signal), threadName);
            thread.setDaemon(true);
            stopSignal = signal;
            worker = thread;
            state = MonitoringState.RUNNING;
            thread.start();
            audit(AuditLogger.AuditEvent.of("enforcer.start", "enforcer/" + threadName, "ok", Map.of(
                    "check_interval_seconds", settings.checkIntervalSeconds(),
                    "shards", settings.shardIds().size()
            )));
        }
    }

    /**
     * Signals the cycle to exit and waits, up to the configured stop timeout, for the
     * monitoring thread to finish. The wait happens outside the lifecycle lock, so an alert
     * callback may call {@code stop}, {@code start} or {@code setBaseline} while an external
     * stop is joining; from the monitoring thread itself the call only signals.
     */
    public void stop() {
        Thread thread;
        synchronized (lifecycleLock) {
            if (state == MonitoringState.STOPPED) {
                audit(AuditLogger.AuditEvent.of("enforcer.stop", "enforcer/" + threadName, "not_running", Map.of()));
                System.err.println("WARN monitoring is not active: " + threadName);
                return;
            }
            thread = worker;
            CountDownLatch signal = stopSignal;
            state = MonitoringState.STOPPED;
            worker = null;
            stopSignal = null;
            signal.countDown();
        }
        boolean exited = true;
        if (thread != null && thread != Thread.currentThread()) {
            exited = awaitExit(thread, settings.stopTimeoutMs());
            if (!exited) {
                thread.interrupt();
                exited = awaitExit(thread, settings.stopTimeoutMs());
            }
        }
        audit(AuditLogger.AuditEvent.of("enforcer.stop", "enforcer/" + threadName,
                exited ? "ok" : "timeout", Map.of("stop_timeout_ms", settings.stopTimeoutMs())));
        if (!exited) {
            System.err.println("WARN monitoring thread did not exit within stop timeout: " + threadName);
        }
    }

    @Override
    public void close() {
        if (state == MonitoringState.RUNNING) {
            stop();
        }
    }

    public MonitoringState state() {
        return state;
    }

    public boolean isRunning() {
        return state == MonitoringState.RUNNING;
    }

    public double baseline() {
        return baseline;
    }

    /**
     * Recalibrates the baseline. Refused (with a warning) while monitoring is running.
     */
    public boolean setBaseline(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("baseline must be finite: " + value);
        }
        synchronized (lifecycleLock) {
            if (state == MonitoringState.RUNNING) {
                return rejectBaseline(value);
            }
        }
        // cycleLock before lifecycleLock, the same order a callback on the cycle thread takes them.
        cycleLock.lock();
        try {
            synchronized (lifecycleLock) {
                if (state == MonitoringState.RUNNING) {
                    return rejectBaseline(value);
                }
                double previous = baseline;
                baseline = value;
                audit(AuditLogger.AuditEvent.of("enforcer.baseline", "environment", "set",
                        Map.of("previous", previous, "baseline", value)));
                return true;
            }
        } finally {
            cycleLock.unlock();
        }
    }

    private boolean rejectBaseline(double value) {
        audit(AuditLogger.AuditEvent.of("enforcer.baseline", "environment", "rejected_running",
                Map.of("requested", value, "baseline", baseline)));
        System.err.println("WARN baseline cannot be changed while monitoring is active");
        return false;
    }

    public EnforcerSettings settings() {
        return settings;
    }

    public String threadName() {
        return threadName;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    /**
     * Runs one full cycle on the calling thread, waiting for any in-flight background
     * cycle to finish first.
     */
    public CycleReport runCycleOnce() {
        return runCycle(NEVER_CANCELLED);
    }

    public EnforcerStats stats() {
        Map<String, Long> byKind = new LinkedHashMap<>();
        long total = 0L;
        for (Map.Entry<AlertKind, AtomicLong> entry : alertsByKind.entrySet()) {
            long value = entry.getValue().get();
            byKind.put(entry.getKey().wireName(), value);
            total += value;
        }
        return new EnforcerStats(
                state.name(),
                baseline,
                settings.shardIds().size(),
                cyclesCompleted.get(),
                cycleErrors.get(),
                total,
                byKind,
                apoptosisTotal.get(),
                readFailures.get(),
                remediationFailures.get(),
                alertBus.callbackFailures(),
                probe.failures(),
                lastCycleDurationMs.get()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats(), namespace);
    }

    private void monitoringLoop(CountDownLatch signal) {
        audit(AuditLogger.AuditEvent.of("enforcer.loop", "enforcer/" + threadName, "started", Map.of()));
        BooleanSupplier cancelled = () -> signal.getCount() == 0L;
        while (!cancelled.getAsBoolean()) {
            try {
                runCycle(cancelled);
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Exception | Error e) {
                cycleErrors.incrementAndGet();
                audit(AuditLogger.AuditEvent.of("enforcer.cycle", "enforcer/" + threadName, "error",
                        Map.of("error", describe(e))));
            }
            try {
                if (signal.await(settings.checkIntervalSeconds(), TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        audit(AuditLogger.AuditEvent.of("enforcer.loop", "enforcer/" + threadName, "exited", Map.of()));
    }

    private CycleReport runCycle(BooleanSupplier cancelled) {
        cycleLock.lock();
        try {
            CycleTally tally = new CycleTally("cyc_" + UUID.randomUUID(), baseline);
            audit(AuditLogger.AuditEvent.ofCycle("enforcer.cycle", "enforcer/" + threadName, "started",
                    tally.cycleId, Map.of("shards", settings.shardIds().size())));
            checkAmbient(tally);
            for (String shardId : settings.shardIds()) {
                if (cancelled.getAsBoolean()) {
                    tally.cancelled = true;
                    break;
                }
                checkEntropy(shardId, tally);
            }
            for (String shardId : settings.shardIds()) {
                if (cancelled.getAsBoolean()) {
                    tally.cancelled = true;
                    break;
                }
                checkRegularity(shardId, tally);
            }
            CycleReport report = tally.toReport(baseline);
            cyclesCompleted.incrementAndGet();
            lastCycleDurationMs.set(report.durationMs());
            audit(AuditLogger.AuditEvent.ofCycle("enforcer.cycle", "enforcer/" + threadName,
                    report.cancelled() ? "cancelled" : "completed", tally.cycleId, Map.of(
                            "duration_ms", report.durationMs(),
                            "alerts", report.alertsPublished(),
                            "apoptosis", report.apoptosisCount(),
                            "read_failures", report.readFailures(),
                            "remediation_failures", report.remediationFailures(),
                            "check_errors", report.checkErrors()
                    )));
            return report;
        } finally {
            cycleLock.unlock();
        }
    }

    private void checkAmbient(CycleTally tally) {
        try {
            double threshold = settings.temperatureVarianceThreshold();
            double before = baseline;
            long failuresBefore = probe.failures();
            double current = probe.read();
            double delta = Math.abs(current - before);
            tally.ambientReading = current;
            tally.probeDegraded = probe.failures() > failuresBefore;
            audit(AuditLogger.AuditEvent.ofCycle("probe.read", "environment",
                    tally.probeDegraded ? "degraded" : "ok", tally.cycleId, Map.of(
                            "current", current,
                            "baseline", before,
                            "delta", delta,
                            "failures", probe.failures()
                    )));
            if (delta <= threshold) {
                return;
            }
            tally.temperatureViolation = true;
            boolean benignDrift = delta < threshold * 2.0;
            publish(Alert.temperatureViolation(
                    tally.cycleId,
                    before,
                    current,
                    delta,
                    threshold,
                    benignDrift ? AlertSeverity.WARNING : AlertSeverity.CRITICAL
            ), tally);
            if (benignDrift) {
                baseline = current;
                audit(AuditLogger.AuditEvent.ofCycle("enforcer.baseline", "environment", "updated", tally.cycleId,
                        Map.of("previous", before, "baseline", current)));
            } else {
                audit(AuditLogger.AuditEvent.ofCycle("enforcer.baseline", "environment", "retained", tally.cycleId,
                        Map.of("baseline", before, "current", current, "delta", delta)));
            }
        } catch (RuntimeException e) {
            tally.checkErrors++;
            audit(AuditLogger.AuditEvent.ofCycle("probe.read", "environment", "error", tally.cycleId,
                    Map.of("error", describe(e))));
        }
    }

    private void checkEntropy(String shardId, CycleTally tally) {
        try {
            byte[] data = readShard(shardId, "entropy", tally);
            if (data == null) {
                return;
            }
            tally.shardsChecked++;
            double entropy = EntropyAnalyzer.entropy(data);
            double threshold = settings.entropyThreshold();
            boolean violated = entropy < threshold;
            audit(AuditLogger.AuditEvent.ofCycle("shard.entropy", "shard/" + shardId,
                    violated ? "violation" : "ok", tally.cycleId, Map.of(
                            "entropy", entropy,
                            "threshold", threshold,
                            "bytes", data.length
                    )));
            if (!violated) {
                return;
            }
            publish(Alert.entropyViolation(tally.cycleId, shardId, entropy, threshold), tally);
            apoptosis(shardId, ApoptosisReason.ENTROPY_VIOLATION, entropy, tally);
        } catch (RuntimeException e) {
            tally.checkErrors++;
            audit(AuditLogger.AuditEvent.ofCycle("shard.entropy", "shard/" + shardId, "error", tally.cycleId,
                    Map.of("error", describe(e))));
        }
    }

    private void checkRegularity(String shardId, CycleTally tally) {
        try {
            byte[] data = readShard(shardId, "regularity", tally);
            if (data == null) {
                return;
            }
            RegularityFinding finding = RegularityDetector.inspect(data);
            String result = finding.detected() ? "detected" : finding.heuristic().wireName();
            Map<String, Object> details = new LinkedHashMap<>(finding.toDetails());
            details.put("bytes", data.length);
            audit(AuditLogger.AuditEvent.ofCycle("shard.regularity", "shard/" + shardId, result, tally.cycleId,
                    details));
            if (!finding.detected()) {
                return;
            }
            publish(Alert.regularityDetected(tally.cycleId, shardId, finding.toDetails()), tally);
            apoptosis(shardId, ApoptosisReason.MATHEMATICAL_BACKDOOR, null, tally);
        } catch (RuntimeException e) {
            tally.checkErrors++;
            audit(AuditLogger.AuditEvent.ofCycle("shard.regularity", "shard/" + shardId, "error", tally.cycleId,
                    Map.of("error", describe(e))));
        }
    }

    private byte[] readShard(String shardId, String pass, CycleTally tally) {
        try {
            return shardStore.readAll(shardId);
        } catch (ShardNotFoundException e) {
            tally.readFailures++;
            readFailures.incrementAndGet();
            audit(AuditLogger.AuditEvent.ofCycle("shard.read", "shard/" + shardId, "not_found", tally.cycleId,
                    Map.of("pass", pass)));
        } catch (IOException e) {
            tally.readFailures++;
            readFailures.incrementAndGet();
            audit(AuditLogger.AuditEvent.ofCycle("shard.read", "shard/" + shardId, "error", tally.cycleId,
                    Map.of("pass", pass, "error", describe(e))));
        }
        return null;
    }

    private void apoptosis(String shardId, ApoptosisReason reason, Double entropy, CycleTally tally) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason.wireName());
        details.put("overwrite_bytes", reason.overwriteBytes());
        audit(AuditLogger.AuditEvent.ofCycle("shard.apoptosis", "shard/" + shardId, "initiated", tally.cycleId,
                details));
        publish(Alert.apoptosis(tally.cycleId, shardId, reason, entropy), tally);
        byte[] replacement = new byte[reason.overwriteBytes()];
        random.nextBytes(replacement);
        try {
            shardStore.overwrite(shardId, replacement);
            tally.apoptosisCount++;
            tally.invalidated.add(shardId);
            apoptosisTotal.incrementAndGet();
            audit(AuditLogger.AuditEvent.ofCycle("shard.apoptosis", "shard/" + shardId, "invalidated",
                    tally.cycleId, details));
        } catch (IOException | RuntimeException e) {
            tally.remediationFailures++;
            remediationFailures.incrementAndGet();
            details.put("error", describe(e));
            audit(AuditLogger.AuditEvent.ofCycle("shard.apoptosis", "shard/" + shardId, "error", tally.cycleId,
                    details));
        }
    }

    private void publish(Alert alert, CycleTally tally) {
        tally.alertsPublished++;
        alertsByKind.get(alert.kind()).incrementAndGet();
        alertBus.publish(alert);
    }

    private void audit(AuditLogger.AuditEvent event) {
        try {
            auditLogger.log(event);
        } catch (RuntimeException e) {
            System.err.println("WARN audit write failed for " + event.action() + " " + event.resource()
                    + ": " + e.getMessage());
        }
    }

    private static boolean awaitExit(Thread thread, long timeoutMs) {
        try {
            thread.join(timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    private static final class CycleTally {
        private final String cycleId;
        private final long startedAtMs;
        private final double baselineBefore;
        private final List<String> invalidated;
        private double ambientReading;
        private boolean temperatureViolation;
        private boolean probeDegraded;
        private boolean cancelled;
        private int shardsChecked;
        private int alertsPublished;
        private int apoptosisCount;
        private int readFailures;
        private int remediationFailures;
        private int checkErrors;

        private CycleTally(String cycleId, double baselineBefore) {
            this.cycleId = cycleId;
            this.startedAtMs = Instant.now().toEpochMilli();
            this.baselineBefore = baselineBefore;
            this.ambientReading = Double.NaN;
            this.invalidated = new ArrayList<>();
        }

        private CycleReport toReport(double baselineAfter) {
            return new CycleReport(
                    cycleId,
                    startedAtMs,
                    Math.max(0L, Instant.now().toEpochMilli() - startedAtMs),
                    ambientReading,
                    baselineBefore,
                    baselineAfter,
                    temperatureViolation,
                    probeDegraded,
                    shardsChecked,
                    alertsPublished,
                    apoptosisCount,
                    readFailures,
                    remediationFailures,
                    checkErrors,
                    cancelled,
                    List.copyOf(invalidated)
            );
        }
    }
}
