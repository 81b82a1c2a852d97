package io.shardguard.enforcer;

import io.shardguard.alert.Alert;
import io.shardguard.alert.AlertKind;
import io.shardguard.alert.AlertSeverity;
import io.shardguard.config.EnforcerSettings;
import io.shardguard.config.ShardGuardConfig;
import io.shardguard.observability.AuditLogger;
import io.shardguard.observability.AuditVerifier;
import io.shardguard.probe.EnvironmentProbe;
import io.shardguard.storage.ShardNotFoundException;
import io.shardguard.storage.ShardStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

final class ThermodynamicEnforcerTest {

    @Test
    void lowEntropyShardIsAlertedThenOverwritten() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-enforcer-entropy-");
        try {
            RecordingShardStore store = new RecordingShardStore();
            store.put("keys/zero.bin", new byte[200]);
            List<Alert> alerts = new CopyOnWriteArrayList<>();
            ThermodynamicEnforcer enforcer = new ThermodynamicEnforcer(
                    EnforcerSettings.of(7.2, 1.0, 60, List.of("keys/zero.bin")),
                    store,
                    constantProbe(22.0),
                    auditLogger(root)
            );
            enforcer.registerAlertCallback(alerts::add);

            CycleReport report = enforcer.runCycleOnce();

            Assertions.assertTrue(alerts.size() >= 2);
            Assertions.assertEquals(AlertKind.ENTROPY_VIOLATION, alerts.get(0).kind());
            Assertions.assertEquals("keys/zero.bin", alerts.get(0).shard());
            Assertions.assertEquals(0.0, alerts.get(0).entropy(), 1e-12);
            Assertions.assertEquals(AlertSeverity.HIGH, alerts.get(0).severity());
            Assertions.assertEquals(AlertKind.CRYPTOGRAPHIC_APOPTOSIS, alerts.get(1).kind());
            Assertions.assertEquals("entropy_violation", alerts.get(1).reason());
            Assertions.assertEquals(0.0, alerts.get(1).entropy(), 1e-12);

            // The fresh random bytes are still too short to pass the repetition screen.
            Assertions.assertEquals(1024, store.overwrites().get(0).length);
            Assertions.assertEquals(List.of(1024, 2048), store.overwriteSizes());
            Assertions.assertEquals(4, alerts.size());
            Assertions.assertEquals(AlertKind.REGULARITY_DETECTED, alerts.get(2).kind());
            Assertions.assertEquals("mathematical_backdoor", alerts.get(3).reason());

            Assertions.assertEquals(2, report.apoptosisCount());
            Assertions.assertEquals(4, report.alertsPublished());
            Assertions.assertEquals(List.of("keys/zero.bin", "keys/zero.bin"), report.invalidatedShards());
            Assertions.assertEquals(1L, enforcer.stats().cyclesCompleted());
            Assertions.assertTrue(enforcer.metricsText().contains("shardguard_apoptosis_total{namespace=\"default\"} 2"));

            AuditLogger logger = enforcer.auditLogger();
            Assertions.assertTrue(AuditVerifier.verify(logger.auditFile(), logger.signingSecret()).ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void shortHighEntropyShardPassesUntouched() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-enforcer-pass-");
        try {
            byte[] content = new byte[64];
            for (int i = 0; i < content.length; i++) {
                content[i] = (byte) (i * 3);
            }
            RecordingShardStore store = new RecordingShardStore();
            store.put("ok.bin", content);
            List<Alert> alerts = new CopyOnWriteArrayList<>();
            ThermodynamicEnforcer enforcer = new ThermodynamicEnforcer(
                    EnforcerSettings.of(5.0, 1.0, 60, List.of("ok.bin")),
                    store,
                    constantProbe(22.0),
                    auditLogger(root)
            );
            enforcer.registerAlertCallback(alerts::add);

            CycleReport report = enforcer.runCycleOnce();

            Assertions.assertTrue(alerts.isEmpty());
            Assertions.assertTrue(store.overwrites().isEmpty());
            Assertions.assertArrayEquals(content, store.readAll("ok.bin"));
            Assertions.assertEquals(1, report.shardsChecked());
            Assertions.assertFalse(report.temperatureViolation());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingShardIsSkippedAndOthersStillChecked() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-enforcer-missing-");
        try {
            RecordingShardStore store = new RecordingShardStore();
            store.put("present.bin", new byte[150]);
            List<Alert> alerts = new CopyOnWriteArrayList<>();
            ThermodynamicEnforcer enforcer = new ThermodynamicEnforcer(
                    EnforcerSettings.of(7.2, 1.0, 60, List.of("absent.bin", "present.bin")),
                    store,
                    constantProbe(22.0),
                    auditLogger(root)
            );
            enforcer.registerAlertCallback(alerts::add);

            CycleReport report = enforcer.runCycleOnce();

            Assertions.assertEquals(2, report.readFailures());
            Assertions.assertEquals(1, report.shardsChecked());
            Assertions.assertTrue(alerts.stream().noneMatch(a -> "absent.bin".equals(a.shard())));
            Assertions.assertTrue(alerts.stream().anyMatch(a -> "present.bin".equals(a.shard())));
            Assertions.assertEquals(2L, enforcer.stats().readFailures());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedOverwriteIsRecordedAndCycleContinues() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-enforcer-readonly-");
        try {
            byte[] good = new byte[64];
            for (int i = 0; i < good.length; i++) {
                good[i] = (byte) i;
            }
            RecordingShardStore store = new RecordingShardStore();
            store.put("locked.bin", new byte[200]);
            store.put("good.bin", good);
            store.failOverwrites(true);
            List<Alert> alerts = new CopyOnWriteArrayList<>();
            ThermodynamicEnforcer enforcer = new ThermodynamicEnforcer(
                    EnforcerSettings.of(5.0, 1.0, 60, List.of("locked.bin", "good.bin")),
                    store,
                    constantProbe(22.0),
                    auditLogger(root)
            );
            enforcer.registerAlertCallback(alerts::add);

            CycleReport report = enforcer.runCycleOnce();

            Assertions.assertEquals(2, report.shardsChecked());
            Assertions.assertEquals(0, report.apoptosisCount());
            Assertions.assertEquals(2, report.remediationFailures());
            Assertions.assertEquals(4, alerts.size());
            Assertions.assertArrayEquals(new byte[200], store.readAll("locked.bin"));
            Assertions.assertEquals(2L, enforcer.stats().remediationFailures());

            String audit = Files.readString(enforcer.auditLogger().auditFile());
            Assertions.assertTrue(audit.contains("\"action\":\"shard.apoptosis\""));
            Assertions.assertTrue(audit.contains("\"result\":\"error\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void moderateDriftMovesBaselineAndLargeDriftRetainsIt() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-enforcer-ambient-");
        try {
            ScriptedProbe probe = new ScriptedProbe(20.0, 21.5, 25.0, 25.2);
            List<Alert> alerts = new CopyOnWriteArrayList<>();
            ThermodynamicEnforcer enforcer = new ThermodynamicEnforcer(
                    EnforcerSettings.of(7.2, 1.0, 60, List.of()),
                    new RecordingShardStore(),
                    probe,
                    auditLogger(root)
            );
            enforcer.registerAlertCallback(alerts::add);
            Assertions.assertEquals(20.0, enforcer.baseline(), 1e-12);

            CycleReport moderate = enforcer.runCycleOnce();
            Assertions.assertTrue(moderate.temperatureViolation());
            Assertions.assertEquals(21.5, enforcer.baseline(), 1e-12);
            Assertions.assertEquals(AlertSeverity.WARNING, alerts.get(0).severity());
            Assertions.assertEquals(1.5, alerts.get(0).delta(), 1e-9);

            CycleReport large = enforcer.runCycleOnce();
            Assertions.assertTrue(large.temperatureViolation());
            Assertions.assertEquals(21.5, enforcer.baseline(), 1e-12);
            Assertions.assertEquals(AlertSeverity.CRITICAL, alerts.get(1).severity());
            Assertions.assertEquals(21.5, alerts.get(1).baseline(), 1e-12);
            Assertions.assertEquals(25.0, alerts.get(1).current(), 1e-12);

            // Drift is always measured against the retained baseline.
            enforcer.runCycleOnce();
            Assertions.assertEquals(3, alerts.size());
            Assertions.assertEquals(AlertSeverity.CRITICAL, alerts.get(2).severity());
            Assertions.assertTrue(alerts.stream().allMatch(a -> a.kind() == AlertKind.TEMPERATURE_VIOLATION));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failingProbeFallsBackWithoutAbortingCycle() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-enforcer-probe-");
        try {
            ThermodynamicEnforcer enforcer = new ThermodynamicEnforcer(
                    EnforcerSettings.of(7.2, 1.0, 60, List.of()),
                    new RecordingShardStore(),
                    () -> {
                        throw new IllegalStateException("sensor offline");
                    },
                    auditLogger(root)
            );
            Assertions.assertEquals(22.5, enforcer.baseline(), 1e-12);
            CycleReport report = enforcer.runCycleOnce();
            Assertions.assertFalse(report.temperatureViolation());
            Assertions.assertTrue(report.probeDegraded());
            Assertions.assertEquals(0, report.checkErrors());
            Assertions.assertEquals(2L, enforcer.stats().probeFailures());
            Assertions.assertTrue(enforcer.metricsText().contains("shardguard_probe_failures_total{namespace=\"default\"} 2"));

            String degradedRow = Files.readAllLines(enforcer.auditLogger().auditFile()).stream()
                    .filter(line -> line.contains("\"action\":\"probe.read\""))
                    .findFirst()
                    .orElseThrow();
            Assertions.assertTrue(degradedRow.contains("\"result\":\"degraded\""));
            Assertions.assertTrue(degradedRow.contains("\"failures\":2"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void startIsIdempotentAndStopHaltsAlerts() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-enforcer-lifecycle-");
        try {
            RecordingShardStore store = new RecordingShardStore();
            store.put("zero.bin", new byte[200]);
            List<Alert> alerts = new CopyOnWriteArrayList<>();
            ThermodynamicEnforcer enforcer = new ThermodynamicEnforcer(
                    new EnforcerSettings(7.2, 1.0, 1, List.of("zero.bin"), 2_000L),
                    store,
                    constantProbe(22.0),
                    auditLogger(root)
            );
            enforcer.registerAlertCallback(alerts::add);

            enforcer.start();
            enforcer.start();
            Assertions.assertTrue(enforcer.isRunning());
            Assertions.assertEquals(1, countThreads(enforcer.threadName()));

            long deadline = System.currentTimeMillis() + 5_000L;
            while (alerts.isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(20L);
            }
            Assertions.assertFalse(alerts.isEmpty());

            enforcer.stop();
            Assertions.assertEquals(MonitoringState.STOPPED, enforcer.state());
            Assertions.assertEquals(0, countThreads(enforcer.threadName()));
            int afterStop = alerts.size();
            Thread.sleep(1_500L);
            Assertions.assertEquals(afterStop, alerts.size());

            enforcer.stop();
            Assertions.assertEquals(MonitoringState.STOPPED, enforcer.state());

            String audit = Files.readString(enforcer.auditLogger().auditFile());
            Assertions.assertTrue(audit.contains("\"result\":\"already_running\""));
            Assertions.assertTrue(audit.contains("\"result\":\"not_running\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stopReturnsPromptlyWhileWaitingForNextCycle() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-enforcer-wait-");
        try {
            RecordingShardStore store = new RecordingShardStore();
            store.put("zero.bin", new byte[200]);
            List<Alert> alerts = new CopyOnWriteArrayList<>();
            ThermodynamicEnforcer enforcer = new ThermodynamicEnforcer(
                    new EnforcerSettings(7.2, 1.0, 60, List.of("zero.bin"), 2_000L),
                    store,
                    constantProbe(22.0),
                    auditLogger(root)
            );
            enforcer.registerAlertCallback(alerts::add);
            enforcer.start();

            long deadline = System.currentTimeMillis() + 5_000L;
            while (enforcer.stats().cyclesCompleted() < 1L && System.currentTimeMillis() < deadline) {
                Thread.sleep(20L);
            }
            Assertions.assertEquals(1L, enforcer.stats().cyclesCompleted());
            Assertions.assertFalse(alerts.isEmpty());

            long startedAt = System.nanoTime();
            enforcer.stop();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

            Assertions.assertTrue(elapsedMs < 1_000L, "stop took " + elapsedMs + " ms");
            Assertions.assertEquals(0, countThreads(enforcer.threadName()));
            Assertions.assertFalse(Files.readString(enforcer.auditLogger().auditFile()).contains("\"result\":\"timeout\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void callbackCallingLifecycleMethodsDuringStopDoesNotOutliveStop() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-enforcer-reentrant-");
        try {
            RecordingShardStore store = new RecordingShardStore();
            store.put("first.bin", new byte[200]);
            store.put("second.bin", new byte[200]);
            List<Alert> alerts = new CopyOnWriteArrayList<>();
            ThermodynamicEnforcer enforcer = new ThermodynamicEnforcer(
                    new EnforcerSettings(7.2, 1.0, 60, List.of("first.bin", "second.bin"), 2_000L),
                    store,
                    constantProbe(22.0),
                    auditLogger(root)
            );
            CountDownLatch firstAlert = new CountDownLatch(1);
            AtomicBoolean reacted = new AtomicBoolean(false);
            AtomicBoolean baselineAccepted = new AtomicBoolean(false);
            enforcer.registerAlertCallback(alerts::add);
            enforcer.registerAlertCallback(alert -> {
                if (!reacted.compareAndSet(false, true)) {
                    return;
                }
                firstAlert.countDown();
                long deadline = System.currentTimeMillis() + 5_000L;
                while (enforcer.isRunning() && System.currentTimeMillis() < deadline) {
                    Thread.onSpinWait();
                }
                enforcer.stop();
                baselineAccepted.set(enforcer.setBaseline(23.0));
            });

            enforcer.start();
            Assertions.assertTrue(firstAlert.await(5, TimeUnit.SECONDS));
            long startedAt = System.nanoTime();
            enforcer.stop();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

            Assertions.assertTrue(elapsedMs < 2_000L, "stop took " + elapsedMs + " ms");
            Assertions.assertEquals(0, countThreads(enforcer.threadName()));
            int alertsAtReturn = alerts.size();
            int overwritesAtReturn = store.overwrites().size();
            Thread.sleep(500L);
            Assertions.assertEquals(alertsAtReturn, alerts.size());
            Assertions.assertEquals(overwritesAtReturn, store.overwrites().size());

            // The in-flight shard is remediated; the next shard is never reached.
            Assertions.assertEquals(2, alertsAtReturn);
            Assertions.assertEquals(AlertKind.CRYPTOGRAPHIC_APOPTOSIS, alerts.get(1).kind());
            Assertions.assertEquals(List.of(1024), store.overwriteSizes());
            Assertions.assertArrayEquals(new byte[200], store.readAll("second.bin"));
            Assertions.assertTrue(baselineAccepted.get());
            Assertions.assertEquals(23.0, enforcer.baseline(), 1e-12);

            String audit = Files.readString(enforcer.auditLogger().auditFile());
            Assertions.assertTrue(audit.contains("\"result\":\"not_running\""));
            Assertions.assertFalse(audit.contains("\"result\":\"timeout\""));
            Assertions.assertTrue(AuditVerifier.verify(enforcer.auditLogger().auditFile(), "enforcer-test-secret").ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void enforcersSharingRuntimeRootKeepOneAuditChain() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-enforcer-shared-");
        try {
            ShardGuardConfig config = ShardGuardConfig.fromRoot(root.toString(), "vault");
            RecordingShardStore firstStore = new RecordingShardStore();
            firstStore.put("a.bin", new byte[200]);
            RecordingShardStore secondStore = new RecordingShardStore();
            secondStore.put("b.bin", new byte[120]);
            ThermodynamicEnforcer first = ThermodynamicEnforcer.create(
                    config, EnforcerSettings.of(7.2, 1.0, 60, List.of("a.bin")), firstStore, constantProbe(22.0));
            ThermodynamicEnforcer second = ThermodynamicEnforcer.create(
                    config, EnforcerSettings.of(7.2, 1.0, 60, List.of("b.bin")), secondStore, constantProbe(22.0));

            first.runCycleOnce();
            second.runCycleOnce();
            first.runCycleOnce();

            String secret = AuditLogger.loadOrCreateSigningSecret(config.auditSigningKeyFile());
            AuditVerifier.IntegrityOutcome outcome = AuditVerifier.verify(config.auditFile(), secret);
            Assertions.assertTrue(outcome.ok(), outcome.reason() + " at line " + outcome.brokenLine());
            String audit = Files.readString(config.auditFile());
            Assertions.assertTrue(audit.contains("\"resource\":\"shard/a.bin\""));
            Assertions.assertTrue(audit.contains("\"resource\":\"shard/b.bin\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void throwingCallbackDoesNotStarveOthersOrLaterCycles() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-enforcer-callback-");
        try {
            RecordingShardStore store = new RecordingShardStore();
            store.put("zero.bin", new byte[200]);
            List<Alert> seen = new CopyOnWriteArrayList<>();
            ThermodynamicEnforcer enforcer = new ThermodynamicEnforcer(
                    EnforcerSettings.of(7.2, 1.0, 60, List.of("zero.bin")),
                    store,
                    constantProbe(22.0),
                    auditLogger(root)
            );
            enforcer.registerAlertCallback(alert -> {
                throw new IllegalStateException("observer failed");
            });
            enforcer.registerAlertCallback(seen::add);

            enforcer.runCycleOnce();
            Assertions.assertEquals(4, seen.size());
            Assertions.assertEquals(4L, enforcer.stats().callbackFailures());

            enforcer.runCycleOnce();
            Assertions.assertEquals(2L, enforcer.stats().cyclesCompleted());
            Assertions.assertTrue(seen.size() > 4);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void baselineCanOnlyBeSetWhileStopped() throws Exception {
        Path root = Files.createTempDirectory("shardguard-test-enforcer-baseline-");
        try {
            ThermodynamicEnforcer enforcer = new ThermodynamicEnforcer(
                    new EnforcerSettings(7.2, 1.0, 60, List.of(), 2_000L),
                    new RecordingShardStore(),
                    constantProbe(22.0),
                    auditLogger(root)
            );
            enforcer.start();
            try {
                Assertions.assertFalse(enforcer.setBaseline(30.0));
                Assertions.assertEquals(22.0, enforcer.baseline(), 1e-12);
            } finally {
                enforcer.close();
            }
            Assertions.assertTrue(enforcer.setBaseline(30.0));
            Assertions.assertEquals(30.0, enforcer.baseline(), 1e-12);
            Assertions.assertThrows(IllegalArgumentException.class, () -> enforcer.setBaseline(Double.NaN));
        } finally {
            deleteRecursively(root);
        }
    }

    private static AuditLogger auditLogger(Path root) {
        return new AuditLogger(root.resolve("audit").resolve("audit.log"), "test", "enforcer-test-secret");
    }

    private static EnvironmentProbe constantProbe(double value) {
        return () -> value;
    }

    private static int countThreads(String name) {
        int count = 0;
        for (Thread thread : Thread.getAllStackTraces().keySet()) {
            if (name.equals(thread.getName()) && thread.isAlive()) {
                count++;
            }
        }
        return count;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static final class ScriptedProbe implements EnvironmentProbe {
        private final Deque<Double> readings;
        private double last;

        private ScriptedProbe(double... values) {
            this.readings = new ArrayDeque<>();
            for (double value : values) {
                readings.add(value);
            }
        }

        @Override
        public synchronized double read() {
            Double next = readings.poll();
            if (next != null) {
                last = next;
            }
            return last;
        }
    }

    private static final class RecordingShardStore implements ShardStore {
        private final Map<String, byte[]> shards = new ConcurrentHashMap<>();
        private final List<byte[]> overwrites = Collections.synchronizedList(new ArrayList<>());
        private volatile boolean failOverwrites;

        void put(String shardId, byte[] content) {
            shards.put(shardId, content.clone());
        }

        void failOverwrites(boolean fail) {
            this.failOverwrites = fail;
        }

        List<byte[]> overwrites() {
            return overwrites;
        }

        List<Integer> overwriteSizes() {
            List<Integer> sizes = new ArrayList<>();
            synchronized (overwrites) {
                for (byte[] content : overwrites) {
                    sizes.add(content.length);
                }
            }
            return sizes;
        }

        @Override
        public byte[] readAll(String shardId) throws IOException {
            byte[] content = shards.get(shardId);
            if (content == null) {
                throw new ShardNotFoundException(shardId);
            }
            return content.clone();
        }

        @Override
        public void overwrite(String shardId, byte[] content) throws IOException {
            if (failOverwrites) {
                throw new IOException("read-only shard: " + shardId);
            }
            overwrites.add(content.clone());
            shards.put(shardId, content.clone());
        }
    }
}
