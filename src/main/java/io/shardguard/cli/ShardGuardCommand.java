package io.shardguard.cli;

import io.shardguard.alert.AlertJournal;
import io.shardguard.analysis.EntropyAnalyzer;
import io.shardguard.analysis.RegularityDetector;
import io.shardguard.analysis.RegularityFinding;
import io.shardguard.config.EnforcerSettings;
import io.shardguard.config.ShardGuardConfig;
import io.shardguard.decoy.DecoyMixer;
import io.shardguard.enforcer.CycleReport;
import io.shardguard.enforcer.ThermodynamicEnforcer;
import io.shardguard.observability.AuditLogger;
import io.shardguard.observability.AuditVerifier;
import io.shardguard.probe.SyntheticTemperatureProbe;
import io.shardguard.security.AesGcmShardSealer;
import io.shardguard.security.EntropyGateException;
import io.shardguard.security.SealedShard;
import io.shardguard.sharding.InsufficientSharesException;
import io.shardguard.sharding.KeyShare;
import io.shardguard.sharding.KeyShareRepository;
import io.shardguard.sharding.ShareInspection;
import io.shardguard.sharding.ThresholdKeySharder;
import io.shardguard.storage.FileShardStore;
import io.shardguard.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
        name = "shardguard",
        mixinStandardHelpOptions = true,
        description = "Key-shard integrity monitor",
        subcommands = {
                ShardGuardCommand.MonitorCommand.class,
                ShardGuardCommand.CheckCommand.class,
                ShardGuardCommand.InspectCommand.class,
                ShardGuardCommand.SealCommand.class,
                ShardGuardCommand.UnsealCommand.class,
                ShardGuardCommand.DecoyCommand.class,
                ShardGuardCommand.SplitCommand.class,
                ShardGuardCommand.CombineCommand.class,
                ShardGuardCommand.AuditVerifyCommand.class
        }
)
public final class ShardGuardCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Audit namespace", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: monitor | check | inspect | seal | unseal | decoy | split | combine | audit-verify");
    }

    ShardGuardConfig config() {
        return ShardGuardConfig.fromRoot(root, namespace);
    }

    AuditLogger auditLogger() {
        ShardGuardConfig config = config();
        return new AuditLogger(config.auditFile(), config.namespace(),
                AuditLogger.loadOrCreateSigningSecret(config.auditSigningKeyFile()));
    }

    /**
     * Shared options for commands that drive the enforcer; unset options keep the
     * value from {@code shardguard-settings.json}. Shard files named on the command line
     * resolve against the working directory; ids from the settings file resolve under
     * {@code --root}.
     */
    static class EnforcerOptions {
        @Option(names = {"--shard"},
                description = "Shard file to monitor, relative to the working directory (repeatable)")
        List<String> shards = new ArrayList<>();

        @Option(names = {"--entropy-threshold"}, description = "Minimum entropy in bits/byte")
        Double entropyThreshold;

        @Option(names = {"--temperature-threshold"}, description = "Maximum ambient drift before alerting")
        Double temperatureThreshold;

        @Option(names = {"--interval-seconds"}, description = "Seconds between check cycles")
        Integer intervalSeconds;

        EnforcerSettings resolve(ShardGuardConfig config) throws IOException {
            EnforcerSettings settings = EnforcerSettings.load(config.settingsFile());
            if (!shards.isEmpty()) {
                List<String> resolved = new ArrayList<>();
                for (String shard : shards) {
                    resolved.add(Path.of(shard).toAbsolutePath().normalize().toString());
                }
                settings = settings.withShardIds(resolved);
            }
            if (entropyThreshold != null) {
                settings = settings.withEntropyThreshold(entropyThreshold);
            }
            if (temperatureThreshold != null) {
                settings = settings.withTemperatureVarianceThreshold(temperatureThreshold);
            }
            if (intervalSeconds != null) {
                settings = settings.withCheckIntervalSeconds(intervalSeconds);
            }
            return settings;
        }
    }

    static ThermodynamicEnforcer enforcer(ShardGuardConfig config, EnforcerSettings settings) {
        ThermodynamicEnforcer enforcer = ThermodynamicEnforcer.create(
                config,
                settings,
                new FileShardStore(config.rootDir()),
                new SyntheticTemperatureProbe()
        );
        enforcer.registerAlertCallback(new AlertJournal(config.alertJournalFile()));
        return enforcer;
    }

    @Command(name = "monitor", description = "Run the monitoring cycle until interrupted")
    static final class MonitorCommand extends EnforcerOptions implements Callable<Integer> {
        @ParentCommand
        ShardGuardCommand parent;

        @Option(names = {"--duration-seconds"}, defaultValue = "0",
                description = "Stop after this many seconds; 0 runs until shutdown")
        long durationSeconds;

        @Override
        public Integer call() throws Exception {
            ShardGuardConfig config = parent.config();
            EnforcerSettings settings = resolve(config);
            if (settings.shardIds().isEmpty()) {
                System.err.println("No shards configured: use --shard or " + config.settingsFile());
                return 2;
            }
            ThermodynamicEnforcer enforcer = enforcer(config, settings);
            enforcer.registerAlertCallback(alert -> System.out.println(Jsons.toCompactJson(alert.toPayload())));
            CountDownLatch done = new CountDownLatch(1);
            Thread hook = new Thread(() -> {
                enforcer.close();
                done.countDown();
            }, "shardguard-shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);
            enforcer.start();
            System.out.println("Monitoring " + settings.shardIds().size() + " shard(s) every "
                    + settings.checkIntervalSeconds() + "s, audit: " + config.auditFile());
            if (durationSeconds > 0) {
                done.await(durationSeconds, TimeUnit.SECONDS);
                Runtime.getRuntime().removeShutdownHook(hook);
                enforcer.close();
            } else {
                done.await();
            }
            System.out.println(Jsons.toJson(enforcer.stats()));
            return 0;
        }
    }

    @Command(name = "check", description = "Run exactly one check cycle")
    static final class CheckCommand extends EnforcerOptions implements Callable<Integer> {
        @ParentCommand
        ShardGuardCommand parent;

        @Option(names = {"--metrics"}, defaultValue = "false", description = "Print Prometheus text instead of the report")
        boolean metrics;

        @Override
        public Integer call() throws Exception {
            ShardGuardConfig config = parent.config();
            EnforcerSettings settings = resolve(config);
            try (ThermodynamicEnforcer enforcer = enforcer(config, settings)) {
                CycleReport report = enforcer.runCycleOnce();
                System.out.println(metrics ? enforcer.metricsText() : Jsons.toJson(report));
                return report.apoptosisCount() > 0 ? 1 : 0;
            }
        }
    }

    @Command(name = "inspect", description = "Report entropy and regularity of a file without remediation")
    static final class InspectCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "File to inspect")
        Path file;

        @Override
        public Integer call() throws IOException {
            byte[] data = Files.readAllBytes(file);
            RegularityFinding finding = RegularityDetector.inspect(data);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("file", file.toString());
            out.put("bytes", data.length);
            out.put("entropy", EntropyAnalyzer.entropy(data));
            out.put("regularity", finding.detected());
            out.putAll(finding.toDetails());
            out.put("decoy_marker", DecoyMixer.containsDecoy(data));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "seal", description = "Encrypt a file, refusing ciphertext below the entropy gate")
    static final class SealCommand implements Callable<Integer> {
        @ParentCommand
        ShardGuardCommand parent;

        @Option(names = {"--in"}, required = true, description = "Plaintext file")
        Path in;

        @Option(names = {"--out"}, required = true, description = "Sealed output file (JSON)")
        Path out;

        @Option(names = {"--entropy-gate"}, defaultValue = "7.9", description = "Minimum ciphertext entropy")
        double entropyGate;

        @Override
        public Integer call() throws IOException {
            AesGcmShardSealer sealer = new AesGcmShardSealer(parent.config().sealerKeyFile(), entropyGate);
            try {
                SealedShard sealed = sealer.seal(Files.readAllBytes(in));
                Files.writeString(out, sealed.toJson(), StandardCharsets.UTF_8);
                System.out.println("Sealed " + in + " -> " + out + " (kid=" + sealed.kid()
                        + ", entropy=" + String.format("%.4f", sealed.entropy()) + ")");
                return 0;
            } catch (EntropyGateException e) {
                System.err.println("Refused: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "unseal", description = "Decrypt a sealed file")
    static final class UnsealCommand implements Callable<Integer> {
        @ParentCommand
        ShardGuardCommand parent;

        @Option(names = {"--in"}, required = true, description = "Sealed file (JSON)")
        Path in;

        @Option(names = {"--out"}, required = true, description = "Plaintext output file")
        Path out;

        @Override
        public Integer call() throws IOException {
            AesGcmShardSealer sealer = new AesGcmShardSealer(parent.config().sealerKeyFile());
            SealedShard sealed = SealedShard.fromJson(Files.readString(in, StandardCharsets.UTF_8));
            Files.write(out, sealer.open(sealed));
            return 0;
        }
    }

    @Command(name = "decoy", description = "Mix decoy content into a file, or check a file for it")
    static final class DecoyCommand implements Callable<Integer> {
        @Option(names = {"--in"}, description = "Input file to mix")
        Path in;

        @Option(names = {"--out"}, description = "Mixed output file")
        Path out;

        @Option(names = {"--check"}, description = "Only report whether this file carries a decoy marker")
        Path check;

        @Option(names = {"--ratio"}, defaultValue = "0.1", description = "Decoy size relative to input (0..1)")
        double ratio;

        @Option(names = {"--complexity"}, defaultValue = "3", description = "Trap generator level 1..5")
        int complexity;

        @Override
        public Integer call() throws IOException {
            if (check != null) {
                boolean found = DecoyMixer.containsDecoy(Files.readAllBytes(check));
                System.out.println(Jsons.toJson(Map.of("file", check.toString(), "decoy_marker", found)));
                return found ? 1 : 0;
            }
            if (in == null || out == null) {
                System.err.println("decoy requires --in and --out, or --check FILE");
                return 2;
            }
            byte[] data = Files.readAllBytes(in);
            byte[] mixed = new DecoyMixer(ratio, complexity).mix(data);
            Files.write(out, mixed);
            System.out.println(Jsons.toJson(Map.of(
                    "input_bytes", data.length,
                    "output_bytes", mixed.length,
                    "input_entropy", EntropyAnalyzer.entropy(data),
                    "output_entropy", EntropyAnalyzer.entropy(mixed)
            )));
            return 0;
        }
    }

    @Command(name = "split", description = "Split a key file into threshold shares written next to --prefix")
    static final class SplitCommand implements Callable<Integer> {
        @ParentCommand
        ShardGuardCommand parent;

        @Option(names = {"--in"}, required = true, description = "Key file to split")
        Path in;

        @Option(names = {"--prefix"}, required = true,
                description = "Share path prefix; shares land at <prefix>.share-<n>")
        String prefix;

        @Option(names = {"--shares"}, defaultValue = "5", description = "Number of shares to produce")
        int shares;

        @Option(names = {"--threshold"}, defaultValue = "3", description = "Shares needed to rebuild the key")
        int threshold;

        @Option(names = {"--entropy-threshold"}, defaultValue = "7.2", description = "Share quality entropy floor")
        double entropyThreshold;

        @Override
        public Integer call() throws IOException {
            List<KeyShare> split = new ThresholdKeySharder(threshold).split(Files.readAllBytes(in), shares);
            List<String> ids = new KeyShareRepository(new FileShardStore()).save(prefix, split);
            List<Map<String, Object>> quality = new ArrayList<>();
            boolean allPassed = true;
            for (ShareInspection inspection : ThresholdKeySharder.inspect(split, entropyThreshold)) {
                quality.add(inspection.toDetails());
                allPassed &= inspection.passed();
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("threshold", threshold);
            out.put("shares", ids);
            out.put("quality_passed", allPassed);
            out.put("quality", quality);
            parent.auditLogger().log(AuditLogger.AuditEvent.of("key.split", "key/" + in.getFileName(), "ok",
                    Map.of("threshold", threshold, "shares", ids, "quality_passed", allPassed)));
            System.out.println(Jsons.toJson(out));
            if (!allPassed) {
                System.err.println("WARN shares fall below the entropy floor or look regular; "
                        + "monitoring them with the same floor will invalidate them");
            }
            return 0;
        }
    }

    @Command(name = "combine", description = "Rebuild a key from threshold shares")
    static final class CombineCommand implements Callable<Integer> {
        @ParentCommand
        ShardGuardCommand parent;

        @Option(names = {"--out"}, required = true, description = "Rebuilt key file")
        Path out;

        @Parameters(arity = "1..*", description = "Share files")
        List<String> shareFiles;

        @Override
        public Integer call() throws IOException {
            AuditLogger logger = parent.auditLogger();
            List<KeyShare> loaded = new KeyShareRepository(new FileShardStore()).load(shareFiles);
            try {
                byte[] key = ThresholdKeySharder.combine(loaded);
                Files.write(out, key);
                logger.log(AuditLogger.AuditEvent.of("key.combine", "key/" + out.getFileName(), "ok",
                        Map.of("shares", shareFiles, "bytes", key.length)));
                System.out.println("Rebuilt " + key.length + " byte key from " + loaded.size() + " share(s) -> " + out);
                return 0;
            } catch (InsufficientSharesException e) {
                logger.log(AuditLogger.AuditEvent.of("key.combine", "key/" + out.getFileName(), "insufficient_shares",
                        Map.of("provided", e.provided(), "threshold", e.threshold())));
                System.err.println("Refused: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify hash chain and signatures of the audit log")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        ShardGuardCommand parent;

        @Override
        public Integer call() throws IOException {
            ShardGuardConfig config = parent.config();
            String secret = Files.exists(config.auditSigningKeyFile())
                    ? AuditLogger.loadOrCreateSigningSecret(config.auditSigningKeyFile())
                    : "";
            AuditVerifier.IntegrityOutcome outcome = AuditVerifier.verify(config.auditFile(), secret);
            System.out.println(Jsons.toJson(outcome));
            return outcome.ok() ? 0 : 1;
        }
    }
}
