package io.shardguard.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ShardGuardConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String SETTINGS_FILE = "shardguard-settings.json";

    private final Path rootDir;
    private final String namespace;

    public ShardGuardConfig(Path rootDir, String namespace) {
        this.rootDir = rootDir;
        this.namespace = namespace;
    }

    public static ShardGuardConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static ShardGuardConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new ShardGuardConfig(resolved.toAbsolutePath().normalize(), sanitizeNamespace(namespace));
    }

    static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        return value.isBlank() ? DEFAULT_NAMESPACE : value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public String namespace() {
        return namespace;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path alertsRoot() {
        return rootDir.resolve("alerts");
    }

    public Path alertJournalFile() {
        return alertsRoot().resolve("alerts.jsonl");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }

    public Path sealerKeyFile() {
        return securityRoot().resolve("sealer-keys.json");
    }
}
