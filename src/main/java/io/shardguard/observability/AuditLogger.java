package io.shardguard.observability;

import io.shardguard.security.SensitiveDataMasker;
import io.shardguard.util.Hashing;
import io.shardguard.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only JSONL audit trail. Each row carries the SHA-256 of the previous row so
 * truncation or edits are detectable by {@link AuditVerifier}; rows are additionally
 * HMAC-signed when a signing secret is configured.
 *
 * <p>Loggers opened on the same file in one JVM share a single chain head, so several
 * enforcers over one runtime root append to one unbroken chain. Appends made by another
 * process are picked up from the file tail before the next row is written.
 */
public final class AuditLogger {
    private static final ConcurrentMap<Path, ChainHead> CHAIN_HEADS = new ConcurrentHashMap<>();

    private final Path auditFile;
    private final String namespace;
    private final String signingSecret;
    private final ChainHead head;

    public AuditLogger(Path auditFile, String namespace, String signingSecret) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            if (auditFile.getParent() != null) {
                Files.createDirectories(auditFile.getParent());
            }
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.head = CHAIN_HEADS.computeIfAbsent(auditFile.toAbsolutePath().normalize(), p -> new ChainHead());
    }

    public void log(AuditEvent event) {
        synchronized (head) {
            append(event);
        }
    }

    private void append(AuditEvent event) {
        if (fileSize() != head.knownSize) {
            head.previousHash = loadLastHash();
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("cycle_id", event.cycleId());
        row.put("details", SensitiveDataMasker.maskedDetails(event.details()));
        row.put("prev_hash", head.previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            head.previousHash = rowHash;
            head.knownSize = fileSize();
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public String currentHash() {
        synchronized (head) {
            if (fileSize() != head.knownSize) {
                head.previousHash = loadLastHash();
                head.knownSize = fileSize();
            }
            return head.previousHash;
        }
    }

    public Path auditFile() {
        return auditFile;
    }

    public String signingSecret() {
        return signingSecret;
    }

    public static String loadOrCreateSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    private long fileSize() {
        try {
            return Files.exists(auditFile) ? Files.size(auditFile) : 0L;
        } catch (IOException e) {
            throw new RuntimeException("Failed to stat audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        if (!Files.exists(auditFile)) {
            return "";
        }
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            // A corrupt tail restarts the chain; AuditVerifier reports the break.
            System.err.println("WARN audit chain tail unreadable, starting new chain: " + e.getMessage());
            return "";
        }
    }

    private static final class ChainHead {
        private String previousHash = "";
        private long knownSize = -1L;
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String cycleId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, "system", resource, result, null, details == null ? Map.of() : details);
        }

        public static AuditEvent ofCycle(
                String action,
                String resource,
                String result,
                String cycleId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, "enforcer", resource, result, cycleId, details == null ? Map.of() : details);
        }
    }
}
