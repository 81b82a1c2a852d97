package io.shardguard.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shardguard.util.Hashing;
import io.shardguard.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class AuditVerifier {
    private AuditVerifier() {
    }

    public static IntegrityOutcome verify(Path file, String signingSecret) throws IOException {
        if (file == null || !Files.exists(file)) {
            return new IntegrityOutcome(true, 0, 0, 0, "", "");
        }
        String secret = signingSecret == null ? "" : signingSecret.trim();
        int totalRows = 0;
        int checkedRows = 0;
        int brokenLine = 0;
        String reason = "";
        String expectedPrev = "";
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            totalRows++;
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(line);
            } catch (JsonProcessingException e) {
                brokenLine = i + 1;
                reason = "invalid_json";
                break;
            }
            String hash = parsed.path("hash").asText("");
            String prevHash = parsed.path("prev_hash").asText("");
            if (hash.isBlank()) {
                brokenLine = i + 1;
                reason = "missing_hash";
                break;
            }
            if (!expectedPrev.isBlank() && !prevHash.equals(expectedPrev)) {
                brokenLine = i + 1;
                reason = "prev_hash_mismatch";
                break;
            }
            ObjectNode canonical = (ObjectNode) parsed.deepCopy();
            canonical.remove("hash");
            canonical.remove("signature");
            String expectedHash = Hashing.sha256Hex(Jsons.toCompactJson(canonical));
            if (!expectedHash.equals(hash)) {
                brokenLine = i + 1;
                reason = "hash_mismatch";
                break;
            }
            String signature = parsed.path("signature").asText("");
            if (!signature.isBlank() && !secret.isBlank()
                    && !Hashing.hmacSha256Hex(secret, hash).equals(signature)) {
                brokenLine = i + 1;
                reason = "signature_mismatch";
                break;
            }
            checkedRows++;
            expectedPrev = hash;
        }
        return new IntegrityOutcome(brokenLine == 0, totalRows, checkedRows, brokenLine, reason, expectedPrev);
    }

    public record IntegrityOutcome(
            boolean ok,
            int totalRows,
            int checkedRows,
            int brokenLine,
            String reason,
            String lastHash
    ) {
    }
}
