package io.shardguard.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shardguard.util.Jsons;

import java.io.IOException;
import java.util.Base64;

/**
 * Ciphertext plus the metadata needed to open it.
 */
public record SealedShard(String schema, String kid, byte[] iv, byte[] ciphertext, double entropy) {

    public String toJson() {
        ObjectNode row = Jsons.mapper().createObjectNode();
        row.put("enc", schema);
        row.put("kid", kid);
        row.put("iv", Base64.getEncoder().encodeToString(iv));
        row.put("ct", Base64.getEncoder().encodeToString(ciphertext));
        row.put("entropy", entropy);
        return Jsons.toJson(row);
    }

    public static SealedShard fromJson(String raw) throws IOException {
        JsonNode node = Jsons.mapper().readTree(raw);
        String ivBase64 = node.path("iv").asText("");
        String ctBase64 = node.path("ct").asText("");
        if (ivBase64.isBlank() || ctBase64.isBlank()) {
            throw new IOException("Invalid sealed shard format: missing iv/ct");
        }
        return new SealedShard(
                node.path("enc").asText(""),
                node.path("kid").asText(""),
                Base64.getDecoder().decode(ivBase64),
                Base64.getDecoder().decode(ctBase64),
                node.path("entropy").asDouble(0.0)
        );
    }
}
