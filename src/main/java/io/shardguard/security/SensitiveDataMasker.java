package io.shardguard.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shardguard.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keeps key material out of the audit trail. Shard contents, plaintexts, seeds and raw
 * key bytes are masked by field name; binary values, arrays of raw byte values and long
 * opaque base64 or hex blobs are masked by shape.
 */
public final class SensitiveDataMasker {
    public static final String MASK = "***";

    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "secret", "password", "token", "credential",
            "plaintext", "content", "key_material", "raw_key", "shard_bytes", "seed"
    );
    private static final Pattern OPAQUE_BLOB = Pattern.compile("^[A-Za-z0-9+/]{64,}={0,2}$");
    private static final int BYTE_ARRAY_MIN = 16;

    private SensitiveDataMasker() {
    }

    /**
     * Masks an audit details map; the result is a fresh map safe to serialize.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> maskedDetails(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return Map.of();
        }
        JsonNode tree = Jsons.mapper().valueToTree(details);
        return Jsons.mapper().convertValue(masked(tree), Map.class);
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = input.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                out.set(field.getKey(), isSensitiveKey(field.getKey())
                        ? Jsons.mapper().getNodeFactory().textNode(MASK)
                        : masked(field.getValue()));
            }
            return out;
        }
        if (input.isArray()) {
            if (looksLikeRawBytes(input)) {
                return Jsons.mapper().getNodeFactory().textNode(MASK);
            }
            ArrayNode out = Jsons.mapper().createArrayNode();
            input.forEach(value -> out.add(masked(value)));
            return out;
        }
        if (input.isBinary() || (input.isTextual() && likelyKeyMaterial(input.asText("")))) {
            return Jsons.mapper().getNodeFactory().textNode(MASK);
        }
        return input;
    }

    static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        return SENSITIVE_HINTS.stream().anyMatch(key::contains);
    }

    static boolean likelyKeyMaterial(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        // Shard ids and paths stay readable.
        if (v.startsWith("/") || v.contains("\\") || v.contains(".")) {
            return false;
        }
        return OPAQUE_BLOB.matcher(v).matches();
    }

    // A long run of small integers is almost certainly a serialized byte[] or int[] of shard bytes.
    private static boolean looksLikeRawBytes(JsonNode array) {
        if (array.size() < BYTE_ARRAY_MIN) {
            return false;
        }
        for (JsonNode element : array) {
            if (!element.canConvertToInt() || !element.isIntegralNumber()) {
                return false;
            }
            int v = element.intValue();
            if (v < -128 || v > 255) {
                return false;
            }
        }
        return true;
    }
}
