package io.shardguard.sharding;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Quality verdict for one encoded share.
 */
public record ShareInspection(int index, int bytes, double entropy, double entropyThreshold, boolean regularity) {

    public boolean passed() {
        return entropy >= entropyThreshold && !regularity;
    }

    public Map<String, Object> toDetails() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("index", index);
        out.put("bytes", bytes);
        out.put("entropy", entropy);
        out.put("entropy_threshold", entropyThreshold);
        out.put("regularity", regularity);
        out.put("passed", passed());
        return out;
    }
}
