package io.shardguard.analysis;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evidence produced by {@link RegularityDetector#inspect(byte[])}.
 *
 * @param heuristic     which test flagged the data, {@link Heuristic#NONE} when nothing did
 * @param bitRatio      fraction of set bits, NaN when the input was too short to judge
 * @param patternLength window length of the repeated substring, 0 unless repetition fired
 * @param observed      occurrence count of the offending substring
 * @param expected      occurrence count expected for uniform random data of the same length
 */
public record RegularityFinding(
        Heuristic heuristic,
        double bitRatio,
        int patternLength,
        long observed,
        double expected
) {
    public enum Heuristic {
        NONE("none"),
        INSUFFICIENT_DATA("insufficient_data"),
        BIT_BALANCE("bit_balance"),
        REPETITION("repetition");

        private final String wireName;

        Heuristic(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    static RegularityFinding insufficient() {
        return new RegularityFinding(Heuristic.INSUFFICIENT_DATA, Double.NaN, 0, 0L, 0.0);
    }

    static RegularityFinding clean(double bitRatio) {
        return new RegularityFinding(Heuristic.NONE, bitRatio, 0, 0L, 0.0);
    }

    public boolean detected() {
        return heuristic == Heuristic.BIT_BALANCE || heuristic == Heuristic.REPETITION;
    }

    public Map<String, Object> toDetails() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("heuristic", heuristic.wireName());
        if (!Double.isNaN(bitRatio)) {
            out.put("bit_ratio", bitRatio);
        }
        if (heuristic == Heuristic.REPETITION) {
            out.put("pattern_length", patternLength);
            out.put("observed", observed);
            out.put("expected", expected);
        }
        return out;
    }
}
