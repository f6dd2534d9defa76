package de.mirkosertic.mcp.ruleengine.training;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Candidate versus active model, both measured on the same validation split.
 *
 * @param candidateEce        ECE of the newly fitted model
 * @param activeEce           ECE of the model that was active when training started
 * @param relativeImprovement {@code (activeEce - candidateEce) / activeEce}, 0 when the active ECE is 0
 * @param threshold           minimum relative improvement required to deploy
 * @param passed              whether the candidate was good enough to deploy
 */
public record GateComparison(
        double candidateEce,
        double activeEce,
        double relativeImprovement,
        double threshold,
        boolean passed
) {

    /**
     * The candidate passes when {@code candidateEce <= activeEce * (1 - threshold)}. An active model
     * with an ECE of 0 cannot be improved on, so nothing passes against it.
     */
    public static GateComparison evaluate(final double candidateEce, final double activeEce, final double threshold) {
        if (activeEce <= 0.0) {
            return new GateComparison(candidateEce, activeEce, 0.0, threshold, false);
        }
        final double improvement = (activeEce - candidateEce) / activeEce;
        return new GateComparison(candidateEce, activeEce, improvement, threshold,
                candidateEce <= activeEce * (1.0 - threshold));
    }

    Map<String, Object> toMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("candidateEce", candidateEce);
        map.put("activeEce", activeEce);
        map.put("relativeImprovement", relativeImprovement);
        map.put("threshold", threshold);
        map.put("passed", passed);
        return map;
    }

    static GateComparison fromMap(final Map<String, Object> map) {
        return new GateComparison(
                ((Number) map.get("candidateEce")).doubleValue(),
                ((Number) map.get("activeEce")).doubleValue(),
                ((Number) map.get("relativeImprovement")).doubleValue(),
                ((Number) map.get("threshold")).doubleValue(),
                Boolean.TRUE.equals(map.get("passed")));
    }
}
