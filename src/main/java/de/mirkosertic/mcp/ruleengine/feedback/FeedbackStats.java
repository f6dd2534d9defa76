package de.mirkosertic.mcp.ruleengine.feedback;

import java.util.Map;

/**
 * Aggregate view over all recorded feedback.
 *
 * @param total                     number of samples
 * @param correct                   samples judged correct
 * @param incorrect                 samples judged incorrect
 * @param byDiscipline              sample count per discipline, "unknown" when none was given
 * @param meanConfidenceCorrect     mean raw confidence of correct samples, NaN when there are none
 * @param meanConfidenceIncorrect   mean raw confidence of incorrect samples, NaN when there are none
 */
public record FeedbackStats(
        int total,
        int correct,
        int incorrect,
        Map<String, Integer> byDiscipline,
        double meanConfidenceCorrect,
        double meanConfidenceIncorrect
) {

    public FeedbackStats {
        byDiscipline = Map.copyOf(byDiscipline);
    }

    public double accuracy() {
        return total == 0 ? Double.NaN : (double) correct / total;
    }
}
