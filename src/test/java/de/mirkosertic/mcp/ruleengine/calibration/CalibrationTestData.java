package de.mirkosertic.mcp.ruleengine.calibration;

import java.util.ArrayList;
import java.util.List;

/**
 * Labelled samples with a fixed number of correct answers per confidence level.
 */
final class CalibrationTestData {

    private CalibrationTestData() {
    }

    static List<CalibrationPair> levels(final double[] confidences, final int[] correctCounts, final int perLevel) {
        final List<CalibrationPair> pairs = new ArrayList<>();
        for (int level = 0; level < confidences.length; level++) {
            for (int i = 0; i < perLevel; i++) {
                pairs.add(new CalibrationPair(confidences[level], i < correctCounts[level]));
            }
        }
        return pairs;
    }

    /**
     * Confidences 0.05, 0.15, ... 0.95 where exactly that share of samples is correct.
     */
    static List<CalibrationPair> wellCalibrated(final int perLevel) {
        final double[] confidences = {0.05, 0.15, 0.25, 0.35, 0.45, 0.55, 0.65, 0.75, 0.85, 0.95};
        final int[] correct = new int[confidences.length];
        for (int i = 0; i < confidences.length; i++) {
            correct[i] = (int) Math.round(confidences[i] * perLevel);
        }
        return levels(confidences, correct, perLevel);
    }

    /**
     * 200 samples between 0.3 and 1.0 whose accuracy is far below the stated confidence.
     */
    static List<CalibrationPair> overconfident() {
        return levels(
                new double[]{0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.9, 1.0},
                new int[]{3, 5, 8, 10, 13, 15, 18, 20},
                25);
    }
}
