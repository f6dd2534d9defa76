package de.mirkosertic.mcp.ruleengine.calibration;

/**
 * Expected calibration error and Brier score.
 */
public final class CalibrationMetrics {

    private CalibrationMetrics() {
    }

    /**
     * Expected calibration error over {@code bins} equal-width bins. A probability p falls into bin
     * {@code min(floor(p * bins), bins - 1)}; the result is the sample-weighted mean of
     * |mean confidence - accuracy| per non-empty bin.
     *
     * @return ECE in [0, 1], 0 for empty input
     */
    public static double expectedCalibrationError(final double[] probabilities, final boolean[] labels, final int bins) {
        if (probabilities.length != labels.length) {
            throw new IllegalArgumentException("Probabilities and labels differ in length");
        }
        if (probabilities.length == 0) {
            return 0.0;
        }
        final double[] confidenceSum = new double[bins];
        final double[] correctSum = new double[bins];
        final int[] counts = new int[bins];
        for (int i = 0; i < probabilities.length; i++) {
            final int bin = Math.min((int) Math.floor(probabilities[i] * bins), bins - 1);
            confidenceSum[bin] += probabilities[i];
            correctSum[bin] += labels[i] ? 1.0 : 0.0;
            counts[bin]++;
        }
        double ece = 0.0;
        for (int bin = 0; bin < bins; bin++) {
            if (counts[bin] > 0) {
                final double gap = Math.abs(confidenceSum[bin] / counts[bin] - correctSum[bin] / counts[bin]);
                ece += gap * counts[bin] / probabilities.length;
            }
        }
        return ece;
    }

    /**
     * Mean squared difference between probability and outcome.
     */
    public static double brierScore(final double[] probabilities, final boolean[] labels) {
        if (probabilities.length != labels.length) {
            throw new IllegalArgumentException("Probabilities and labels differ in length");
        }
        if (probabilities.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = 0; i < probabilities.length; i++) {
            final double diff = probabilities[i] - (labels[i] ? 1.0 : 0.0);
            sum += diff * diff;
        }
        return sum / probabilities.length;
    }
}
