package de.mirkosertic.mcp.ruleengine.calibration;

/**
 * Numeric helpers shared by the calibration functions.
 */
final class Probabilities {

    /** Probabilities are clamped to [EPSILON, 1 - EPSILON] before taking logits. */
    static final double EPSILON = 1e-6;

    private Probabilities() {
    }

    /**
     * Clamp to [0, 1]; NaN becomes 0.
     */
    static double clamp(final double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    static double logit(final double probability) {
        final double p = Math.max(EPSILON, Math.min(1.0 - EPSILON, probability));
        return Math.log(p / (1.0 - p));
    }

    static double sigmoid(final double x) {
        if (x >= 0) {
            return 1.0 / (1.0 + Math.exp(-x));
        }
        final double e = Math.exp(x);
        return e / (1.0 + e);
    }

    /**
     * Log-likelihood of a Bernoulli outcome with target in [0, 1].
     */
    static double logLikelihood(final double probability, final double target) {
        final double p = Math.max(EPSILON, Math.min(1.0 - EPSILON, probability));
        return target * Math.log(p) + (1.0 - target) * Math.log(1.0 - p);
    }
}
