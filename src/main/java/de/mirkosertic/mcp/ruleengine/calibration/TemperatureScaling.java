package de.mirkosertic.mcp.ruleengine.calibration;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * {@code sigmoid(logit / T)} with a single temperature T.
 * <p>
 * T is found by golden-section search on {@code ln T} in [{@value #MIN_TEMPERATURE}, {@value #MAX_TEMPERATURE}],
 * minimising the negative log-likelihood. The NLL is unimodal in T for a fixed set of logits,
 * so the bracket search converges to the global optimum within the range.
 * Parameters: {@code [T]}.
 */
final class TemperatureScaling implements CalibrationFunction {

    static final double MIN_TEMPERATURE = 0.05;
    static final double MAX_TEMPERATURE = 20.0;
    private static final double INV_PHI = (Math.sqrt(5.0) - 1.0) / 2.0;
    private static final double TOLERANCE = 1e-7;
    private static final int MAX_ITERATIONS = 200;

    @Override
    public List<Double> fit(final double[] scores, final boolean[] labels) {
        if (scores.length == 0) {
            throw new IllegalArgumentException("No samples");
        }
        final double[] logits = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            logits[i] = Probabilities.logit(scores[i]);
        }

        double low = Math.log(MIN_TEMPERATURE);
        double high = Math.log(MAX_TEMPERATURE);
        double x1 = high - INV_PHI * (high - low);
        double x2 = low + INV_PHI * (high - low);
        double f1 = negativeLogLikelihood(logits, labels, Math.exp(x1));
        double f2 = negativeLogLikelihood(logits, labels, Math.exp(x2));

        for (int i = 0; i < MAX_ITERATIONS && high - low > TOLERANCE; i++) {
            if (f1 < f2) {
                high = x2;
                x2 = x1;
                f2 = f1;
                x1 = high - INV_PHI * (high - low);
                f1 = negativeLogLikelihood(logits, labels, Math.exp(x1));
            } else {
                low = x1;
                x1 = x2;
                f1 = f2;
                x2 = low + INV_PHI * (high - low);
                f2 = negativeLogLikelihood(logits, labels, Math.exp(x2));
            }
        }
        final double temperature = Math.exp((low + high) / 2.0);
        if (!Double.isFinite(temperature)) {
            throw new IllegalArgumentException("Temperature did not converge");
        }
        return List.of(temperature);
    }

    private static double negativeLogLikelihood(final double[] logits, final boolean[] labels, final double temperature) {
        double sum = 0.0;
        for (int i = 0; i < logits.length; i++) {
            sum -= Probabilities.logLikelihood(Probabilities.sigmoid(logits[i] / temperature), labels[i] ? 1.0 : 0.0);
        }
        return sum / logits.length;
    }

    @Override
    public double apply(final List<Double> parameters, final double score, final @Nullable Double logit) {
        final double z = logit != null && Double.isFinite(logit) ? logit : Probabilities.logit(score);
        return Probabilities.sigmoid(z / parameters.get(0));
    }
}
