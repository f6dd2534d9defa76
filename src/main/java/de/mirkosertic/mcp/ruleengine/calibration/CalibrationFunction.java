package de.mirkosertic.mcp.ruleengine.calibration;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Fitting and application of one calibration method. Implementations are stateless; the fitted
 * state is the parameter list stored in {@link CalibrationModel}.
 */
interface CalibrationFunction {

    /**
     * @param scores raw confidences in [0, 1]
     * @param labels correctness per score
     * @return fitted parameters
     * @throws IllegalArgumentException if the data cannot be fitted by this method
     */
    List<Double> fit(double[] scores, boolean[] labels);

    /**
     * @param parameters fitted parameters
     * @param score      raw confidence in [0, 1]
     * @param logit      raw logit when the generator provides one, else null
     */
    double apply(List<Double> parameters, double score, @Nullable Double logit);
}
