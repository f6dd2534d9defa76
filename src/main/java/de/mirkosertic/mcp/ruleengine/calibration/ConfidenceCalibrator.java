package de.mirkosertic.mcp.ruleengine.calibration;

import de.mirkosertic.mcp.ruleengine.config.ApplicationConfig;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Maps raw finding confidences to calibrated probabilities.
 * <p>
 * Fitting tries temperature scaling, Platt scaling and isotonic regression on the training split,
 * measures each on the validation split and keeps the one with the lowest expected calibration
 * error (ties: lower Brier score, then {@link CalibrationMethod} order). A method that throws is
 * logged and skipped.
 * <p>
 * Calibration always uses the model held by {@link ActiveCalibrationModel}; fitting never changes
 * it. Deployment is the training orchestrator's decision.
 */
public class ConfidenceCalibrator {

    private static final Logger logger = LoggerFactory.getLogger(ConfidenceCalibrator.class);

    private final ActiveCalibrationModel activeModel;
    private final Map<CalibrationMethod, CalibrationFunction> candidates;
    private final int minSamples;
    private final int eceBins;
    private final double validationFraction;
    private final long seed;

    public ConfidenceCalibrator(final ApplicationConfig config, final ActiveCalibrationModel activeModel) {
        this(activeModel, config.getMinCalibrationSamples(), config.getEceBins(),
                config.getValidationFraction(), config.getRandomSeed());
    }

    public ConfidenceCalibrator(final ActiveCalibrationModel activeModel, final int minSamples, final int eceBins,
                                final double validationFraction, final long seed) {
        this(activeModel, minSamples, eceBins, validationFraction, seed, CalibrationFunctions.candidates());
    }

    ConfidenceCalibrator(final ActiveCalibrationModel activeModel, final int minSamples, final int eceBins,
                         final double validationFraction, final long seed,
                         final Map<CalibrationMethod, CalibrationFunction> candidates) {
        if (candidates.isEmpty() || candidates.containsKey(CalibrationMethod.IDENTITY)) {
            throw new IllegalArgumentException("candidates must name at least one fitted method and not IDENTITY");
        }
        this.activeModel = activeModel;
        this.candidates = new EnumMap<>(candidates);
        this.minSamples = minSamples;
        this.eceBins = eceBins;
        this.validationFraction = validationFraction;
        this.seed = seed;
    }

    /**
     * Split with a seeded shuffle and fit.
     */
    public FitResult fit(final List<CalibrationPair> pairs) throws InsufficientDataException, CalibrationFailedException {
        if (pairs.size() < minSamples) {
            throw new InsufficientDataException(pairs.size(), minSamples);
        }
        final Split split = split(pairs);
        return fit(split.train(), split.validation());
    }

    /**
     * Fit every candidate method on {@code train} and select the best on {@code validation}.
     *
     * @throws InsufficientDataException if both splits together hold fewer than the minimum samples
     * @throws CalibrationFailedException if no method could be fitted
     */
    public FitResult fit(final List<CalibrationPair> train, final List<CalibrationPair> validation)
            throws InsufficientDataException, CalibrationFailedException {
        final int total = train.size() + validation.size();
        if (total < minSamples || train.isEmpty()) {
            throw new InsufficientDataException(total, minSamples);
        }
        final List<CalibrationPair> evaluationSet = validation.isEmpty() ? train : validation;

        final double[] scores = new double[train.size()];
        final boolean[] labels = new boolean[train.size()];
        for (int i = 0; i < train.size(); i++) {
            scores[i] = Probabilities.clamp(train.get(i).rawConfidence());
            labels[i] = train.get(i).correct();
        }

        final Instant trainedAt = Instant.now();
        final Map<CalibrationMethod, CalibrationEvaluation> evaluations = new EnumMap<>(CalibrationMethod.class);
        final Map<CalibrationMethod, String> failures = new EnumMap<>(CalibrationMethod.class);
        CalibrationModel best = null;
        CalibrationEvaluation bestEvaluation = null;

        for (final Map.Entry<CalibrationMethod, CalibrationFunction> entry : candidates.entrySet()) {
            final CalibrationMethod method = entry.getKey();
            final CalibrationModel candidate;
            final CalibrationEvaluation evaluation;
            try {
                final List<Double> parameters = entry.getValue().fit(scores, labels);
                final CalibrationModel unrated = new CalibrationModel(method, parameters, Double.NaN, Double.NaN, total, trainedAt);
                evaluation = evaluate(unrated, evaluationSet);
                if (!Double.isFinite(evaluation.ece()) || !Double.isFinite(evaluation.brier())) {
                    throw new IllegalArgumentException("non-finite calibration output");
                }
                candidate = unrated.withMetrics(evaluation.ece(), evaluation.brier());
            } catch (final RuntimeException e) {
                logger.warn("Calibration method {} failed to fit: {}", method, e.getMessage(), e);
                failures.put(method, String.valueOf(e.getMessage()));
                continue;
            }
            evaluations.put(method, evaluation);
            logger.debug("Calibration candidate {}: ECE={}, Brier={}", method, evaluation.ece(), evaluation.brier());
            if (bestEvaluation == null || isBetter(evaluation, bestEvaluation)) {
                best = candidate;
                bestEvaluation = evaluation;
            }
        }

        if (best == null) {
            throw new CalibrationFailedException(failures);
        }
        logger.info("Selected calibration method {} (ECE={}, Brier={}) from {} samples",
                best.method(), best.ece(), best.brier(), total);
        return new FitResult(best, evaluations, failures, evaluationSet);
    }

    // candidates arrive in method order, so equal ECE and Brier keep the earlier method
    private static boolean isBetter(final CalibrationEvaluation candidate, final CalibrationEvaluation best) {
        final int byEce = Double.compare(candidate.ece(), best.ece());
        if (byEce != 0) {
            return byEce < 0;
        }
        return Double.compare(candidate.brier(), best.brier()) < 0;
    }

    /**
     * Seeded shuffle split into training and validation part. Both parts hold at least one sample
     * when there are two or more pairs.
     */
    public Split split(final List<CalibrationPair> pairs) {
        final List<CalibrationPair> shuffled = new ArrayList<>(pairs);
        Collections.shuffle(shuffled, new Random(seed));
        if (shuffled.size() < 2) {
            return new Split(shuffled, List.of());
        }
        final int validationSize = (int) Math.max(1, Math.min(shuffled.size() - 1,
                Math.round(shuffled.size() * validationFraction)));
        return new Split(
                List.copyOf(shuffled.subList(validationSize, shuffled.size())),
                List.copyOf(shuffled.subList(0, validationSize)));
    }

    /**
     * ECE and Brier score of {@code model} on {@code pairs}.
     */
    public CalibrationEvaluation evaluate(final CalibrationModel model, final List<CalibrationPair> pairs) {
        final double[] probabilities = new double[pairs.size()];
        final boolean[] labels = new boolean[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            probabilities[i] = apply(model, pairs.get(i).rawConfidence(), null);
            labels[i] = pairs.get(i).correct();
        }
        return new CalibrationEvaluation(
                CalibrationMetrics.expectedCalibrationError(probabilities, labels, eceBins),
                CalibrationMetrics.brierScore(probabilities, labels),
                pairs.size());
    }

    public double calibrate(final double rawConfidence) {
        return calibrate(rawConfidence, null);
    }

    /**
     * Calibrate with the active model. The input is clamped to [0, 1] (NaN counts as 0) and so is
     * the output.
     *
     * @param rawLogit logit of the generator, used by temperature scaling when present
     */
    public double calibrate(final double rawConfidence, final @Nullable Double rawLogit) {
        return apply(activeModel.get(), rawConfidence, rawLogit);
    }

    static double apply(final CalibrationModel model, final double rawConfidence, final @Nullable Double rawLogit) {
        final double input = Probabilities.clamp(rawConfidence);
        final double output = CalibrationFunctions.of(model.method()).apply(model.parameters(), input, rawLogit);
        return Probabilities.clamp(output);
    }

    public CalibrationSummary metrics() {
        return CalibrationSummary.of(activeModel.get());
    }

    public ActiveCalibrationModel getActiveModel() {
        return activeModel;
    }

    public int getMinSamples() {
        return minSamples;
    }

    /**
     * Training and validation part of a split.
     */
    public record Split(List<CalibrationPair> train, List<CalibrationPair> validation) {
    }
}
