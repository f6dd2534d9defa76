package de.mirkosertic.mcp.ruleengine.calibration;

import java.util.List;
import java.util.Map;

/**
 * Outcome of fitting all candidate methods.
 *
 * @param selected   the winning model, its ECE/Brier measured on {@code validation}
 * @param candidates validation metrics of every method that fitted
 * @param failures   error message of every method that failed
 * @param validation the validation split the candidates were compared on
 */
public record FitResult(
        CalibrationModel selected,
        Map<CalibrationMethod, CalibrationEvaluation> candidates,
        Map<CalibrationMethod, String> failures,
        List<CalibrationPair> validation
) {

    public FitResult {
        candidates = Map.copyOf(candidates);
        failures = Map.copyOf(failures);
        validation = List.copyOf(validation);
    }
}
