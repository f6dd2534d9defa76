package de.mirkosertic.mcp.ruleengine.calibration;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Metrics of the active calibration model.
 */
public record CalibrationSummary(
        CalibrationMethod method,
        double ece,
        double brier,
        @Nullable Instant trainedAt,
        int sampleCount
) {

    static CalibrationSummary of(final CalibrationModel model) {
        return new CalibrationSummary(model.method(), model.ece(), model.brier(), model.trainedAt(), model.sampleCount());
    }
}
