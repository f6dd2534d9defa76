package de.mirkosertic.mcp.ruleengine.training;

import de.mirkosertic.mcp.ruleengine.calibration.CalibrationMethod;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Snapshot of the calibration subsystem.
 *
 * @param activeMethod    method of the active model
 * @param ece             fit-time ECE of the active model, NaN for identity
 * @param brier           fit-time Brier score of the active model, NaN for identity
 * @param totalFeedback   recorded feedback samples
 * @param sampleBacklog   samples recorded since the last training attempt
 * @param modelAgeDays    days since the active model was trained, null for identity
 * @param lastJobStatus   status of the most recent job, null before the first one
 * @param lastJobReason   reason attached to the most recent job
 * @param warnings        human readable problems, empty when healthy
 */
public record CalibrationHealth(
        CalibrationMethod activeMethod,
        double ece,
        double brier,
        int totalFeedback,
        int sampleBacklog,
        @Nullable Double modelAgeDays,
        @Nullable JobStatus lastJobStatus,
        @Nullable String lastJobReason,
        List<String> warnings
) {

    public CalibrationHealth {
        warnings = List.copyOf(warnings);
    }
}
