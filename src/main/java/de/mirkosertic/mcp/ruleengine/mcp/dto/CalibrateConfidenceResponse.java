package de.mirkosertic.mcp.ruleengine.mcp.dto;

import de.mirkosertic.mcp.ruleengine.calibration.CalibrationMethod;
import de.mirkosertic.mcp.ruleengine.mcp.ToolResponse;

/**
 * Response DTO for the calibrateConfidence tool.
 */
public record CalibrateConfidenceResponse(
        boolean success,
        Double rawConfidence,
        Double calibratedConfidence,
        CalibrationMethod method,
        String error
) implements ToolResponse {

    public static CalibrateConfidenceResponse success(final double raw, final double calibrated,
                                                      final CalibrationMethod method) {
        return new CalibrateConfidenceResponse(true, raw, calibrated, method, null);
    }

    public static CalibrateConfidenceResponse error(final String errorMessage) {
        return new CalibrateConfidenceResponse(false, null, null, null, errorMessage);
    }
}
