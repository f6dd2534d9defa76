package de.mirkosertic.mcp.ruleengine.mcp.dto;

import de.mirkosertic.mcp.ruleengine.mcp.ToolResponse;
import de.mirkosertic.mcp.ruleengine.training.CalibrationHealth;

import java.util.List;

/**
 * Response DTO for the getCalibrationHealth tool. Metrics of the identity model are omitted.
 */
public record CalibrationHealthResponse(
        boolean success,
        String activeMethod,
        Double ece,
        Double brier,
        Integer totalFeedback,
        Integer sampleBacklog,
        Double modelAgeDays,
        String lastJobStatus,
        String lastJobReason,
        String nextScheduledRun,
        List<String> warnings,
        String error
) implements ToolResponse {

    public static CalibrationHealthResponse success(final CalibrationHealth health, final String nextScheduledRun) {
        return new CalibrationHealthResponse(
                true,
                health.activeMethod().name(),
                Numbers.finiteOrNull(health.ece()),
                Numbers.finiteOrNull(health.brier()),
                health.totalFeedback(),
                health.sampleBacklog(),
                health.modelAgeDays(),
                health.lastJobStatus() != null ? health.lastJobStatus().name() : null,
                health.lastJobReason(),
                nextScheduledRun,
                health.warnings(),
                null);
    }

    public static CalibrationHealthResponse error(final String errorMessage) {
        return new CalibrationHealthResponse(false, null, null, null, null, null, null, null, null, null, null,
                errorMessage);
    }
}
