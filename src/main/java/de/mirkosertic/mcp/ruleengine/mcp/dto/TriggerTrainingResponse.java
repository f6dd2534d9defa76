package de.mirkosertic.mcp.ruleengine.mcp.dto;

import de.mirkosertic.mcp.ruleengine.mcp.ToolResponse;
import de.mirkosertic.mcp.ruleengine.training.GateComparison;
import de.mirkosertic.mcp.ruleengine.training.TrainingJob;

/**
 * Response DTO for the triggerTraining tool. A job that was skipped or failed is still a successful
 * tool call; its outcome is in {@code status} and {@code reason}.
 */
public record TriggerTrainingResponse(
        boolean success,
        String jobId,
        String status,
        Integer sampleCount,
        String selectedMethod,
        Boolean deployed,
        GateComparison gate,
        String reason,
        Long durationMs,
        String error
) implements ToolResponse {

    public static TriggerTrainingResponse success(final TrainingJob job) {
        final Long durationMs = job.finishedAt() != null
                ? job.finishedAt().toEpochMilli() - job.startedAt().toEpochMilli()
                : null;
        return new TriggerTrainingResponse(
                true,
                job.id(),
                job.status().name(),
                job.sampleCount(),
                job.model() != null ? job.model().method().name() : null,
                job.deployed(),
                job.gate(),
                job.reason(),
                durationMs,
                null);
    }

    public static TriggerTrainingResponse error(final String errorMessage) {
        return new TriggerTrainingResponse(false, null, null, null, null, null, null, null, null, errorMessage);
    }
}
