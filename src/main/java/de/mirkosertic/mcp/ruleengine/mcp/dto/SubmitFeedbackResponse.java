package de.mirkosertic.mcp.ruleengine.mcp.dto;

import de.mirkosertic.mcp.ruleengine.mcp.ToolResponse;

/**
 * Response DTO for the submitFeedback tool.
 */
public record SubmitFeedbackResponse(
        boolean success,
        String findingId,
        String recordedAt,
        Integer totalFeedback,
        String error
) implements ToolResponse {

    public static SubmitFeedbackResponse success(final String findingId, final String recordedAt, final int totalFeedback) {
        return new SubmitFeedbackResponse(true, findingId, recordedAt, totalFeedback, null);
    }

    public static SubmitFeedbackResponse error(final String errorMessage) {
        return new SubmitFeedbackResponse(false, null, null, null, errorMessage);
    }
}
