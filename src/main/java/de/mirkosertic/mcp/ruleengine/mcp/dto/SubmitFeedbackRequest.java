package de.mirkosertic.mcp.ruleengine.mcp.dto;

import de.mirkosertic.mcp.ruleengine.feedback.FeedbackSample;
import de.mirkosertic.mcp.ruleengine.mcp.ToolParam;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the submitFeedback tool.
 */
public record SubmitFeedbackRequest(
        @Nullable
        @ToolParam("Id of the finding the verdict is about")
        String findingId,

        @Nullable
        @ToolParam(value = "Raw (uncalibrated) confidence the finding was reported with", minimum = 0.0, maximum = 1.0)
        Double rawConfidence,

        @Nullable
        @ToolParam("true if the finding was correct, false if it was wrong")
        Boolean correct,

        @Nullable
        @ToolParam("Discipline of the analysed document")
        String discipline,

        @Nullable
        @ToolParam("Document type of the analysed document")
        String documentType,

        @Nullable
        @ToolParam("Id of the rule the finding was raised for")
        String ruleId
) {

    public static SubmitFeedbackRequest fromMap(final Map<String, Object> args) {
        return new SubmitFeedbackRequest(
                RequestArguments.string(args, "findingId"),
                RequestArguments.number(args, "rawConfidence"),
                RequestArguments.bool(args, "correct"),
                RequestArguments.string(args, "discipline"),
                RequestArguments.string(args, "documentType"),
                RequestArguments.string(args, "ruleId"));
    }

    public FeedbackSample.FeedbackMetadata metadata() {
        return new FeedbackSample.FeedbackMetadata(discipline, documentType, ruleId);
    }
}
