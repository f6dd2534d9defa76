package de.mirkosertic.mcp.ruleengine.mcp.dto;

import de.mirkosertic.mcp.ruleengine.feedback.FeedbackStats;
import de.mirkosertic.mcp.ruleengine.mcp.ToolResponse;

import java.util.Map;

/**
 * Response DTO for the getFeedbackStats tool.
 */
public record FeedbackStatsResponse(
        boolean success,
        Integer total,
        Integer correct,
        Integer incorrect,
        Double accuracy,
        Map<String, Integer> byDiscipline,
        Double meanConfidenceCorrect,
        Double meanConfidenceIncorrect,
        String error
) implements ToolResponse {

    public static FeedbackStatsResponse success(final FeedbackStats stats) {
        return new FeedbackStatsResponse(
                true,
                stats.total(),
                stats.correct(),
                stats.incorrect(),
                Numbers.finiteOrNull(stats.accuracy()),
                stats.byDiscipline(),
                Numbers.finiteOrNull(stats.meanConfidenceCorrect()),
                Numbers.finiteOrNull(stats.meanConfidenceIncorrect()),
                null);
    }

    public static FeedbackStatsResponse error(final String errorMessage) {
        return new FeedbackStatsResponse(false, null, null, null, null, null, null, null, errorMessage);
    }
}
