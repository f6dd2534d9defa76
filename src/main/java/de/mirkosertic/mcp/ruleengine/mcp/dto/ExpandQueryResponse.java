package de.mirkosertic.mcp.ruleengine.mcp.dto;

import de.mirkosertic.mcp.ruleengine.expansion.ExpansionResult;
import de.mirkosertic.mcp.ruleengine.expansion.ExpansionTerm;
import de.mirkosertic.mcp.ruleengine.mcp.ToolResponse;

import java.util.List;

/**
 * Response DTO for the expandQuery tool.
 */
public record ExpandQueryResponse(
        boolean success,
        String originalQuery,
        String expandedQuery,
        List<ExpansionTerm> terms,
        String error
) implements ToolResponse {

    public static ExpandQueryResponse success(final ExpansionResult result) {
        return new ExpandQueryResponse(true, result.originalQuery(), result.expandedQuery(), result.terms(), null);
    }

    public static ExpandQueryResponse error(final String errorMessage) {
        return new ExpandQueryResponse(false, null, null, null, errorMessage);
    }
}
