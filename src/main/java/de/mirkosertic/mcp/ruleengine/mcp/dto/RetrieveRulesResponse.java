package de.mirkosertic.mcp.ruleengine.mcp.dto;

import de.mirkosertic.mcp.ruleengine.RetrievalResult;
import de.mirkosertic.mcp.ruleengine.expansion.ExpansionTerm;
import de.mirkosertic.mcp.ruleengine.mcp.ToolResponse;
import de.mirkosertic.mcp.ruleengine.retrieval.RetrievedRule;

import java.util.List;

/**
 * Response DTO for the retrieveRules tool.
 */
public record RetrieveRulesResponse(
        boolean success,
        String expandedQuery,
        List<ExpansionTerm> expansionTerms,
        String discipline,
        List<RetrievedRule> rules,
        Long searchTimeMs,
        String error
) implements ToolResponse {

    public static RetrieveRulesResponse success(final RetrievalResult result, final long searchTimeMs) {
        return new RetrieveRulesResponse(true, result.expansion().expandedQuery(), result.expansion().terms(),
                result.discipline(), result.rules(), searchTimeMs, null);
    }

    public static RetrieveRulesResponse error(final String errorMessage) {
        return new RetrieveRulesResponse(false, null, null, null, null, null, errorMessage);
    }
}
