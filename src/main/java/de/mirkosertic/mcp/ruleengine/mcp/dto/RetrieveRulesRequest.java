package de.mirkosertic.mcp.ruleengine.mcp.dto;

import de.mirkosertic.mcp.ruleengine.mcp.ToolParam;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for the retrieveRules tool.
 */
public record RetrieveRulesRequest(
        @ToolParam("Analysis query; it is expanded with domain vocabulary before searching")
        String query,

        @Nullable
        @ToolParam("Only return rules of this discipline (pt, ot, slp or a name like 'physical therapy')")
        String discipline,

        @Nullable
        @ToolParam("Only return rules applicable to this document type")
        String documentType,

        @Nullable
        @ToolParam("Entities extracted from the analysed document")
        List<String> contextEntities,

        @Nullable
        @ToolParam(value = "Maximum number of rules, 10 when omitted", minimum = 1, maximum = RetrieveRulesRequest.MAX_TOP_K)
        Integer topK
) {

    public static final int MAX_TOP_K = 50;

    public static RetrieveRulesRequest fromMap(final Map<String, Object> args) {
        final String query = RequestArguments.string(args, "query");
        return new RetrieveRulesRequest(
                query != null ? query : "",
                RequestArguments.string(args, "discipline"),
                RequestArguments.string(args, "documentType"),
                RequestArguments.strings(args, "contextEntities"),
                RequestArguments.integer(args, "topK"));
    }

    public int effectiveTopK(final int defaultTopK) {
        return topK != null && topK > 0 ? Math.min(topK, MAX_TOP_K) : defaultTopK;
    }
}
