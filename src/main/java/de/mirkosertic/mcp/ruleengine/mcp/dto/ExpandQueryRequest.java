package de.mirkosertic.mcp.ruleengine.mcp.dto;

import de.mirkosertic.mcp.ruleengine.mcp.ToolParam;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for the expandQuery tool.
 */
public record ExpandQueryRequest(
        @ToolParam("Analysis query, e.g. 'PT progress toward goals'")
        String query,

        @Nullable
        @ToolParam("Discipline code or name: pt, ot, slp, 'physical therapy', ...")
        String discipline,

        @Nullable
        @ToolParam("Document type: progress_note, evaluation, treatment_plan, discharge_summary")
        String documentType,

        @Nullable
        @ToolParam("Entities extracted from the analysed document, used as additional context terms")
        List<String> contextEntities
) {

    public static ExpandQueryRequest fromMap(final Map<String, Object> args) {
        final String query = RequestArguments.string(args, "query");
        return new ExpandQueryRequest(
                query != null ? query : "",
                RequestArguments.string(args, "discipline"),
                RequestArguments.string(args, "documentType"),
                RequestArguments.strings(args, "contextEntities"));
    }
}
