package de.mirkosertic.mcp.ruleengine.mcp.dto;

import de.mirkosertic.mcp.ruleengine.mcp.ToolParam;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the calibrateConfidence tool.
 */
public record CalibrateConfidenceRequest(
        @Nullable
        @ToolParam("Raw confidence reported by the finding generator, expected within [0, 1]")
        Double rawConfidence,

        @Nullable
        @ToolParam("Raw logit of the finding, used by temperature scaling when given")
        Double rawLogit
) {

    public static CalibrateConfidenceRequest fromMap(final Map<String, Object> args) {
        return new CalibrateConfidenceRequest(
                RequestArguments.number(args, "rawConfidence"),
                RequestArguments.number(args, "rawLogit"));
    }
}
