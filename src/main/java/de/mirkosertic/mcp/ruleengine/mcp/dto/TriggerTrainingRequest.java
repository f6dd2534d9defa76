package de.mirkosertic.mcp.ruleengine.mcp.dto;

import de.mirkosertic.mcp.ruleengine.mcp.ToolParam;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the triggerTraining tool.
 */
public record TriggerTrainingRequest(
        @Nullable
        @ToolParam("Train even if no retraining is due. Default is false.")
        Boolean force
) {

    public static TriggerTrainingRequest fromMap(final Map<String, Object> args) {
        return new TriggerTrainingRequest(RequestArguments.bool(args, "force"));
    }

    public boolean effectiveForce() {
        return Boolean.TRUE.equals(force);
    }
}
