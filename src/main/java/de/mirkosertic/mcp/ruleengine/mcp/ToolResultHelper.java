package de.mirkosertic.mcp.ruleengine.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns tool response records into MCP results carrying the response as JSON text.
 */
public final class ToolResultHelper {

    private static final Logger logger = LoggerFactory.getLogger(ToolResultHelper.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    /**
     * @return a result flagged as error when the response reports {@code success=false}
     */
    public static McpSchema.CallToolResult createResult(final ToolResponse response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(!response.success())
                .build();
    }

    public static String toJson(final Object value) {
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            logger.error("Cannot serialize tool response {}", value.getClass().getSimpleName(), e);
            return errorJson("JSON serialization error: " + e.getOriginalMessage());
        }
    }

    private static String errorJson(final String errorMessage) {
        final ObjectNode node = OBJECT_MAPPER.createObjectNode();
        node.put("success", false);
        node.put("error", errorMessage != null ? errorMessage : "");
        return node.toString();
    }
}
