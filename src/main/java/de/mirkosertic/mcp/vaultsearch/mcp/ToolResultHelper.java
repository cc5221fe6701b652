package de.mirkosertic.mcp.vaultsearch.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.mirkosertic.mcp.vaultsearch.mcp.dto.ToolResponse;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.List;

/**
 * Wraps response DTOs into MCP tool results as JSON text content.
 */
public final class ToolResultHelper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    /**
     * Serializes the response; a response reporting {@code success=false} is flagged as a tool error.
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
            return "{\"success\":false,\"errorType\":\"INTERNAL\",\"error\":\"JSON serialization error: "
                    + escapeJson(e.getOriginalMessage()) + "\"}";
        }
    }

    private static String escapeJson(final String str) {
        if (str == null) {
            return "";
        }
        return str.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
