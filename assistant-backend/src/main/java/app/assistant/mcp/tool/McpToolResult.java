package app.assistant.mcp.tool;

import org.springframework.lang.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Outcome of a tool call as handed to the tool-execution layer.
 *
 * @param content      content parts returned by the server
 * @param toolResponse the server's {@code _meta.toolResponse}, if any
 * @param isError      whether the call failed
 */
public record McpToolResult(JsonNode content, @Nullable String toolResponse, boolean isError) {

    /**
     * A failed call rendered as a single text part naming server, tool and action.
     */
    public static McpToolResult error(String serverId, String toolName, String action, Throwable cause) {
        ArrayNode content = JsonNodeFactory.instance.arrayNode();
        content.addObject()
                .put("type", "text")
                .put("text", "MCP tool " + toolName + " on server " + serverId + " failed during "
                        + action + ": " + cause.getMessage());
        return new McpToolResult(content, null, true);
    }
}
