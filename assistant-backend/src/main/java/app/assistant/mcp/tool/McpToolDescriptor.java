package app.assistant.mcp.tool;

import java.util.ArrayList;
import java.util.List;

import org.springframework.lang.Nullable;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool advertised by an MCP server.
 */
public record McpToolDescriptor(String name, @Nullable String description, @Nullable JsonNode inputSchema) {

    /**
     * Reads the {@code tools} array of a {@code tools/list} result.
     */
    public static List<McpToolDescriptor> listFrom(JsonNode listToolsResult) {
        List<McpToolDescriptor> tools = new ArrayList<>();
        for (JsonNode tool : listToolsResult.path("tools")) {
            String name = tool.path("name").asText(null);
            if (name == null || name.isBlank()) {
                continue;
            }
            tools.add(new McpToolDescriptor(name,
                    tool.hasNonNull("description") ? tool.get("description").asText() : null,
                    tool.get("inputSchema")));
        }
        return tools;
    }
}
