package app.assistant.mcp.tool;

/**
 * A tool offered across all servers, with its name qualified as {@code tool_serverId}.
 */
public record McpToolSummary(String name, String description, String serverId, String serverName) {
}
