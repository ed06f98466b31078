package app.assistant.mcp.web.dto;

import java.util.Map;

import app.assistant.mcp.tool.ToolCallContext;

public record ToolCallRequest(
        Map<String, Object> arguments,
        String projectId,
        String collaborationId,
        String userId
) {

    public ToolCallContext context() {
        return new ToolCallContext(projectId, collaborationId, userId);
    }
}
