package app.assistant.mcp.tool;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.lang.Nullable;

/**
 * Who is calling a tool. Sent to the server as the {@code _meta} object of {@code tools/call}.
 */
public record ToolCallContext(@Nullable String projectId, @Nullable String collaborationId, @Nullable String userId) {

    public static ToolCallContext anonymous() {
        return new ToolCallContext(null, null, null);
    }

    Map<String, Object> toMeta(String serverId) {
        Map<String, Object> meta = new LinkedHashMap<>();
        if (projectId != null) {
            meta.put("projectId", projectId);
        }
        if (collaborationId != null) {
            meta.put("collaborationId", collaborationId);
        }
        meta.put("userId", userId != null ? userId : "unknown");
        meta.put("serverId", serverId);
        return meta;
    }
}
