package app.assistant.mcp.model;

import java.time.Instant;
import java.util.List;

import org.springframework.lang.Nullable;

/**
 * Point-in-time view of one registered server.
 */
public record McpServerStatus(
        String serverId,
        String name,
        McpTransportKind transport,
        ConnectionState state,
        List<String> capabilities,
        Instant lastActivity,
        @Nullable String lastError,
        @Nullable String pendingAuthUrl
) {

    public static McpServerStatus of(McpServerInfo info) {
        McpServerConfig config = info.config();
        return new McpServerStatus(info.serverId(), config.name(), config.transport(), info.state(),
                info.capabilities(), info.lastActivity(), info.lastError(), info.pendingAuthUrl());
    }
}
