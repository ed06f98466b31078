package app.assistant.mcp.error;

import org.springframework.lang.Nullable;

/**
 * Base class of all failures raised by the MCP subsystem.
 * <p>
 * Every instance names the action that failed and, where one is involved, the server, so callers
 * can build a user-facing message without knowing about transports.
 */
public class McpClientException extends RuntimeException {

    public static final String SERVICE = "mcp";

    private final String action;
    private final String serverId;

    public McpClientException(String message, String action, @Nullable String serverId) {
        super(message);
        this.action = action;
        this.serverId = serverId;
    }

    public McpClientException(String message, String action, @Nullable String serverId, Throwable cause) {
        super(message, cause);
        this.action = action;
        this.serverId = serverId;
    }

    public String getService() {
        return SERVICE;
    }

    public String getAction() {
        return action;
    }

    @Nullable
    public String getServerId() {
        return serverId;
    }
}
