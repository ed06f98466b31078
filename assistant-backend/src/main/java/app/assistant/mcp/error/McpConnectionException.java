package app.assistant.mcp.error;

import org.springframework.lang.Nullable;

/**
 * The transport to a server could not be established.
 */
public class McpConnectionException extends McpClientException {

    public McpConnectionException(String message, String action, @Nullable String serverId) {
        super(message, action, serverId);
    }

    public McpConnectionException(String message, String action, @Nullable String serverId, Throwable cause) {
        super(message, action, serverId, cause);
    }
}
