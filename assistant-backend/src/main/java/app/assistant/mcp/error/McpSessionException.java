package app.assistant.mcp.error;

import org.springframework.lang.Nullable;

/**
 * The server session is gone and a reconnect did not restore it.
 */
public class McpSessionException extends McpClientException {

    public McpSessionException(String message, String action, @Nullable String serverId) {
        super(message, action, serverId);
    }

    public McpSessionException(String message, String action, @Nullable String serverId, Throwable cause) {
        super(message, action, serverId, cause);
    }
}
