package app.assistant.mcp.error;

import org.springframework.lang.Nullable;

/**
 * The server does not implement the requested method.
 */
public class McpUnsupportedOperationException extends McpClientException {

    public McpUnsupportedOperationException(String message, String action, @Nullable String serverId) {
        super(message, action, serverId);
    }

    public McpUnsupportedOperationException(String message, String action, @Nullable String serverId, Throwable cause) {
        super(message, action, serverId, cause);
    }
}
