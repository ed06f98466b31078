package app.assistant.mcp.error;

import org.springframework.lang.Nullable;

/**
 * Invalid or incomplete server configuration. Raised before any connection attempt and never retried.
 */
public class McpConfigurationException extends McpClientException {

    public McpConfigurationException(String message, String action, @Nullable String serverId) {
        super(message, action, serverId);
    }

    public McpConfigurationException(String message, String action, @Nullable String serverId, Throwable cause) {
        super(message, action, serverId, cause);
    }
}
