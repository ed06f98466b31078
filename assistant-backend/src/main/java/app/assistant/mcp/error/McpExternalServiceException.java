package app.assistant.mcp.error;

import org.springframework.lang.Nullable;

/**
 * Catch-all for failures of the MCP subsystem or its collaborators, such as configuration persistence.
 */
public class McpExternalServiceException extends McpClientException {

    public McpExternalServiceException(String message, String action, @Nullable String serverId) {
        super(message, action, serverId);
    }

    public McpExternalServiceException(String message, String action, @Nullable String serverId, Throwable cause) {
        super(message, action, serverId, cause);
    }
}
