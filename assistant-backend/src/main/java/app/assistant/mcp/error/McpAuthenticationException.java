package app.assistant.mcp.error;

import org.springframework.lang.Nullable;

/**
 * The server rejected our credentials and a token refresh did not help; the user has to re-authenticate.
 */
public class McpAuthenticationException extends McpClientException {

    public McpAuthenticationException(String message, String action, @Nullable String serverId) {
        super(message, action, serverId);
    }

    public McpAuthenticationException(String message, String action, @Nullable String serverId, Throwable cause) {
        super(message, action, serverId, cause);
    }
}
