package app.assistant.mcp.transport;

import org.springframework.lang.Nullable;

import app.assistant.mcp.error.McpClientException;

/**
 * A failure reported by a live server handle, reduced to the facts error classification needs.
 */
public class McpTransportFailureException extends McpClientException {

    private final Integer httpStatus;
    private final Integer rpcErrorCode;
    private final boolean sessionLost;

    public McpTransportFailureException(String message, String action, String serverId,
                                        @Nullable Integer httpStatus, @Nullable Integer rpcErrorCode,
                                        boolean sessionLost, @Nullable Throwable cause) {
        super(message, action, serverId, cause);
        this.httpStatus = httpStatus;
        this.rpcErrorCode = rpcErrorCode;
        this.sessionLost = sessionLost;
    }

    public static McpTransportFailureException httpStatus(String serverId, String action, int status, String message) {
        return new McpTransportFailureException(message, action, serverId, status, null, false, null);
    }

    public static McpTransportFailureException rpcError(String serverId, String action, int code, String message) {
        return new McpTransportFailureException(message, action, serverId, null, code, false, null);
    }

    public static McpTransportFailureException sessionLost(String serverId, String action, String message) {
        return new McpTransportFailureException(message, action, serverId, null, null, true, null);
    }

    @Nullable
    public Integer getHttpStatus() {
        return httpStatus;
    }

    @Nullable
    public Integer getRpcErrorCode() {
        return rpcErrorCode;
    }

    public boolean isSessionLost() {
        return sessionLost;
    }
}
