package app.assistant.mcp.model;

/**
 * Per-server connection state.
 * <pre>
 * DISCONNECTED → CONNECTING → CONNECTED
 * CONNECTED → AUTH_EXPIRED → CONNECTED | DISCONNECTED
 * CONNECTED → SESSION_EXPIRED → CONNECTED | DISCONNECTED
 * </pre>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    AUTH_EXPIRED,
    SESSION_EXPIRED
}
