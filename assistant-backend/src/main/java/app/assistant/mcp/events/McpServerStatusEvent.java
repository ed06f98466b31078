package app.assistant.mcp.events;

import java.time.Instant;

import app.assistant.mcp.model.ConnectionState;
import lombok.Builder;
import lombok.Value;

/**
 * Published whenever a server's connection state changes.
 */
@Value
@Builder
public class McpServerStatusEvent {

    String serverId;
    String serverName;
    ConnectionState previousState;
    ConnectionState state;
    String message;
    Instant timestamp;
}
