package app.assistant.mcp.events;

import java.time.Instant;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import app.assistant.mcp.model.ConnectionState;
import app.assistant.mcp.model.McpServerInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Component
@RequiredArgsConstructor
@Slf4j
public class McpServerStatusPublisher {

    private final ApplicationEventPublisher eventPublisher;

    public void publishStateChange(McpServerInfo server, ConnectionState previousState, String message) {
        McpServerStatusEvent event = McpServerStatusEvent.builder()
                .serverId(server.serverId())
                .serverName(server.config().name())
                .previousState(previousState)
                .state(server.state())
                .message(message)
                .timestamp(Instant.now())
                .build();

        log.debug("MCP server {}: {} -> {} ({})", server.serverId(), previousState, event.getState(), message);
        eventPublisher.publishEvent(event);
    }
}
