package app.assistant.mcp.transport;

import org.springframework.lang.Nullable;

import app.assistant.mcp.model.McpServerConfig;
import reactor.core.publisher.Mono;

/**
 * Opens and initializes connections to MCP servers.
 */
public interface McpServerHandleFactory {

    /**
     * Opens a new connection and completes the MCP initialization handshake.
     *
     * @param config      connection recipe
     * @param accessToken bearer token for HTTP servers, or {@code null}
     */
    Mono<McpServerHandle> open(McpServerConfig config, @Nullable String accessToken);
}
