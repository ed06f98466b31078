package app.assistant.mcp.transport;

import java.util.Map;

import org.springframework.lang.Nullable;

import com.fasterxml.jackson.databind.JsonNode;

import reactor.core.publisher.Mono;

/**
 * Live, initialized connection to one MCP server.
 * <p>
 * Results are returned in their wire shape; turning them into canonical envelopes is the job of
 * {@link app.assistant.mcp.resource.McpResourceAdapter}. Failures are signalled as
 * {@link McpTransportFailureException}.
 */
public interface McpServerHandle {

    /**
     * {@code resources/list}, one page.
     */
    Mono<JsonNode> listResources(@Nullable String cursor);

    /**
     * {@code resources/read}.
     */
    Mono<JsonNode> readResource(String uri);

    Mono<JsonNode> listTools();

    /**
     * {@code tools/call}. {@code meta} is sent as the request's {@code _meta} object.
     */
    Mono<JsonNode> callTool(String name, Map<String, Object> arguments, Map<String, Object> meta);

    Mono<Void> ping();

    /**
     * Whether the server advertised the resources capability during initialization.
     */
    boolean supportsResources();

    /**
     * Closes the session. For stdio servers this terminates the child process.
     */
    Mono<Void> close();
}
