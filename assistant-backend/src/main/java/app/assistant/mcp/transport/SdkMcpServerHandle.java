package app.assistant.mcp.transport;

import java.util.Map;

import org.springframework.lang.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.modelcontextprotocol.client.McpAsyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * {@link McpServerHandle} backed by an initialized {@link McpAsyncClient}.
 */
final class SdkMcpServerHandle implements McpServerHandle {

    private final String serverId;
    private final McpAsyncClient client;
    private final ObjectMapper objectMapper;
    private final boolean supportsResources;

    SdkMcpServerHandle(String serverId, McpAsyncClient client, ObjectMapper objectMapper,
                       boolean supportsResources) {
        this.serverId = serverId;
        this.client = client;
        this.objectMapper = objectMapper;
        this.supportsResources = supportsResources;
    }

    @Override
    public Mono<JsonNode> listResources(@Nullable String cursor) {
        Mono<McpSchema.ListResourcesResult> call = cursor == null
                ? client.listResources()
                : client.listResources(cursor);
        return toJson(call, "list-resources");
    }

    @Override
    public Mono<JsonNode> readResource(String uri) {
        return toJson(client.readResource(new McpSchema.ReadResourceRequest(uri)), "load-resource");
    }

    @Override
    public Mono<JsonNode> listTools() {
        return toJson(client.listTools(), "list-tools");
    }

    @Override
    public Mono<JsonNode> callTool(String name, Map<String, Object> arguments, Map<String, Object> meta) {
        McpSchema.CallToolRequest request = new McpSchema.CallToolRequest(
                name, arguments, meta.isEmpty() ? null : meta);
        return toJson(client.callTool(request), "call-tool:" + name);
    }

    @Override
    public Mono<Void> ping() {
        return client.ping()
                .onErrorMap(error -> McpFailureTranslator.translate(serverId, "ping", error))
                .then();
    }

    @Override
    public boolean supportsResources() {
        return supportsResources;
    }

    @Override
    public Mono<Void> close() {
        return client.closeGracefully();
    }

    private <T> Mono<JsonNode> toJson(Mono<T> call, String action) {
        return call
                .map(result -> objectMapper.<JsonNode>valueToTree(result))
                .onErrorMap(error -> McpFailureTranslator.translate(serverId, action, error));
    }
}
