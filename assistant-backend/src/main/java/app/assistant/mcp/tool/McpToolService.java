package app.assistant.mcp.tool;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import app.assistant.mcp.connection.McpConnectionService;
import app.assistant.mcp.error.McpClientException;
import app.assistant.mcp.error.McpExternalServiceException;
import app.assistant.mcp.model.McpServerInfo;
import app.assistant.mcp.registry.McpServerRegistry;
import app.assistant.mcp.resource.McpResourceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Tool listing and invocation. Calls share the recovery policy of resource operations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class McpToolService {

    private final McpServerRegistry registry;
    private final McpConnectionService connectionService;
    private final McpResourceService resourceService;

    /**
     * Tools of one server, cached on the server entry after the first successful listing.
     */
    public Mono<List<McpToolDescriptor>> listTools(String serverId) {
        return resourceService.withAvailableServer(serverId, "list-tools", info -> {
            if (info.tools() != null) {
                log.debug("Using cached tools for MCP server {}", serverId);
                return Mono.just(info.tools());
            }
            return fetchTools(info);
        });
    }

    public Mono<List<McpToolDescriptor>> refreshToolsCache(String serverId) {
        return resourceService.withAvailableServer(serverId, "refresh-tools-cache", this::fetchTools)
                .doOnNext(tools -> log.debug("Refreshed tools cache for MCP server {} ({} tools)",
                        serverId, tools.size()));
    }

    /**
     * Every tool of every registered server. Servers whose tools cannot be listed are skipped.
     */
    public Mono<List<McpToolSummary>> getAllTools() {
        return Flux.fromIterable(registry.all())
                .concatMap(info -> listTools(info.serverId())
                        .flatMapMany(Flux::fromIterable)
                        .map(tool -> summary(info, tool))
                        .onErrorResume(error -> {
                            log.warn("Skipping tools of MCP server {}: {}", info.serverId(), error.getMessage());
                            return Flux.empty();
                        }))
                .collectList();
    }

    /**
     * Calls a tool with one recovery attempt. Failures propagate as typed exceptions; callers
     * that need a result payload instead use {@link McpToolResult#error}.
     */
    public Mono<McpToolResult> executeMCPTool(String serverId, String toolName, Map<String, Object> arguments,
                                              ToolCallContext context) {
        ToolCallContext caller = context != null ? context : ToolCallContext.anonymous();
        Map<String, Object> meta = caller.toMeta(serverId);
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        return resourceService.withAvailableServer(serverId, "execute-tool", info -> {
            log.info("Executing MCP tool {} on server {}", toolName, serverId);
            return resourceService.executeWithRecovery(serverId, "execute-tool",
                    handle -> handle.callTool(toolName, args, meta));
        }).map(result -> {
            connectionService.recordActivity(serverId);
            return toResult(result);
        }).doOnError(error -> log.error("MCP tool {} on server {} failed: {}", toolName, serverId, error.getMessage()));
    }

    private Mono<List<McpToolDescriptor>> fetchTools(McpServerInfo info) {
        return resourceService.executeWithRecovery(info.serverId(), "list-tools", handle -> handle.listTools())
                .map(McpToolDescriptor::listFrom)
                .doOnNext(tools -> {
                    info.setTools(tools);
                    connectionService.recordActivity(info.serverId());
                })
                .onErrorMap(error -> !(error instanceof McpClientException),
                        error -> new McpExternalServiceException(
                                "Failed to list MCP tools: " + error.getMessage(), "list-tools", info.serverId(), error));
    }

    private static McpToolSummary summary(McpServerInfo info, McpToolDescriptor tool) {
        String serverName = info.config().name() != null ? info.config().name() : info.serverId();
        String description = tool.description() != null ? tool.description() : "MCP Tool " + tool.name();
        return new McpToolSummary(tool.name() + "_" + info.serverId(), description, info.serverId(), serverName);
    }

    private static McpToolResult toResult(JsonNode result) {
        JsonNode content = result.has("content") ? result.get("content") : JsonNodeFactory.instance.arrayNode();
        JsonNode toolResponse = result.path("_meta").path("toolResponse");
        return new McpToolResult(content,
                toolResponse.isMissingNode() || toolResponse.isNull() ? null : toolResponse.asText(),
                result.path("isError").asBoolean(false));
    }
}
