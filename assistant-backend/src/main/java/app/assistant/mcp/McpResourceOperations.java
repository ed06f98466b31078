package app.assistant.mcp;

import java.util.List;
import java.util.Map;

import app.assistant.mcp.model.McpServerConfig;
import app.assistant.mcp.resource.ResourceContent;
import app.assistant.mcp.resource.ResourceDeleteOptions;
import app.assistant.mcp.resource.ResourceDeleteResult;
import app.assistant.mcp.resource.ResourceLoadResult;
import app.assistant.mcp.resource.ResourceMetadata;
import app.assistant.mcp.resource.ResourceMoveOptions;
import app.assistant.mcp.resource.ResourceMoveResult;
import app.assistant.mcp.resource.ResourceSearchOptions;
import app.assistant.mcp.resource.ResourceSearchResult;
import app.assistant.mcp.resource.ResourceWriteOptions;
import app.assistant.mcp.resource.ResourceWriteResult;
import app.assistant.mcp.tool.McpToolResult;
import app.assistant.mcp.tool.ToolCallContext;
import reactor.core.publisher.Mono;

/**
 * What the tool-execution layer needs from MCP: server management, resource access and tool calls.
 * <p>
 * Failures are signalled with the {@link app.assistant.mcp.error.McpClientException} hierarchy.
 * Authentication and session failures have already been retried once by the time they reach a
 * caller.
 */
public interface McpResourceOperations {

    /**
     * Registers or replaces a server and tries to connect it.
     *
     * @throws app.assistant.mcp.error.McpConfigurationException synchronously, before any work is
     *                                                          scheduled, if the configuration is invalid
     */
    Mono<Void> addServer(McpServerConfig config);

    Mono<Void> removeServer(String serverId);

    List<String> getServers();

    /**
     * Never fails. Unknown servers report {@code read, list}.
     */
    Mono<List<String>> getServerCapabilities(String serverId);

    /**
     * Resource listing, cached until the next write, move or delete on the same server. A server
     * that does not implement resource listing yields an empty list.
     */
    Mono<List<ResourceMetadata>> listResources(String serverId);

    Mono<ResourceLoadResult> loadResource(String serverId, String uri);

    Mono<ResourceSearchResult> searchResources(String serverId, String query, ResourceSearchOptions options);

    Mono<ResourceWriteResult> writeResource(String serverId, String path, ResourceContent content,
                                            ResourceWriteOptions options);

    Mono<ResourceMoveResult> moveResource(String serverId, String sourcePath, String destinationPath,
                                          ResourceMoveOptions options);

    Mono<ResourceDeleteResult> deleteResource(String serverId, String path, ResourceDeleteOptions options);

    /**
     * Calls a tool. A failed call completes with an error result naming server and tool instead of
     * signalling an error.
     */
    Mono<McpToolResult> executeMCPTool(String serverId, String toolName, Map<String, Object> arguments,
                                       ToolCallContext context);
}
