package app.assistant.mcp;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import app.assistant.mcp.connection.McpConnectionService;
import app.assistant.mcp.model.McpServerConfig;
import app.assistant.mcp.model.McpServerStatus;
import app.assistant.mcp.oauth.McpOAuthService;
import app.assistant.mcp.registry.McpServerConfigValidator;
import app.assistant.mcp.registry.McpServerRegistry;
import app.assistant.mcp.resource.McpResourceService;
import app.assistant.mcp.resource.ResourceContent;
import app.assistant.mcp.resource.ResourceDeleteOptions;
import app.assistant.mcp.resource.ResourceDeleteResult;
import app.assistant.mcp.resource.ResourceListResult;
import app.assistant.mcp.resource.ResourceLoadResult;
import app.assistant.mcp.resource.ResourceMetadata;
import app.assistant.mcp.resource.ResourceMoveOptions;
import app.assistant.mcp.resource.ResourceMoveResult;
import app.assistant.mcp.resource.ResourceSearchOptions;
import app.assistant.mcp.resource.ResourceSearchResult;
import app.assistant.mcp.resource.ResourceWriteOptions;
import app.assistant.mcp.resource.ResourceWriteResult;
import app.assistant.mcp.tool.McpToolDescriptor;
import app.assistant.mcp.tool.McpToolResult;
import app.assistant.mcp.tool.McpToolService;
import app.assistant.mcp.tool.McpToolSummary;
import app.assistant.mcp.tool.ToolCallContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Entry point of the MCP layer. Composes the registry, connection, OAuth, resource and tool
 * services; none of them is reachable through a global.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class McpManager implements McpResourceOperations {

    private final McpServerRegistry registry;
    private final McpServerConfigValidator validator;
    private final McpConnectionService connectionService;
    private final McpOAuthService oauthService;
    private final McpResourceService resourceService;
    private final McpToolService toolService;

    /**
     * Loads persisted servers and connects them. A server that fails to connect stays registered
     * and is retried lazily on its next use.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        initialize().subscribe(
                count -> log.info("Initialized {} MCP servers", count),
                error -> log.error("Failed to load MCP servers: {}", error.getMessage()));
    }

    Mono<Integer> initialize() {
        return registry.loadPersistedServers()
                .flatMapMany(Flux::fromIterable)
                .flatMap(config -> connectQuietly(config.id()).thenReturn(config))
                .count()
                .map(Long::intValue);
    }

    @Override
    public Mono<Void> addServer(McpServerConfig config) {
        validator.validate(config);
        String serverId = config.id();
        return connectionService.disconnect(serverId)
                .then(Mono.defer(() -> registry.addServer(config)))
                .then(Mono.fromRunnable(() -> registry.get(serverId).ifPresent(info -> {
                    info.setTools(null);
                    resourceService.invalidateCache(serverId);
                    connectionService.resetReconnectionState(serverId);
                })))
                .then(Mono.defer(() -> connectQuietly(serverId)))
                .doOnSuccess(ignored -> log.info("Added MCP server {} ({})", serverId, config.transport().wireName()));
    }

    @Override
    public Mono<Void> removeServer(String serverId) {
        return connectionService.disconnect(serverId)
                .then(Mono.defer(() -> registry.removeServer(serverId)));
    }

    @Override
    public List<String> getServers() {
        return registry.getServers();
    }

    @Override
    public Mono<List<String>> getServerCapabilities(String serverId) {
        return resourceService.getServerCapabilities(serverId);
    }

    @Override
    public Mono<List<ResourceMetadata>> listResources(String serverId) {
        return resourceService.listResources(serverId);
    }

    public Mono<ResourceListResult> listResourcePage(String serverId, @Nullable String cursor) {
        return resourceService.listResourcePage(serverId, cursor);
    }

    @Override
    public Mono<ResourceLoadResult> loadResource(String serverId, String uri) {
        return resourceService.loadResource(serverId, uri);
    }

    @Override
    public Mono<ResourceSearchResult> searchResources(String serverId, String query, ResourceSearchOptions options) {
        return resourceService.searchResources(serverId, query, options);
    }

    @Override
    public Mono<ResourceWriteResult> writeResource(String serverId, String path, ResourceContent content,
                                                   ResourceWriteOptions options) {
        return resourceService.writeResource(serverId, path, content, options);
    }

    @Override
    public Mono<ResourceMoveResult> moveResource(String serverId, String sourcePath, String destinationPath,
                                                 ResourceMoveOptions options) {
        return resourceService.moveResource(serverId, sourcePath, destinationPath, options);
    }

    @Override
    public Mono<ResourceDeleteResult> deleteResource(String serverId, String path, ResourceDeleteOptions options) {
        return resourceService.deleteResource(serverId, path, options);
    }

    @Override
    public Mono<McpToolResult> executeMCPTool(String serverId, String toolName, Map<String, Object> arguments,
                                              ToolCallContext context) {
        return toolService.executeMCPTool(serverId, toolName, arguments, context)
                .onErrorResume(error -> Mono.just(McpToolResult.error(serverId, toolName, "execute-tool", error)));
    }

    public Mono<List<McpToolDescriptor>> listTools(String serverId) {
        return toolService.listTools(serverId);
    }

    public Mono<List<McpToolDescriptor>> refreshToolsCache(String serverId) {
        return toolService.refreshToolsCache(serverId);
    }

    public Mono<List<McpToolSummary>> getAllTools() {
        return toolService.getAllTools();
    }

    public Mono<Void> connectServer(String serverId) {
        return connectionService.connectServer(serverId);
    }

    public Optional<McpServerStatus> getServerInfo(String serverId) {
        return registry.get(serverId).map(McpServerStatus::of);
    }

    public List<McpServerStatus> getServerInfos() {
        return registry.all().stream().map(McpServerStatus::of).toList();
    }

    public Optional<McpServerConfig> getMCPServerConfiguration(String serverId) {
        return registry.getMCPServerConfiguration(serverId);
    }

    public List<McpServerConfig> getMCPServerConfigurations() {
        return registry.getMCPServerConfigurations();
    }

    public Mono<String> generateAuthorizationUrl(String serverId) {
        return oauthService.generateAuthorizationUrl(serverId);
    }

    /**
     * Completes an authorization code flow and connects the server it belongs to.
     *
     * @return the id of the authorized server
     */
    public Mono<String> handleAuthorizationCallback(String code, String state) {
        return oauthService.handleAuthorizationCallback(code, state)
                .flatMap(serverId -> connectionService.forceReconnect(serverId).thenReturn(serverId));
    }

    public void cleanup() {
        connectionService.cleanup();
    }

    private Mono<Void> connectQuietly(String serverId) {
        return connectionService.connectServer(serverId)
                .onErrorResume(error -> {
                    log.warn("MCP server {} registered but not connected: {}", serverId, error.getMessage());
                    return Mono.empty();
                });
    }
}
