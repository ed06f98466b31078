package app.assistant.mcp.resource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;

import app.assistant.mcp.config.McpProperties;
import app.assistant.mcp.connection.McpConnectionService;
import app.assistant.mcp.error.McpAuthenticationException;
import app.assistant.mcp.error.McpConnectionException;
import app.assistant.mcp.error.McpExternalServiceException;
import app.assistant.mcp.error.McpSessionException;
import app.assistant.mcp.error.McpUnsupportedOperationException;
import app.assistant.mcp.model.McpServerInfo;
import app.assistant.mcp.oauth.McpOAuthService;
import app.assistant.mcp.registry.McpServerRegistry;
import app.assistant.mcp.tool.McpToolDescriptor;
import app.assistant.mcp.transport.McpServerHandle;
import app.assistant.mcp.transport.McpTransportFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Resource operations against connected MCP servers.
 * <p>
 * Every call goes through {@link #executeWithRecovery}: an authentication failure triggers one
 * token refresh, a session failure one reconnect, and in both cases the operation is retried
 * exactly once. Listing results are cached on the server entry until a write, move or delete
 * on that server succeeds.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class McpResourceService {

    static final String SEARCH_TOOL = "search_resources";
    static final String WRITE_TOOL = "write_resource";
    static final String MOVE_TOOL = "move_resource";
    static final String DELETE_TOOL = "delete_resource";

    private static final int METHOD_NOT_FOUND = -32601;

    private static final Map<String, String> TOOL_CAPABILITIES = Map.of(
            WRITE_TOOL, "write",
            SEARCH_TOOL, "search",
            MOVE_TOOL, "move",
            DELETE_TOOL, "delete");

    private final McpServerRegistry registry;
    private final McpConnectionService connectionService;
    private final McpOAuthService oauthService;
    private final McpResourceAdapter adapter;
    private final McpProperties properties;

    public Mono<List<ResourceMetadata>> listResources(String serverId) {
        return withAvailableServer(serverId, "list-resources", info -> {
            List<ResourceMetadata> cached = info.resources();
            if (cached != null && !cached.isEmpty()) {
                log.debug("Serving {} cached resources for MCP server {}", cached.size(), serverId);
                return Mono.just(cached);
            }
            McpServerHandle handle = info.handle();
            if (handle != null && !handle.supportsResources()) {
                log.debug("MCP server {} does not advertise resources", serverId);
                return Mono.just(List.<ResourceMetadata>of());
            }
            return executeWithRecovery(serverId, "list-resources", current -> current.listResources(null))
                    .map(result -> adapter.toListResult(result).resources())
                    .doOnNext(resources -> {
                        info.setResources(resources);
                        connectionService.recordActivity(serverId);
                    })
                    .onErrorResume(McpResourceService::isMethodNotFound, error -> {
                        log.info("MCP server {} does not implement resource listing", serverId);
                        return Mono.just(List.of());
                    });
        });
    }

    /**
     * One page of a listing, bypassing the cache.
     */
    public Mono<ResourceListResult> listResourcePage(String serverId, @Nullable String cursor) {
        return withAvailableServer(serverId, "list-resources", info ->
                executeWithRecovery(serverId, "list-resources", handle -> handle.listResources(cursor))
                        .map(adapter::toListResult)
                        .doOnNext(page -> connectionService.recordActivity(serverId))
                        .onErrorResume(McpResourceService::isMethodNotFound,
                                error -> Mono.just(new ResourceListResult(List.of(), null, false))));
    }

    public Mono<ResourceLoadResult> loadResource(String serverId, String uri) {
        return withAvailableServer(serverId, "load-resource", info ->
                executeWithRecovery(serverId, "load-resource", handle -> handle.readResource(uri))
                        .map(result -> adapter.toLoadResult(result, serverId, uri))
                        .doOnNext(result -> connectionService.recordActivity(serverId)));
    }

    public Mono<ResourceSearchResult> searchResources(String serverId, String query, ResourceSearchOptions options) {
        ResourceSearchOptions opts = options != null ? options : ResourceSearchOptions.defaults();
        Map<String, Object> arguments = arguments(
                "query", query,
                "path", opts.path(),
                "caseSensitive", opts.caseSensitive(),
                "limit", opts.limit(),
                "includeTypes", opts.includeTypes(),
                "filePattern", opts.filePattern());
        return callResourceTool(serverId, "search-resources", SEARCH_TOOL, arguments)
                .map(adapter::toSearchResult);
    }

    public Mono<ResourceWriteResult> writeResource(String serverId, String path, ResourceContent content,
                                                   ResourceWriteOptions options) {
        ResourceWriteOptions opts = options != null ? options : ResourceWriteOptions.defaults();
        Map<String, Object> arguments = arguments(
                "path", path,
                "content", content.toWireValue(),
                "contentIsBinary", content.isBinary(),
                "createMissingDirectories", opts.createMissingDirectories(),
                "overwrite", opts.overwrite(),
                "encoding", opts.encoding(),
                "contentType", opts.contentType(),
                "metadata", opts.metadata());
        return callResourceTool(serverId, "write-resource", WRITE_TOOL, arguments)
                .map(payload -> adapter.toWriteResult(payload, path, content, opts))
                .doOnNext(result -> invalidateCache(serverId));
    }

    public Mono<ResourceMoveResult> moveResource(String serverId, String sourcePath, String destinationPath,
                                                 ResourceMoveOptions options) {
        ResourceMoveOptions opts = options != null ? options : ResourceMoveOptions.defaults();
        Map<String, Object> arguments = arguments(
                "sourcePath", sourcePath,
                "destinationPath", destinationPath,
                "createMissingDirectories", opts.createMissingDirectories(),
                "overwrite", opts.overwrite());
        return callResourceTool(serverId, "move-resource", MOVE_TOOL, arguments)
                .map(payload -> adapter.toMoveResult(payload, sourcePath, destinationPath))
                .doOnNext(result -> invalidateCache(serverId));
    }

    public Mono<ResourceDeleteResult> deleteResource(String serverId, String path, ResourceDeleteOptions options) {
        ResourceDeleteOptions opts = options != null ? options : ResourceDeleteOptions.defaults();
        Map<String, Object> arguments = arguments(
                "path", path,
                "recursive", opts.recursive(),
                "permanent", opts.permanent());
        return callResourceTool(serverId, "delete-resource", DELETE_TOOL, arguments)
                .map(payload -> adapter.toDeleteResult(payload, path))
                .doOnNext(result -> invalidateCache(serverId));
    }

    /**
     * Capability tags of a server: {@code read} and {@code list}, plus one tag per resource tool
     * the server offers. Falls back to {@code read, list} on any failure or for unknown servers.
     */
    public Mono<List<String>> getServerCapabilities(String serverId) {
        return Mono.defer(() -> {
            McpServerInfo info = registry.get(serverId).orElse(null);
            if (info == null) {
                return Mono.just(McpServerInfo.DEFAULT_CAPABILITIES);
            }
            return withAvailableServer(serverId, "get-capabilities", available -> tools(available))
                    .map(tools -> {
                        List<String> capabilities = deriveCapabilities(tools);
                        info.setCapabilities(capabilities);
                        return capabilities;
                    })
                    .onErrorResume(error -> {
                        log.debug("Capability lookup for MCP server {} failed, using defaults: {}",
                                serverId, error.getMessage());
                        return Mono.just(McpServerInfo.DEFAULT_CAPABILITIES);
                    });
        });
    }

    public void invalidateCache(String serverId) {
        registry.get(serverId).ifPresent(info -> {
            if (info.resources() != null) {
                log.debug("Invalidating resource cache of MCP server {}", serverId);
            }
            info.setResources(null);
        });
    }

    /**
     * Runs {@code operation} against the server's current handle, recovering once from
     * authentication and session failures. Other failures propagate unchanged.
     */
    public <T> Mono<T> executeWithRecovery(String serverId, String action,
                                           Function<McpServerHandle, Mono<T>> operation) {
        return invoke(serverId, action, operation)
                .onErrorResume(error -> recover(serverId, action, operation, error));
    }

    Mono<List<McpToolDescriptor>> tools(McpServerInfo info) {
        List<McpToolDescriptor> cached = info.tools();
        if (cached != null) {
            return Mono.just(cached);
        }
        return executeWithRecovery(info.serverId(), "list-tools", McpServerHandle::listTools)
                .map(McpToolDescriptor::listFrom)
                .doOnNext(info::setTools);
    }

    /**
     * Resolves availability first; a resource operation is never attempted against an
     * unavailable server.
     */
    public <T> Mono<T> withAvailableServer(String serverId, String action, Function<McpServerInfo, Mono<T>> operation) {
        return connectionService.isServerAvailable(serverId)
                .flatMap(available -> {
                    McpServerInfo info = registry.get(serverId).orElse(null);
                    if (!available || info == null) {
                        return Mono.error(new McpConnectionException(
                                "MCP server " + serverId + " is not available", action, serverId));
                    }
                    return operation.apply(info);
                });
    }

    private Mono<JsonNode> callResourceTool(String serverId, String action, String tool, Map<String, Object> arguments) {
        return withAvailableServer(serverId, action, info ->
                executeWithRecovery(serverId, action, handle -> handle.callTool(tool, arguments, Map.of())))
                .map(result -> adapter.toolPayload(result, serverId, tool))
                .doOnNext(payload -> connectionService.recordActivity(serverId))
                .onErrorMap(McpResourceService::isMethodNotFound, error -> new McpUnsupportedOperationException(
                        "MCP server " + serverId + " does not support " + tool, action, serverId, error));
    }

    private <T> Mono<T> invoke(String serverId, String action, Function<McpServerHandle, Mono<T>> operation) {
        return Mono.defer(() -> {
            McpServerHandle handle = registry.get(serverId).map(McpServerInfo::handle).orElse(null);
            if (handle == null) {
                return Mono.error(new McpConnectionException(
                        "MCP server " + serverId + " is not connected", action, serverId));
            }
            return operation.apply(handle)
                    .timeout(properties.requestTimeout())
                    .onErrorMap(TimeoutException.class, timeout -> new McpExternalServiceException(
                            "MCP server " + serverId + " did not answer " + action + " within "
                                    + properties.requestTimeout(), action, serverId, timeout));
        });
    }

    private <T> Mono<T> recover(String serverId, String action, Function<McpServerHandle, Mono<T>> operation,
                                Throwable error) {
        if (connectionService.isAuthError(error)) {
            log.warn("Authentication error during {} on MCP server {}, refreshing token: {}",
                    action, serverId, error.getMessage());
            connectionService.markAuthExpired(serverId);
            return oauthService.refreshAccessToken(serverId)
                    .onErrorResume(refreshError -> connectionService.markRecoveryFailed(serverId, refreshError)
                            .then(Mono.error(new McpAuthenticationException(
                                    "Authentication failed for MCP server " + serverId + ". Please re-authenticate.",
                                    action, serverId, refreshError))))
                    .then(connectionService.forceReconnect(serverId))
                    .then(invoke(serverId, action, operation)
                            .onErrorMap(retryError -> connectionService.isAuthError(retryError)
                                            && !(retryError instanceof McpAuthenticationException),
                                    retryError -> new McpAuthenticationException(
                                            "MCP server " + serverId + " still rejects our credentials. Please re-authenticate.",
                                            action, serverId, retryError)));
        }
        if (connectionService.isSessionError(error)) {
            log.warn("Session error during {} on MCP server {}, reconnecting: {}", action, serverId, error.getMessage());
            connectionService.markSessionExpired(serverId);
            return connectionService.forceReconnect(serverId)
                    .onErrorResume(reconnectError -> connectionService.markRecoveryFailed(serverId, reconnectError)
                            .then(Mono.error(new McpExternalServiceException(
                                    "Failed to reconnect to MCP server " + serverId, action, serverId, reconnectError))))
                    .then(Mono.fromRunnable(() -> invalidateCache(serverId)))
                    .then(invoke(serverId, action, operation)
                            .onErrorMap(connectionService::isSessionError, retryError -> new McpSessionException(
                                    "Session with MCP server " + serverId + " failed again after reconnecting",
                                    action, serverId, retryError)));
        }
        return Mono.error(error);
    }

    private static List<String> deriveCapabilities(List<McpToolDescriptor> tools) {
        List<String> capabilities = new ArrayList<>(McpServerInfo.DEFAULT_CAPABILITIES);
        Set<String> names = new HashSet<>();
        tools.forEach(tool -> names.add(tool.name()));
        TOOL_CAPABILITIES.forEach((tool, capability) -> {
            if (names.contains(tool)) {
                capabilities.add(capability);
            }
        });
        capabilities.sort(null);
        return List.copyOf(capabilities);
    }

    static boolean isMethodNotFound(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof McpTransportFailureException failure
                    && failure.getRpcErrorCode() != null && failure.getRpcErrorCode() == METHOD_NOT_FOUND) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("method not found")) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, Object> arguments(Object... keysAndValues) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                arguments.put((String) keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return arguments;
    }
}
