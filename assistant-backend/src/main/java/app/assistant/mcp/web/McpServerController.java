package app.assistant.mcp.web;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import app.assistant.mcp.McpManager;
import app.assistant.mcp.model.McpServerConfig;
import app.assistant.mcp.model.McpServerStatus;
import app.assistant.mcp.resource.ResourceDeleteOptions;
import app.assistant.mcp.resource.ResourceDeleteResult;
import app.assistant.mcp.resource.ResourceListResult;
import app.assistant.mcp.resource.ResourceMoveResult;
import app.assistant.mcp.resource.ResourceSearchResult;
import app.assistant.mcp.resource.ResourceWriteResult;
import app.assistant.mcp.tool.McpToolDescriptor;
import app.assistant.mcp.tool.McpToolResult;
import app.assistant.mcp.tool.McpToolSummary;
import app.assistant.mcp.web.dto.AuthorizationUrlResponse;
import app.assistant.mcp.web.dto.ResourceContentResponse;
import app.assistant.mcp.web.dto.ResourceMoveRequest;
import app.assistant.mcp.web.dto.ResourceSearchRequest;
import app.assistant.mcp.web.dto.ResourceWriteRequest;
import app.assistant.mcp.web.dto.ToolCallRequest;
import jakarta.validation.Valid;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/mcp")
@Validated
public class McpServerController {

    private final McpManager manager;

    public McpServerController(McpManager manager) {
        this.manager = manager;
    }

    @GetMapping("/servers")
    public Flux<McpServerStatus> listServers() {
        return Flux.fromIterable(manager.getServerInfos());
    }

    @GetMapping("/servers/{serverId}")
    public Mono<McpServerStatus> getServer(@PathVariable String serverId) {
        return Mono.justOrEmpty(manager.getServerInfo(serverId))
                .switchIfEmpty(Mono.error(() -> notFound(serverId)));
    }

    @PostMapping("/servers")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<McpServerStatus> addServer(@RequestBody McpServerConfig config) {
        return Mono.defer(() -> manager.addServer(config))
                .then(Mono.fromSupplier(() -> manager.getServerInfo(config.id()).orElseThrow(() -> notFound(config.id()))));
    }

    @DeleteMapping("/servers/{serverId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> removeServer(@PathVariable String serverId) {
        return manager.removeServer(serverId);
    }

    @PostMapping("/servers/{serverId}/connect")
    public Mono<McpServerStatus> connect(@PathVariable String serverId) {
        return manager.connectServer(serverId)
                .then(Mono.fromSupplier(() -> manager.getServerInfo(serverId).orElseThrow(() -> notFound(serverId))));
    }

    @GetMapping("/servers/{serverId}/capabilities")
    public Mono<List<String>> getCapabilities(@PathVariable String serverId) {
        return manager.getServerCapabilities(serverId);
    }

    @GetMapping("/servers/{serverId}/resources")
    public Mono<ResourceListResult> listResources(@PathVariable String serverId,
                                                  @RequestParam(required = false) String cursor) {
        if (cursor != null) {
            return manager.listResourcePage(serverId, cursor);
        }
        return manager.listResources(serverId)
                .map(resources -> new ResourceListResult(resources, null, false));
    }

    @GetMapping("/servers/{serverId}/resources/content")
    public Mono<ResourceContentResponse> loadResource(@PathVariable String serverId, @RequestParam String uri) {
        return manager.loadResource(serverId, uri).map(ResourceContentResponse::of);
    }

    @PostMapping("/servers/{serverId}/resources/search")
    public Mono<ResourceSearchResult> searchResources(@PathVariable String serverId,
                                                      @Valid @RequestBody ResourceSearchRequest request) {
        return manager.searchResources(serverId, request.query(), request.options());
    }

    @PutMapping("/servers/{serverId}/resources")
    public Mono<ResourceWriteResult> writeResource(@PathVariable String serverId,
                                                   @Valid @RequestBody ResourceWriteRequest request) {
        return Mono.fromSupplier(request::toContent)
                .onErrorMap(IllegalArgumentException.class,
                        error -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Content is not valid base64", error))
                .flatMap(content -> manager.writeResource(serverId, request.path(), content, request.options()));
    }

    @PostMapping("/servers/{serverId}/resources/move")
    public Mono<ResourceMoveResult> moveResource(@PathVariable String serverId,
                                                 @Valid @RequestBody ResourceMoveRequest request) {
        return manager.moveResource(serverId, request.sourcePath(), request.destinationPath(), request.options());
    }

    @DeleteMapping("/servers/{serverId}/resources")
    public Mono<ResourceDeleteResult> deleteResource(@PathVariable String serverId,
                                                     @RequestParam String path,
                                                     @RequestParam(required = false) Boolean recursive,
                                                     @RequestParam(required = false) Boolean permanent) {
        return manager.deleteResource(serverId, path, new ResourceDeleteOptions(recursive, permanent));
    }

    @GetMapping("/servers/{serverId}/tools")
    public Mono<List<McpToolDescriptor>> listTools(@PathVariable String serverId) {
        return manager.listTools(serverId);
    }

    @PostMapping("/servers/{serverId}/tools/refresh")
    public Mono<List<McpToolDescriptor>> refreshTools(@PathVariable String serverId) {
        return manager.refreshToolsCache(serverId);
    }

    @PostMapping("/servers/{serverId}/tools/{toolName}")
    public Mono<McpToolResult> executeTool(@PathVariable String serverId,
                                           @PathVariable String toolName,
                                           @RequestBody ToolCallRequest request) {
        return manager.executeMCPTool(serverId, toolName, request.arguments(), request.context());
    }

    @GetMapping("/tools")
    public Mono<List<McpToolSummary>> getAllTools() {
        return manager.getAllTools();
    }

    @GetMapping("/servers/{serverId}/oauth/authorize")
    public Mono<AuthorizationUrlResponse> authorize(@PathVariable String serverId) {
        return manager.generateAuthorizationUrl(serverId)
                .map(url -> new AuthorizationUrlResponse(serverId, url));
    }

    @GetMapping("/oauth/callback")
    public Mono<Map<String, String>> oauthCallback(@RequestParam String code, @RequestParam String state) {
        return manager.handleAuthorizationCallback(code, state)
                .map(serverId -> Map.of("serverId", serverId, "status", "authorized"));
    }

    private static ResponseStatusException notFound(String serverId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "MCP server " + serverId + " not found");
    }
}
