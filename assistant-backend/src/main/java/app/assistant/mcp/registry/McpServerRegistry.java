package app.assistant.mcp.registry;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import org.springframework.stereotype.Component;

import app.assistant.config.store.GlobalConfig;
import app.assistant.config.store.GlobalConfigStore;
import app.assistant.mcp.error.McpClientException;
import app.assistant.mcp.error.McpExternalServiceException;
import app.assistant.mcp.model.McpServerConfig;
import app.assistant.mcp.model.McpServerInfo;
import app.assistant.security.SecretEncryptor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * In-memory map of server id to {@link McpServerInfo}, mirrored to durable configuration.
 * <p>
 * This is the only component that writes server configurations to the {@link GlobalConfigStore}.
 * Secrets are encrypted on the way out and decrypted on the way in. The registry never opens or
 * closes connections.
 */
@Component
@Slf4j
public class McpServerRegistry {

    private final ConcurrentHashMap<String, McpServerInfo> servers = new ConcurrentHashMap<>();
    private final GlobalConfigStore configStore;
    private final SecretEncryptor encryptor;
    private final McpServerConfigValidator validator;

    public McpServerRegistry(GlobalConfigStore configStore,
                             SecretEncryptor encryptor,
                             McpServerConfigValidator validator) {
        this.configStore = configStore;
        this.encryptor = encryptor;
        this.validator = validator;
    }

    // Plain map operations

    public boolean has(String serverId) {
        return servers.containsKey(serverId);
    }

    public Optional<McpServerInfo> get(String serverId) {
        return Optional.ofNullable(servers.get(serverId));
    }

    public void set(String serverId, McpServerInfo info) {
        servers.put(serverId, info);
    }

    public boolean delete(String serverId) {
        return servers.remove(serverId) != null;
    }

    public void clear() {
        servers.clear();
    }

    public List<McpServerInfo> all() {
        return List.copyOf(servers.values());
    }

    // Configuration lifecycle

    /**
     * Validates and persists a configuration, then installs it in memory. An existing entry for the
     * same id keeps its identity and only has its config replaced.
     *
     * @throws app.assistant.mcp.error.McpConfigurationException synchronously, if the configuration is invalid
     */
    public Mono<Void> addServer(McpServerConfig config) {
        validator.validate(config);
        String serverId = config.id();
        if (has(serverId)) {
            log.warn("MCP server {} already exists, its configuration will be replaced", serverId);
        }
        return persist(serverId, "add-server", servers -> upsert(servers, config))
                .then(Mono.fromRunnable(() -> install(config)));
    }

    public Mono<Void> removeServer(String serverId) {
        return Mono.fromRunnable(() -> servers.remove(serverId))
                .then(persist(serverId, "remove-server",
                        stored -> stored.removeIf(candidate -> candidate.id().equals(serverId))))
                .doOnSuccess(ignored -> log.info("Removed MCP server {}", serverId));
    }

    /**
     * Persists a changed configuration of an already registered server, such as refreshed OAuth
     * tokens. Skips validation so partially discovered OAuth settings can be saved.
     */
    public Mono<Void> saveServerConfig(McpServerConfig config) {
        return persist(config.id(), "save-server-config", stored -> upsert(stored, config))
                .then(Mono.fromRunnable(() -> install(config)));
    }

    /**
     * Reads durable storage and refreshes the in-memory view.
     */
    public Mono<List<McpServerConfig>> loadPersistedServers() {
        return configStore.getGlobalConfig()
                .onErrorMap(error -> wrap("load-servers", null, error))
                .map(globalConfig -> {
                    updateGlobalConfig(globalConfig);
                    return getMCPServerConfigurations();
                });
    }

    /**
     * Refreshes the cached view after an external change to durable storage. Entries that are no
     * longer present are left in place; removing them is a {@link #removeServer(String)} call.
     */
    public void updateGlobalConfig(GlobalConfig globalConfig) {
        for (McpServerConfig stored : globalConfig.mcpServers()) {
            try {
                install(McpConfigSecrets.map(stored, encryptor::decrypt));
            } catch (RuntimeException ex) {
                log.error("Skipping persisted MCP server {}: {}", stored.id(), ex.getMessage());
            }
        }
    }

    // Read accessors

    public List<String> getServers() {
        return List.copyOf(servers.keySet());
    }

    public Optional<McpServerConfig> getMCPServerConfiguration(String serverId) {
        return get(serverId).map(McpServerInfo::config);
    }

    public Optional<List<String>> getServerCapabilities(String serverId) {
        return get(serverId).map(McpServerInfo::capabilities);
    }

    public List<McpServerConfig> getMCPServerConfigurations() {
        return servers.values().stream().map(McpServerInfo::config).toList();
    }

    private void install(McpServerConfig config) {
        servers.compute(config.id(), (id, existing) -> {
            if (existing == null) {
                return new McpServerInfo(config);
            }
            existing.updateConfig(config);
            return existing;
        });
    }

    private void upsert(List<McpServerConfig> stored, McpServerConfig config) {
        McpServerConfig encrypted = McpConfigSecrets.map(config, encryptor::encrypt);
        for (int i = 0; i < stored.size(); i++) {
            if (stored.get(i).id().equals(config.id())) {
                stored.set(i, encrypted);
                return;
            }
        }
        stored.add(encrypted);
    }

    private Mono<Void> persist(String serverId, String action,
                               Consumer<List<McpServerConfig>> change) {
        return configStore.updateMcpServers(stored -> {
                    change.accept(stored);
                    return stored;
                })
                .onErrorMap(error -> wrap(action, serverId, error));
    }

    private static McpClientException wrap(String action, String serverId, Throwable error) {
        if (error instanceof McpClientException mcpError) {
            return mcpError;
        }
        log.error("Failed to {} for MCP server {}: {}", action, serverId, error.getMessage());
        return new McpExternalServiceException(
                "Failed to " + action.replace('-', ' ') + ": " + error.getMessage(), action, serverId, error);
    }
}
