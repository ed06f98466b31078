package app.assistant.config.store;

import java.util.List;
import java.util.function.UnaryOperator;

import app.assistant.mcp.model.McpServerConfig;
import reactor.core.publisher.Mono;

/**
 * Durable key/value configuration storage.
 */
public interface GlobalConfigStore {

    Mono<GlobalConfig> getGlobalConfig();

    Mono<Void> updateGlobalConfig(GlobalConfig config);

    /**
     * Reads the stored server list, applies {@code change} and writes the result back as one
     * step. Concurrent calls on the same store never overwrite each other's changes.
     */
    Mono<Void> updateMcpServers(UnaryOperator<List<McpServerConfig>> change);

    /**
     * Sets a single value addressed by a dotted key such as {@code api.logLevel}, creating
     * intermediate objects as needed.
     */
    Mono<Void> setConfigValue(String key, Object value);
}
