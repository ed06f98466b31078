package app.assistant.config.store;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import app.assistant.mcp.model.McpServerConfig;

/**
 * The part of the durable configuration the MCP subsystem reads and writes. Other keys in the
 * backing store are preserved untouched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GlobalConfig(List<McpServerConfig> mcpServers) {

    public GlobalConfig {
        mcpServers = mcpServers == null ? List.of() : List.copyOf(mcpServers);
    }

    public static GlobalConfig empty() {
        return new GlobalConfig(List.of());
    }

    public GlobalConfig withMcpServers(List<McpServerConfig> servers) {
        return new GlobalConfig(servers);
    }
}
