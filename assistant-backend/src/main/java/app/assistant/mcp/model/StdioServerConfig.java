package app.assistant.mcp.model;

import java.util.List;
import java.util.Map;

import org.springframework.lang.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;

/**
 * Server reached by spawning a local process and speaking MCP over its stdin/stdout.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StdioServerConfig(
        String id,
        String name,
        @Nullable String description,
        String command,
        List<String> args,
        Map<String, String> env,
        @Nullable Boolean healthCheckEnabled,
        @Nullable Integer healthCheckIdleMinutes) implements McpServerConfig {

    public StdioServerConfig {
        args = args == null ? List.of() : List.copyOf(args);
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    @Override
    @JsonIgnore
    public McpTransportKind transport() {
        return McpTransportKind.STDIO;
    }
}
