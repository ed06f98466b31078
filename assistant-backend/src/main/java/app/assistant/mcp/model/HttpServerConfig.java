package app.assistant.mcp.model;

import org.springframework.lang.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.With;

/**
 * Remote server reached over streamable HTTP, optionally protected by OAuth.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HttpServerConfig(
        String id,
        String name,
        @Nullable String description,
        String url,
        @With @Nullable McpOAuthConfig oauth,
        @Nullable Boolean healthCheckEnabled,
        @Nullable Integer healthCheckIdleMinutes) implements McpServerConfig {

    @Override
    @JsonIgnore
    public McpTransportKind transport() {
        return McpTransportKind.HTTP;
    }

    @JsonIgnore
    public boolean hasOAuth() {
        return oauth != null;
    }
}
