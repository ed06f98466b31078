package app.assistant.mcp.model;

import org.springframework.lang.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Identity and connection recipe for one external MCP server.
 * <p>
 * The JSON form carries a {@code transport} discriminator ({@code stdio} or {@code http}); the
 * transport-specific fields only exist on the matching subtype.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "transport")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StdioServerConfig.class, name = "stdio"),
        @JsonSubTypes.Type(value = HttpServerConfig.class, name = "http")
})
public sealed interface McpServerConfig permits StdioServerConfig, HttpServerConfig {

    String id();

    String name();

    @Nullable
    String description();

    /**
     * Whether idle connections to this server should be pinged. {@code null} means enabled.
     */
    @Nullable
    Boolean healthCheckEnabled();

    @Nullable
    Integer healthCheckIdleMinutes();

    @JsonIgnore
    McpTransportKind transport();

    @JsonIgnore
    default boolean isHealthCheckEnabled() {
        return !Boolean.FALSE.equals(healthCheckEnabled());
    }
}
