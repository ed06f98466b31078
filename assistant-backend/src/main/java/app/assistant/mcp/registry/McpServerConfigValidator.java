package app.assistant.mcp.registry;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import app.assistant.mcp.error.McpConfigurationException;
import app.assistant.mcp.model.HttpServerConfig;
import app.assistant.mcp.model.McpOAuthConfig;
import app.assistant.mcp.model.McpServerConfig;
import app.assistant.mcp.model.OAuthGrantType;
import app.assistant.mcp.model.StdioServerConfig;

/**
 * Rejects server configurations that can never connect.
 */
@Component
public class McpServerConfigValidator {

    private static final String ACTION = "validate-config";

    public void validate(McpServerConfig config) {
        if (config == null) {
            throw new McpConfigurationException("Server configuration is required", ACTION, null);
        }
        String serverId = config.id();
        if (!StringUtils.hasText(serverId)) {
            throw new McpConfigurationException("Server id is required", ACTION, null);
        }
        if (!StringUtils.hasText(config.name())) {
            throw new McpConfigurationException("Server name is required", ACTION, serverId);
        }
        if (config.healthCheckIdleMinutes() != null && config.healthCheckIdleMinutes() < 1) {
            throw new McpConfigurationException("healthCheckIdleMinutes must be at least 1", ACTION, serverId);
        }

        if (config instanceof StdioServerConfig stdio) {
            if (!StringUtils.hasText(stdio.command())) {
                throw new McpConfigurationException("Command is required for stdio transport", ACTION, serverId);
            }
        } else if (config instanceof HttpServerConfig http) {
            validateUrl(http);
            if (http.oauth() != null && !isOAuthConfigurationSufficient(http.oauth())) {
                throw new McpConfigurationException(
                        "OAuth configuration is incomplete: client_credentials needs clientId and clientSecret",
                        ACTION, serverId);
            }
        }
    }

    /**
     * A client_credentials setup needs both client id and secret. An authorization_code setup is
     * always usable because discovery and dynamic registration can fill in the rest.
     */
    public boolean isOAuthConfigurationSufficient(McpOAuthConfig oauth) {
        if (oauth.grantType() == null) {
            return false;
        }
        if (oauth.grantType() == OAuthGrantType.CLIENT_CREDENTIALS) {
            return StringUtils.hasText(oauth.clientId()) && StringUtils.hasText(oauth.clientSecret());
        }
        return true;
    }

    private void validateUrl(HttpServerConfig http) {
        if (!StringUtils.hasText(http.url())) {
            throw new McpConfigurationException("URL is required for http transport", ACTION, http.id());
        }
        URI uri;
        try {
            uri = new URI(http.url().trim());
        } catch (URISyntaxException ex) {
            throw new McpConfigurationException("Invalid URL: " + http.url(), ACTION, http.id(), ex);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new McpConfigurationException("URL must use http or https: " + http.url(), ACTION, http.id());
        }
        if (!StringUtils.hasText(uri.getHost())) {
            throw new McpConfigurationException("URL must include a host: " + http.url(), ACTION, http.id());
        }
        if ("http".equals(scheme) && !isLoopback(uri.getHost())) {
            throw new McpConfigurationException(
                    "Remote MCP servers must use https; plain http is only allowed for localhost", ACTION, http.id());
        }
    }

    private static boolean isLoopback(String host) {
        String normalized = host.toLowerCase(Locale.ROOT);
        return "localhost".equals(normalized)
                || normalized.startsWith("127.")
                || "[::1]".equals(normalized)
                || "::1".equals(normalized);
    }
}
