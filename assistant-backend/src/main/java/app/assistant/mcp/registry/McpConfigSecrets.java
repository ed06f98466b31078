package app.assistant.mcp.registry;

import java.util.function.UnaryOperator;

import app.assistant.mcp.model.HttpServerConfig;
import app.assistant.mcp.model.McpOAuthConfig;
import app.assistant.mcp.model.McpServerConfig;
import app.assistant.mcp.model.OAuthToken;

/**
 * Applies a transformation to the secret fields of a server configuration: the OAuth client
 * secret and the access and refresh tokens.
 */
final class McpConfigSecrets {

    private McpConfigSecrets() {
    }

    static McpServerConfig map(McpServerConfig config, UnaryOperator<String> transform) {
        if (!(config instanceof HttpServerConfig http) || http.oauth() == null) {
            return config;
        }
        McpOAuthConfig oauth = http.oauth();
        OAuthToken token = oauth.token();
        if (token != null) {
            token = token.toBuilder()
                    .accessToken(transform.apply(token.accessToken()))
                    .refreshToken(transform.apply(token.refreshToken()))
                    .build();
        }
        return http.withOauth(oauth.toBuilder()
                .clientSecret(transform.apply(oauth.clientSecret()))
                .token(token)
                .build());
    }
}
