package app.assistant.mcp.oauth;

import org.springframework.lang.Nullable;

/**
 * Authorization server endpoints, discovered or derived from the server origin.
 */
public record OAuthEndpoints(String authorizationEndpoint, String tokenEndpoint,
                             @Nullable String registrationEndpoint) {

    static OAuthEndpoints fallback(String origin) {
        return new OAuthEndpoints(origin + "/authorize", origin + "/token", origin + "/register");
    }
}
