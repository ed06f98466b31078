package app.assistant.mcp.model;

import java.util.List;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.With;

/**
 * OAuth settings of an HTTP server. Endpoints are discovery hints and may be filled in later by
 * discovery and dynamic client registration.
 */
@Builder(toBuilder = true)
@With
@JsonInclude(JsonInclude.Include.NON_NULL)
public record McpOAuthConfig(
        OAuthGrantType grantType,
        @Nullable String clientId,
        @Nullable String clientSecret,
        List<String> scopes,
        @Nullable String redirectUri,
        @Nullable String authorizationEndpoint,
        @Nullable String tokenEndpoint,
        @Nullable String registrationEndpoint,
        @Nullable OAuthToken token) {

    public McpOAuthConfig {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    @JsonIgnore
    public String scopeString() {
        return String.join(" ", scopes);
    }

    @JsonIgnore
    public boolean hasEndpoints() {
        return StringUtils.hasText(authorizationEndpoint) && StringUtils.hasText(tokenEndpoint);
    }

    @JsonIgnore
    public boolean hasClientId() {
        return StringUtils.hasText(clientId);
    }
}
