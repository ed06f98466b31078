package app.assistant.mcp.oauth;

import org.springframework.lang.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RFC 7591 registration response, reduced to what we keep.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OAuthClientRegistration(
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_secret") @Nullable String clientSecret) {
}
