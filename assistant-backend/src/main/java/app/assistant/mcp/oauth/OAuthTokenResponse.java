package app.assistant.mcp.oauth;

import java.time.Instant;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import app.assistant.mcp.model.OAuthToken;

@JsonIgnoreProperties(ignoreUnknown = true)
record OAuthTokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") @Nullable String refreshToken,
        @JsonProperty("expires_in") @Nullable Long expiresIn,
        @JsonProperty("token_type") @Nullable String tokenType,
        @JsonProperty("scope") @Nullable String scope) {

    /**
     * Providers may omit the refresh token on refresh; the previous one then stays valid.
     */
    OAuthToken toToken(@Nullable OAuthToken previous, Instant now) {
        String refresh = StringUtils.hasText(refreshToken) ? refreshToken
                : previous != null ? previous.refreshToken() : null;
        return OAuthToken.builder()
                .accessToken(accessToken)
                .refreshToken(refresh)
                .expiresAt(expiresIn != null ? now.plusSeconds(expiresIn) : null)
                .tokenType(tokenType != null ? tokenType : "Bearer")
                .scope(scope)
                .build();
    }
}
