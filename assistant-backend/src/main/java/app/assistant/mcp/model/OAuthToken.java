package app.assistant.mcp.model;

import java.time.Duration;
import java.time.Instant;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;

/**
 * Access token state for one server. {@code expiresAt} is absolute; {@code null} means the
 * provider did not report a lifetime.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OAuthToken(
        String accessToken,
        @Nullable String refreshToken,
        @Nullable Instant expiresAt,
        @Nullable String tokenType,
        @Nullable String scope) {

    @JsonIgnore
    public boolean hasRefreshToken() {
        return StringUtils.hasText(refreshToken);
    }

    public boolean expiresWithin(Duration window, Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now.plus(window));
    }
}
