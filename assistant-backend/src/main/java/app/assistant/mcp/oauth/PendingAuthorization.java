package app.assistant.mcp.oauth;

import java.time.Instant;

/**
 * An authorization request waiting for its callback, keyed by the {@code state} parameter.
 */
record PendingAuthorization(String serverId, String codeVerifier, String redirectUri, Instant expiresAt) {

    boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
