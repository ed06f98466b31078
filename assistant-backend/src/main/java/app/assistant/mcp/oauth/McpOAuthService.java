package app.assistant.mcp.oauth;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.databind.JsonNode;

import app.assistant.mcp.config.McpProperties;
import app.assistant.mcp.error.McpAuthenticationException;
import app.assistant.mcp.error.McpClientException;
import app.assistant.mcp.model.HttpServerConfig;
import app.assistant.mcp.model.McpOAuthConfig;
import app.assistant.mcp.model.McpServerInfo;
import app.assistant.mcp.model.OAuthGrantType;
import app.assistant.mcp.model.OAuthToken;
import app.assistant.mcp.registry.McpServerConfigValidator;
import app.assistant.mcp.registry.McpServerRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Acquires and refreshes OAuth access tokens for HTTP servers.
 * <p>
 * Tokens live in the server's {@link McpOAuthConfig} and are persisted through
 * {@link McpServerRegistry#saveServerConfig}. Refreshes are single-flight per server: concurrent
 * callers share the result of one token request.
 */
@Service
@Slf4j
public class McpOAuthService {

    static final String WELL_KNOWN_PATH = "/.well-known/oauth-authorization-server";

    private final McpServerRegistry registry;
    private final McpServerConfigValidator validator;
    private final McpProperties properties;
    private final WebClient webClient;
    private final Clock clock;

    private final ConcurrentHashMap<String, Mono<OAuthToken>> inflightRefreshes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, PendingAuthorization> pendingAuthorizations = new ConcurrentHashMap<>();

    @Autowired
    public McpOAuthService(McpServerRegistry registry,
                           McpServerConfigValidator validator,
                           McpProperties properties,
                           WebClient.Builder webClientBuilder) {
        this(registry, validator, properties, webClientBuilder, Clock.systemUTC());
    }

    McpOAuthService(McpServerRegistry registry,
                    McpServerConfigValidator validator,
                    McpProperties properties,
                    WebClient.Builder webClientBuilder,
                    Clock clock) {
        this.registry = registry;
        this.validator = validator;
        this.properties = properties;
        this.webClient = webClientBuilder.build();
        this.clock = clock;
    }

    public boolean isOAuthConfigurationSufficient(McpOAuthConfig oauth) {
        return validator.isOAuthConfigurationSufficient(oauth);
    }

    /**
     * Obtains a fresh access token: a refresh grant for authorization_code servers, a new
     * client_credentials grant otherwise. The new token is persisted before the returned Mono
     * completes.
     *
     * @return the new token; fails with {@link McpAuthenticationException} if no token could be obtained
     */
    public Mono<OAuthToken> refreshAccessToken(String serverId) {
        return Mono.defer(() -> {
            AtomicReference<Mono<OAuthToken>> self = new AtomicReference<>();
            Mono<OAuthToken> refresh = Mono.defer(() -> doRefresh(serverId))
                    .timeout(properties.tokenRefreshTimeout())
                    .onErrorMap(error -> authenticationFailure(serverId, "refresh-token", error))
                    .doOnTerminate(() -> inflightRefreshes.remove(serverId, self.get()))
                    .doOnCancel(() -> inflightRefreshes.remove(serverId, self.get()))
                    .cache();
            self.set(refresh);
            Mono<OAuthToken> existing = inflightRefreshes.putIfAbsent(serverId, refresh);
            return existing != null ? existing : refresh;
        });
    }

    /**
     * Returns a token that is valid for at least the configured refresh window, refreshing or
     * acquiring one if needed. Empty when the server has no OAuth configuration or still awaits
     * user authorization.
     */
    public Mono<OAuthToken> ensureValidToken(String serverId) {
        return Mono.defer(() -> {
            McpOAuthConfig oauth = oauthConfig(serverId).orElse(null);
            if (oauth == null) {
                return Mono.empty();
            }
            OAuthToken token = oauth.token();
            if (token == null) {
                return oauth.grantType() == OAuthGrantType.CLIENT_CREDENTIALS
                        ? performClientCredentialsFlow(serverId)
                        : Mono.empty();
            }
            if (token.expiresWithin(properties.getOauth().refreshWindow(), clock.instant())) {
                log.info("Access token for MCP server {} expires soon, refreshing", serverId);
                return refreshAccessToken(serverId);
            }
            return Mono.just(token);
        });
    }

    public Mono<OAuthToken> performClientCredentialsFlow(String serverId) {
        return ensureOAuthConfiguration(serverId)
                .flatMap(oauth -> {
                    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
                    form.add("grant_type", "client_credentials");
                    form.add("client_id", oauth.clientId());
                    form.add("client_secret", oauth.clientSecret());
                    if (!oauth.scopes().isEmpty()) {
                        form.add("scope", oauth.scopeString());
                    }
                    return requestToken(oauth.tokenEndpoint(), form, null);
                })
                .flatMap(token -> storeToken(serverId, token))
                .doOnSuccess(token -> log.info("Acquired client credentials token for MCP server {}", serverId))
                .onErrorMap(error -> authenticationFailure(serverId, "client-credentials", error));
    }

    /**
     * Fills in missing authorization server endpoints by discovery and, for authorization_code
     * servers without a client id, registers a client dynamically. Persists any change.
     */
    public Mono<McpOAuthConfig> ensureOAuthConfiguration(String serverId) {
        return Mono.defer(() -> {
            HttpServerConfig http = httpConfig(serverId, "configure-oauth");
            McpOAuthConfig oauth = http.oauth();

            Mono<McpOAuthConfig> withEndpoints = !needsDiscovery(oauth)
                    ? Mono.just(oauth)
                    : discoverOAuthEndpoints(http.url()).map(endpoints -> oauth.toBuilder()
                            .authorizationEndpoint(firstNonBlank(oauth.authorizationEndpoint(),
                                    endpoints.authorizationEndpoint()))
                            .tokenEndpoint(firstNonBlank(oauth.tokenEndpoint(), endpoints.tokenEndpoint()))
                            .registrationEndpoint(firstNonBlank(oauth.registrationEndpoint(),
                                    endpoints.registrationEndpoint()))
                            .build());

            return withEndpoints
                    .flatMap(updated -> needsRegistration(updated)
                            ? registerDynamicClient(updated.registrationEndpoint(), redirectUri(updated), updated.scopes())
                                    .map(registration -> updated.toBuilder()
                                            .clientId(registration.clientId())
                                            .clientSecret(registration.clientSecret())
                                            .build())
                            : Mono.just(updated))
                    .flatMap(updated -> updated.equals(oauth)
                            ? Mono.just(updated)
                            : registry.saveServerConfig(http.withOauth(updated)).thenReturn(updated));
        });
    }

    /**
     * Reads RFC 8414 metadata from the server origin, falling back to conventional paths.
     */
    public Mono<OAuthEndpoints> discoverOAuthEndpoints(String serverUrl) {
        String origin = origin(serverUrl);
        return webClient.get()
                .uri(origin + WELL_KNOWN_PATH)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(properties.tokenRefreshTimeout())
                .map(metadata -> new OAuthEndpoints(
                        metadata.path("authorization_endpoint").asText(origin + "/authorize"),
                        metadata.path("token_endpoint").asText(origin + "/token"),
                        metadata.hasNonNull("registration_endpoint")
                                ? metadata.get("registration_endpoint").asText() : null))
                .onErrorResume(error -> {
                    log.warn("OAuth discovery failed for {}, using default endpoints: {}", origin, error.getMessage());
                    return Mono.just(OAuthEndpoints.fallback(origin));
                });
    }

    public Mono<OAuthClientRegistration> registerDynamicClient(String registrationEndpoint, String redirectUri,
                                                               List<String> scopes) {
        Map<String, Object> request = Map.of(
                "client_name", properties.getOauth().clientName(),
                "redirect_uris", List.of(redirectUri),
                "grant_types", List.of("authorization_code", "refresh_token"),
                "response_types", List.of("code"),
                "token_endpoint_auth_method", "client_secret_post",
                "scope", String.join(" ", scopes));

        return webClient.post()
                .uri(registrationEndpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(OAuthClientRegistration.class)
                .timeout(properties.tokenRefreshTimeout())
                .doOnSuccess(registration -> log.info("Registered OAuth client at {}", registrationEndpoint));
    }

    /**
     * Builds the URL the user has to visit to authorize access (PKCE S256). The returned state is
     * remembered until the callback arrives or it expires.
     */
    public Mono<String> generateAuthorizationUrl(String serverId) {
        return ensureOAuthConfiguration(serverId)
                .map(oauth -> {
                    purgeExpiredAuthorizations();
                    String state = Pkce.randomToken();
                    String verifier = Pkce.randomToken();
                    String redirectUri = redirectUri(oauth);
                    pendingAuthorizations.put(state, new PendingAuthorization(serverId, verifier, redirectUri,
                            clock.instant().plus(properties.getOauth().stateTtl())));

                    UriComponentsBuilder url = UriComponentsBuilder.fromUriString(oauth.authorizationEndpoint())
                            .queryParam("response_type", "code")
                            .queryParam("client_id", oauth.clientId())
                            .queryParam("redirect_uri", redirectUri)
                            .queryParam("state", state)
                            .queryParam("code_challenge", Pkce.challenge(verifier))
                            .queryParam("code_challenge_method", "S256");
                    if (!oauth.scopes().isEmpty()) {
                        url.queryParam("scope", oauth.scopeString());
                    }
                    String authorizationUrl = url.encode().build().toUriString();
                    registry.get(serverId).ifPresent(info -> info.setPendingAuthUrl(authorizationUrl));
                    return authorizationUrl;
                })
                .onErrorMap(error -> authenticationFailure(serverId, "authorize", error));
    }

    /**
     * Completes an authorization code flow.
     *
     * @return the id of the server that was authorized
     */
    public Mono<String> handleAuthorizationCallback(String code, String state) {
        return Mono.defer(() -> {
            PendingAuthorization pending = state == null ? null : pendingAuthorizations.remove(state);
            if (pending == null || pending.isExpired(clock.instant())) {
                return Mono.error(new McpAuthenticationException(
                        "Invalid or expired OAuth state; please start the authorization again", "oauth-callback", null));
            }
            String serverId = pending.serverId();
            return ensureOAuthConfiguration(serverId)
                    .flatMap(oauth -> {
                        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
                        form.add("grant_type", "authorization_code");
                        form.add("code", code);
                        form.add("redirect_uri", pending.redirectUri());
                        form.add("client_id", oauth.clientId());
                        form.add("code_verifier", pending.codeVerifier());
                        if (StringUtils.hasText(oauth.clientSecret())) {
                            form.add("client_secret", oauth.clientSecret());
                        }
                        return requestToken(oauth.tokenEndpoint(), form, null);
                    })
                    .flatMap(token -> storeToken(serverId, token))
                    .doOnSuccess(token -> {
                        registry.get(serverId).ifPresent(info -> info.setPendingAuthUrl(null));
                        log.info("MCP server {} authorized", serverId);
                    })
                    .onErrorMap(error -> authenticationFailure(serverId, "oauth-callback", error))
                    .thenReturn(serverId);
        });
    }

    private Mono<OAuthToken> doRefresh(String serverId) {
        HttpServerConfig http = httpConfig(serverId, "refresh-token");
        McpOAuthConfig oauth = http.oauth();
        if (oauth.grantType() == OAuthGrantType.CLIENT_CREDENTIALS) {
            log.info("Re-acquiring client credentials token for MCP server {}", serverId);
            return performClientCredentialsFlow(serverId);
        }
        OAuthToken current = oauth.token();
        if (current == null || !current.hasRefreshToken()) {
            return Mono.error(new McpAuthenticationException(
                    "No refresh token available for MCP server " + serverId, "refresh-token", serverId));
        }

        log.info("Refreshing access token for MCP server {}", serverId);
        return ensureOAuthConfiguration(serverId)
                .flatMap(configured -> {
                    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
                    form.add("grant_type", "refresh_token");
                    form.add("refresh_token", current.refreshToken());
                    form.add("client_id", configured.clientId());
                    if (StringUtils.hasText(configured.clientSecret())) {
                        form.add("client_secret", configured.clientSecret());
                    }
                    return requestToken(configured.tokenEndpoint(), form, current);
                })
                .flatMap(token -> storeToken(serverId, token));
    }

    private Mono<OAuthToken> requestToken(String tokenEndpoint, MultiValueMap<String, String> form,
                                          @Nullable OAuthToken previous) {
        return webClient.post()
                .uri(tokenEndpoint)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(OAuthTokenResponse.class)
                .timeout(properties.tokenRefreshTimeout())
                .flatMap(response -> StringUtils.hasText(response.accessToken())
                        ? Mono.just(response.toToken(previous, clock.instant()))
                        : Mono.error(new IllegalStateException("Token endpoint returned no access_token")));
    }

    private Mono<OAuthToken> storeToken(String serverId, OAuthToken token) {
        return Mono.defer(() -> {
            HttpServerConfig http = httpConfig(serverId, "store-token");
            return registry.saveServerConfig(http.withOauth(http.oauth().withToken(token)))
                    .thenReturn(token);
        });
    }

    private Optional<McpOAuthConfig> oauthConfig(String serverId) {
        return registry.get(serverId)
                .map(McpServerInfo::config)
                .filter(HttpServerConfig.class::isInstance)
                .map(config -> ((HttpServerConfig) config).oauth());
    }

    private HttpServerConfig httpConfig(String serverId, String action) {
        McpServerInfo info = registry.get(serverId).orElseThrow(() -> new McpAuthenticationException(
                "Unknown MCP server " + serverId, action, serverId));
        if (!(info.config() instanceof HttpServerConfig http) || http.oauth() == null) {
            throw new McpAuthenticationException(
                    "MCP server " + serverId + " has no OAuth configuration", action, serverId);
        }
        return http;
    }

    private boolean needsDiscovery(McpOAuthConfig oauth) {
        if (!StringUtils.hasText(oauth.tokenEndpoint())) {
            return true;
        }
        return oauth.grantType() == OAuthGrantType.AUTHORIZATION_CODE && !oauth.hasEndpoints();
    }

    private boolean needsRegistration(McpOAuthConfig oauth) {
        return oauth.grantType() == OAuthGrantType.AUTHORIZATION_CODE
                && !oauth.hasClientId()
                && StringUtils.hasText(oauth.registrationEndpoint());
    }

    private String redirectUri(McpOAuthConfig oauth) {
        return StringUtils.hasText(oauth.redirectUri()) ? oauth.redirectUri() : properties.getOauth().redirectUri();
    }

    private void purgeExpiredAuthorizations() {
        Instant now = clock.instant();
        pendingAuthorizations.values().removeIf(pending -> pending.isExpired(now));
    }

    @Nullable
    private static String firstNonBlank(@Nullable String preferred, @Nullable String fallback) {
        return StringUtils.hasText(preferred) ? preferred : fallback;
    }

    private static String origin(String serverUrl) {
        URI uri = URI.create(serverUrl.trim());
        String origin = uri.getScheme() + "://" + uri.getHost();
        return uri.getPort() == -1 ? origin : origin + ":" + uri.getPort();
    }

    private static McpClientException authenticationFailure(String serverId, String action, Throwable error) {
        if (error instanceof McpAuthenticationException authError) {
            return authError;
        }
        String reason = error instanceof WebClientResponseException responseError
                ? responseError.getStatusCode().value() + " " + responseError.getResponseBodyAsString()
                : error.getMessage();
        log.error("OAuth {} failed for MCP server {}: {}", action, serverId, reason);
        return new McpAuthenticationException(
                "Authentication failed for MCP server " + serverId + ". Please re-authenticate.",
                action, serverId, error);
    }
}
