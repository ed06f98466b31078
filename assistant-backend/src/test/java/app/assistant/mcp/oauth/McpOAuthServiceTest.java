package app.assistant.mcp.oauth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import app.assistant.config.store.InMemoryGlobalConfigStore;
import app.assistant.mcp.config.McpProperties;
import app.assistant.mcp.error.McpAuthenticationException;
import app.assistant.mcp.model.HttpServerConfig;
import app.assistant.mcp.model.McpOAuthConfig;
import app.assistant.mcp.model.OAuthGrantType;
import app.assistant.mcp.model.OAuthToken;
import app.assistant.mcp.registry.McpServerConfigValidator;
import app.assistant.mcp.registry.McpServerRegistry;
import app.assistant.security.AesGcmSecretEncryptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class McpOAuthServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final String TOKEN_JSON =
            "{\"access_token\":\"new-access\",\"expires_in\":3600,\"token_type\":\"Bearer\"}";

    private final Map<String, Route> routes = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();

    private McpServerRegistry registry;
    private McpOAuthService service;

    @BeforeEach
    void setUp() {
        McpServerConfigValidator validator = new McpServerConfigValidator();
        registry = new McpServerRegistry(new InMemoryGlobalConfigStore(),
                new AesGcmSecretEncryptor("oauth-test-key"), validator);
        WebClient.Builder webClient = WebClient.builder().exchangeFunction(this::exchange);
        service = new McpOAuthService(registry, validator, new McpProperties(), webClient,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void refreshUsesRefreshTokenAndKeepsItWhenNotRotated() {
        // given
        register(authorizationCodeOAuth().token(token("old-access", "refresh-1")).build());
        route("/token", HttpStatus.OK, TOKEN_JSON);

        // when / then
        StepVerifier.create(service.refreshAccessToken("notes"))
                .assertNext(token -> {
                    assertThat(token.accessToken()).isEqualTo("new-access");
                    assertThat(token.refreshToken()).isEqualTo("refresh-1");
                    assertThat(token.expiresAt()).isEqualTo(NOW.plusSeconds(3600));
                })
                .verifyComplete();
        assertThat(storedOAuth().token().accessToken()).isEqualTo("new-access");
        assertThat(hits("/token")).isEqualTo(1);
    }

    @Test
    void concurrentRefreshesShareOneTokenRequest() {
        // given
        register(authorizationCodeOAuth().token(token("old-access", "refresh-1")).build());
        routes.put("/token", new Route(HttpStatus.OK, TOKEN_JSON, Duration.ofMillis(200)));

        // when
        Mono<List<OAuthToken>> both = Mono.zip(service.refreshAccessToken("notes"), service.refreshAccessToken("notes"))
                .map(tuple -> List.of(tuple.getT1(), tuple.getT2()));

        // then
        StepVerifier.create(both)
                .assertNext(tokens -> assertThat(tokens).extracting(OAuthToken::accessToken)
                        .containsExactly("new-access", "new-access"))
                .verifyComplete();
        assertThat(hits("/token")).isEqualTo(1);
    }

    @Test
    void refreshRequestedAfterCompletionIsNotServedFromFinishedAttempt() {
        // given
        register(authorizationCodeOAuth().token(token("old-access", "refresh-1")).build());
        route("/token", HttpStatus.OK, TOKEN_JSON);

        // when
        Mono<OAuthToken> chained = service.refreshAccessToken("notes")
                .flatMap(first -> service.refreshAccessToken("notes"));

        // then
        StepVerifier.create(chained)
                .assertNext(token -> assertThat(token.accessToken()).isEqualTo("new-access"))
                .verifyComplete();
        assertThat(hits("/token")).isEqualTo(2);
    }

    @Test
    void rejectedRefreshSurfacesAsAuthenticationFailure() {
        register(authorizationCodeOAuth().token(token("old-access", "refresh-1")).build());
        route("/token", HttpStatus.BAD_REQUEST, "{\"error\":\"invalid_grant\"}");

        StepVerifier.create(service.refreshAccessToken("notes"))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(McpAuthenticationException.class)
                        .hasMessage("Authentication failed for MCP server notes. Please re-authenticate."))
                .verify();
    }

    @Test
    void refreshWithoutRefreshTokenFails() {
        register(authorizationCodeOAuth().token(token("old-access", null)).build());

        StepVerifier.create(service.refreshAccessToken("notes"))
                .expectError(McpAuthenticationException.class)
                .verify();
        assertThat(hits("/token")).isZero();
    }

    @Test
    void clientCredentialsRefreshAcquiresNewToken() {
        register(McpOAuthConfig.builder()
                .grantType(OAuthGrantType.CLIENT_CREDENTIALS)
                .clientId("client").clientSecret("secret")
                .tokenEndpoint("https://auth.example.com/token")
                .build());
        route("/token", HttpStatus.OK, TOKEN_JSON);

        StepVerifier.create(service.refreshAccessToken("notes"))
                .assertNext(token -> assertThat(token.accessToken()).isEqualTo("new-access"))
                .verifyComplete();
        assertThat(storedOAuth().token()).isNotNull();
    }

    @Test
    void validTokenIsReturnedWithoutNetwork() {
        register(authorizationCodeOAuth().token(OAuthToken.builder()
                .accessToken("current").expiresAt(NOW.plus(Duration.ofHours(1))).build()).build());

        StepVerifier.create(service.ensureValidToken("notes"))
                .assertNext(token -> assertThat(token.accessToken()).isEqualTo("current"))
                .verifyComplete();
        assertThat(hits).isEmpty();
    }

    @Test
    void tokenCloseToExpiryIsRefreshed() {
        register(authorizationCodeOAuth().token(OAuthToken.builder()
                .accessToken("current").refreshToken("refresh-1")
                .expiresAt(NOW.plus(Duration.ofMinutes(2))).build()).build());
        route("/token", HttpStatus.OK, TOKEN_JSON);

        StepVerifier.create(service.ensureValidToken("notes"))
                .assertNext(token -> assertThat(token.accessToken()).isEqualTo("new-access"))
                .verifyComplete();
    }

    @Test
    void discoveryReadsAuthorizationServerMetadata() {
        route("/.well-known/oauth-authorization-server", HttpStatus.OK, """
                {"authorization_endpoint":"https://id.example.com/oauth/authorize",
                 "token_endpoint":"https://id.example.com/oauth/token"}
                """);

        StepVerifier.create(service.discoverOAuthEndpoints("https://mcp.example.com/mcp"))
                .assertNext(endpoints -> {
                    assertThat(endpoints.authorizationEndpoint()).isEqualTo("https://id.example.com/oauth/authorize");
                    assertThat(endpoints.tokenEndpoint()).isEqualTo("https://id.example.com/oauth/token");
                    assertThat(endpoints.registrationEndpoint()).isNull();
                })
                .verifyComplete();
    }

    @Test
    void discoveryFallsBackToConventionalPaths() {
        route("/.well-known/oauth-authorization-server", HttpStatus.NOT_FOUND, "{}");

        StepVerifier.create(service.discoverOAuthEndpoints("https://mcp.example.com:8443/mcp"))
                .assertNext(endpoints -> {
                    assertThat(endpoints.authorizationEndpoint()).isEqualTo("https://mcp.example.com:8443/authorize");
                    assertThat(endpoints.tokenEndpoint()).isEqualTo("https://mcp.example.com:8443/token");
                    assertThat(endpoints.registrationEndpoint()).isEqualTo("https://mcp.example.com:8443/register");
                })
                .verifyComplete();
    }

    @Test
    void authorizationCodeFlowRegistersClientAndExchangesCode() {
        // given
        register(McpOAuthConfig.builder().grantType(OAuthGrantType.AUTHORIZATION_CODE).scopes(List.of("notes.read")).build());
        route("/.well-known/oauth-authorization-server", HttpStatus.OK, """
                {"authorization_endpoint":"https://x/authorize","token_endpoint":"https://x/token",
                 "registration_endpoint":"https://x/register"}
                """);
        route("/register", HttpStatus.CREATED, "{\"client_id\":\"dyn-client\"}");
        route("/token", HttpStatus.OK, "{\"access_token\":\"granted\",\"refresh_token\":\"r\",\"expires_in\":60}");

        // when
        String url = service.generateAuthorizationUrl("notes").block();

        // then
        Map<String, String> query = UriComponentsBuilder.fromUriString(url).build().getQueryParams().toSingleValueMap();
        assertThat(url).startsWith("https://x/authorize?");
        assertThat(query).containsEntry("client_id", "dyn-client")
                .containsEntry("code_challenge_method", "S256")
                .containsEntry("response_type", "code")
                .containsKeys("state", "code_challenge");
        assertThat(registry.get("notes").orElseThrow().pendingAuthUrl()).isEqualTo(url);
        assertThat(storedOAuth().clientId()).isEqualTo("dyn-client");

        StepVerifier.create(service.handleAuthorizationCallback("code-1", query.get("state")))
                .expectNext("notes")
                .verifyComplete();
        assertThat(storedOAuth().token().accessToken()).isEqualTo("granted");
        assertThat(registry.get("notes").orElseThrow().pendingAuthUrl()).isNull();

        StepVerifier.create(service.handleAuthorizationCallback("code-1", query.get("state")))
                .expectError(McpAuthenticationException.class)
                .verify();
    }

    private void register(McpOAuthConfig oauth) {
        registry.addServer(HttpServerConfig.builder()
                .id("notes").name("Notes").url("https://x/mcp").oauth(oauth).build()).block();
    }

    private McpOAuthConfig storedOAuth() {
        return ((HttpServerConfig) registry.getMCPServerConfiguration("notes").orElseThrow()).oauth();
    }

    private static McpOAuthConfig.McpOAuthConfigBuilder authorizationCodeOAuth() {
        return McpOAuthConfig.builder()
                .grantType(OAuthGrantType.AUTHORIZATION_CODE)
                .clientId("client")
                .authorizationEndpoint("https://auth.example.com/authorize")
                .tokenEndpoint("https://auth.example.com/token");
    }

    private static OAuthToken token(String access, String refresh) {
        return OAuthToken.builder().accessToken(access).refreshToken(refresh)
                .expiresAt(NOW.minusSeconds(10)).build();
    }

    private void route(String path, HttpStatus status, String body) {
        routes.put(path, new Route(status, body, Duration.ZERO));
    }

    private int hits(String path) {
        AtomicInteger count = hits.get(path);
        return count == null ? 0 : count.get();
    }

    private Mono<ClientResponse> exchange(ClientRequest request) {
        String path = request.url().getPath();
        hits.computeIfAbsent(path, key -> new AtomicInteger()).incrementAndGet();
        Route route = routes.getOrDefault(path, new Route(HttpStatus.NOT_FOUND, "{}", Duration.ZERO));
        ClientResponse response = ClientResponse.create(route.status())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(route.body())
                .build();
        return route.delay().isZero() ? Mono.just(response) : Mono.delay(route.delay()).thenReturn(response);
    }

    private record Route(HttpStatus status, String body, Duration delay) {
    }
}
