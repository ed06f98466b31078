package app.assistant.mcp.connection;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import org.mockito.Mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import org.mockito.junit.jupiter.MockitoExtension;

import app.assistant.config.store.InMemoryGlobalConfigStore;
import app.assistant.mcp.config.McpProperties;
import app.assistant.mcp.error.McpAuthenticationException;
import app.assistant.mcp.error.McpConnectionException;
import app.assistant.mcp.events.McpServerStatusPublisher;
import app.assistant.mcp.model.ConnectionState;
import app.assistant.mcp.model.HttpServerConfig;
import app.assistant.mcp.model.McpOAuthConfig;
import app.assistant.mcp.model.McpServerConfig;
import app.assistant.mcp.model.McpServerInfo;
import app.assistant.mcp.model.OAuthGrantType;
import app.assistant.mcp.model.StdioServerConfig;
import app.assistant.mcp.oauth.McpOAuthService;
import app.assistant.mcp.registry.McpServerConfigValidator;
import app.assistant.mcp.registry.McpServerRegistry;
import app.assistant.mcp.transport.FakeMcpServerHandle;
import app.assistant.mcp.transport.FakeMcpServerHandleFactory;
import app.assistant.mcp.transport.McpServerHandle;
import app.assistant.mcp.transport.McpServerHandleFactory;
import app.assistant.mcp.transport.McpTransportFailureException;
import app.assistant.security.AesGcmSecretEncryptor;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class McpConnectionServiceTest {

    private static final McpServerConfig FILES =
            StdioServerConfig.builder().id("fs").name("Files").command("npx").build();

    @Mock
    private McpOAuthService oauthService;

    @Mock
    private McpServerStatusPublisher statusPublisher;

    private McpServerRegistry registry;
    private McpProperties properties;
    private FakeMcpServerHandle handle;
    private FakeMcpServerHandleFactory factory;
    private McpConnectionService service;

    @BeforeEach
    void setUp() {
        registry = new McpServerRegistry(new InMemoryGlobalConfigStore(),
                new AesGcmSecretEncryptor("connection-test-key"), new McpServerConfigValidator());
        properties = new McpProperties();
        handle = new FakeMcpServerHandle();
        factory = new FakeMcpServerHandleFactory(() -> handle);
        service = newService(factory);
        registry.addServer(FILES).block();
    }

    @AfterEach
    void tearDown() {
        service.cleanup();
    }

    @Test
    void connectInstallsHandleAndPublishesTransitions() {
        StepVerifier.create(service.connectServer("fs")).verifyComplete();

        McpServerInfo info = registry.get("fs").orElseThrow();
        assertThat(info.isConnected()).isTrue();
        assertThat(info.handle()).isSameAs(handle);
        verify(statusPublisher).publishStateChange(info, ConnectionState.DISCONNECTED, "Connecting");
        verify(statusPublisher).publishStateChange(info, ConnectionState.CONNECTING, "Connected");
    }

    @Test
    void concurrentConnectsShareOneAttempt() {
        // given
        AtomicInteger opens = new AtomicInteger();
        McpServerHandleFactory slow = (config, token) -> {
            opens.incrementAndGet();
            return Mono.delay(Duration.ofMillis(100)).thenReturn(handle);
        };
        service = newService(slow);

        // when
        StepVerifier.create(Mono.when(service.connectServer("fs"), service.connectServer("fs"), service.connectServer("fs")))
                .verifyComplete();

        // then
        assertThat(opens).hasValue(1);
        assertThat(registry.get("fs").orElseThrow().isConnected()).isTrue();
    }

    @Test
    void concurrentForcedReconnectsShareOneAttemptAndCloseOldHandle() {
        // given
        FakeMcpServerHandle first = new FakeMcpServerHandle();
        FakeMcpServerHandle second = new FakeMcpServerHandle();
        Deque<FakeMcpServerHandle> handles = new ArrayDeque<>(List.of(first, second));
        AtomicInteger opens = new AtomicInteger();
        McpServerHandleFactory slow = (config, token) -> {
            opens.incrementAndGet();
            return Mono.delay(Duration.ofMillis(50)).thenReturn(handles.poll());
        };
        service = newService(slow);
        service.connectServer("fs").block();

        // when
        StepVerifier.create(Mono.when(service.forceReconnect("fs"), service.forceReconnect("fs")))
                .verifyComplete();

        // then
        assertThat(opens).hasValue(2);
        assertThat(first.isClosed()).isTrue();
        assertThat(registry.get("fs").orElseThrow().handle()).isSameAs(second);
    }

    @Test
    void reconnectRequestedWhileConnectCompletesStartsFreshAttempt() {
        // given
        FakeMcpServerHandle first = new FakeMcpServerHandle();
        FakeMcpServerHandle second = new FakeMcpServerHandle();
        factory.enqueue(first).enqueue(second);

        // when
        StepVerifier.create(service.connectServer("fs")
                        .then(Mono.fromRunnable(() -> service.markSessionExpired("fs")))
                        .then(Mono.defer(() -> service.forceReconnect("fs"))))
                .verifyComplete();

        // then
        McpServerInfo info = registry.get("fs").orElseThrow();
        assertThat(factory.openCount()).isEqualTo(2);
        assertThat(first.isClosed()).isTrue();
        assertThat(info.handle()).isSameAs(second);
        assertThat(info.state()).isEqualTo(ConnectionState.CONNECTED);
    }

    @Test
    void availabilityIsFalseForUnknownServer() {
        StepVerifier.create(service.isServerAvailable("missing"))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void availabilityIsFalseWhenConnectFails() {
        factory.enqueueFailure(new IOException("spawn npx ENOENT"));

        StepVerifier.create(service.isServerAvailable("fs"))
                .expectNext(false)
                .verifyComplete();

        McpServerInfo info = registry.get("fs").orElseThrow();
        assertThat(info.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(info.lastError()).contains("spawn npx ENOENT");
    }

    @Test
    void availabilityConnectsLazily() {
        StepVerifier.create(service.isServerAvailable("fs"))
                .expectNext(true)
                .verifyComplete();
        assertThat(factory.openCount()).isEqualTo(1);
    }

    @Test
    void cancelledConnectLeavesServerDisconnected() {
        // given
        factory.enqueueHang();
        Disposable pending = service.connectServer("fs").subscribe();
        assertThat(registry.get("fs").orElseThrow().state()).isEqualTo(ConnectionState.CONNECTING);

        // when
        pending.dispose();

        // then
        assertThat(registry.get("fs").orElseThrow().state()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void connectIsBoundedByInitializationTimeout() {
        properties.setInitializationTimeout(Duration.ofMillis(50));
        factory.enqueueHang();

        StepVerifier.create(service.connectServer("fs"))
                .expectError(McpConnectionException.class)
                .verify(Duration.ofSeconds(5));
        assertThat(registry.get("fs").orElseThrow().state()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void authorizationCodeServerWithoutTokenWaitsForUser() {
        // given
        registry.addServer(HttpServerConfig.builder()
                .id("notes").name("Notes").url("https://x/mcp")
                .oauth(McpOAuthConfig.builder().grantType(OAuthGrantType.AUTHORIZATION_CODE).build())
                .build()).block();
        when(oauthService.generateAuthorizationUrl("notes")).thenReturn(Mono.just("https://x/authorize?state=s"));

        // when
        StepVerifier.create(service.connectServer("notes")).verifyComplete();

        // then
        assertThat(registry.get("notes").orElseThrow().state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(factory.openCount()).isZero();
        verify(oauthService, never()).ensureValidToken(anyString());
    }

    @Test
    void classifiesAuthenticationErrors() {
        assertThat(service.isAuthError(McpTransportFailureException.httpStatus("fs", "read", 401, "HTTP 401"))).isTrue();
        assertThat(service.isAuthError(new IllegalStateException("HTTP 401 Unauthorized"))).isTrue();
        assertThat(service.isAuthError(new RuntimeException("wrapped", new McpAuthenticationException("x", "a", "fs"))))
                .isTrue();
        assertThat(service.isAuthError(new IOException("connection refused"))).isFalse();
        assertThat(service.isAuthError(null)).isFalse();
    }

    @Test
    void classifiesSessionErrors() {
        assertThat(service.isSessionError(McpTransportFailureException.sessionLost("fs", "read", "Broken pipe"))).isTrue();
        assertThat(service.isSessionError(
                McpTransportFailureException.httpStatus("fs", "read", 404, "HTTP 404: Session not found"))).isTrue();
        assertThat(service.isSessionError(new IllegalStateException("Bad Request: No valid session ID provided")))
                .isTrue();
        assertThat(service.isSessionError(McpTransportFailureException.httpStatus("fs", "read", 400, "HTTP 400")))
                .isFalse();
        assertThat(service.isSessionError(new IOException("connection refused"))).isFalse();
    }

    @Test
    void serverAnsweredRpcErrorsAreNeitherAuthNorSessionErrors() {
        McpTransportFailureException toolRejected = McpTransportFailureException.rpcError("fs", "call-tool", -32602,
                "Authentication provider rejected the request: invalid_token for upstream API");
        McpTransportFailureException missingArgument = McpTransportFailureException.rpcError("fs", "call-tool", -32602,
                "Missing required argument: session id");

        assertThat(service.isAuthError(toolRejected)).isFalse();
        assertThat(service.isSessionError(toolRejected)).isFalse();
        assertThat(service.isSessionError(missingArgument)).isFalse();
        assertThat(service.isAuthError(new RuntimeException("wrapped", toolRejected))).isFalse();
        assertThat(service.isAuthError(new IllegalStateException("Authentication section missing from report")))
                .isFalse();
        assertThat(service.isSessionError(new IllegalStateException("Export failed for session id 42"))).isFalse();
    }

    @Test
    void failedHealthCheckDropsHandleAndSchedulesReconnect() throws InterruptedException {
        // given
        properties.setHealthCheckIdle(Duration.ZERO);
        service.connectServer("fs").block();
        handle.failNext(FakeMcpServerHandle.PING, new IOException("stream closed"));
        Thread.sleep(10);

        // when
        service.runHealthChecks().block(Duration.ofSeconds(5));

        // then
        McpServerInfo info = registry.get("fs").orElseThrow();
        assertThat(handle.calls(FakeMcpServerHandle.PING)).isEqualTo(1);
        assertThat(handle.isClosed()).isTrue();
        assertThat(info.handle()).isNull();
        assertThat(info.reconnectAttempts()).isEqualTo(1);
    }

    @Test
    void healthCheckSkipsServersThatOptedOut() throws InterruptedException {
        registry.addServer(((StdioServerConfig) FILES).toBuilder().healthCheckEnabled(false).build()).block();
        properties.setHealthCheckIdle(Duration.ZERO);
        service.connectServer("fs").block();
        Thread.sleep(10);

        service.runHealthChecks().block(Duration.ofSeconds(5));

        assertThat(handle.calls(FakeMcpServerHandle.PING)).isZero();
    }

    @Test
    void recoveryFailureDisconnectsAndRecordsError() {
        service.connectServer("fs").block();

        StepVerifier.create(service.markRecoveryFailed("fs", new IllegalStateException("gone"))).verifyComplete();

        McpServerInfo info = registry.get("fs").orElseThrow();
        assertThat(info.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(info.lastError()).isEqualTo("gone");
        assertThat(handle.isClosed()).isTrue();
    }

    @Test
    void removedServerDoesNotKeepLateHandle() {
        // given
        AtomicInteger closes = new AtomicInteger();
        FakeMcpServerHandle late = new FakeMcpServerHandle() {
            @Override
            public Mono<Void> close() {
                closes.incrementAndGet();
                return super.close();
            }
        };
        McpServerHandleFactory slow = (config, token) -> Mono.delay(Duration.ofMillis(100)).thenReturn((McpServerHandle) late);
        service = newService(slow);

        // when
        StepVerifier.create(service.connectServer("fs"))
                .then(() -> registry.delete("fs"))
                .verifyComplete();

        // then
        assertThat(closes).hasValue(1);
        verify(statusPublisher, never()).publishStateChange(any(), eq(ConnectionState.CONNECTING), eq("Connected"));
    }

    private McpConnectionService newService(McpServerHandleFactory handleFactory) {
        return new McpConnectionService(registry, handleFactory, oauthService, properties, statusPublisher);
    }
}
