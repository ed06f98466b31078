package app.assistant.mcp.connection;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import app.assistant.mcp.config.McpProperties;
import app.assistant.mcp.error.McpAuthenticationException;
import app.assistant.mcp.error.McpClientException;
import app.assistant.mcp.error.McpConnectionException;
import app.assistant.mcp.error.McpSessionException;
import app.assistant.mcp.events.McpServerStatusPublisher;
import app.assistant.mcp.model.ConnectionState;
import app.assistant.mcp.model.HttpServerConfig;
import app.assistant.mcp.model.McpServerConfig;
import app.assistant.mcp.model.McpServerInfo;
import app.assistant.mcp.model.OAuthGrantType;
import app.assistant.mcp.model.StdioServerConfig;
import app.assistant.mcp.oauth.McpOAuthService;
import app.assistant.mcp.registry.McpServerRegistry;
import app.assistant.mcp.transport.McpServerHandle;
import app.assistant.mcp.transport.McpServerHandleFactory;
import app.assistant.mcp.transport.McpTransportFailureException;
import io.modelcontextprotocol.spec.McpError;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Owns the live connection handle of every server.
 * <p>
 * Connects and reconnects are single-flight per server id: a caller arriving while one is in
 * progress waits for the same outcome instead of opening a second handle. Servers never share a
 * lock. Every transport interaction is bounded by a configured timeout, and a cancelled connect
 * leaves the server {@link ConnectionState#DISCONNECTED} rather than {@link ConnectionState#CONNECTING}.
 */
@Service
@Slf4j
public class McpConnectionService implements ApplicationListener<ContextClosedEvent> {

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final McpServerRegistry registry;
    private final McpServerHandleFactory handleFactory;
    private final McpOAuthService oauthService;
    private final McpProperties properties;
    private final McpServerStatusPublisher statusPublisher;

    private final ConcurrentHashMap<String, Mono<Void>> inflightConnects = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Disposable> scheduledReconnects = new ConcurrentHashMap<>();

    public McpConnectionService(McpServerRegistry registry,
                                McpServerHandleFactory handleFactory,
                                McpOAuthService oauthService,
                                McpProperties properties,
                                McpServerStatusPublisher statusPublisher) {
        this.registry = registry;
        this.handleFactory = handleFactory;
        this.oauthService = oauthService;
        this.properties = properties;
        this.statusPublisher = statusPublisher;
    }

    /**
     * Connects a registered server unless it is already connected. An authorization_code server
     * without a token is left disconnected with a pending authorization URL.
     */
    public Mono<Void> connectServer(String serverId) {
        return singleFlight(serverId, () -> doConnect(serverId));
    }

    /**
     * @return whether a live connection exists after a best-effort connect; never fails
     */
    public Mono<Boolean> isServerAvailable(String serverId) {
        return Mono.defer(() -> {
            McpServerInfo info = registry.get(serverId).orElse(null);
            if (info == null) {
                log.debug("MCP server {} is not registered", serverId);
                return Mono.just(false);
            }
            if (info.isConnected()) {
                return Mono.just(true);
            }
            return connectServer(serverId)
                    .then(Mono.fromSupplier(info::isConnected))
                    .onErrorResume(error -> {
                        log.warn("MCP server {} is unavailable: {}", serverId, error.getMessage());
                        return Mono.just(false);
                    });
        });
    }

    /**
     * Tears down the current handle and connects again with the current configuration. Concurrent
     * calls for the same server share one attempt.
     */
    public Mono<Void> forceReconnect(String serverId) {
        return singleFlight(serverId, () -> {
            McpServerInfo info = requireServer(serverId, "reconnect");
            log.info("Forcing reconnection of MCP server {}", serverId);
            return closeHandle(info)
                    .then(doConnect(serverId))
                    .then(Mono.defer(() -> info.isConnected()
                            ? Mono.<Void>empty()
                            : Mono.error(new McpConnectionException(
                                    "MCP server " + serverId + " did not reconnect", "reconnect", serverId))))
                    .timeout(properties.reconnectTimeout());
        });
    }

    /**
     * Closes the handle and marks the server disconnected. Pending automatic reconnects are
     * cancelled.
     */
    public Mono<Void> disconnect(String serverId) {
        return Mono.defer(() -> {
            cancelScheduledReconnect(serverId);
            return registry.get(serverId).map(this::closeHandle).orElseGet(Mono::empty);
        });
    }

    public void recordActivity(String serverId) {
        registry.get(serverId).ifPresent(McpServerInfo::touch);
    }

    public void resetReconnectionState(String serverId) {
        cancelScheduledReconnect(serverId);
        registry.get(serverId).ifPresent(McpServerInfo::resetReconnectAttempts);
    }

    public void markAuthExpired(String serverId) {
        registry.get(serverId).ifPresent(info -> transition(info, ConnectionState.AUTH_EXPIRED, "Authentication expired"));
    }

    public void markSessionExpired(String serverId) {
        registry.get(serverId).ifPresent(info -> transition(info, ConnectionState.SESSION_EXPIRED, "Session expired"));
    }

    /**
     * Terminal outcome of a failed recovery: the handle is discarded and the server is left
     * disconnected with the failure recorded.
     */
    public Mono<Void> markRecoveryFailed(String serverId, Throwable error) {
        return Mono.defer(() -> registry.get(serverId)
                .map(info -> closeHandle(info).then(Mono.fromRunnable(() -> info.setLastError(error.getMessage()))))
                .orElseGet(Mono::empty))
                .then();
    }

    /**
     * HTTP 401 and credential-related transport failures. A JSON-RPC error answered by the server
     * is never an auth failure, whatever its message says.
     */
    public boolean isAuthError(@Nullable Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof McpAuthenticationException) {
                return true;
            }
            if (isRpcAnswer(current)) {
                return false;
            }
            if (current instanceof McpTransportFailureException failure
                    && failure.getHttpStatus() != null && failure.getHttpStatus() == 401) {
                return true;
            }
            if (current instanceof WebClientResponseException response && response.getStatusCode().value() == 401) {
                return true;
            }
            String message = lowerMessage(current);
            if (message.contains("http 401") || message.contains("401 unauthorized")
                    || message.contains("invalid_token") || message.contains("token expired")
                    || message.contains("expired token")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Failures that mean the session or process behind the handle is gone: expired session ids,
     * HTTP 400/404 about the session, or a dead stdio process. JSON-RPC errors answered by the
     * server come from a live session and never count.
     */
    public boolean isSessionError(@Nullable Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof McpSessionException) {
                return true;
            }
            if (isRpcAnswer(current)) {
                return false;
            }
            String message = lowerMessage(current);
            if (current instanceof McpTransportFailureException failure) {
                if (failure.isSessionLost()) {
                    return true;
                }
                Integer status = failure.getHttpStatus();
                if (status != null && (status == 400 || status == 404) && message.contains("session")) {
                    return true;
                }
            }
            if (message.contains("no valid session") || message.contains("session expired")
                    || message.contains("session not found") || message.contains("invalid session id")
                    || (message.contains("http 400") && message.contains("session"))
                    || (message.contains("http 404") && message.contains("session"))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isRpcAnswer(Throwable error) {
        if (error instanceof McpTransportFailureException failure) {
            return failure.getRpcErrorCode() != null;
        }
        return error instanceof McpError mcpError && mcpError.getJsonRpcError() != null;
    }

    /**
     * Pings connected servers that have been idle longer than their health check interval and
     * schedules a reconnect for those that do not answer.
     */
    @Scheduled(fixedDelayString = "${mcp.health-check-interval:PT1M}",
            initialDelayString = "${mcp.health-check-interval:PT1M}")
    public void performHealthChecks() {
        runHealthChecks().block(properties.pingTimeout().plus(CLOSE_TIMEOUT));
    }

    Mono<Void> runHealthChecks() {
        Instant now = Instant.now();
        return Flux.fromIterable(registry.all())
                .filter(McpServerInfo::isConnected)
                .filter(info -> info.config().isHealthCheckEnabled())
                .filter(info -> info.lastActivity().plus(idleThreshold(info.config())).isBefore(now))
                .flatMap(this::checkHealth)
                .then();
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        cleanup();
    }

    /**
     * Closes every connection. Called on shutdown.
     */
    public void cleanup() {
        scheduledReconnects.values().forEach(Disposable::dispose);
        scheduledReconnects.clear();
        Flux.fromIterable(registry.all())
                .filter(info -> info.handle() != null)
                .flatMap(this::closeHandle)
                .then()
                .block(CLOSE_TIMEOUT.multipliedBy(2));
        log.info("Closed all MCP connections");
    }

    private Mono<Void> doConnect(String serverId) {
        return Mono.defer(() -> {
            McpServerInfo info = requireServer(serverId, "connect");
            if (info.isConnected()) {
                return Mono.empty();
            }
            transition(info, ConnectionState.CONNECTING, "Connecting");
            return credentials(info)
                    .flatMap(credentials -> {
                        if (credentials.awaitingAuthorization()) {
                            log.info("MCP server {} requires authorization before it can connect", serverId);
                            transition(info, ConnectionState.DISCONNECTED, "Awaiting authorization");
                            return Mono.empty();
                        }
                        return handleFactory.open(info.config(), credentials.accessToken())
                                .timeout(properties.initializationTimeout())
                                .flatMap(handle -> install(info, handle));
                    })
                    .onErrorMap(error -> connectFailure(serverId, error))
                    .doOnError(error -> {
                        info.setLastError(error.getMessage());
                        transition(info, ConnectionState.DISCONNECTED, error.getMessage());
                        log.error("Failed to connect MCP server {}: {}", serverId, error.getMessage());
                    })
                    .doOnCancel(() -> {
                        if (info.compareAndSetState(ConnectionState.CONNECTING, ConnectionState.DISCONNECTED)) {
                            log.info("Connection attempt for MCP server {} was cancelled", serverId);
                        }
                    });
        });
    }

    private Mono<Credentials> credentials(McpServerInfo info) {
        McpServerConfig config = info.config();
        if (!(config instanceof HttpServerConfig http) || http.oauth() == null) {
            return Mono.just(Credentials.NONE);
        }
        if (http.oauth().token() == null && http.oauth().grantType() == OAuthGrantType.AUTHORIZATION_CODE) {
            return oauthService.generateAuthorizationUrl(info.serverId())
                    .thenReturn(Credentials.AWAITING_AUTHORIZATION);
        }
        return oauthService.ensureValidToken(info.serverId())
                .map(token -> new Credentials(token.accessToken(), false))
                .defaultIfEmpty(Credentials.NONE);
    }

    private Mono<Void> install(McpServerInfo info, McpServerHandle handle) {
        if (registry.get(info.serverId()).orElse(null) != info) {
            log.info("MCP server {} was removed while connecting, closing new connection", info.serverId());
            return handle.close().onErrorResume(error -> Mono.empty());
        }
        McpServerHandle previous = info.handle();
        info.setHandle(handle);
        info.setLastError(null);
        info.setPendingAuthUrl(null);
        info.resetReconnectAttempts();
        info.touch();
        transition(info, ConnectionState.CONNECTED, "Connected");
        log.info("Connected to MCP server {} ({})", info.serverId(), info.config().transport().wireName());
        return previous == null ? Mono.empty() : quietly(previous.close(), info.serverId());
    }

    private Mono<Void> closeHandle(McpServerInfo info) {
        return Mono.defer(() -> {
            McpServerHandle handle = info.handle();
            info.setHandle(null);
            transition(info, ConnectionState.DISCONNECTED, "Disconnected");
            return handle == null ? Mono.empty() : quietly(handle.close(), info.serverId());
        });
    }

    private Mono<Void> checkHealth(McpServerInfo info) {
        McpServerHandle handle = info.handle();
        if (handle == null) {
            return Mono.empty();
        }
        return handle.ping()
                .timeout(properties.pingTimeout())
                .doOnSuccess(ignored -> info.touch())
                .onErrorResume(error -> {
                    log.warn("Health check failed for MCP server {}: {}", info.serverId(), error.getMessage());
                    info.setLastError(error.getMessage());
                    return closeHandle(info).then(Mono.fromRunnable(() -> scheduleReconnect(info)));
                });
    }

    /**
     * Schedules an automatic reconnect with exponential backoff, up to the transport's attempt limit.
     */
    void scheduleReconnect(McpServerInfo info) {
        McpProperties.Reconnect policy = info.config() instanceof StdioServerConfig
                ? properties.getStdioReconnect()
                : properties.getHttpReconnect();
        int attempt = info.incrementReconnectAttempts();
        if (attempt > policy.maxAttempts()) {
            log.error("Giving up on MCP server {} after {} reconnect attempts", info.serverId(), policy.maxAttempts());
            return;
        }
        Duration delay = policy.delayFor(attempt);
        log.info("Reconnecting MCP server {} in {} (attempt {}/{})",
                info.serverId(), delay, attempt, policy.maxAttempts());

        Disposable task = Mono.delay(delay)
                .then(connectServer(info.serverId()))
                .subscribe(
                        null,
                        error -> {
                            scheduledReconnects.remove(info.serverId());
                            if (registry.get(info.serverId()).orElse(null) == info) {
                                scheduleReconnect(info);
                            }
                        },
                        () -> scheduledReconnects.remove(info.serverId()));
        Disposable previous = scheduledReconnects.put(info.serverId(), task);
        if (previous != null) {
            previous.dispose();
        }
    }

    private void cancelScheduledReconnect(String serverId) {
        Disposable task = scheduledReconnects.remove(serverId);
        if (task != null) {
            task.dispose();
        }
    }

    /**
     * Shares one attempt between concurrent callers. The entry leaves the map before the attempt's
     * terminal signal reaches any caller, so a caller reacting to that signal starts a new attempt.
     */
    private Mono<Void> singleFlight(String serverId, Supplier<Mono<Void>> work) {
        return Mono.defer(() -> {
                    AtomicReference<Mono<Void>> self = new AtomicReference<>();
                    Mono<Void> attempt = Mono.defer(work)
                            .doOnTerminate(() -> inflightConnects.remove(serverId, self.get()))
                            .doOnCancel(() -> inflightConnects.remove(serverId, self.get()))
                            .cache();
                    self.set(attempt);
                    Mono<Void> existing = inflightConnects.putIfAbsent(serverId, attempt);
                    return existing != null ? existing : attempt;
                })
                .doOnCancel(() -> registry.get(serverId).ifPresent(info -> {
                    if (info.compareAndSetState(ConnectionState.CONNECTING, ConnectionState.DISCONNECTED)) {
                        log.info("Caller cancelled while MCP server {} was connecting", serverId);
                    }
                }));
    }

    private void transition(McpServerInfo info, ConnectionState state, String message) {
        ConnectionState previous = info.setState(state);
        if (previous != state) {
            statusPublisher.publishStateChange(info, previous, message);
        }
    }

    private McpServerInfo requireServer(String serverId, String action) {
        return registry.get(serverId).orElseThrow(() -> new McpConnectionException(
                "MCP server " + serverId + " is not registered", action, serverId));
    }

    private Duration idleThreshold(McpServerConfig config) {
        Integer minutes = config.healthCheckIdleMinutes();
        return minutes != null ? Duration.ofMinutes(minutes) : properties.healthCheckIdle();
    }

    private static McpClientException connectFailure(String serverId, Throwable error) {
        if (error instanceof McpAuthenticationException || error instanceof McpConnectionException) {
            return (McpClientException) error;
        }
        String reason = error instanceof TimeoutException
                ? "timed out" : error.getMessage();
        return new McpConnectionException(
                "Failed to connect to MCP server " + serverId + ": " + reason, "connect", serverId, error);
    }

    private static Mono<Void> quietly(Mono<Void> close, String serverId) {
        return close
                .timeout(CLOSE_TIMEOUT)
                .onErrorResume(error -> {
                    log.warn("Error while closing connection to MCP server {}: {}", serverId, error.getMessage());
                    return Mono.empty();
                });
    }

    private static String lowerMessage(Throwable error) {
        return error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
    }

    private record Credentials(@Nullable String accessToken, boolean awaitingAuthorization) {

        static final Credentials NONE = new Credentials(null, false);
        static final Credentials AWAITING_AUTHORIZATION = new Credentials(null, true);
    }
}
