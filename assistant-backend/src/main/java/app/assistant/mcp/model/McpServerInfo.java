package app.assistant.mcp.model;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.lang.Nullable;

import app.assistant.mcp.resource.ResourceMetadata;
import app.assistant.mcp.tool.McpToolDescriptor;
import app.assistant.mcp.transport.McpServerHandle;

/**
 * Runtime record of one registered server.
 * <p>
 * Exactly one instance exists per server id. The connection handle is installed only by the
 * connection service; the resource cache is written only by the resource service.
 */
public final class McpServerInfo {

    public static final List<String> DEFAULT_CAPABILITIES = List.of("read", "list");

    private final String serverId;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicInteger reconnectAttempts = new AtomicInteger();

    private volatile McpServerConfig config;
    private volatile McpServerHandle handle;
    private volatile List<String> capabilities = DEFAULT_CAPABILITIES;
    private volatile List<ResourceMetadata> resources;
    private volatile List<McpToolDescriptor> tools;
    private volatile Instant lastActivity = Instant.now();
    private volatile String lastError;
    private volatile String pendingAuthUrl;

    public McpServerInfo(McpServerConfig config) {
        this.serverId = config.id();
        this.config = config;
    }

    public String serverId() {
        return serverId;
    }

    public McpServerConfig config() {
        return config;
    }

    public void updateConfig(McpServerConfig config) {
        if (!serverId.equals(config.id())) {
            throw new IllegalArgumentException("Config id " + config.id() + " does not match server " + serverId);
        }
        this.config = config;
    }

    public ConnectionState state() {
        return state.get();
    }

    public ConnectionState setState(ConnectionState newState) {
        return state.getAndSet(newState);
    }

    public boolean compareAndSetState(ConnectionState expected, ConnectionState newState) {
        return state.compareAndSet(expected, newState);
    }

    @Nullable
    public McpServerHandle handle() {
        return handle;
    }

    public void setHandle(@Nullable McpServerHandle handle) {
        this.handle = handle;
    }

    public boolean isConnected() {
        return state.get() == ConnectionState.CONNECTED && handle != null;
    }

    public List<String> capabilities() {
        return capabilities;
    }

    public void setCapabilities(List<String> capabilities) {
        this.capabilities = List.copyOf(capabilities);
    }

    @Nullable
    public List<ResourceMetadata> resources() {
        return resources;
    }

    public void setResources(@Nullable List<ResourceMetadata> resources) {
        this.resources = resources == null ? null : List.copyOf(resources);
    }

    @Nullable
    public List<McpToolDescriptor> tools() {
        return tools;
    }

    public void setTools(@Nullable List<McpToolDescriptor> tools) {
        this.tools = tools == null ? null : List.copyOf(tools);
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public void touch() {
        this.lastActivity = Instant.now();
    }

    @Nullable
    public String lastError() {
        return lastError;
    }

    public void setLastError(@Nullable String lastError) {
        this.lastError = lastError;
    }

    @Nullable
    public String pendingAuthUrl() {
        return pendingAuthUrl;
    }

    public void setPendingAuthUrl(@Nullable String pendingAuthUrl) {
        this.pendingAuthUrl = pendingAuthUrl;
    }

    public int reconnectAttempts() {
        return reconnectAttempts.get();
    }

    public int incrementReconnectAttempts() {
        return reconnectAttempts.incrementAndGet();
    }

    public void resetReconnectAttempts() {
        reconnectAttempts.set(0);
    }

    @Override
    public String toString() {
        return "McpServerInfo[" + serverId + ", " + config.transport().wireName() + ", " + state.get() + "]";
    }
}
