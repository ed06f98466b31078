package app.assistant.mcp.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Validated
@ConfigurationProperties(prefix = "mcp")
public class McpProperties {

    @NotBlank
    private String encryptionKey;

    @NotBlank
    private String clientName = "assistant-backend";

    @NotBlank
    private String clientVersion = "1.0.0";

    /**
     * JSON file holding the persisted server list.
     */
    @NotBlank
    private String configFile = "config/mcp-servers.json";

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration initializationTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration reconnectTimeout = Duration.ofSeconds(60);

    @NotNull
    private Duration tokenRefreshTimeout = Duration.ofSeconds(15);

    @NotNull
    private Duration pingTimeout = Duration.ofSeconds(10);

    /**
     * Idle time after which a connected server is pinged, unless the server overrides it.
     */
    @NotNull
    private Duration healthCheckIdle = Duration.ofMinutes(5);

    @NotNull
    private Duration healthCheckInterval = Duration.ofMinutes(1);

    @Valid
    private final Reconnect stdioReconnect = new Reconnect(5, Duration.ofSeconds(1), Duration.ofSeconds(30));

    @Valid
    private final Reconnect httpReconnect = new Reconnect(60, Duration.ofSeconds(60), Duration.ofMinutes(5));

    @Valid
    private final OAuth oauth = new OAuth();

    public String encryptionKey() {
        return encryptionKey;
    }

    public void setEncryptionKey(String encryptionKey) {
        this.encryptionKey = encryptionKey;
    }

    public String clientName() {
        return clientName;
    }

    public void setClientName(String clientName) {
        this.clientName = clientName;
    }

    public String clientVersion() {
        return clientVersion;
    }

    public void setClientVersion(String clientVersion) {
        this.clientVersion = clientVersion;
    }

    public String configFile() {
        return configFile;
    }

    public void setConfigFile(String configFile) {
        this.configFile = configFile;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration initializationTimeout() {
        return initializationTimeout;
    }

    public void setInitializationTimeout(Duration initializationTimeout) {
        this.initializationTimeout = initializationTimeout;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration reconnectTimeout() {
        return reconnectTimeout;
    }

    public void setReconnectTimeout(Duration reconnectTimeout) {
        this.reconnectTimeout = reconnectTimeout;
    }

    public Duration tokenRefreshTimeout() {
        return tokenRefreshTimeout;
    }

    public void setTokenRefreshTimeout(Duration tokenRefreshTimeout) {
        this.tokenRefreshTimeout = tokenRefreshTimeout;
    }

    public Duration pingTimeout() {
        return pingTimeout;
    }

    public void setPingTimeout(Duration pingTimeout) {
        this.pingTimeout = pingTimeout;
    }

    public Duration healthCheckIdle() {
        return healthCheckIdle;
    }

    public void setHealthCheckIdle(Duration healthCheckIdle) {
        this.healthCheckIdle = healthCheckIdle;
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public void setHealthCheckInterval(Duration healthCheckInterval) {
        this.healthCheckInterval = healthCheckInterval;
    }

    public Reconnect getStdioReconnect() {
        return stdioReconnect;
    }

    public Reconnect getHttpReconnect() {
        return httpReconnect;
    }

    public OAuth getOauth() {
        return oauth;
    }

    /**
     * Exponential backoff used when a connection drops.
     */
    public static class Reconnect {

        @Min(0)
        private int maxAttempts;

        @NotNull
        private Duration initialDelay;

        @NotNull
        private Duration maxDelay;

        public Reconnect() {
        }

        public Reconnect(int maxAttempts, Duration initialDelay, Duration maxDelay) {
            this.maxAttempts = maxAttempts;
            this.initialDelay = initialDelay;
            this.maxDelay = maxDelay;
        }

        public int maxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration initialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration maxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        /**
         * Delay before the given (1-based) attempt: {@code initialDelay * 2^(attempt-1)}, capped.
         */
        public Duration delayFor(int attempt) {
            long factor = 1L << Math.min(Math.max(attempt - 1, 0), 20);
            Duration delay = initialDelay.multipliedBy(factor);
            return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
        }
    }

    public static class OAuth {

        @NotBlank
        private String clientName = "Assistant MCP Client";

        @NotBlank
        private String redirectUri = "http://localhost:8080/api/mcp/oauth/callback";

        @NotNull
        private Duration refreshWindow = Duration.ofMinutes(5);

        @NotNull
        private Duration stateTtl = Duration.ofMinutes(10);

        public String clientName() {
            return clientName;
        }

        public void setClientName(String clientName) {
            this.clientName = clientName;
        }

        public String redirectUri() {
            return redirectUri;
        }

        public void setRedirectUri(String redirectUri) {
            this.redirectUri = redirectUri;
        }

        public Duration refreshWindow() {
            return refreshWindow;
        }

        public void setRefreshWindow(Duration refreshWindow) {
            this.refreshWindow = refreshWindow;
        }

        public Duration stateTtl() {
            return stateTtl;
        }

        public void setStateTtl(Duration stateTtl) {
            this.stateTtl = stateTtl;
        }
    }
}
