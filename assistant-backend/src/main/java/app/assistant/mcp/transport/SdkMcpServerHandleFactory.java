package app.assistant.mcp.transport;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;

import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.ObjectMapper;

import app.assistant.mcp.config.McpProperties;
import app.assistant.mcp.model.HttpServerConfig;
import app.assistant.mcp.model.McpServerConfig;
import app.assistant.mcp.model.StdioServerConfig;
import io.modelcontextprotocol.client.McpAsyncClient;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Opens connections through the MCP Java SDK: stdio servers as child processes, HTTP servers via
 * the streamable HTTP transport.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SdkMcpServerHandleFactory implements McpServerHandleFactory {

    private final McpProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<McpServerHandle> open(McpServerConfig config, @Nullable String accessToken) {
        return Mono.defer(() -> {
            McpClientTransport transport = createTransport(config, accessToken);
            McpAsyncClient client = McpClient.async(transport)
                    .clientInfo(new McpSchema.Implementation(properties.clientName(), properties.clientVersion()))
                    .capabilities(McpSchema.ClientCapabilities.builder().build())
                    .requestTimeout(properties.requestTimeout())
                    .initializationTimeout(properties.initializationTimeout())
                    .build();

            return client.initialize()
                    .map(result -> {
                        boolean resources = result.capabilities() != null
                                && result.capabilities().resources() != null;
                        log.debug("Initialized MCP session with server {} (protocol {}, resources={})",
                                config.id(), result.protocolVersion(), resources);
                        return (McpServerHandle) new SdkMcpServerHandle(config.id(), client, objectMapper, resources);
                    })
                    .onErrorResume(error -> client.closeGracefully()
                            .onErrorResume(closeError -> {
                                log.debug("Ignoring close failure after failed initialization of {}: {}",
                                        config.id(), closeError.getMessage());
                                return Mono.empty();
                            })
                            .then(Mono.error(McpFailureTranslator.translate(config.id(), "connect", error))));
        });
    }

    private McpClientTransport createTransport(McpServerConfig config, @Nullable String accessToken) {
        if (config instanceof StdioServerConfig stdio) {
            ServerParameters parameters = ServerParameters.builder(stdio.command())
                    .args(stdio.args())
                    .env(stdio.env())
                    .build();
            log.info("Starting stdio MCP server {}: {} {}", stdio.id(), stdio.command(), stdio.args());
            return new StdioClientTransport(parameters, McpJsonMapper.getDefault());
        }

        HttpServerConfig http = (HttpServerConfig) config;
        McpEndpointResolver.Endpoint endpoint = McpEndpointResolver.resolve(http.url());

        HttpClient.Builder clientBuilder = HttpClient.newBuilder()
                .connectTimeout(properties.connectTimeout());
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder();
        if (StringUtils.hasText(accessToken)) {
            requestBuilder.header("Authorization", "Bearer " + accessToken.trim());
        }

        log.info("Connecting to HTTP MCP server {} at {}", http.id(), endpoint.fullUrl());
        return HttpClientStreamableHttpTransport
                .builder(endpoint.baseUri())
                .clientBuilder(clientBuilder)
                .requestBuilder(requestBuilder)
                .endpoint(endpoint.endpoint())
                .connectTimeout(properties.connectTimeout())
                .build();
    }
}
