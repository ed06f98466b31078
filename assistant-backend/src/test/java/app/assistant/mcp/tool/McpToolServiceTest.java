package app.assistant.mcp.tool;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.ObjectMapper;

import app.assistant.config.store.InMemoryGlobalConfigStore;
import app.assistant.mcp.config.McpProperties;
import app.assistant.mcp.connection.McpConnectionService;
import app.assistant.mcp.error.McpExternalServiceException;
import app.assistant.mcp.events.McpServerStatusPublisher;
import app.assistant.mcp.model.StdioServerConfig;
import app.assistant.mcp.oauth.McpOAuthService;
import app.assistant.mcp.registry.McpServerConfigValidator;
import app.assistant.mcp.registry.McpServerRegistry;
import app.assistant.mcp.resource.McpResourceAdapter;
import app.assistant.mcp.resource.McpResourceService;
import app.assistant.mcp.transport.FakeMcpServerHandle;
import app.assistant.mcp.transport.FakeMcpServerHandleFactory;
import app.assistant.mcp.transport.McpTransportFailureException;
import app.assistant.security.AesGcmSecretEncryptor;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class McpToolServiceTest {

    @Mock
    private McpOAuthService oauthService;

    @Mock
    private McpServerStatusPublisher statusPublisher;

    private McpServerRegistry registry;
    private FakeMcpServerHandle handle;
    private McpConnectionService connectionService;
    private McpToolService service;

    @BeforeEach
    void setUp() {
        registry = new McpServerRegistry(new InMemoryGlobalConfigStore(),
                new AesGcmSecretEncryptor("tool-test-key"), new McpServerConfigValidator());
        McpProperties properties = new McpProperties();
        handle = new FakeMcpServerHandle();
        connectionService = new McpConnectionService(registry, new FakeMcpServerHandleFactory(() -> handle),
                oauthService, properties, statusPublisher);
        McpResourceService resourceService = new McpResourceService(registry, connectionService, oauthService,
                new McpResourceAdapter(new ObjectMapper()), properties);
        service = new McpToolService(registry, connectionService, resourceService);
        registry.addServer(StdioServerConfig.builder().id("fs").name("Files").command("npx").build()).block();
    }

    @AfterEach
    void tearDown() {
        connectionService.cleanup();
    }

    @Test
    void toolListIsCachedOnServerEntry() {
        StepVerifier.create(service.listTools("fs"))
                .assertNext(tools -> assertThat(tools).extracting(McpToolDescriptor::name)
                        .contains("echo", "write_resource"))
                .verifyComplete();
        StepVerifier.create(service.listTools("fs")).expectNextCount(1).verifyComplete();

        assertThat(handle.calls(FakeMcpServerHandle.LIST_TOOLS)).isEqualTo(1);
    }

    @Test
    void refreshBypassesCache() {
        service.listTools("fs").block();
        handle.withTools("echo");

        StepVerifier.create(service.refreshToolsCache("fs"))
                .assertNext(tools -> assertThat(tools).extracting(McpToolDescriptor::name).containsExactly("echo"))
                .verifyComplete();
        assertThat(registry.get("fs").orElseThrow().tools()).hasSize(1);
    }

    @Test
    void allToolsAreSuffixedWithServerId() {
        StepVerifier.create(service.getAllTools())
                .assertNext(tools -> assertThat(tools)
                        .contains(new McpToolSummary("echo_fs", "Fake echo", "fs", "Files")))
                .verifyComplete();
    }

    @Test
    void serversWhoseToolsFailAreSkipped() {
        handle.failNext(FakeMcpServerHandle.LIST_TOOLS, new IllegalStateException("tools unavailable"));

        StepVerifier.create(service.getAllTools())
                .assertNext(tools -> assertThat(tools).isEmpty())
                .verifyComplete();
    }

    @Test
    void listingFailureIsReportedAsExternalServiceError() {
        handle.failNext(FakeMcpServerHandle.LIST_TOOLS, new IllegalStateException("tools unavailable"));

        StepVerifier.create(service.listTools("fs"))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(McpExternalServiceException.class)
                        .hasMessage("Failed to list MCP tools: tools unavailable"))
                .verify();
    }

    @Test
    void executeSendsCallerMetaAndReturnsToolResponse() {
        // given
        ToolCallContext context = new ToolCallContext("p-1", "c-1", null);

        // when / then
        StepVerifier.create(service.executeMCPTool("fs", "echo", Map.of("text", "hi"), context))
                .assertNext(result -> {
                    assertThat(result.isError()).isFalse();
                    assertThat(result.toolResponse()).isEqualTo("echoed");
                    assertThat(result.content().get(0).path("type").asText()).isEqualTo("text");
                })
                .verifyComplete();
        assertThat(handle.lastMeta()).containsExactlyInAnyOrderEntriesOf(Map.of(
                "projectId", "p-1", "collaborationId", "c-1", "userId", "unknown", "serverId", "fs"));
    }

    @Test
    void unknownToolFailsWithTransportError() {
        StepVerifier.create(service.executeMCPTool("fs", "missing", Map.of(), ToolCallContext.anonymous()))
                .expectError(McpTransportFailureException.class)
                .verify();
    }
}
