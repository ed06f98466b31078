package app.assistant.mcp.transport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import reactor.core.publisher.Mono;

/**
 * In-memory MCP server. Holds text resources keyed by uri, implements the resource tools and
 * can be told to fail the next calls of an operation.
 */
public class FakeMcpServerHandle implements McpServerHandle {

    public static final String LIST_RESOURCES = "listResources";
    public static final String READ_RESOURCE = "readResource";
    public static final String LIST_TOOLS = "listTools";
    public static final String CALL_TOOL = "callTool";
    public static final String PING = "ping";

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final Map<String, String> resources = new LinkedHashMap<>();
    private final Map<String, Deque<Throwable>> failures = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final List<String> toolNames = new ArrayList<>(List.of(
            "search_resources", "write_resource", "move_resource", "delete_resource", "echo"));
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean supportsResources = true;
    private volatile Map<String, Object> lastMeta = Map.of();

    public FakeMcpServerHandle withResource(String uri, String text) {
        synchronized (resources) {
            resources.put(uri, text);
        }
        return this;
    }

    public FakeMcpServerHandle withTools(String... names) {
        toolNames.clear();
        toolNames.addAll(List.of(names));
        return this;
    }

    public FakeMcpServerHandle withoutResourceSupport() {
        supportsResources = false;
        return this;
    }

    /**
     * The next call of {@code operation} fails with {@code error}. Queued failures are consumed in order.
     */
    public FakeMcpServerHandle failNext(String operation, Throwable error) {
        failures.computeIfAbsent(operation, key -> new ArrayDeque<>()).add(error);
        return this;
    }

    public int calls(String operation) {
        AtomicInteger count = calls.get(operation);
        return count == null ? 0 : count.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public Map<String, Object> lastMeta() {
        return lastMeta;
    }

    @Override
    public Mono<JsonNode> listResources(String cursor) {
        return call(LIST_RESOURCES, () -> {
            ObjectNode result = JSON.objectNode();
            ArrayNode list = result.putArray("resources");
            synchronized (resources) {
                resources.keySet().forEach(uri -> list.addObject()
                        .put("uri", uri)
                        .put("name", uri)
                        .put("mimeType", "text/markdown"));
            }
            return result;
        });
    }

    @Override
    public Mono<JsonNode> readResource(String uri) {
        return call(READ_RESOURCE, () -> {
            String text;
            synchronized (resources) {
                text = resources.get(uri);
            }
            if (text == null) {
                throw McpTransportFailureException.rpcError("fake", "read-resource", -32002, "Resource not found: " + uri);
            }
            ObjectNode result = JSON.objectNode();
            result.putArray("contents").addObject()
                    .put("uri", uri)
                    .put("mimeType", "text/markdown")
                    .put("text", text);
            return result;
        });
    }

    @Override
    public Mono<JsonNode> listTools() {
        return call(LIST_TOOLS, () -> {
            ObjectNode result = JSON.objectNode();
            ArrayNode tools = result.putArray("tools");
            toolNames.forEach(name -> tools.addObject().put("name", name).put("description", "Fake " + name));
            return result;
        });
    }

    @Override
    public Mono<JsonNode> callTool(String name, Map<String, Object> arguments, Map<String, Object> meta) {
        return call(CALL_TOOL, () -> {
            if (!toolNames.contains(name)) {
                throw McpTransportFailureException.rpcError("fake", "call-tool", -32601, "Method not found: " + name);
            }
            lastMeta = Map.copyOf(meta);
            ObjectNode result = JSON.objectNode();
            result.set("structuredContent", runTool(name, arguments));
            if ("echo".equals(name)) {
                result.putArray("content").addObject().put("type", "text").put("text", String.valueOf(arguments));
                result.putObject("_meta").put("toolResponse", "echoed");
            }
            return result;
        });
    }

    @Override
    public Mono<Void> ping() {
        return call(PING, JSON::objectNode).then();
    }

    @Override
    public boolean supportsResources() {
        return supportsResources;
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(() -> closed.set(true));
    }

    private ObjectNode runTool(String name, Map<String, Object> arguments) {
        ObjectNode payload = JSON.objectNode();
        synchronized (resources) {
            switch (name) {
                case "write_resource" -> {
                    String path = (String) arguments.get("path");
                    String content = (String) arguments.get("content");
                    resources.put(path, content);
                    payload.put("success", true).put("uri", path).put("bytes_written", content.length());
                }
                case "move_resource" -> {
                    String source = (String) arguments.get("sourcePath");
                    String destination = (String) arguments.get("destinationPath");
                    String content = resources.remove(source);
                    if (content != null) {
                        resources.put(destination, content);
                    }
                    payload.put("success", content != null);
                }
                case "delete_resource" -> {
                    String path = (String) arguments.get("path");
                    payload.put("success", resources.remove(path) != null).put("type", "file");
                }
                case "search_resources" -> {
                    String query = (String) arguments.get("query");
                    ArrayNode matches = payload.putArray("matches");
                    resources.forEach((uri, text) -> {
                        if (text.contains(query)) {
                            ObjectNode match = matches.addObject();
                            match.putObject("resource").put("uri", uri).put("type", "file");
                            match.putArray("snippets").add(text);
                            match.put("score", 1.0);
                        }
                    });
                    payload.put("total_matches", matches.size());
                }
                default -> payload.put("success", true);
            }
        }
        return payload;
    }

    private Mono<JsonNode> call(String operation, Supplier<JsonNode> body) {
        return Mono.fromSupplier(() -> {
            calls.computeIfAbsent(operation, key -> new AtomicInteger()).incrementAndGet();
            Deque<Throwable> queued = failures.get(operation);
            Throwable failure = queued == null ? null : queued.poll();
            if (failure instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (failure != null) {
                throw new IllegalStateException(failure);
            }
            return body.get();
        });
    }
}
