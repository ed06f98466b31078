package app.assistant.config.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import app.assistant.mcp.model.McpServerConfig;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * {@link GlobalConfigStore} backed by a single JSON document on disk.
 * <p>
 * Writes go to a sibling temp file that is then moved over the original, so readers never observe
 * a half-written document. Every read-modify-write runs under one lock on this instance.
 */
@Slf4j
public class JsonFileGlobalConfigStore implements GlobalConfigStore {

    private static final String MCP_SERVERS = "mcpServers";

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Object writeLock = new Object();

    public JsonFileGlobalConfigStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<GlobalConfig> getGlobalConfig() {
        return Mono.fromCallable(() -> objectMapper.treeToValue(readDocument(), GlobalConfig.class))
                .onErrorMap(IOException.class, ex -> new ConfigStoreException("Failed to read " + file, ex))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> updateGlobalConfig(GlobalConfig config) {
        JsonNode servers = objectMapper.valueToTree(config).get(MCP_SERVERS);
        return modify(document -> document.set(MCP_SERVERS, servers));
    }

    @Override
    public Mono<Void> updateMcpServers(UnaryOperator<List<McpServerConfig>> change) {
        return modify(document -> {
            GlobalConfig current = objectMapper.treeToValue(document, GlobalConfig.class);
            List<McpServerConfig> updated = change.apply(new ArrayList<>(current.mcpServers()));
            document.set(MCP_SERVERS, objectMapper.valueToTree(current.withMcpServers(updated)).get(MCP_SERVERS));
        });
    }

    @Override
    public Mono<Void> setConfigValue(String key, Object value) {
        if (!StringUtils.hasText(key)) {
            return Mono.error(new IllegalArgumentException("Config key must not be blank"));
        }
        String[] segments = key.split("\\.");
        JsonNode node = objectMapper.valueToTree(value);
        return modify(document -> {
            ObjectNode parent = document;
            for (int i = 0; i < segments.length - 1; i++) {
                JsonNode child = parent.get(segments[i]);
                parent = child instanceof ObjectNode object ? object : parent.putObject(segments[i]);
            }
            parent.set(segments[segments.length - 1], node);
        });
    }

    private Mono<Void> modify(DocumentChange change) {
        return Mono.<Void>fromRunnable(() -> {
                    synchronized (writeLock) {
                        try {
                            ObjectNode document = readDocument();
                            change.apply(document);
                            write(document);
                        } catch (IOException ex) {
                            throw new ConfigStoreException("Failed to write " + file, ex);
                        }
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private ObjectNode readDocument() throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) {
            return objectMapper.createObjectNode();
        }
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root instanceof ObjectNode object) {
            return object;
        }
        throw new IOException("Expected a JSON object at the root of " + file);
    }

    private void write(ObjectNode document) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote configuration to {}", file);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @FunctionalInterface
    private interface DocumentChange {
        void apply(ObjectNode document) throws IOException;
    }
}
