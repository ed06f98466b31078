package app.assistant.mcp.resource;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import app.assistant.mcp.error.McpExternalServiceException;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns MCP wire responses into the canonical resource envelopes.
 * <p>
 * Servers disagree on field spelling ({@code last_modified} vs {@code lastModified},
 * {@code mime_type} vs {@code contentType}, ...). Every spelling is resolved here and nowhere else.
 */
@Component
@Slf4j
public class McpResourceAdapter {

    static final String DEFAULT_MIME_TYPE = "text/plain";
    static final String OCTET_STREAM = "application/octet-stream";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public McpResourceAdapter(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemUTC());
    }

    McpResourceAdapter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * {@code resources/list} result. Listed resources are typed {@code mcp}; the content type is
     * {@code image} for image MIME types and {@code text} otherwise.
     */
    public ResourceListResult toListResult(JsonNode listResult) {
        List<ResourceMetadata> resources = new ArrayList<>();
        for (JsonNode resource : listResult.path("resources")) {
            String mimeType = text(resource, "mimeType", "mime_type", "contentType");
            String effectiveMime = mimeType != null ? mimeType : DEFAULT_MIME_TYPE;
            resources.add(ResourceMetadata.builder()
                    .uri(uri(resource, ""))
                    .type("mcp")
                    .contentType(effectiveMime.toLowerCase(Locale.ROOT).startsWith("image/") ? "image" : "text")
                    .mimeType(effectiveMime)
                    .size(number(resource, "size"))
                    .lastModified(lastModified(resource.has("annotations") ? resource.get("annotations") : resource))
                    .name(text(resource, "name", "title"))
                    .description(text(resource, "description"))
                    .build());
        }
        String next = text(listResult, "nextCursor", "nextPageToken", "continuation_token");
        boolean hasMore = flag(listResult, "hasMore", "has_more") || next != null;
        return new ResourceListResult(resources, next, hasMore);
    }

    /**
     * {@code resources/read} result. Text parts are concatenated; a single blob part is decoded.
     *
     * @throws McpExternalServiceException if the blob is not valid base64
     */
    public ResourceLoadResult toLoadResult(JsonNode readResult, String serverId, String requestedUri) {
        JsonNode contents = readResult.path("contents");
        JsonNode first = contents.size() > 0 ? contents.get(0) : objectMapper.createObjectNode();

        ResourceContent content;
        if (contents.size() == 1 && first.hasNonNull("blob")) {
            content = ResourceContent.ofBytes(decodeBlob(first.get("blob").asText(), serverId, requestedUri));
        } else {
            StringBuilder text = new StringBuilder();
            for (JsonNode part : contents) {
                if (part.hasNonNull("text")) {
                    text.append(part.get("text").asText());
                }
            }
            content = ResourceContent.ofText(text.toString());
        }

        String mimeType = text(first, "mimeType", "mime_type", "contentType");
        ResourceMetadata metadata = ResourceMetadata.builder()
                .uri(uri(first, requestedUri))
                .type(textOr(first, "file", "type"))
                .contentType(mimeType != null ? mimeType : content.isBinary() ? OCTET_STREAM : DEFAULT_MIME_TYPE)
                .mimeType(mimeType)
                .size(content.size())
                .lastModified(lastModified(first))
                .build();
        return new ResourceLoadResult(content, metadata, flag(readResult, "isPartial", "is_partial", "partial"));
    }

    private static byte[] decodeBlob(String blob, String serverId, String requestedUri) {
        try {
            return Base64.getDecoder().decode(blob);
        } catch (IllegalArgumentException e) {
            throw new McpExternalServiceException("MCP server " + serverId + " returned malformed base64 content for "
                    + requestedUri, "load-resource", serverId, e);
        }
    }

    /**
     * Extracts the JSON payload of a {@code tools/call} result: {@code structuredContent} if
     * present, otherwise the first text part parsed as JSON.
     *
     * @throws McpExternalServiceException if the tool reported an error
     */
    public JsonNode toolPayload(JsonNode callToolResult, String serverId, String toolName) {
        String text = firstText(callToolResult);
        if (callToolResult.path("isError").asBoolean(false)) {
            throw new McpExternalServiceException(
                    "Tool " + toolName + " failed on MCP server " + serverId + (text != null ? ": " + text : ""),
                    toolName, serverId);
        }
        JsonNode structured = callToolResult.get("structuredContent");
        if (structured != null && structured.isObject()) {
            return structured;
        }
        if (text == null) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode parsed = objectMapper.readTree(text);
            if (parsed != null && parsed.isObject()) {
                return parsed;
            }
        } catch (IOException ex) {
            log.debug("Tool {} on MCP server {} returned plain text", toolName, serverId);
        }
        ObjectNode wrapper = objectMapper.createObjectNode();
        wrapper.put("text", text);
        return wrapper;
    }

    public ResourceSearchResult toSearchResult(JsonNode payload) {
        List<ResourceSearchResult.ResourceMatch> matches = new ArrayList<>();
        for (JsonNode match : payload.path("matches")) {
            JsonNode resource = match.path("resource");
            List<String> snippets = new ArrayList<>();
            match.path("snippets").forEach(snippet -> snippets.add(snippet.asText()));
            matches.add(new ResourceSearchResult.ResourceMatch(
                    metadata(resource, "", "unknown", OCTET_STREAM, null),
                    snippets,
                    match.path("score").asDouble(0)));
        }
        Long total = number(payload, "totalMatches", "total_matches");
        return new ResourceSearchResult(matches, total != null ? total.intValue() : matches.size());
    }

    public ResourceWriteResult toWriteResult(JsonNode payload, String path, ResourceContent content,
                                             ResourceWriteOptions options) {
        String uri = textOr(payload, path, "uri", "path");
        String defaultContentType = options.contentType() != null ? options.contentType() : OCTET_STREAM;
        ResourceMetadata metadata = metadata(payload.path("metadata"), uri, "file", defaultContentType, content.size());
        Long written = number(payload, "bytesWritten", "bytes_written");
        return new ResourceWriteResult(isSuccess(payload), uri, metadata, written != null ? written : content.size());
    }

    public ResourceMoveResult toMoveResult(JsonNode payload, String sourcePath, String destinationPath) {
        ResourceMetadata metadata = metadata(payload.path("metadata"), destinationPath, "file", OCTET_STREAM, 0L);
        return new ResourceMoveResult(isSuccess(payload), sourcePath, destinationPath, metadata);
    }

    public ResourceDeleteResult toDeleteResult(JsonNode payload, String path) {
        return new ResourceDeleteResult(isSuccess(payload), path, textOr(payload, "unknown", "type"),
                text(payload, "trashUri", "trash_uri"));
    }

    private ResourceMetadata metadata(JsonNode node, String fallbackUri, String defaultType,
                                      String defaultContentType, @Nullable Long defaultSize) {
        String mimeType = text(node, "mimeType", "mime_type");
        Long size = number(node, "size");
        return ResourceMetadata.builder()
                .uri(uri(node, fallbackUri))
                .type(textOr(node, defaultType, "type"))
                .contentType(textOr(node, mimeType != null ? mimeType : defaultContentType, "contentType", "content_type"))
                .mimeType(mimeType)
                .size(size != null ? size : defaultSize)
                .lastModified(lastModified(node))
                .name(text(node, "name"))
                .description(text(node, "description"))
                .build();
    }

    // only a literal true counts as success
    private static boolean isSuccess(JsonNode payload) {
        JsonNode success = payload.get("success");
        return success != null && success.isBoolean() && success.booleanValue();
    }

    private Instant lastModified(JsonNode node) {
        String value = text(node, "lastModified", "last_modified");
        if (value != null) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException ex) {
                log.debug("Ignoring unparseable lastModified value '{}'", value);
            }
        }
        return clock.instant();
    }

    private static String uri(JsonNode node, String fallback) {
        return textOr(node, fallback, "uri", "path");
    }

    private static String textOr(JsonNode node, String fallback, String... fields) {
        String value = text(node, fields);
        return value != null ? value : fallback;
    }

    @Nullable
    private static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && value.isValueNode() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return null;
    }

    @Nullable
    private static Long number(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.canConvertToLong()) {
                return value.longValue();
            }
        }
        return null;
    }

    private static boolean flag(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.asBoolean(false)) {
                return true;
            }
        }
        return false;
    }

    @Nullable
    private static String firstText(JsonNode callToolResult) {
        for (JsonNode part : callToolResult.path("content")) {
            if ("text".equals(part.path("type").asText()) && part.hasNonNull("text")) {
                return part.get("text").asText();
            }
        }
        return null;
    }
}
