package app.assistant.mcp.resource;

import java.time.Instant;

import org.springframework.lang.Nullable;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;

/**
 * Canonical description of one resource exposed by a server.
 *
 * @param uri          address of the resource on the server
 * @param type         resource kind as reported by the server, e.g. {@code mcp}, {@code file}, {@code directory}
 * @param contentType  coarse content class, {@code text} or {@code image} for listed resources
 * @param mimeType     full MIME type
 * @param size         size in bytes, if known
 * @param lastModified last modification time, defaulted to the time of normalization when absent
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceMetadata(
        String uri,
        String type,
        String contentType,
        @Nullable String mimeType,
        @Nullable Long size,
        Instant lastModified,
        @Nullable String name,
        @Nullable String description) {
}
