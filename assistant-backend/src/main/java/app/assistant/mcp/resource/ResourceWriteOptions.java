package app.assistant.mcp.resource;

import java.util.Map;

import org.springframework.lang.Nullable;

import lombok.Builder;

@Builder
public record ResourceWriteOptions(
        @Nullable Boolean createMissingDirectories,
        @Nullable Boolean overwrite,
        @Nullable String encoding,
        @Nullable String contentType,
        @Nullable Map<String, Object> metadata) {

    public static ResourceWriteOptions defaults() {
        return ResourceWriteOptions.builder().build();
    }
}
