package app.assistant.mcp.resource;

import org.springframework.lang.Nullable;

import lombok.Builder;

@Builder
public record ResourceMoveOptions(@Nullable Boolean createMissingDirectories, @Nullable Boolean overwrite) {

    public static ResourceMoveOptions defaults() {
        return ResourceMoveOptions.builder().build();
    }
}
