package app.assistant.mcp.resource;

import org.springframework.lang.Nullable;

import lombok.Builder;

@Builder
public record ResourceDeleteOptions(@Nullable Boolean recursive, @Nullable Boolean permanent) {

    public static ResourceDeleteOptions defaults() {
        return ResourceDeleteOptions.builder().build();
    }
}
