package app.assistant.mcp.resource;

import java.util.List;

import org.springframework.lang.Nullable;

import lombok.Builder;

@Builder
public record ResourceSearchOptions(
        @Nullable String path,
        @Nullable Boolean caseSensitive,
        @Nullable Integer limit,
        @Nullable List<String> includeTypes,
        @Nullable String filePattern) {

    public static ResourceSearchOptions defaults() {
        return ResourceSearchOptions.builder().build();
    }
}
