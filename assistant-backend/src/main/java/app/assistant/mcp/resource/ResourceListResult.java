package app.assistant.mcp.resource;

import java.util.List;

import org.springframework.lang.Nullable;

public record ResourceListResult(List<ResourceMetadata> resources, @Nullable String nextPageToken, boolean hasMore) {

    public ResourceListResult {
        resources = resources == null ? List.of() : List.copyOf(resources);
    }
}
