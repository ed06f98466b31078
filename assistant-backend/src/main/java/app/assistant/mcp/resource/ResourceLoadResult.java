package app.assistant.mcp.resource;

public record ResourceLoadResult(ResourceContent content, ResourceMetadata metadata, boolean partial) {
}
