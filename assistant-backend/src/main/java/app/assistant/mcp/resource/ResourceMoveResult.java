package app.assistant.mcp.resource;

public record ResourceMoveResult(boolean success, String sourceUri, String destinationUri, ResourceMetadata metadata) {
}
