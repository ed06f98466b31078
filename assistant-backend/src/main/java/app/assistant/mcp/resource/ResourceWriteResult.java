package app.assistant.mcp.resource;

public record ResourceWriteResult(boolean success, String uri, ResourceMetadata metadata, long bytesWritten) {
}
