package app.assistant.mcp.web.dto;

import app.assistant.mcp.resource.ResourceLoadResult;
import app.assistant.mcp.resource.ResourceMetadata;

/**
 * Loaded resource. Binary content is base64 encoded.
 */
public record ResourceContentResponse(String content, boolean binary, ResourceMetadata metadata, boolean partial) {

    public static ResourceContentResponse of(ResourceLoadResult result) {
        return new ResourceContentResponse(result.content().toWireValue(), result.content().isBinary(),
                result.metadata(), result.partial());
    }
}
