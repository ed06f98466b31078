package app.assistant.mcp.web.dto;

import java.util.Base64;

import app.assistant.mcp.resource.ResourceContent;
import app.assistant.mcp.resource.ResourceWriteOptions;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * @param binary whether {@code content} is base64 encoded bytes
 */
public record ResourceWriteRequest(
        @NotBlank String path,
        @NotNull String content,
        boolean binary,
        ResourceWriteOptions options
) {

    public ResourceContent toContent() {
        return binary ? ResourceContent.ofBytes(Base64.getDecoder().decode(content)) : ResourceContent.ofText(content);
    }
}
