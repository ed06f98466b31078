package app.assistant.mcp.web.dto;

import app.assistant.mcp.resource.ResourceMoveOptions;
import jakarta.validation.constraints.NotBlank;

public record ResourceMoveRequest(
        @NotBlank String sourcePath,
        @NotBlank String destinationPath,
        ResourceMoveOptions options
) {
}
