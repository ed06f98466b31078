package app.assistant.mcp.web.dto;

import app.assistant.mcp.resource.ResourceSearchOptions;
import jakarta.validation.constraints.NotBlank;

public record ResourceSearchRequest(@NotBlank String query, ResourceSearchOptions options) {
}
