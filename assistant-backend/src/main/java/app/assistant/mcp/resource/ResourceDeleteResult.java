package app.assistant.mcp.resource;

import org.springframework.lang.Nullable;

public record ResourceDeleteResult(boolean success, String uri, String type, @Nullable String trashUri) {
}
