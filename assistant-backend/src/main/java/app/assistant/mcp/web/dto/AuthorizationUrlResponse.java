package app.assistant.mcp.web.dto;

public record AuthorizationUrlResponse(String serverId, String authorizationUrl) {
}
