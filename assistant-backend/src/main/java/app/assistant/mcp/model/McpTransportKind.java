package app.assistant.mcp.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Channel used to reach an MCP server.
 */
public enum McpTransportKind {
    STDIO("stdio"),
    HTTP("http");

    private final String wireName;

    McpTransportKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static McpTransportKind fromString(String value) {
        if (value == null) {
            return null;
        }
        for (McpTransportKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value.trim()) || kind.name().equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown MCP transport: " + value);
    }
}
