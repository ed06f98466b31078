package app.assistant.mcp.resource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * Text or binary resource content.
 */
public final class ResourceContent {

    private final String text;
    private final byte[] bytes;

    private ResourceContent(String text, byte[] bytes) {
        this.text = text;
        this.bytes = bytes;
    }

    public static ResourceContent ofText(String text) {
        return new ResourceContent(text == null ? "" : text, null);
    }

    public static ResourceContent ofBytes(byte[] bytes) {
        return new ResourceContent(null, bytes == null ? new byte[0] : bytes.clone());
    }

    public boolean isBinary() {
        return bytes != null;
    }

    public String asText() {
        return isBinary() ? new String(bytes, StandardCharsets.UTF_8) : text;
    }

    public byte[] asBytes() {
        return isBinary() ? bytes.clone() : text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Form sent over the wire: text as-is, binary as base64.
     */
    public String toWireValue() {
        return isBinary() ? Base64.getEncoder().encodeToString(bytes) : text;
    }

    public long size() {
        return isBinary() ? bytes.length : text.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ResourceContent that)) {
            return false;
        }
        return isBinary() == that.isBinary()
                && (isBinary() ? Arrays.equals(bytes, that.bytes) : text.equals(that.text));
    }

    @Override
    public int hashCode() {
        return isBinary() ? Arrays.hashCode(bytes) : text.hashCode();
    }

    @Override
    public String toString() {
        return isBinary() ? "ResourceContent[binary, " + bytes.length + " bytes]"
                : "ResourceContent[text, " + text.length() + " chars]";
    }
}
