package app.assistant.mcp.transport;

import java.net.URI;

import org.springframework.util.StringUtils;

/**
 * Splits a configured server URL into the base URI and endpoint path expected by the streamable
 * HTTP transport.
 * <p>
 * A URL with a path is used exactly as given. A bare origin gets the conventional {@code /mcp}
 * endpoint.
 * <pre>
 * https://host/mcp/uuid     → base https://host, endpoint /mcp/uuid
 * https://host:8443/api/    → base https://host:8443, endpoint /api
 * http://localhost:5678     → base http://localhost:5678, endpoint /mcp
 * </pre>
 */
final class McpEndpointResolver {

    static final String DEFAULT_ENDPOINT = "/mcp";

    private McpEndpointResolver() {
    }

    static Endpoint resolve(String url) {
        if (!StringUtils.hasText(url)) {
            throw new IllegalArgumentException("MCP server url must not be blank");
        }

        URI uri = URI.create(url.trim());
        if (!StringUtils.hasText(uri.getScheme()) || !StringUtils.hasText(uri.getHost())) {
            throw new IllegalArgumentException("MCP server url must include scheme and host");
        }

        String baseUri = buildBaseUri(uri);
        String path = normalizePath(uri.getRawPath());
        if ("/".equals(path)) {
            path = DEFAULT_ENDPOINT;
        }
        String endpoint = StringUtils.hasText(uri.getRawQuery()) ? path + "?" + uri.getRawQuery() : path;
        return new Endpoint(baseUri, endpoint, baseUri + endpoint);
    }

    private static String buildBaseUri(URI uri) {
        StringBuilder builder = new StringBuilder()
                .append(uri.getScheme())
                .append("://")
                .append(uri.getHost());

        if (uri.getPort() != -1) {
            builder.append(':').append(uri.getPort());
        }
        return builder.toString();
    }

    private static String normalizePath(String rawPath) {
        if (!StringUtils.hasText(rawPath)) {
            return "/";
        }
        String path = rawPath.trim();
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        while (path.endsWith("/") && path.length() > 1) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    record Endpoint(String baseUri, String endpoint, String fullUrl) {
    }
}
