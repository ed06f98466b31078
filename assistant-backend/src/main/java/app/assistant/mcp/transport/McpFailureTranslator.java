package app.assistant.mcp.transport;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import app.assistant.mcp.error.McpClientException;
import io.modelcontextprotocol.spec.McpError;

/**
 * Reduces exceptions thrown by the MCP SDK to {@link McpTransportFailureException}.
 */
public final class McpFailureTranslator {

    private static final Pattern HTTP_STATUS = Pattern.compile(
            "(?i)(?:status(?:\\s*code)?\\s*[:=]?\\s*|http\\s+)([1-5]\\d{2})\\b");

    private McpFailureTranslator() {
    }

    public static McpClientException translate(String serverId, String action, Throwable error) {
        if (error instanceof McpClientException mcpException) {
            return mcpException;
        }
        String message = describe(error);
        Integer rpcCode = rpcErrorCode(error);
        Integer status = rpcCode == null ? httpStatus(error) : null;
        boolean sessionLost = !(error instanceof TimeoutException) && processGone(error);
        return new McpTransportFailureException(message, action, serverId, status, rpcCode, sessionLost, error);
    }

    static Integer rpcErrorCode(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof McpError mcpError && mcpError.getJsonRpcError() != null) {
                return mcpError.getJsonRpcError().code();
            }
        }
        return null;
    }

    static Integer httpStatus(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current.getMessage() == null) {
                continue;
            }
            Matcher matcher = HTTP_STATUS.matcher(current.getMessage());
            if (matcher.find()) {
                return Integer.parseInt(matcher.group(1));
            }
        }
        return null;
    }

    // stdio child exited or the pipe broke underneath us
    private static boolean processGone(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            String message = current.getMessage() == null ? "" : current.getMessage().toLowerCase(Locale.ROOT);
            if (current instanceof IOException
                    && (message.contains("broken pipe") || message.contains("stream closed"))) {
                return true;
            }
            if (message.contains("process exited") || message.contains("transport closed")
                    || message.contains("transport is closed")) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "Request timed out";
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
