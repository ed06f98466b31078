package app.assistant.mcp.web;

import java.net.URI;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import app.assistant.mcp.error.McpAuthenticationException;
import app.assistant.mcp.error.McpClientException;
import app.assistant.mcp.error.McpConfigurationException;
import app.assistant.mcp.error.McpConnectionException;
import app.assistant.mcp.error.McpUnsupportedOperationException;
import lombok.extern.slf4j.Slf4j;

/**
 * Renders MCP failures as problem details carrying service, action and server id.
 */
@RestControllerAdvice(basePackageClasses = McpServerController.class)
@Slf4j
public class McpExceptionHandler {

    @ExceptionHandler(McpClientException.class)
    public ResponseEntity<ProblemDetail> handle(McpClientException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("MCP {} on server {} failed: {}", ex.getAction(), ex.getServerId(), ex.getMessage());
        } else {
            log.debug("MCP {} on server {} rejected: {}", ex.getAction(), ex.getServerId(), ex.getMessage());
        }
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setType(URI.create("urn:problem:mcp:" + ex.getClass().getSimpleName()));
        problem.setProperty("service", ex.getService());
        problem.setProperty("action", ex.getAction());
        if (ex.getServerId() != null) {
            problem.setProperty("serverId", ex.getServerId());
        }
        return ResponseEntity.status(status).body(problem);
    }

    static HttpStatus statusFor(McpClientException ex) {
        if (ex instanceof McpConfigurationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof McpAuthenticationException) {
            return HttpStatus.UNAUTHORIZED;
        }
        if (ex instanceof McpUnsupportedOperationException) {
            return HttpStatus.NOT_IMPLEMENTED;
        }
        if (ex instanceof McpConnectionException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.BAD_GATEWAY;
    }
}
