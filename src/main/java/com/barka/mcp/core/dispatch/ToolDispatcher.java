package com.barka.mcp.core.dispatch;

import com.barka.mcp.core.connection.ConnectionManager;
import com.barka.mcp.core.error.ConnectionUnavailableException;
import com.barka.mcp.core.error.McpToolException;
import com.barka.mcp.core.error.UnknownToolException;
import com.barka.mcp.core.registry.ToolDefinition;
import com.barka.mcp.core.registry.ToolRegistry;
import com.barka.mcp.core.response.ErrorKind;
import com.barka.mcp.core.response.McpResponse;
import com.barka.mcp.core.validation.ToolCallValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Outermost boundary of {@code call_tool}: health gate, validation, routing under a deadline,
 * and conversion of every outcome into a {@link McpResponse}. No error escapes this class.
 */
public class ToolDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private final ToolRegistry registry;
    private final ToolCallValidator validator;
    private final ActionRouter router;
    private final ConnectionManager connection;
    private final Duration timeout;

    public ToolDispatcher(ToolRegistry registry, ToolCallValidator validator, ActionRouter router,
                          ConnectionManager connection, Duration timeout) {
        this.registry = registry;
        this.validator = validator;
        this.router = router;
        this.connection = connection;
        this.timeout = timeout;
    }

    public List<Map<String, Object>> listTools() {
        return registry.list();
    }

    public Mono<McpResponse<Object>> dispatch(String toolName, Map<String, Object> arguments) {
        return Mono.defer(() -> {
                    log.info("Tool call received: tool={} action={}", toolName, actionOf(arguments));
                    if (!connection.isHealthy()) {
                        throw new ConnectionUnavailableException();
                    }
                    ToolDefinition tool = registry.get(toolName)
                            .orElseThrow(() -> new UnknownToolException(toolName));
                    ToolCallRequest request = validator.validate(tool, arguments);
                    return withDeadline(router.route(request));
                })
                .map(McpResponse::success)
                .switchIfEmpty(Mono.fromSupplier(() -> McpResponse.<Object>success(Map.of())))
                .onErrorResume(e -> Mono.just(toErrorResponse(toolName, e)))
                .doOnNext(r -> log.info("Tool call completed: tool={} status={}", toolName, r.status()));
    }

    private Mono<Object> withDeadline(Mono<Object> call) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return call;
        }
        return call.timeout(timeout);
    }

    private McpResponse<Object> toErrorResponse(String toolName, Throwable e) {
        if (e instanceof McpToolException te) {
            if (te.isClientError()) {
                log.debug("Rejected call to {}: {}", toolName, te.getMessage());
            } else if (te.kind() == ErrorKind.DOMAIN) {
                log.warn("Tool {} failed: {}", toolName, te.getMessage());
            } else {
                log.error("Tool {} failed: {}", toolName, te.getMessage());
            }
            return McpResponse.error(te.kind(), te.getMessage());
        }
        if (e instanceof TimeoutException) {
            log.error("Tool {} timed out after {} ms", toolName, timeout.toMillis());
            return McpResponse.error(ErrorKind.TIMEOUT, "Tool execution timed out after " + timeout.toMillis() + " ms");
        }
        log.error("Tool call failed: {}", toolName, e);
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return McpResponse.error(ErrorKind.UNEXPECTED, "Tool execution failed: " + detail);
    }

    private static Object actionOf(Map<String, Object> arguments) {
        return arguments == null ? null : arguments.get(ToolDefinition.ACTION);
    }
}
