package com.barka.mcp.adapter.mcp.ws;

import com.barka.mcp.core.dispatch.ToolDispatcher;
import com.barka.mcp.core.response.McpResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MCP over JSON-RPC 2.0 on a WebSocket. Each text frame carries one request; notifications
 * (methods under {@code notifications/}) get no reply.
 */
@Component
public class McpWebSocketHandler implements WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(McpWebSocketHandler.class);
    private static final TypeReference<Map<String, Object>> ARGS = new TypeReference<>() {};
    private static final String PROTOCOL_VERSION = "2024-11-05";
    private static final String INTERNAL_ERROR_FRAME =
            "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32603,\"message\":\"Internal error\"}}";

    private final ToolDispatcher dispatcher;
    private final ObjectMapper om = new ObjectMapper();

    public McpWebSocketHandler(ToolDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        Flux<WebSocketMessage> output = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(this::route)
                .map(session::textMessage);
        return session.send(output);
    }

    Mono<String> route(String text) {
        JsonNode node;
        try {
            node = om.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Unparsable frame: {}", e.getOriginalMessage());
            return write(JsonRpcModels.Response.err(null, JsonRpcModels.PARSE_ERROR, "Parse error"));
        }
        if (node == null || !node.isObject()) {
            return write(JsonRpcModels.Response.err(null, JsonRpcModels.PARSE_ERROR, "Parse error"));
        }
        String method = node.path("method").asText();
        JsonNode id = node.get("id");
        if (method.startsWith("notifications/")) {
            return Mono.empty();
        }
        Mono<String> reply = switch (method) {
            case "initialize" -> handleInitialize(id);
            case "ping" -> write(JsonRpcModels.Response.ok(id, om.createObjectNode()));
            case "tools/list" -> handleToolsList(id);
            case "tools/call" -> handleToolsCall(id, node.path("params"));
            default -> write(JsonRpcModels.Response.err(id, JsonRpcModels.METHOD_NOT_FOUND, "Method not found: " + method));
        };
        return reply.onErrorResume(e -> {
            log.error("Failed to handle {}", method, e);
            return write(JsonRpcModels.Response.err(id, JsonRpcModels.INTERNAL_ERROR, "Internal error"));
        });
    }

    private Mono<String> handleInitialize(JsonNode id) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", PROTOCOL_VERSION);
        result.put("serverInfo", Map.of("name", "barka-project-manager", "version", "1.0.0"));
        result.put("capabilities", Map.of("tools", Map.of()));
        return write(JsonRpcModels.Response.ok(id, om.valueToTree(result)));
    }

    private Mono<String> handleToolsList(JsonNode id) {
        return write(JsonRpcModels.Response.ok(id, om.valueToTree(Map.of("tools", dispatcher.listTools()))));
    }

    private Mono<String> handleToolsCall(JsonNode id, JsonNode params) {
        String tool = params.hasNonNull("name") ? params.get("name").asText() : params.path("tool").asText(null);
        JsonNode arguments = params.path("arguments");
        Map<String, Object> args = arguments.isObject() ? om.convertValue(arguments, ARGS) : null;
        return dispatcher.dispatch(tool, args)
                .flatMap(response -> {
                    try {
                        return write(JsonRpcModels.Response.ok(id, om.valueToTree(toContent(response))));
                    } catch (JsonProcessingException e) {
                        return Mono.error(e);
                    }
                });
    }

    private Map<String, Object> toContent(McpResponse<Object> response) throws JsonProcessingException {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("content", List.of(Map.of("type", "text", "text", om.writeValueAsString(response))));
        result.put("isError", !response.isSuccess());
        return result;
    }

    private Mono<String> write(JsonRpcModels.Response response) {
        try {
            return Mono.just(om.writeValueAsString(response));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize JSON-RPC response", e);
            return Mono.just(INTERNAL_ERROR_FRAME);
        }
    }
}
