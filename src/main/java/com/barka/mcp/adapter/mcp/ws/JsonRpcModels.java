package com.barka.mcp.adapter.mcp.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

public class JsonRpcModels {
    public static final int PARSE_ERROR = -32700;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INTERNAL_ERROR = -32603;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Response(String jsonrpc, JsonNode id, JsonNode result, Error error) {
        public static Response ok(JsonNode id, JsonNode result) {
            return new Response("2.0", orNull(id), result, null);
        }
        public static Response err(JsonNode id, int code, String message) {
            return new Response("2.0", orNull(id), null, new Error(code, message, null));
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Error(int code, String message, JsonNode data) {}

    static JsonNode orNull(JsonNode id) {
        return id == null || id.isMissingNode() ? NullNode.getInstance() : id;
    }
}
