package com.barka.mcp.adapter.mcp;

import com.barka.mcp.core.dispatch.ToolDispatcher;
import com.barka.mcp.core.response.McpResponse;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping(path = "/mcp", produces = MediaType.APPLICATION_JSON_VALUE)
public class McpController {
    private final ToolDispatcher dispatcher;

    public McpController(ToolDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @GetMapping("/tools")
    public Map<String, Object> listTools() {
        return Map.of("tools", dispatcher.listTools());
    }

    /** {@code tool} is accepted as an alias of {@code name}. */
    public record CallReq(String name, String tool, Map<String, Object> arguments) {
        String toolName() {
            return name != null ? name : tool;
        }
    }

    @PostMapping("/tools/call")
    public Mono<McpResponse<Object>> call(@RequestBody CallReq req) {
        return dispatcher.dispatch(req.toolName(), req.arguments());
    }
}
