package com.barka.mcp.adapter.mcp.ws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    @Bean
    public SimpleUrlHandlerMapping webSocketMapping(McpWebSocketHandler handler,
                                                    @Value("${mcp.transport.ws-path:/mcp/ws}") String path) {
        return new SimpleUrlHandlerMapping(Map.of(path, handler), -1);
    }

    @Bean
    public WebSocketHandlerAdapter handlerAdapter() { return new WebSocketHandlerAdapter(); }
}
