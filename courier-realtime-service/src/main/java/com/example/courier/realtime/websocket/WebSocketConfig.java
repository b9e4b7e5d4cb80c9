package com.example.courier.realtime.websocket;

import com.example.courier.shared.config.AppProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping webSocketHandlerMapping(ConnectionHandler connectionHandler, AppProperties appProperties) {
        // Ahead of annotated controllers so the upgrade path is never shadowed
        return new SimpleUrlHandlerMapping(Map.of(appProperties.getWebsocket().getPath(), connectionHandler), -1);
    }
}
