package com.copyleft.LetterClash.config;

import com.copyleft.LetterClash.infra.websocket.WebSocketRouterHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final WebSocketRouterHandler webSocketRouterHandler;
    private final String path;

    public WebSocketConfig(WebSocketRouterHandler webSocketRouterHandler,
                           @Value("${game.websocket.path:/ws}") String path) {
        this.webSocketRouterHandler = webSocketRouterHandler;
        this.path = path;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(webSocketRouterHandler, path)
                .setAllowedOriginPatterns("*");
    }
}
