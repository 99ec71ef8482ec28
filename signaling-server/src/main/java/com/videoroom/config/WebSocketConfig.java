package com.videoroom.config;

import com.videoroom.websocket.SignalingWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * WebSocket 핸들러를 등록하는 설정 클래스.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SignalingWebSocketHandler signalingWebSocketHandler;
    private final SignalingProperties properties;

    public WebSocketConfig(SignalingWebSocketHandler signalingWebSocketHandler, SignalingProperties properties) {
        this.signalingWebSocketHandler = signalingWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(signalingWebSocketHandler, properties.getWebsocketPath())
                .setAllowedOriginPatterns(properties.getAllowedOriginPatterns().toArray(String[]::new));
    }
}
