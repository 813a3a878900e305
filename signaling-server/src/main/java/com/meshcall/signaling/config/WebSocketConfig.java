package com.meshcall.signaling.config;

import com.meshcall.signaling.websocket.SignalingWebSocketHandler;
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
    private final WebSocketProperties properties;

    public WebSocketConfig(SignalingWebSocketHandler signalingWebSocketHandler, WebSocketProperties properties) {
        this.signalingWebSocketHandler = signalingWebSocketHandler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // 기본값은 모든 출처 허용. 운영 환경에서는 signaling.websocket.allowed-origin-patterns로 제한한다.
        registry.addHandler(signalingWebSocketHandler, properties.getPath())
                .setAllowedOriginPatterns(properties.getAllowedOriginPatterns().toArray(String[]::new));
    }
}
