package com.questhub.combatservice.platform.ws;

import com.questhub.combatservice.platform.config.CombatProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * 原生 WebSocket 配置
 * ----------------------------------------
 * 客户端连接 ws://host/ws/combat?combatId=...&token=...，
 * 下行消息为 JSON Envelope，上行为 JSON CombatCommand。
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class CombatWebSocketConfig implements WebSocketConfigurer {

    private final CombatWebSocketHandler handler;
    private final CombatHandshakeInterceptor handshakeInterceptor;
    private final CombatProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        var registration = registry.addHandler(handler, properties.getWs().getPath())
                .addInterceptors(handshakeInterceptor);
        if (!properties.getWs().getAllowedOrigins().isEmpty()) {
            registration.setAllowedOriginPatterns(properties.getWs().getAllowedOrigins().toArray(String[]::new));
        }
    }
}
