package com.questhub.combatservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * 握手拦截器：从 query 中取出 combatId 与 token 放入会话属性。
 * 这里不做任何校验，握手总是放行；准入判断在连接建立后进行，以便把 invalid_token 事件回给客户端。
 */
@Slf4j
@Component
public class CombatHandshakeInterceptor implements HandshakeInterceptor {

    public static final String ATTR_COMBAT_ID = "combatId";
    public static final String ATTR_TOKEN = "token";
    public static final String ATTR_PLAYER_ID = "playerId";
    public static final String ATTR_CONNECTION = "combatConnection";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams();
        String combatId = decode(params.getFirst(ATTR_COMBAT_ID));
        String token = decode(params.getFirst(ATTR_TOKEN));
        if (combatId != null) {
            attributes.put(ATTR_COMBAT_ID, combatId);
        }
        if (token != null) {
            attributes.put(ATTR_TOKEN, token);
        }
        log.debug("战斗握手: combatId={}, hasToken={}", combatId, token != null);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("战斗握手失败: uri={}, err={}", request.getURI(), exception.getMessage());
        }
    }

    private static String decode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
