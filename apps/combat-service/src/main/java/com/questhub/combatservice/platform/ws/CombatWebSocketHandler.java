package com.questhub.combatservice.platform.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questhub.combatservice.combat.admission.CombatAdmissionController;
import com.questhub.combatservice.combat.domain.constants.CombatMessages;
import com.questhub.combatservice.combat.session.CombatCommand;
import com.questhub.combatservice.combat.session.CombatPayloads;
import com.questhub.combatservice.combat.session.CombatRegistry;
import com.questhub.combatservice.combat.session.CombatSession;
import com.questhub.combatservice.platform.config.CombatProperties;
import com.questhub.combatservice.platform.transport.CombatConnection;
import com.questhub.combatservice.platform.transport.CombatEvents;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Optional;

/**
 * 战斗 WebSocket 处理器
 * ----------------------------------------
 * - 建立连接：包装为 CombatConnection，交给 CombatAdmissionController 执行准入；
 * - 收到文本帧：解析为 CombatCommand，路由到对应会话；
 * - 连接关闭：释放该玩家在会话中的槽位（会话本身继续存在）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CombatWebSocketHandler extends TextWebSocketHandler {

    private final CombatAdmissionController admissionController;
    private final CombatRegistry registry;
    private final ObjectMapper objectMapper;
    private final CombatProperties properties;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String combatId = (String) session.getAttributes().get(CombatHandshakeInterceptor.ATTR_COMBAT_ID);
        String token = (String) session.getAttributes().get(CombatHandshakeInterceptor.ATTR_TOKEN);
        // 令牌只在准入时使用，不在会话属性中保留
        session.getAttributes().remove(CombatHandshakeInterceptor.ATTR_TOKEN);

        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(session,
                properties.getWs().getSendTimeLimit(), properties.getWs().getSendBufferSizeLimit());
        CombatConnection connection = new WebSocketCombatConnection(concurrent, combatId, objectMapper);
        session.getAttributes().put(CombatHandshakeInterceptor.ATTR_CONNECTION, connection);

        log.debug("战斗连接建立: sessionId={}, combatId={}", session.getId(), combatId);
        admissionController.admit(connection, combatId, token)
                .ifPresent(playerId -> session.getAttributes().put(CombatHandshakeInterceptor.ATTR_PLAYER_ID, playerId));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String playerId = (String) session.getAttributes().get(CombatHandshakeInterceptor.ATTR_PLAYER_ID);
        CombatConnection connection = (CombatConnection) session.getAttributes().get(CombatHandshakeInterceptor.ATTR_CONNECTION);
        if (playerId == null || connection == null) {
            log.debug("未准入的连接发来消息，忽略: sessionId={}", session.getId());
            return;
        }
        Optional<CombatSession> combat = resolve(session);
        if (combat.isEmpty()) {
            connection.disconnect();
            return;
        }
        CombatCommand command;
        try {
            command = objectMapper.readValue(message.getPayload(), CombatCommand.class);
        } catch (JsonProcessingException e) {
            log.debug("指令解析失败: sessionId={}, err={}", session.getId(), e.getOriginalMessage());
            connection.emit(CombatEvents.ERROR,
                    new CombatPayloads.ErrorInfo(CombatMessages.CODE_BAD_COMMAND, CombatMessages.MSG_MALFORMED));
            return;
        }
        combat.get().handleCommand(playerId, connection, command);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String playerId = (String) session.getAttributes().get(CombatHandshakeInterceptor.ATTR_PLAYER_ID);
        CombatConnection connection = (CombatConnection) session.getAttributes().get(CombatHandshakeInterceptor.ATTR_CONNECTION);
        log.debug("战斗连接关闭: sessionId={}, playerId={}, status={}", session.getId(), playerId, status);
        if (playerId == null || connection == null) {
            return;
        }
        resolve(session).ifPresent(s -> s.releasePlayer(playerId, connection));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("战斗连接传输错误: sessionId={}, err={}", session.getId(), exception.getMessage());
    }

    private Optional<CombatSession> resolve(WebSocketSession session) {
        String combatId = (String) session.getAttributes().get(CombatHandshakeInterceptor.ATTR_COMBAT_ID);
        return registry.get(combatId);
    }
}
