package com.questhub.combatservice.platform.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questhub.combatservice.platform.transport.CombatConnection;
import com.questhub.combatservice.platform.transport.Envelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * WebSocketSession → CombatConnection 适配
 * ----------------------------------------
 * 传入的 session 应已被 ConcurrentWebSocketSessionDecorator 包装，可被多线程并发发送。
 * 每条下行消息都序列化为 {@link Envelope}，seq 为本连接内递增序号。
 */
@Slf4j
public class WebSocketCombatConnection implements CombatConnection {

    private final WebSocketSession session;
    private final String combatId;
    private final ObjectMapper objectMapper;
    private final AtomicLong seq = new AtomicLong();

    public WebSocketCombatConnection(WebSocketSession session, String combatId, ObjectMapper objectMapper) {
        this.session = session;
        this.combatId = combatId;
        this.objectMapper = objectMapper;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void emit(String event, Object payload) {
        if (!session.isOpen()) {
            log.debug("连接已关闭，丢弃消息: connectionId={}, event={}", session.getId(), event);
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(Envelope.of(event, combatId, payload, seq.incrementAndGet()));
        } catch (JsonProcessingException e) {
            log.error("消息序列化失败: connectionId={}, event={}", session.getId(), event, e);
            return;
        }
        try {
            session.sendMessage(new TextMessage(json));
        } catch (IOException | IllegalStateException e) {
            log.warn("消息发送失败: connectionId={}, event={}, err={}", session.getId(), event, e.getMessage());
        }
    }

    @Override
    public void disconnect() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("关闭连接失败: connectionId={}, err={}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
