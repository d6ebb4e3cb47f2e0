package com.questhub.combatservice.platform.transport;

/**
 * 战斗会话看到的“连接”抽象
 * ----------------------------------------
 * 会话只依赖此接口，不关心底层是 WebSocket 还是测试用的内存实现。
 * 实现需保证 emit 可被多个线程并发调用。
 */
public interface CombatConnection {

    /** 连接唯一 ID（WebSocket sessionId） */
    String id();

    /**
     * 发送一个具名事件。连接已关闭时静默丢弃。
     */
    void emit(String event, Object payload);

    /** 主动断开；可重复调用 */
    void disconnect();

    boolean isOpen();
}
