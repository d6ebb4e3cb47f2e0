package com.questhub.combatservice.platform.transport;

import java.time.Instant;
import java.util.Objects;

/**
 * 下行消息外壳
 * - 字段：kind / event / combatId / payload / ts / seq
 * - kind 区分完整状态（握手快照）、增量事件与错误通知
 *
 * 用法示例：
 *   Envelope.of("turn_changed", combatId, payload, seq);
 */
public record Envelope(Kind kind, String event, String combatId, Object payload, long ts, long seq) {

    /** STATE=完整状态，EVENT=增量事件，ERROR=错误通知 */
    public enum Kind { STATE, EVENT, ERROR }

    public Envelope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(event, "event");
    }

    /**
     * 按事件名推断 kind：handshake 为 STATE，error / invalid_token 为 ERROR，其余为 EVENT。
     */
    public static Envelope of(String event, String combatId, Object payload, long seq) {
        return new Envelope(kindOf(event), event, combatId, payload, Instant.now().toEpochMilli(), seq);
    }

    static Kind kindOf(String event) {
        if (CombatEvents.HANDSHAKE.equals(event)) return Kind.STATE;
        if (CombatEvents.ERROR.equals(event) || CombatEvents.INVALID_TOKEN.equals(event)) return Kind.ERROR;
        return Kind.EVENT;
    }
}
