package com.questhub.combatservice.platform.transport;

/**
 * 下行事件名
 */
public final class CombatEvents {
    private CombatEvents() {}

    public static final String HANDSHAKE = "handshake";
    public static final String PLAYER_JOINED = "player_joined";
    public static final String PLAYER_LEFT = "player_left";
    public static final String COMBAT_STARTED = "combat_started";
    public static final String TURN_CHANGED = "turn_changed";
    public static final String ROUND_STARTED = "round_started";
    public static final String ACTION_PERFORMED = "action_performed";
    public static final String COMBAT_FINISHED = "combat_finished";
    public static final String ERROR = "error";
    /** 令牌校验失败，随后服务端断开连接 */
    public static final String INVALID_TOKEN = "invalid_token";
}
