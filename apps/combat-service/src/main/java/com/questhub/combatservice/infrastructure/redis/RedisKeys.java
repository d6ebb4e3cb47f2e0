package com.questhub.combatservice.infrastructure.redis;

import java.util.Locale;

/**
 * Redis 键名统一管理
 * <pre>
 *   quest:lobby:{lobbyId}          大厅文档
 *   quest:user:{userId}            用户文档
 *   quest:user:handle:{handle}     登录名 → 用户 ID（小写）
 *   quest:character:{characterId}  角色 / 实体定义
 *   quest:preset:{presetId}        战斗预设
 *   quest:preset:seq               预设 ID 计数器
 * </pre>
 */
public final class RedisKeys {
    private RedisKeys() {}

    private static final String PREFIX = "quest:";

    public static String lobby(String lobbyId) {
        return PREFIX + "lobby:" + lobbyId;
    }

    public static String user(String userId) {
        return PREFIX + "user:" + userId;
    }

    public static String userHandle(String handle) {
        return PREFIX + "user:handle:" + handle.toLowerCase(Locale.ROOT);
    }

    public static String character(String characterId) {
        return PREFIX + "character:" + characterId;
    }

    public static String preset(String presetId) {
        return PREFIX + "preset:" + presetId;
    }

    public static String presetSeq() {
        return PREFIX + "preset:seq";
    }
}
