package com.questhub.combatservice.combat.domain.constants;

/**
 * 对外错误文案与错误码常量
 */
public final class CombatMessages {
    private CombatMessages() {}

    // ---- 预设 ----
    public static final String PRESET_NOT_FOUND = "Combat preset not found";
    public static final String ENTITY_NOT_FOUND = "Entity not found";
    public static final String DUPLICATE_SQUARE = "Two pawns claim the same square";
    public static final String BLANK_SQUARE = "Square must not be blank";
    public static final String BLANK_PATH = "Pawn path must not be blank";
    public static final String UNKNOWN_SOURCE = "Unknown pawn source";
    public static final String MISSING_OWNER = "Pawn controller is required";
    public static final String UNKNOWN_PRESET_TYPE =
            "Unknown preset type. Use \"importable\" or \"requested\". Provided: ";

    // ---- 大厅 ----
    public static final String LOBBY_NOT_FOUND = "Lobby not found";
    public static final String NOT_LOBBY_GM = "Only the lobby GM can do this";
    public static final String NOT_LOBBY_MEMBER = "Player is not a member of this lobby";
    public static final String CHARACTER_NOT_FOUND = "Character not found";
    public static final String COMBAT_NOT_FOUND = "Combat not found";

    // ---- 会话内错误码（error 事件的 code 字段）----
    public static final String CODE_NOT_IN_ROSTER = "NOT_IN_ROSTER";
    public static final String CODE_NOT_YOUR_PAWN = "NOT_YOUR_PAWN";
    public static final String CODE_NOT_YOUR_TURN = "NOT_YOUR_TURN";
    public static final String CODE_NOT_ACTIVE = "COMBAT_NOT_ACTIVE";
    public static final String CODE_GM_ONLY = "GM_ONLY";
    public static final String CODE_BAD_COMMAND = "BAD_COMMAND";
    public static final String CODE_INTERNAL = "INTERNAL_FAULT";

    public static final String MSG_NOT_IN_ROSTER = "You are not part of this combat";
    public static final String MSG_NOT_YOUR_PAWN = "This pawn is not controlled by you";
    public static final String MSG_NOT_YOUR_TURN = "It is not this pawn's turn";
    public static final String MSG_NOT_ACTIVE = "Combat is not active";
    public static final String MSG_ALREADY_STARTED = "Combat has already started";
    public static final String MSG_NO_PAWNS = "Battlefield has no pawns";
    public static final String MSG_GM_ONLY = "Only the GM can do this";
    public static final String MSG_UNKNOWN_COMMAND = "Unknown command type: ";
    public static final String MSG_MALFORMED = "Malformed message";

    // ---- 结束原因 ----
    public static final String REASON_GM_FINISHED = "finished_by_gm";
    public static final String REASON_TERMINATED = "terminated";
}
