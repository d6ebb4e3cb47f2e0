package com.questhub.combatservice.combat.session;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 上行指令（客户端 → 会话）
 * <pre>
 *   {"type":"start"}
 *   {"type":"action","pawn":"A1","action":"builtins:slash","target":"B2"}
 *   {"type":"end_turn","pawn":"A1"}
 *   {"type":"finish","reason":"party_wiped"}
 *   {"type":"snapshot"}
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CombatCommand {
    public static final String START = "start";
    public static final String ACTION = "action";
    public static final String END_TURN = "end_turn";
    public static final String FINISH = "finish";
    public static final String SNAPSHOT = "snapshot";

    private String type;
    /** 发起行动的棋子所在格子；缺省为当前回合棋子 */
    private String pawn;
    private String action;
    private String target;
    /** finish 时的结束原因 */
    private String reason;

    public static CombatCommand of(String type) {
        return new CombatCommand(type, null, null, null, null);
    }
}
