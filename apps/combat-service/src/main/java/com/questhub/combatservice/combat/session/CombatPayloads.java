package com.questhub.combatservice.combat.session;

import com.questhub.combatservice.combat.domain.model.BattlefieldSeed;
import com.questhub.combatservice.combat.domain.model.ControlInfo;

import java.util.List;

/**
 * 下行事件载荷
 */
public final class CombatPayloads {
    private CombatPayloads() {}

    /**
     * 握手快照：连接被接纳后立即发给该玩家，也可通过 snapshot 指令重新获取
     */
    public record Snapshot(String combatId,
                           String nickname,
                           String combatStatus,
                           int roundCount,
                           BattlefieldSeed battlefield,
                           String gmId,
                           String currentPawn,
                           ControlInfo currentController,
                           List<String> connectedPlayers,
                           List<String> controlledPawns,
                           List<LogEntry> messages) {
    }

    public record Presence(String playerId, List<String> connectedPlayers) {
    }

    public record Started(int roundCount, String currentPawn) {
    }

    public record TurnChanged(String currentPawn, ControlInfo controller, int roundCount) {
    }

    public record RoundStarted(int roundCount) {
    }

    public record ActionPerformed(String pawn, String action, String target, String playerId, int roundCount) {
    }

    public record Finished(String reason, int roundCount) {
    }

    public record ErrorInfo(String code, String message) {
    }

    /** 战斗日志条目（只记录广播过的事件） */
    public record LogEntry(long ts, String event, Object payload) {
    }
}
