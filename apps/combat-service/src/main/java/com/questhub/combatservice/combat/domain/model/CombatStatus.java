package com.questhub.combatservice.combat.domain.model;

/**
 * 战斗会话状态：PENDING → ACTIVE → FINISHED（终态）
 */
public enum CombatStatus {
    PENDING("pending"),
    ACTIVE("ongoing"),
    FINISHED("finished");

    /** 握手快照中对客户端暴露的取值 */
    private final String wire;

    CombatStatus(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
