package com.questhub.combatservice.combat.session;

/**
 * 战斗结束事件
 * ----------------------------------------
 * 会话进入 FINISHED 后恰好发出一次，先由 CombatRegistry 摘除会话，
 * 再经 ApplicationEventPublisher 转发给其他监听方（大厅索引等）。
 */
public record CombatEndedEvent(String combatId, String reason) {
}
