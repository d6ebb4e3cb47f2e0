package com.questhub.combatservice.combat.domain.model;

/**
 * 棋子引用的实体：来源 + 名称（embedded 时即 custom_entities 的键）
 */
public record EntityPreset(PawnSource source, String name) {
}
