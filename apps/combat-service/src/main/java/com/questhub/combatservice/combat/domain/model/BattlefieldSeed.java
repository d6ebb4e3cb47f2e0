package com.questhub.combatservice.combat.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.questhub.combatservice.combat.domain.document.CharacterDocument;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 战斗种子：布阵（格子 → 棋子）+ 内嵌实体定义
 * ----------------------------------------
 * 由 PresetCookingPipeline 产出，战斗会话创建后只读。
 * 格子在同一种子内唯一；每个 embedded 棋子的实体名在 custom_entities 中都有对应定义。
 * 两个映射都保持插入顺序，行动顺序即 field_pawns 的顺序。
 */
public record BattlefieldSeed(@JsonProperty("field_pawns") Map<String, FieldPawn> fieldPawns,
                              @JsonProperty("custom_entities") Map<String, CharacterDocument> customEntities) {

    public BattlefieldSeed {
        fieldPawns = Collections.unmodifiableMap(new LinkedHashMap<>(fieldPawns));
        customEntities = Collections.unmodifiableMap(new LinkedHashMap<>(customEntities));
    }

    /** 按行动顺序排列的格子列表 */
    @JsonIgnore
    public List<String> turnOrder() {
        return List.copyOf(fieldPawns.keySet());
    }

    public FieldPawn pawnAt(String square) {
        return square == null ? null : fieldPawns.get(square);
    }
}
