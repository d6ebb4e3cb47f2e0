package com.questhub.combatservice.combat.preset;

import com.questhub.combatservice.combat.domain.constants.CombatMessages;
import com.questhub.combatservice.combat.domain.document.CharacterDocument;
import com.questhub.combatservice.combat.domain.document.CombatPresetDocument;
import com.questhub.combatservice.combat.domain.document.PresetPawn;
import com.questhub.combatservice.combat.domain.model.BattlefieldSeed;
import com.questhub.combatservice.combat.domain.model.EntityPreset;
import com.questhub.combatservice.combat.domain.model.FieldPawn;
import com.questhub.combatservice.combat.domain.model.PawnSource;
import com.questhub.combatservice.combat.domain.repository.GameStore;
import com.questhub.combatservice.common.exception.ClientFaultException;
import com.questhub.combatservice.common.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 预设烹饪流水线
 * ----------------------------------------
 * 把已存储预设或内联预设转换成可直接运行的 {@link BattlefieldSeed}。
 *
 * 流程（两种模式一致）：
 *   1. 取得棋子列表（importable 从存储读取，不存在则 NotFound）
 *   2. 规范化格子（trim + 大写）并校验必填字段
 *   3. 整体校验格子唯一性，重复即 ClientFault（此时尚未做任何实体查询）
 *   4. 逐个解析 embedded 实体，缺失即 NotFound
 *   5. 组装种子，顺序与输入一致
 *
 * 对存储只读；任何一步失败都不会产出半成品种子。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PresetCookingPipeline {

    private final GameStore store;

    public BattlefieldSeed cook(PresetSource source) {
        List<PresetPawn> raw;
        if (source instanceof PresetSource.Importable imp) {
            raw = loadStored(imp.presetId());
        } else if (source instanceof PresetSource.Requested req) {
            raw = req.preset().field();
        } else {
            throw new ClientFaultException(CombatMessages.UNKNOWN_PRESET_TYPE + source);
        }

        List<PresetPawn> pawns = validate(raw);
        Map<String, CharacterDocument> entities = resolveEmbedded(pawns);

        Map<String, FieldPawn> field = new LinkedHashMap<>();
        for (PresetPawn p : pawns) {
            field.put(p.getSquare(), new FieldPawn(new EntityPreset(p.getSource(), p.getPath()), p.getControlledBy()));
        }
        log.debug("预设烹饪完成: pawns={}, customEntities={}", field.size(), entities.size());
        return new BattlefieldSeed(field, entities);
    }

    /**
     * 规范化并校验整组棋子，返回规范化后的新列表（入参不变）。
     *
     * @throws ClientFaultException 字段缺失或格子重复
     */
    public List<PresetPawn> validate(List<PresetPawn> pawns) {
        List<PresetPawn> out = new ArrayList<>(pawns.size());
        Set<String> seen = new HashSet<>();
        for (PresetPawn p : pawns) {
            String square = normalizeSquare(p.getSquare());
            if (p.getPath() == null || p.getPath().isBlank()) {
                throw new ClientFaultException(CombatMessages.BLANK_PATH + ": " + square);
            }
            if (p.getSource() == null) {
                throw new ClientFaultException(CombatMessages.UNKNOWN_SOURCE + ": " + square);
            }
            if (p.getControlledBy() == null) {
                throw new ClientFaultException(CombatMessages.MISSING_OWNER + ": " + square);
            }
            if (!seen.add(square)) {
                throw new ClientFaultException(CombatMessages.DUPLICATE_SQUARE + ": " + square);
            }
            out.add(new PresetPawn(square, p.getPath().trim(), p.getSource(), p.getControlledBy()));
        }
        return out;
    }

    private List<PresetPawn> loadStored(String presetId) {
        CombatPresetDocument doc = store.getCombatPreset(presetId)
                .orElseThrow(() -> new NotFoundException(CombatMessages.PRESET_NOT_FOUND + ": " + presetId));
        return doc.getField() == null ? List.of() : doc.getField();
    }

    /** 同一 path 只查询一次 */
    private Map<String, CharacterDocument> resolveEmbedded(List<PresetPawn> pawns) {
        Map<String, CharacterDocument> entities = new LinkedHashMap<>();
        for (PresetPawn p : pawns) {
            if (p.getSource() != PawnSource.EMBEDDED || entities.containsKey(p.getPath())) {
                continue;
            }
            CharacterDocument def = store.getCharacter(p.getPath())
                    .orElseThrow(() -> new NotFoundException(CombatMessages.ENTITY_NOT_FOUND + ": " + p.getPath()));
            entities.put(p.getPath(), def);
        }
        return entities;
    }

    private static String normalizeSquare(String square) {
        if (square == null || square.isBlank()) {
            throw new ClientFaultException(CombatMessages.BLANK_SQUARE);
        }
        return square.trim().toUpperCase(Locale.ROOT);
    }
}
