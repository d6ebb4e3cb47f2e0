package com.questhub.combatservice.combat.preset;

import com.questhub.combatservice.combat.domain.document.PresetPawn;
import com.questhub.combatservice.combat.domain.repository.GameStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 战斗预设的新建入口
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CombatPresetService {

    private final PresetCookingPipeline pipeline;
    private final GameStore store;

    /**
     * 校验后落库：先按烹饪规则试烹一次（格子唯一、embedded 实体可解析），再保存规范化后的棋子列表。
     *
     * @return 新预设 ID
     */
    public String createPreset(List<PresetPawn> field) {
        List<PresetPawn> normalized = pipeline.validate(field);
        pipeline.cook(new PresetSource.Requested(new RequestedPreset(normalized)));
        String id = store.createCombatPreset(normalized);
        log.info("新建战斗预设: presetId={}, pawns={}", id, normalized.size());
        return id;
    }
}
