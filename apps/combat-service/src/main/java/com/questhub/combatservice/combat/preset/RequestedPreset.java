package com.questhub.combatservice.combat.preset;

import com.questhub.combatservice.combat.domain.document.PresetPawn;

import java.util.List;

/**
 * 客户端随请求提交的内联预设。保留提交顺序，也保留重复格子以便统一校验。
 */
public record RequestedPreset(List<PresetPawn> field) {

    public RequestedPreset {
        field = field == null ? List.of() : List.copyOf(field);
    }
}
