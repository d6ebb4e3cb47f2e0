package com.questhub.combatservice.combat.domain.document;

import com.questhub.combatservice.combat.domain.model.ControlInfo;
import com.questhub.combatservice.combat.domain.model.PawnSource;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已存储预设中的单个棋子：格子 + 实体引用 + 控制方
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PresetPawn {
    private String square;
    /** 实体引用（embedded 时为角色文档 ID，dlc 时为扩展包内的路径） */
    private String path;
    private PawnSource source;
    private ControlInfo controlledBy;
}
