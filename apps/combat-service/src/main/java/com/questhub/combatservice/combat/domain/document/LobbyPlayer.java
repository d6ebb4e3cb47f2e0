package com.questhub.combatservice.combat.domain.document;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 大厅成员条目
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LobbyPlayer {
    private String userId;
    /** 大厅内昵称 */
    private String nickname;
    /** 绑定的角色 ID，未分配时为 null */
    private String characterId;
}
