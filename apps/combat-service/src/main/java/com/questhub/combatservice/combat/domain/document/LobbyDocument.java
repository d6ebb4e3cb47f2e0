package com.questhub.combatservice.combat.domain.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 大厅文档（存储层结构）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LobbyDocument {
    private String id;
    private String name;
    /** 创建时间（epoch ms） */
    private long createdAt;
    /** 组织者（GM）的用户 ID */
    private String gmId;
    @Builder.Default
    private List<LobbyPlayer> players = new ArrayList<>();
    /** 关联的战斗预设 ID */
    @Builder.Default
    private List<String> relatedPresets = new ArrayList<>();

    public Optional<LobbyPlayer> findPlayer(String userId) {
        if (userId == null || players == null) return Optional.empty();
        return players.stream().filter(p -> userId.equals(p.getUserId())).findFirst();
    }

    public boolean hasPlayer(String userId) {
        return findPlayer(userId).isPresent();
    }
}
