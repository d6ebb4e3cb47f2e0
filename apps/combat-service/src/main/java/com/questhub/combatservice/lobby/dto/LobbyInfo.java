package com.questhub.combatservice.lobby.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 大厅详情聚合视图
 *
 * @param layout           前端布局：GM 为 "gm"，其他人为 "default"
 * @param controlledEntity 调用者在大厅中绑定的角色，未绑定为 null
 */
public record LobbyInfo(String name,
                        String lobbyId,
                        List<CombatSummary> combats,
                        String gm,
                        List<PlayerEntry> players,
                        String layout,
                        ControlledEntity controlledEntity) {

    public static final String LAYOUT_GM = "gm";
    public static final String LAYOUT_DEFAULT = "default";

    /**
     * 单场战斗摘要；roundCount 在未激活时为 0
     */
    public record CombatSummary(@JsonProperty("_id") String id,
                                String nickname,
                                boolean isActive,
                                int roundCount,
                                List<ActivePlayer> activePlayers) {
    }

    public record ActivePlayer(String handle, String nickname) {
    }

    public record PlayerEntry(PlayerView player, CharacterView character) {
    }

    public record PlayerView(String handle, String avatar, String userId, String nickname) {
    }

    public record CharacterView(String name, String sprite) {
    }

    public record ControlledEntity(String name, String id) {
    }
}
