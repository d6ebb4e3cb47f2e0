package com.questhub.combatservice.combat.domain.repository;

import com.questhub.combatservice.combat.domain.document.CharacterDocument;
import com.questhub.combatservice.combat.domain.document.CombatPresetDocument;
import com.questhub.combatservice.combat.domain.document.LobbyDocument;
import com.questhub.combatservice.combat.domain.document.LobbyPlayer;
import com.questhub.combatservice.combat.domain.document.PresetPawn;
import com.questhub.combatservice.combat.domain.document.UserDocument;

import java.util.List;
import java.util.Optional;

/**
 * 文档存储访问接口（用户 / 大厅 / 角色 / 战斗预设）
 * <p>
 * 查询类方法以 Optional.empty() 表示不存在；写入失败抛出 InternalFaultException。
 */
public interface GameStore {

    Optional<LobbyDocument> getLobby(String lobbyId);

    Optional<UserDocument> getUser(String userId);

    Optional<UserDocument> getUserByHandle(String handle);

    /**
     * 按 ID 读取角色 / 实体定义。战斗预设中 embedded 棋子的 path 也通过此方法解析。
     */
    Optional<CharacterDocument> getCharacter(String characterId);

    Optional<CombatPresetDocument> getCombatPreset(String presetId);

    /**
     * 新建战斗预设
     *
     * @return 新预设 ID
     */
    String createCombatPreset(List<PresetPawn> field);

    /**
     * 追加大厅成员（已存在同一 userId 时覆盖昵称与角色）
     */
    void addPlayerToLobby(String lobbyId, LobbyPlayer player);

    /**
     * 更新大厅成员绑定的角色
     */
    void assignCharacterToPlayer(String lobbyId, String userId, String characterId);
}
