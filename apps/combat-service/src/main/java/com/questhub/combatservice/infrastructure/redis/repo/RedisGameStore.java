package com.questhub.combatservice.infrastructure.redis.repo;

import com.questhub.combatservice.combat.domain.constants.CombatMessages;
import com.questhub.combatservice.combat.domain.document.CharacterDocument;
import com.questhub.combatservice.combat.domain.document.CombatPresetDocument;
import com.questhub.combatservice.combat.domain.document.LobbyDocument;
import com.questhub.combatservice.combat.domain.document.LobbyPlayer;
import com.questhub.combatservice.combat.domain.document.PresetPawn;
import com.questhub.combatservice.combat.domain.document.UserDocument;
import com.questhub.combatservice.combat.domain.repository.GameStore;
import com.questhub.combatservice.common.exception.InternalFaultException;
import com.questhub.combatservice.common.exception.NotFoundException;
import com.questhub.combatservice.infrastructure.redis.RedisKeys;
import com.questhub.combatservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 基于 Redis 的文档存储
 * ----------------------------------------
 * 每个文档一个 JSON 值；不存在返回 Optional.empty()，Redis 访问失败统一抛 InternalFaultException。
 */
@Repository
@RequiredArgsConstructor
public class RedisGameStore implements GameStore {

    private final RedisOps ops;

    @Override
    public Optional<LobbyDocument> getLobby(String lobbyId) {
        return read(RedisKeys.lobby(lobbyId), LobbyDocument.class);
    }

    @Override
    public Optional<UserDocument> getUser(String userId) {
        return read(RedisKeys.user(userId), UserDocument.class);
    }

    @Override
    public Optional<UserDocument> getUserByHandle(String handle) {
        if (handle == null || handle.isBlank()) {
            return Optional.empty();
        }
        try {
            return ops.getString(RedisKeys.userHandle(handle)).flatMap(this::getUser);
        } catch (DataAccessException e) {
            throw new InternalFaultException("按登录名查询用户失败: " + handle, e);
        }
    }

    @Override
    public Optional<CharacterDocument> getCharacter(String characterId) {
        return read(RedisKeys.character(characterId), CharacterDocument.class);
    }

    @Override
    public Optional<CombatPresetDocument> getCombatPreset(String presetId) {
        return read(RedisKeys.preset(presetId), CombatPresetDocument.class);
    }

    @Override
    public String createCombatPreset(List<PresetPawn> field) {
        try {
            String id = "preset-" + ops.incr(RedisKeys.presetSeq());
            ops.set(RedisKeys.preset(id), new CombatPresetDocument(id, new ArrayList<>(field)));
            return id;
        } catch (DataAccessException e) {
            throw new InternalFaultException("写入战斗预设失败", e);
        }
    }

    // TODO: 大厅成员的读改写改为 Lua 脚本，避免多实例同时加入时互相覆盖
    @Override
    public void addPlayerToLobby(String lobbyId, LobbyPlayer player) {
        LobbyDocument lobby = getLobby(lobbyId)
                .orElseThrow(() -> new NotFoundException(CombatMessages.LOBBY_NOT_FOUND));
        List<LobbyPlayer> players = lobby.getPlayers() == null ? new ArrayList<>() : new ArrayList<>(lobby.getPlayers());
        players.removeIf(p -> player.getUserId().equals(p.getUserId()));
        players.add(player);
        lobby.setPlayers(players);
        write(RedisKeys.lobby(lobbyId), lobby);
    }

    @Override
    public void assignCharacterToPlayer(String lobbyId, String userId, String characterId) {
        LobbyDocument lobby = getLobby(lobbyId)
                .orElseThrow(() -> new NotFoundException(CombatMessages.LOBBY_NOT_FOUND));
        LobbyPlayer player = lobby.findPlayer(userId)
                .orElseThrow(() -> new NotFoundException(CombatMessages.NOT_LOBBY_MEMBER));
        player.setCharacterId(characterId);
        write(RedisKeys.lobby(lobbyId), lobby);
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        try {
            return ops.get(key, type);
        } catch (DataAccessException e) {
            throw new InternalFaultException("读取文档失败: " + key, e);
        }
    }

    private void write(String key, Object doc) {
        try {
            ops.set(key, doc);
        } catch (DataAccessException e) {
            throw new InternalFaultException("写入文档失败: " + key, e);
        }
    }
}
