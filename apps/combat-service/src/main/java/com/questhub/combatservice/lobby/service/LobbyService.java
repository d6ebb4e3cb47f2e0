package com.questhub.combatservice.lobby.service;

import com.questhub.combatservice.combat.domain.constants.CombatMessages;
import com.questhub.combatservice.combat.domain.document.CharacterDocument;
import com.questhub.combatservice.combat.domain.document.LobbyDocument;
import com.questhub.combatservice.combat.domain.document.LobbyPlayer;
import com.questhub.combatservice.combat.domain.document.UserDocument;
import com.questhub.combatservice.combat.domain.model.BattlefieldSeed;
import com.questhub.combatservice.combat.domain.repository.GameStore;
import com.questhub.combatservice.combat.preset.PresetCookingPipeline;
import com.questhub.combatservice.combat.preset.PresetSource;
import com.questhub.combatservice.combat.session.CombatRegistry;
import com.questhub.combatservice.combat.session.CombatSession;
import com.questhub.combatservice.common.exception.ClientFaultException;
import com.questhub.combatservice.common.exception.ForbiddenException;
import com.questhub.combatservice.common.exception.NotFoundException;
import com.questhub.combatservice.lobby.LobbyCombatIndex;
import com.questhub.combatservice.lobby.dto.CharacterInfo;
import com.questhub.combatservice.lobby.dto.LobbyInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * 大厅侧服务
 * ----------------------------------------
 * 对外提供：创建战斗、列出大厅战斗、大厅详情聚合、加入大厅、角色查询、GM 终止战斗。
 * 存储调用之后重新确认会话是否仍存在，再更新索引。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LobbyService {

    private final GameStore store;
    private final PresetCookingPipeline cookingPipeline;
    private final CombatRegistry registry;
    private final LobbyCombatIndex index;

    /**
     * 为大厅创建一场战斗
     *
     * @param gmId      必须是该大厅的 GM
     * @param playerIds 参战玩家，必须都是大厅成员
     * @return 战斗 ID；会话在登记进索引前就已结束时返回 null
     * @throws NotFoundException    大厅不存在、预设或实体缺失
     * @throws ForbiddenException   调用者不是 GM
     * @throws ClientFaultException 参战玩家不在大厅中、预设不合法
     */
    public String createCombat(String lobbyId, String nickname, PresetSource preset, String gmId, List<String> playerIds) {
        LobbyDocument lobby = requireLobby(lobbyId);
        if (!lobby.getGmId().equals(gmId)) {
            throw new ForbiddenException(CombatMessages.NOT_LOBBY_GM);
        }
        List<String> players = new ArrayList<>(new LinkedHashSet<>(playerIds == null ? List.of() : playerIds));
        for (String playerId : players) {
            if (!lobby.hasPlayer(playerId)) {
                throw new ClientFaultException(CombatMessages.NOT_LOBBY_MEMBER + ": " + playerId);
            }
        }

        BattlefieldSeed seed = cookingPipeline.cook(preset);
        String combatId = registry.create(nickname, seed, gmId, players);
        index.add(lobbyId, combatId);

        // 会话可能在登记之前就结束了（结束事件先于 add 到达），此时撤销登记
        if (registry.get(combatId).isEmpty()) {
            index.remove(combatId);
            log.warn("战斗在登记前已结束: lobbyId={}, combatId={}", lobbyId, combatId);
            return null;
        }
        log.info("大厅创建战斗: lobbyId={}, combatId={}, nickname={}", lobbyId, combatId, nickname);
        return combatId;
    }

    public List<String> getActiveCombats(String lobbyId) {
        return index.getActiveCombats(lobbyId);
    }

    public Optional<CombatSession> get(String combatId) {
        return registry.get(combatId);
    }

    /**
     * GM 终止本大厅下的某场战斗
     */
    public void terminateCombat(String lobbyId, String combatId, String requesterId) {
        LobbyDocument lobby = requireLobby(lobbyId);
        if (!lobby.getGmId().equals(requesterId)) {
            throw new ForbiddenException(CombatMessages.NOT_LOBBY_GM);
        }
        if (!index.getActiveCombats(lobbyId).contains(combatId) || !registry.terminate(combatId, CombatMessages.REASON_TERMINATED)) {
            throw new NotFoundException(CombatMessages.COMBAT_NOT_FOUND);
        }
        log.info("GM 终止战斗: lobbyId={}, combatId={}", lobbyId, combatId);
    }

    /**
     * 大厅详情聚合。枚举与查询之间消失的战斗直接略过，不影响整体结果。
     */
    public LobbyInfo getLobbyInfo(String lobbyId, String userId) {
        LobbyDocument lobby = requireLobby(lobbyId);

        List<LobbyInfo.CombatSummary> combats = new ArrayList<>();
        for (String combatId : index.getActiveCombats(lobbyId)) {
            Optional<CombatSession> found = registry.get(combatId);
            if (found.isEmpty()) {
                continue;
            }
            CombatSession combat = found.get();
            List<LobbyInfo.ActivePlayer> active = new ArrayList<>();
            for (String playerId : combat.getConnectedPlayerIds()) {
                String handle = store.getUser(playerId).map(UserDocument::getHandle).orElse("");
                String nick = lobby.findPlayer(playerId).map(LobbyPlayer::getNickname).orElse("");
                active.add(new LobbyInfo.ActivePlayer(handle, nick));
            }
            boolean isActive = combat.isActive();
            combats.add(new LobbyInfo.CombatSummary(
                    combatId,
                    combat.getNickname() == null ? "" : combat.getNickname(),
                    isActive,
                    isActive ? combat.getRoundCount() : 0,
                    active));
        }

        List<LobbyInfo.PlayerEntry> players = new ArrayList<>();
        for (LobbyPlayer p : lobby.getPlayers()) {
            String handle = store.getUser(p.getUserId()).map(UserDocument::getHandle).orElse("");
            LobbyInfo.CharacterView character = Optional.ofNullable(p.getCharacterId())
                    .flatMap(store::getCharacter)
                    .map(LobbyService::characterView)
                    .orElse(null);
            players.add(new LobbyInfo.PlayerEntry(
                    new LobbyInfo.PlayerView(handle, "", p.getUserId(), p.getNickname()),
                    character));
        }

        LobbyInfo.ControlledEntity controlled = lobby.findPlayer(userId)
                .map(LobbyPlayer::getCharacterId)
                .flatMap(id -> store.getCharacter(id)
                        .map(c -> new LobbyInfo.ControlledEntity(c.getDescriptor(), id)))
                .orElse(null);

        String layout = lobby.getGmId().equals(userId) ? LobbyInfo.LAYOUT_GM : LobbyInfo.LAYOUT_DEFAULT;
        return new LobbyInfo(lobby.getName(), lobbyId, combats, lobby.getGmId(), players, layout, controlled);
    }

    /**
     * 加入大厅（已是成员时更新昵称与角色）
     */
    public void addPlayerToLobby(String lobbyId, String userId, String nickname, String characterId) {
        requireLobby(lobbyId);
        if (characterId != null && store.getCharacter(characterId).isEmpty()) {
            throw new NotFoundException(CombatMessages.CHARACTER_NOT_FOUND);
        }
        store.addPlayerToLobby(lobbyId, new LobbyPlayer(userId, nickname, characterId));
        log.info("玩家加入大厅: lobbyId={}, userId={}, characterId={}", lobbyId, userId, characterId);
    }

    /**
     * 调用者在该大厅绑定的角色
     */
    public CharacterInfo getMyCharacterInfo(String lobbyId, String userId) {
        LobbyDocument lobby = requireLobby(lobbyId);
        String characterId = lobby.findPlayer(userId)
                .orElseThrow(() -> new ClientFaultException(CombatMessages.NOT_LOBBY_MEMBER))
                .getCharacterId();
        if (characterId == null) {
            throw new NotFoundException(CombatMessages.CHARACTER_NOT_FOUND);
        }
        return getCharacter(characterId);
    }

    /**
     * 大厅内任一成员的角色（只允许查询本大厅成员绑定的角色）
     */
    public CharacterInfo getCharacterInfo(String lobbyId, String characterId) {
        LobbyDocument lobby = requireLobby(lobbyId);
        boolean inLobby = lobby.getPlayers().stream().anyMatch(p -> characterId.equals(p.getCharacterId()));
        if (!inLobby) {
            throw new NotFoundException(CombatMessages.CHARACTER_NOT_FOUND);
        }
        return getCharacter(characterId);
    }

    private CharacterInfo getCharacter(String characterId) {
        return store.getCharacter(characterId)
                .map(CharacterInfo::from)
                .orElseThrow(() -> new NotFoundException(CombatMessages.CHARACTER_NOT_FOUND));
    }

    private LobbyDocument requireLobby(String lobbyId) {
        return store.getLobby(lobbyId).orElseThrow(() -> new NotFoundException(CombatMessages.LOBBY_NOT_FOUND));
    }

    private static LobbyInfo.CharacterView characterView(CharacterDocument c) {
        CharacterDocument.Decorations d = c.getDecorations();
        if (d != null) {
            return new LobbyInfo.CharacterView(d.getName(), d.getSprite());
        }
        return new LobbyInfo.CharacterView(c.getDescriptor() + ".name", c.getDescriptor() + ".sprite");
    }
}
