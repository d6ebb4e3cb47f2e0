package com.questhub.combatservice.lobby.interfaces.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questhub.combatservice.combat.preset.PresetSource;
import com.questhub.combatservice.lobby.dto.CharacterInfo;
import com.questhub.combatservice.lobby.dto.LobbyInfo;
import com.questhub.combatservice.lobby.interfaces.http.dto.CreateCombatRequest;
import com.questhub.combatservice.lobby.interfaces.http.dto.JoinLobbyRequest;
import com.questhub.combatservice.lobby.service.LobbyService;
import com.questhub.web.common.ApiResponse;
import com.questhub.web.common.CurrentUserHelper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 大厅接口：战斗创建 / 列表 / 终止，大厅详情，加入大厅，角色查询
 */
@RestController
@RequestMapping("/api/lobbies/{lobbyId}")
@RequiredArgsConstructor
public class LobbyController {

    private final LobbyService lobbyService;
    private final ObjectMapper objectMapper;

    @GetMapping
    public ApiResponse<LobbyInfo> info(@PathVariable String lobbyId, @AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.ok(lobbyService.getLobbyInfo(lobbyId, CurrentUserHelper.requireUserId(jwt)));
    }

    /**
     * GM 创建战斗，返回 combatId；客户端随后连接 /ws/combat?combatId=...&token=...
     */
    @PostMapping("/combats")
    public ApiResponse<Map<String, String>> createCombat(@PathVariable String lobbyId,
                                                         @Valid @RequestBody CreateCombatRequest req,
                                                         @AuthenticationPrincipal Jwt jwt) {
        PresetSource preset = PresetSource.parse(req.getPresetType(), req.getPreset(), objectMapper);
        String combatId = lobbyService.createCombat(lobbyId, req.getNickname(), preset,
                CurrentUserHelper.requireUserId(jwt), req.getPlayers());
        if (combatId == null) {
            throw new IllegalStateException("Combat ended before it could be registered");
        }
        return ApiResponse.ok(Map.of("combatId", combatId));
    }

    @GetMapping("/combats")
    public ApiResponse<List<String>> activeCombats(@PathVariable String lobbyId) {
        return ApiResponse.ok(lobbyService.getActiveCombats(lobbyId));
    }

    @DeleteMapping("/combats/{combatId}")
    public ApiResponse<Void> terminate(@PathVariable String lobbyId, @PathVariable String combatId,
                                       @AuthenticationPrincipal Jwt jwt) {
        lobbyService.terminateCombat(lobbyId, combatId, CurrentUserHelper.requireUserId(jwt));
        return ApiResponse.ok();
    }

    @PostMapping("/players")
    public ApiResponse<Void> join(@PathVariable String lobbyId, @Valid @RequestBody JoinLobbyRequest req,
                                  @AuthenticationPrincipal Jwt jwt) {
        lobbyService.addPlayerToLobby(lobbyId, CurrentUserHelper.requireUserId(jwt), req.getNickname(), req.getCharacterId());
        return ApiResponse.ok();
    }

    @GetMapping("/characters/me")
    public ApiResponse<CharacterInfo> myCharacter(@PathVariable String lobbyId, @AuthenticationPrincipal Jwt jwt) {
        return ApiResponse.ok(lobbyService.getMyCharacterInfo(lobbyId, CurrentUserHelper.requireUserId(jwt)));
    }

    @GetMapping("/characters/{characterId}")
    public ApiResponse<CharacterInfo> character(@PathVariable String lobbyId, @PathVariable String characterId) {
        return ApiResponse.ok(lobbyService.getCharacterInfo(lobbyId, characterId));
    }
}
