package com.questhub.combatservice.lobby.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class JoinLobbyRequest {
    @NotBlank
    private String nickname;
    /** 可选，加入时直接绑定角色 */
    private String characterId;
}
