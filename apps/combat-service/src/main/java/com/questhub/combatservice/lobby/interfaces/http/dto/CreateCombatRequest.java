package com.questhub.combatservice.lobby.interfaces.http.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 创建战斗请求
 * <pre>
 * {
 *   "nickname": "Boss Fight",
 *   "presetType": "requested",          // 或 "importable"
 *   "preset": {"field": {"A1": {"path": "goblin", "source": "embedded", "controlledBy": {"type": "ai", "id": "g1"}}}},
 *   "players": ["p1", "p2"]
 * }
 * </pre>
 */
@Data
public class CreateCombatRequest {
    @NotBlank
    private String nickname;
    private String presetType;
    @NotNull
    private JsonNode preset;
    private List<String> players = new ArrayList<>();
}
