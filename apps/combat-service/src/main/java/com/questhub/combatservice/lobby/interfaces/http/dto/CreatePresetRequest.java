package com.questhub.combatservice.lobby.interfaces.http.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 新建战斗预设请求，field 结构与创建战斗时的 requested 预设一致
 */
@Data
public class CreatePresetRequest {
    @NotNull
    private JsonNode field;
}
