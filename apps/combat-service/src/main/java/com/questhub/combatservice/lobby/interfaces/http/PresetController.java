package com.questhub.combatservice.lobby.interfaces.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questhub.combatservice.combat.preset.CombatPresetService;
import com.questhub.combatservice.combat.preset.PresetSource;
import com.questhub.combatservice.lobby.interfaces.http.dto.CreatePresetRequest;
import com.questhub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 战斗预设接口
 */
@RestController
@RequestMapping("/api/presets")
@RequiredArgsConstructor
public class PresetController {

    private final CombatPresetService presetService;
    private final ObjectMapper objectMapper;

    @PostMapping
    public ApiResponse<Map<String, String>> create(@Valid @RequestBody CreatePresetRequest req) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.set("field", req.getField());
        PresetSource.Requested parsed = (PresetSource.Requested) PresetSource.parse(PresetSource.REQUESTED, payload, objectMapper);
        String presetId = presetService.createPreset(parsed.preset().field());
        return ApiResponse.ok(Map.of("presetId", presetId));
    }
}
