package com.questhub.combatservice.combat.preset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questhub.combatservice.combat.domain.constants.CombatMessages;
import com.questhub.combatservice.combat.domain.document.PresetPawn;
import com.questhub.combatservice.combat.domain.model.ControlInfo;
import com.questhub.combatservice.combat.domain.model.PawnSource;
import com.questhub.combatservice.common.exception.ClientFaultException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 预设来源：importable（按 ID 读取已存储预设）或 requested（请求内联提交）
 * ----------------------------------------
 * {@link #parse} 是唯一的边界解析入口，未知类型在这里就被拒绝，
 * 之后的烹饪流程只面对两种合法取值。
 */
public interface PresetSource {

    String IMPORTABLE = "importable";
    String REQUESTED = "requested";

    record Importable(String presetId) implements PresetSource {
    }

    record Requested(RequestedPreset preset) implements PresetSource {
    }

    /**
     * 解析请求中的 presetType + preset 载荷。
     * <ul>
     *   <li>type 为空时按 requested 处理；</li>
     *   <li>importable：载荷为预设 ID 字符串，或含 presetId 字段的对象；</li>
     *   <li>requested：载荷为 {"field": {...}}，field 可以是 “格子 → 棋子” 对象，也可以是带 square 字段的数组。</li>
     * </ul>
     *
     * @throws ClientFaultException 类型未知或载荷结构不合法
     */
    static PresetSource parse(String type, JsonNode payload, ObjectMapper mapper) {
        String mode = (type == null || type.isBlank()) ? REQUESTED : type.trim().toLowerCase();
        switch (mode) {
            case IMPORTABLE:
                return new Importable(readPresetId(payload));
            case REQUESTED:
                return new Requested(readRequested(payload, mapper));
            default:
                throw new ClientFaultException(CombatMessages.UNKNOWN_PRESET_TYPE + type);
        }
    }

    private static String readPresetId(JsonNode payload) {
        JsonNode idNode = payload;
        if (payload != null && payload.isObject()) {
            idNode = payload.get("presetId");
        }
        if (idNode == null || !idNode.isTextual() || idNode.asText().isBlank()) {
            throw new ClientFaultException("Importable preset requires a preset id");
        }
        return idNode.asText().trim();
    }

    private static RequestedPreset readRequested(JsonNode payload, ObjectMapper mapper) {
        JsonNode field = payload == null ? null : payload.get("field");
        if (field == null || field.isNull()) {
            throw new ClientFaultException("Requested preset requires a field");
        }
        List<PresetPawn> pawns = new ArrayList<>();
        if (field.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = field.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                pawns.add(readPawn(e.getKey(), e.getValue(), mapper));
            }
        } else if (field.isArray()) {
            for (JsonNode node : field) {
                pawns.add(readPawn(node.path("square").asText(null), node, mapper));
            }
        } else {
            throw new ClientFaultException("Preset field must be an object or an array");
        }
        return new RequestedPreset(pawns);
    }

    private static PresetPawn readPawn(String square, JsonNode node, ObjectMapper mapper) {
        if (node == null || !node.isObject()) {
            throw new ClientFaultException("Pawn at " + square + " must be an object");
        }
        String path = node.path("path").asText(null);
        String sourceRaw = node.path("source").asText(null);
        PawnSource source = PawnSource.fromWire(sourceRaw);
        if (source == null) {
            throw new ClientFaultException(CombatMessages.UNKNOWN_SOURCE + ": " + sourceRaw);
        }
        JsonNode ownerNode = node.get("controlledBy");
        if (ownerNode == null || ownerNode.isNull()) {
            ownerNode = node.get("controlled_by");
        }
        if (ownerNode == null || ownerNode.isNull()) {
            throw new ClientFaultException(CombatMessages.MISSING_OWNER + ": " + square);
        }
        ControlInfo owner;
        try {
            owner = mapper.treeToValue(ownerNode, ControlInfo.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ClientFaultException("Invalid controller for pawn at " + square + ": " + ownerNode);
        }
        return new PresetPawn(square, path, source, owner);
    }
}
