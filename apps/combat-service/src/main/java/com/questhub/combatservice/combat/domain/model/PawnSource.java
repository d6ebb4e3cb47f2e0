package com.questhub.combatservice.combat.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 棋子实体来源
 */
public enum PawnSource {
    /** 实体定义存放在存储层，烹饪时解析并内嵌到 custom_entities */
    EMBEDDED("embedded"),
    /** 实体定义随扩展包（DLC）分发，客户端自行解析 */
    DLC("dlc");

    private final String wire;

    PawnSource(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /**
     * 宽松解析；无法识别时返回 null，由调用方决定如何报错。
     */
    @JsonCreator
    public static PawnSource fromWire(String value) {
        if (value == null) return null;
        for (PawnSource s : values()) {
            if (s.wire.equalsIgnoreCase(value.trim())) return s;
        }
        return null;
    }
}
