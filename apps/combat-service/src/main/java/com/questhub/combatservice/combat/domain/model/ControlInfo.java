package com.questhub.combatservice.combat.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 棋子控制方（带 type 判别字段的联合类型）
 * <pre>
 *   {"type":"player","id":"u1"}   玩家控制；id 为 null 表示尚未指派
 *   {"type":"ai","id":"g1"}       AI 控制，id 为 AI 配置标识
 *   {"type":"game_logic"}         由游戏逻辑驱动（陷阱、环境物件等）
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ControlInfo.PlayerControl.class, name = "player"),
        @JsonSubTypes.Type(value = ControlInfo.AiControl.class, name = "ai"),
        @JsonSubTypes.Type(value = ControlInfo.GameLogicControl.class, name = "game_logic")
})
public interface ControlInfo {

    record PlayerControl(String id) implements ControlInfo {
    }

    record AiControl(String id) implements ControlInfo {
    }

    record GameLogicControl() implements ControlInfo {
    }

    static ControlInfo player(String id) {
        return new PlayerControl(id);
    }

    static ControlInfo ai(String id) {
        return new AiControl(id);
    }

    static ControlInfo gameLogic() {
        return new GameLogicControl();
    }
}
