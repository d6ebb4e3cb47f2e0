package com.questhub.combatservice.combat.domain.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 角色 / 实体定义文档
 * ----------------------------------------
 * 既用于大厅玩家绑定的角色，也作为战斗种子中 embedded 棋子的完整实体定义（custom_entities）。
 * 字段只做承载，数值含义由战斗规则解释，本服务不做平衡性校验。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CharacterDocument {
    private String id;
    /** 实体描述符（如 builtins:goblin），也是翻译键的前缀 */
    private String descriptor;
    private Decorations decorations;
    @Builder.Default
    private Level level = new Level(1, 0);
    private int gold;
    @Builder.Default
    private List<String> alignments = new ArrayList<>();
    @Builder.Default
    private AbilitiesPoints abilitiesPoints = new AbilitiesPoints();
    @Builder.Default
    private List<Attribute> attributes = new ArrayList<>();
    @Builder.Default
    private List<ItemStack> inventory = new ArrayList<>();
    @Builder.Default
    private List<ItemStack> weaponry = new ArrayList<>();
    @Builder.Default
    private List<Spell> spellBook = new ArrayList<>();
    @Builder.Default
    private SpellLayout spellLayout = new SpellLayout(4, new ArrayList<>());
    @Builder.Default
    private List<StatusEffect> statusEffects = new ArrayList<>();

    /** 展示信息：名称、描述、立绘 */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Decorations {
        private String name;
        private String description;
        private String sprite;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Level {
        private int current;
        private int availableUpgrades;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AbilitiesPoints {
        private int will;
        private int reflexes;
        private int strength;
        private int max;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Attribute {
        private String dlc = "builtins";
        private String descriptor;
        private double value;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemStack {
        private String descriptor;
        private int quantity = 1;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Spell {
        private String descriptor;
        private List<String> conflictsWith = new ArrayList<>();
        private List<String> requiresToUse = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SpellLayout {
        private int max;
        private List<String> layout = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatusEffect {
        private String descriptor;
        private int duration;
    }
}
