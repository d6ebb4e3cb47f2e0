package com.questhub.combatservice.lobby.dto;

import com.questhub.combatservice.combat.domain.document.CharacterDocument;

import java.util.List;

/**
 * 角色详情视图（角色面板用）
 */
public record CharacterInfo(String id,
                            String descriptor,
                            String name,
                            String description,
                            String sprite,
                            int level,
                            int availableUpgrades,
                            int gold,
                            List<CharacterDocument.Attribute> attributes,
                            List<CharacterDocument.ItemStack> inventory,
                            List<CharacterDocument.ItemStack> weaponry,
                            List<CharacterDocument.Spell> spellBook,
                            CharacterDocument.SpellLayout spellLayout,
                            List<CharacterDocument.StatusEffect> statusEffects) {

    public static CharacterInfo from(CharacterDocument c) {
        CharacterDocument.Decorations d = c.getDecorations();
        CharacterDocument.Level lvl = c.getLevel();
        return new CharacterInfo(
                c.getId(),
                c.getDescriptor(),
                d != null ? d.getName() : c.getDescriptor() + ".name",
                d != null ? d.getDescription() : c.getDescriptor() + ".description",
                d != null ? d.getSprite() : c.getDescriptor() + ".sprite",
                lvl != null ? lvl.getCurrent() : 0,
                lvl != null ? lvl.getAvailableUpgrades() : 0,
                c.getGold(),
                nullSafe(c.getAttributes()),
                nullSafe(c.getInventory()),
                nullSafe(c.getWeaponry()),
                nullSafe(c.getSpellBook()),
                c.getSpellLayout(),
                nullSafe(c.getStatusEffects()));
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
