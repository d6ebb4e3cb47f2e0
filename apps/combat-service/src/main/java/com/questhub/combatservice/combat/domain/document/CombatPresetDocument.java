package com.questhub.combatservice.combat.domain.document;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CombatPresetDocument {
    private String id;
    private List<PresetPawn> field = new ArrayList<>();
}
