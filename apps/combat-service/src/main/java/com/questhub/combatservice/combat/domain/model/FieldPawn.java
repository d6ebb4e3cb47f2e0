package com.questhub.combatservice.combat.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FieldPawn(@JsonProperty("entity_preset") EntityPreset entityPreset,
                        @JsonProperty("owner") ControlInfo owner) {
}
