package com.questhub.combatservice.combat.session;

@FunctionalInterface
public interface CombatEndedListener {
    void onCombatEnded(CombatEndedEvent event);
}
