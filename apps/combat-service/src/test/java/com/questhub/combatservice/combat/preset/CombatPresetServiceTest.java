package com.questhub.combatservice.combat.preset;

import com.questhub.combatservice.combat.domain.document.PresetPawn;
import com.questhub.combatservice.combat.domain.model.ControlInfo;
import com.questhub.combatservice.combat.domain.model.PawnSource;
import com.questhub.combatservice.combat.domain.repository.GameStore;
import com.questhub.combatservice.common.exception.ClientFaultException;
import com.questhub.combatservice.common.exception.NotFoundException;
import com.questhub.combatservice.support.Seeds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CombatPresetServiceTest {

    @Mock
    private GameStore store;

    private CombatPresetService service;

    @BeforeEach
    void setUp() {
        service = new CombatPresetService(new PresetCookingPipeline(store), store);
    }

    @Test
    void storesNormalizedPawns() {
        when(store.getCharacter("goblin")).thenReturn(Optional.of(Seeds.goblin()));
        when(store.createCombatPreset(any())).thenReturn("preset-1");

        String id = service.createPreset(List.of(new PresetPawn(" b2", "goblin", PawnSource.EMBEDDED, ControlInfo.ai("g1"))));

        assertThat(id).isEqualTo("preset-1");
        verify(store).createCombatPreset(List.of(new PresetPawn("B2", "goblin", PawnSource.EMBEDDED, ControlInfo.ai("g1"))));
    }

    @Test
    void duplicateSquaresAreNotStored() {
        List<PresetPawn> pawns = List.of(
                new PresetPawn("A1", "x", PawnSource.DLC, ControlInfo.gameLogic()),
                new PresetPawn("a1", "y", PawnSource.DLC, ControlInfo.gameLogic()));

        assertThatThrownBy(() -> service.createPreset(pawns)).isInstanceOf(ClientFaultException.class);
        verify(store, never()).createCombatPreset(any());
    }

    @Test
    void danglingEmbeddedReferenceIsNotStored() {
        when(store.getCharacter("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.createPreset(
                List.of(new PresetPawn("A1", "ghost", PawnSource.EMBEDDED, ControlInfo.ai("g1")))))
                .isInstanceOf(NotFoundException.class);
        verify(store, never()).createCombatPreset(any());
    }
}
