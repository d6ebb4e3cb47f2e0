package com.questhub.combatservice.lobby.service;

import com.questhub.combatservice.combat.domain.document.CharacterDocument;
import com.questhub.combatservice.combat.domain.document.LobbyDocument;
import com.questhub.combatservice.combat.domain.document.LobbyPlayer;
import com.questhub.combatservice.combat.domain.document.UserDocument;
import com.questhub.combatservice.combat.domain.model.ControlInfo;
import com.questhub.combatservice.combat.domain.document.PresetPawn;
import com.questhub.combatservice.combat.domain.model.PawnSource;
import com.questhub.combatservice.combat.domain.repository.GameStore;
import com.questhub.combatservice.combat.preset.PresetCookingPipeline;
import com.questhub.combatservice.combat.preset.PresetSource;
import com.questhub.combatservice.combat.preset.RequestedPreset;
import com.questhub.combatservice.combat.session.CombatEndedEvent;
import com.questhub.combatservice.combat.session.CombatRegistry;
import com.questhub.combatservice.combat.session.CombatSession;
import com.questhub.combatservice.common.exception.ClientFaultException;
import com.questhub.combatservice.common.exception.ForbiddenException;
import com.questhub.combatservice.common.exception.NotFoundException;
import com.questhub.combatservice.lobby.LobbyCombatIndex;
import com.questhub.combatservice.lobby.dto.CharacterInfo;
import com.questhub.combatservice.lobby.dto.LobbyInfo;
import com.questhub.combatservice.platform.config.CombatProperties;
import com.questhub.combatservice.support.RecordingConnection;
import com.questhub.combatservice.support.Seeds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LobbyServiceTest {

    @Mock
    private GameStore store;

    private LobbyCombatIndex index;
    private CombatRegistry registry;
    private LobbyService service;

    private final PresetSource knightAndGoblin = new PresetSource.Requested(new RequestedPreset(List.of(
            new PresetPawn("A1", "builtins:knight", PawnSource.DLC, ControlInfo.player("p1")),
            new PresetPawn("B1", "goblin", PawnSource.EMBEDDED, ControlInfo.ai("g1")))));

    @BeforeEach
    void setUp() {
        index = new LobbyCombatIndex();
        // 同步转发，与 Spring 的 @EventListener 行为一致
        registry = new CombatRegistry(event -> index.onCombatEnded((CombatEndedEvent) event), new CombatProperties());
        service = new LobbyService(store, new PresetCookingPipeline(store), registry, index);

        LobbyDocument lobby = LobbyDocument.builder()
                .id("lobby1")
                .name("Tavern")
                .gmId("gm1")
                .players(new ArrayList<>(List.of(
                        new LobbyPlayer("p1", "Sir Lancelot", "char-1"),
                        new LobbyPlayer("p2", "Robin", null))))
                .build();
        when(store.getLobby("lobby1")).thenReturn(Optional.of(lobby));
        when(store.getLobby("nowhere")).thenReturn(Optional.empty());
        when(store.getCharacter("goblin")).thenReturn(Optional.of(Seeds.goblin()));
        when(store.getCharacter("char-1")).thenReturn(Optional.of(CharacterDocument.builder()
                .id("char-1")
                .descriptor("builtins:paladin")
                .decorations(new CharacterDocument.Decorations("Paladin", "Holy knight", "paladin.png"))
                .build()));
        when(store.getUser("p1")).thenReturn(Optional.of(new UserDocument("p1", "lance", 0L)));
        when(store.getUser("p2")).thenReturn(Optional.of(new UserDocument("p2", "robin_h", 0L)));
    }

    @Nested
    @DisplayName("createCombat")
    class CreateCombat {

        @Test
        @DisplayName("Boss Fight：创建后可见，结束后从大厅消失")
        void bossFightAppearsAndDisappears() {
            String id = service.createCombat("lobby1", "Boss Fight", knightAndGoblin, "gm1", List.of("p1", "p2"));

            assertThat(service.getActiveCombats("lobby1")).containsExactly(id);
            CombatSession session = service.get(id).orElseThrow();
            assertThat(session.getRoster()).containsExactlyInAnyOrder("p1", "p2");

            session.finish("victory");

            assertThat(service.getActiveCombats("lobby1")).isEmpty();
            assertThat(service.get(id)).isEmpty();
        }

        @Test
        void missingLobbyIsNotFound() {
            assertThatThrownBy(() -> service.createCombat("nowhere", "x", knightAndGoblin, "gm1", List.of()))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        void onlyLobbyGmMayCreate() {
            assertThatThrownBy(() -> service.createCombat("lobby1", "x", knightAndGoblin, "p1", List.of("p2")))
                    .isInstanceOf(ForbiddenException.class);
            assertThat(registry.activeCount()).isZero();
        }

        @Test
        void playersMustBeLobbyMembers() {
            assertThatThrownBy(() -> service.createCombat("lobby1", "x", knightAndGoblin, "gm1", List.of("p1", "intruder")))
                    .isInstanceOf(ClientFaultException.class)
                    .hasMessageContaining("intruder");
            assertThat(registry.activeCount()).isZero();
        }

        @Test
        void cookingFailureCreatesNothing() {
            when(store.getCharacter("goblin")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.createCombat("lobby1", "x", knightAndGoblin, "gm1", List.of("p1")))
                    .isInstanceOf(NotFoundException.class);
            assertThat(registry.activeCount()).isZero();
            assertThat(service.getActiveCombats("lobby1")).isEmpty();
        }

        @Test
        void combatsOfDifferentLobbiesStaySeparate() {
            LobbyDocument other = LobbyDocument.builder().id("lobby2").name("Inn").gmId("gm1").build();
            when(store.getLobby("lobby2")).thenReturn(Optional.of(other));

            String a = service.createCombat("lobby1", "A", knightAndGoblin, "gm1", List.of());
            String b = service.createCombat("lobby2", "B", knightAndGoblin, "gm1", List.of());

            assertThat(service.getActiveCombats("lobby1")).containsExactly(a);
            assertThat(service.getActiveCombats("lobby2")).containsExactly(b);
        }
    }

    @Nested
    @DisplayName("getLobbyInfo")
    class Aggregation {

        @Test
        void aggregatesConnectedPlayersAndRoundState() {
            String id = service.createCombat("lobby1", "Boss Fight", knightAndGoblin, "gm1", List.of("p1", "p2"));
            CombatSession session = service.get(id).orElseThrow();
            session.handlePlayer("p1", new RecordingConnection("c1"));
            session.start("gm1");

            LobbyInfo info = service.getLobbyInfo("lobby1", "p1");

            assertThat(info.name()).isEqualTo("Tavern");
            assertThat(info.layout()).isEqualTo(LobbyInfo.LAYOUT_DEFAULT);
            assertThat(info.combats()).singleElement().satisfies(c -> {
                assertThat(c.id()).isEqualTo(id);
                assertThat(c.nickname()).isEqualTo("Boss Fight");
                assertThat(c.isActive()).isTrue();
                assertThat(c.roundCount()).isEqualTo(1);
                assertThat(c.activePlayers()).containsExactly(new LobbyInfo.ActivePlayer("lance", "Sir Lancelot"));
            });
            assertThat(info.controlledEntity()).isEqualTo(new LobbyInfo.ControlledEntity("builtins:paladin", "char-1"));
            assertThat(info.players()).extracting(p -> p.player().handle()).containsExactly("lance", "robin_h");
            assertThat(info.players().get(0).character()).isEqualTo(new LobbyInfo.CharacterView("Paladin", "paladin.png"));
            assertThat(info.players().get(1).character()).isNull();
        }

        @Test
        void pendingCombatReportsRoundZero() {
            service.createCombat("lobby1", "Later", knightAndGoblin, "gm1", List.of("p1"));

            LobbyInfo info = service.getLobbyInfo("lobby1", "gm1");

            assertThat(info.layout()).isEqualTo(LobbyInfo.LAYOUT_GM);
            assertThat(info.controlledEntity()).isNull();
            assertThat(info.combats()).singleElement().satisfies(c -> {
                assertThat(c.isActive()).isFalse();
                assertThat(c.roundCount()).isZero();
                assertThat(c.activePlayers()).isEmpty();
            });
        }

        @Test
        @DisplayName("索引中存在但注册表中已消失的战斗被略过")
        void vanishedCombatIsOmitted() {
            String live = service.createCombat("lobby1", "Live", knightAndGoblin, "gm1", List.of());
            index.add("lobby1", "999");

            LobbyInfo info = service.getLobbyInfo("lobby1", "p2");

            assertThat(info.combats()).extracting(LobbyInfo.CombatSummary::id).containsExactly(live);
        }

        @Test
        void unknownUserGetsEmptyHandle() {
            when(store.getUser("p2")).thenReturn(Optional.empty());
            String id = service.createCombat("lobby1", "Boss", knightAndGoblin, "gm1", List.of("p2"));
            service.get(id).orElseThrow().handlePlayer("p2", new RecordingConnection("c2"));

            LobbyInfo info = service.getLobbyInfo("lobby1", "p2");

            assertThat(info.combats().get(0).activePlayers()).containsExactly(new LobbyInfo.ActivePlayer("", "Robin"));
        }

        @Test
        void missingLobbyIsNotFound() {
            assertThatThrownBy(() -> service.getLobbyInfo("nowhere", "p1")).isInstanceOf(NotFoundException.class);
        }
    }

    @Nested
    @DisplayName("大厅成员与角色")
    class Members {

        @Test
        void joinStoresPlayer() {
            service.addPlayerToLobby("lobby1", "p3", "Merlin", null);

            verify(store).addPlayerToLobby("lobby1", new LobbyPlayer("p3", "Merlin", null));
        }

        @Test
        void joinWithUnknownCharacterIsRejected() {
            when(store.getCharacter("char-x")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.addPlayerToLobby("lobby1", "p3", "Merlin", "char-x"))
                    .isInstanceOf(NotFoundException.class);
            verify(store, never()).addPlayerToLobby(anyString(), any());
        }

        @Test
        void myCharacterIsResolvedThroughLobby() {
            CharacterInfo info = service.getMyCharacterInfo("lobby1", "p1");

            assertThat(info.name()).isEqualTo("Paladin");
            assertThat(info.descriptor()).isEqualTo("builtins:paladin");
        }

        @Test
        void playerWithoutCharacterGetsNotFound() {
            assertThatThrownBy(() -> service.getMyCharacterInfo("lobby1", "p2")).isInstanceOf(NotFoundException.class);
        }

        @Test
        void characterOutsideLobbyIsHidden() {
            assertThatThrownBy(() -> service.getCharacterInfo("lobby1", "goblin")).isInstanceOf(NotFoundException.class);
            assertThat(service.getCharacterInfo("lobby1", "char-1").sprite()).isEqualTo("paladin.png");
        }
    }

    @Nested
    @DisplayName("terminateCombat")
    class Terminate {

        @Test
        void gmTerminatesAndIndexIsPruned() {
            String id = service.createCombat("lobby1", "Boss", knightAndGoblin, "gm1", List.of("p1"));

            service.terminateCombat("lobby1", id, "gm1");

            assertThat(service.getActiveCombats("lobby1")).isEmpty();
            assertThat(service.get(id)).isEmpty();
        }

        @Test
        void nonGmCannotTerminate() {
            String id = service.createCombat("lobby1", "Boss", knightAndGoblin, "gm1", List.of("p1"));

            assertThatThrownBy(() -> service.terminateCombat("lobby1", id, "p1")).isInstanceOf(ForbiddenException.class);
            assertThat(service.get(id)).isPresent();
        }

        @Test
        void combatOfAnotherLobbyIsNotFound() {
            assertThatThrownBy(() -> service.terminateCombat("lobby1", "42", "gm1")).isInstanceOf(NotFoundException.class);
        }
    }
}
