package com.questhub.combatservice.combat.admission;

import com.questhub.combatservice.combat.session.CombatRegistry;
import com.questhub.combatservice.combat.session.CombatSession;
import com.questhub.combatservice.common.exception.UnauthorizedException;
import com.questhub.combatservice.platform.auth.AccessTokenVerifier;
import com.questhub.combatservice.platform.auth.VerifiedToken;
import com.questhub.combatservice.platform.config.CombatProperties;
import com.questhub.combatservice.platform.transport.CombatEvents;
import com.questhub.combatservice.support.RecordingConnection;
import com.questhub.combatservice.support.Seeds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CombatAdmissionControllerTest {

    @Mock
    private AccessTokenVerifier verifier;
    @Mock
    private ApplicationEventPublisher publisher;

    private CombatRegistry registry;
    private CombatAdmissionController admission;
    private String combatId;

    @BeforeEach
    void setUp() {
        registry = new CombatRegistry(publisher, new CombatProperties());
        admission = new CombatAdmissionController(registry, verifier);
        combatId = registry.create("Boss Fight", Seeds.threePawns(), "gm", List.of("p1", "p2"));
    }

    @Test
    @DisplayName("会话不存在：直接断开，不校验令牌")
    void unknownCombatDisconnectsWithoutVerifying() {
        RecordingConnection conn = new RecordingConnection("c1");

        Optional<String> admitted = admission.admit(conn, "999", "tok");

        assertThat(admitted).isEmpty();
        assertThat(conn.events()).containsExactly(RecordingConnection.DISCONNECTED);
        verifyNoInteractions(verifier);
    }

    @Test
    @DisplayName("令牌无效：先发 invalid_token 再断开")
    void invalidTokenEmitsSignalThenDisconnects() {
        when(verifier.verify("bad")).thenThrow(new UnauthorizedException("Invalid access token"));
        RecordingConnection conn = new RecordingConnection("c1");

        Optional<String> admitted = admission.admit(conn, combatId, "bad");

        assertThat(admitted).isEmpty();
        assertThat(conn.events()).containsExactly(CombatEvents.INVALID_TOKEN, RecordingConnection.DISCONNECTED);
        assertThat(registry.get(combatId).orElseThrow().getConnectedPlayerIds()).isEmpty();
    }

    @Test
    void validTokenAttachesPlayer() {
        when(verifier.verify("tok-p1")).thenReturn(new VerifiedToken("p1", "alice"));
        RecordingConnection conn = new RecordingConnection("c1");

        Optional<String> admitted = admission.admit(conn, combatId, "tok-p1");

        assertThat(admitted).contains("p1");
        assertThat(conn.events()).containsExactly(CombatEvents.HANDSHAKE);
        assertThat(conn.wasDisconnected()).isFalse();
        assertThat(registry.get(combatId).orElseThrow().isPlayerInCombat("p1")).isTrue();
    }

    @Test
    @DisplayName("同一玩家第二个连接被拒绝，第一个连接不受影响")
    void duplicatePlayerIsRejected() {
        when(verifier.verify(anyString())).thenReturn(new VerifiedToken("p1", "alice"));
        RecordingConnection first = new RecordingConnection("c1");
        RecordingConnection second = new RecordingConnection("c2");

        admission.admit(first, combatId, "tok");
        Optional<String> again = admission.admit(second, combatId, "tok");

        assertThat(again).isEmpty();
        assertThat(second.events()).containsExactly(RecordingConnection.DISCONNECTED);
        assertThat(first.wasDisconnected()).isFalse();
    }

    @Test
    @DisplayName("并发竞争落败（handlePlayer 返回 false）也要断开")
    void lostRaceDisconnects() {
        CombatRegistry mockedRegistry = mock(CombatRegistry.class);
        CombatSession session = mock(CombatSession.class);
        when(mockedRegistry.get("5")).thenReturn(Optional.of(session));
        when(verifier.verify("tok")).thenReturn(new VerifiedToken("p1", null));
        when(session.isPlayerInCombat("p1")).thenReturn(false);
        when(session.handlePlayer(anyString(), any())).thenReturn(false);
        RecordingConnection conn = new RecordingConnection("c1");

        Optional<String> admitted = new CombatAdmissionController(mockedRegistry, verifier).admit(conn, "5", "tok");

        assertThat(admitted).isEmpty();
        assertThat(conn.wasDisconnected()).isTrue();
    }

    @Test
    void reconnectAfterReleaseSucceeds() {
        when(verifier.verify(anyString())).thenReturn(new VerifiedToken("p1", "alice"));
        RecordingConnection first = new RecordingConnection("c1");
        admission.admit(first, combatId, "tok");
        registry.get(combatId).orElseThrow().releasePlayer("p1", first);

        RecordingConnection second = new RecordingConnection("c2");

        assertThat(admission.admit(second, combatId, "tok")).contains("p1");
    }

    @Test
    void finishedCombatIsNotAdmitted() {
        registry.terminate(combatId, "cancel");
        RecordingConnection conn = new RecordingConnection("c1");

        assertThat(admission.admit(conn, combatId, "tok")).isEmpty();
        assertThat(conn.wasDisconnected()).isTrue();
        verify(verifier, never()).verify(anyString());
    }
}
