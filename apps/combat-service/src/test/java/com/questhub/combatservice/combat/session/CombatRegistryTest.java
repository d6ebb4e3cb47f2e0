package com.questhub.combatservice.combat.session;

import com.questhub.combatservice.platform.config.CombatProperties;
import com.questhub.combatservice.support.Seeds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CombatRegistryTest {

    @Mock
    private ApplicationEventPublisher publisher;

    private CombatRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CombatRegistry(publisher, new CombatProperties());
    }

    @Test
    void idsAreSequentialStrings() {
        String first = registry.create("One", Seeds.threePawns(), "gm", List.of("p1"));
        String second = registry.create("Two", Seeds.threePawns(), "gm", List.of("p1"));

        assertThat(first).isEqualTo("0");
        assertThat(second).isEqualTo("1");
        assertThat(registry.get(first)).get().extracting(CombatSession::getNickname).isEqualTo("One");
    }

    @Test
    void idsAreNotReusedAfterRemoval() {
        String first = registry.create("One", Seeds.threePawns(), "gm", List.of());
        registry.get(first).orElseThrow().finish("done");

        String next = registry.create("Two", Seeds.threePawns(), "gm", List.of());

        assertThat(next).isNotEqualTo(first).isEqualTo("1");
    }

    @Test
    void finishedSessionIsRemovedAndEventPublishedOnce() {
        String id = registry.create("Boss", Seeds.threePawns(), "gm", List.of("p1"));
        CombatSession session = registry.get(id).orElseThrow();

        session.finish("victory");
        session.finish("again");

        assertThat(registry.get(id)).isEmpty();
        assertThat(registry.activeCount()).isZero();
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(publisher, times(1)).publishEvent(captor.capture());
        assertThat(captor.getValue()).isEqualTo(new CombatEndedEvent(id, "victory"));
    }

    @Test
    void duplicateEndNotificationIsIgnored() {
        String id = registry.create("Boss", Seeds.threePawns(), "gm", List.of());
        registry.get(id).orElseThrow().finish("done");

        registry.onCombatEnded(new CombatEndedEvent(id, "done"));

        verify(publisher, times(1)).publishEvent(any(Object.class));
    }

    @Test
    void terminateFinishesExistingSessionOnly() {
        String id = registry.create("Boss", Seeds.threePawns(), "gm", List.of());

        assertThat(registry.terminate("404", "cancel")).isFalse();
        verify(publisher, never()).publishEvent(any(Object.class));

        assertThat(registry.terminate(id, "cancel")).isTrue();
        assertThat(registry.get(id)).isEmpty();
        assertThat(registry.terminate(id, "cancel")).isFalse();
    }

    @Test
    void unknownOrNullIdIsAbsent() {
        assertThat(registry.get("nope")).isEmpty();
        assertThat(registry.get(null)).isEmpty();
    }

    @Test
    void concurrentCreatesGetDistinctIds() throws Exception {
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        Set<String> ids = ConcurrentHashMap.newKeySet();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++) {
                        ids.add(registry.create("c", Seeds.threePawns(), "gm", List.of()));
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(ids).hasSize(threads * perThread);
        assertThat(registry.activeCount()).isEqualTo(threads * perThread);
    }
}
