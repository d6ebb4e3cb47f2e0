package com.questhub.combatservice.combat.session;

import com.questhub.combatservice.combat.domain.model.BattlefieldSeed;
import com.questhub.combatservice.platform.config.CombatProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 战斗会话注册表
 * ----------------------------------------
 * - 分配单调递增的战斗 ID（进程存活期间不复用）；
 * - 持有 combatId → CombatSession 映射；
 * - 会话结束时先从映射中摘除（后续查找立即失效），再广播 {@link CombatEndedEvent}。
 *
 * 会话状态只存在于本进程内存，重启即丢失。
 */
@Slf4j
@Component
public class CombatRegistry {

    private final Map<String, CombatSession> combats = new ConcurrentHashMap<>();
    private final AtomicLong managedSoFar = new AtomicLong();

    private final ApplicationEventPublisher publisher;
    private final CombatProperties properties;

    public CombatRegistry(ApplicationEventPublisher publisher, CombatProperties properties) {
        this.publisher = publisher;
        this.properties = properties;
    }

    /**
     * 创建会话并返回其 ID。纯内存操作，不做任何 I/O。
     */
    public String create(String nickname, BattlefieldSeed seed, String gmId, Collection<String> players) {
        String combatId = Long.toString(managedSoFar.getAndIncrement());
        CombatSession session = new CombatSession(combatId, nickname, seed, gmId, players,
                this::onCombatEnded, properties.getMessageLogSize());
        combats.put(combatId, session);
        log.info("创建战斗: combatId={}, nickname={}, gmId={}, players={}, pawns={}",
                combatId, nickname, gmId, players, seed.fieldPawns().size());
        return combatId;
    }

    /**
     * 按 ID 查找仍在进行中的会话；已结束的会话不会被返回。
     */
    public Optional<CombatSession> get(String combatId) {
        if (combatId == null) {
            return Optional.empty();
        }
        CombatSession session = combats.get(combatId);
        if (session == null || session.isFinished()) {
            return Optional.empty();
        }
        return Optional.of(session);
    }

    /**
     * 主动终止（GM 取消等）。会话走自己的结束流程，摘除与事件广播由 {@link #onCombatEnded} 完成。
     *
     * @return false 表示会话不存在或已结束
     */
    public boolean terminate(String combatId, String reason) {
        return get(combatId).map(s -> s.finish(reason)).orElse(false);
    }

    public int activeCount() {
        return combats.size();
    }

    /**
     * 会话结束回调：只有第一个成功摘除的调用会继续广播。
     */
    void onCombatEnded(CombatEndedEvent event) {
        if (combats.remove(event.combatId()) == null) {
            log.debug("战斗已被摘除，忽略重复结束通知: combatId={}", event.combatId());
            return;
        }
        log.info("战斗已摘除: combatId={}, reason={}, remaining={}", event.combatId(), event.reason(), combats.size());
        publisher.publishEvent(event);
    }
}
