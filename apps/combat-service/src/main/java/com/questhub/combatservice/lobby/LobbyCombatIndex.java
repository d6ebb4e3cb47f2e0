package com.questhub.combatservice.lobby;

import com.questhub.combatservice.combat.session.CombatEndedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 大厅 → 战斗 ID 索引
 * ----------------------------------------
 * 维护每个大厅下仍存活的战斗 ID（按创建顺序）。
 * 监听 {@link CombatEndedEvent}：注册表摘除会话后，这里立即同步剪除，不保留悬挂 ID。
 */
@Slf4j
@Component
public class LobbyCombatIndex {

    private final Map<String, List<String>> combatsByLobby = new ConcurrentHashMap<>();
    /** 反向索引：combatId → lobbyId，结束事件只携带 combatId */
    private final Map<String, String> lobbyByCombat = new ConcurrentHashMap<>();

    public void add(String lobbyId, String combatId) {
        lobbyByCombat.put(combatId, lobbyId);
        combatsByLobby.compute(lobbyId, (k, list) -> {
            List<String> l = list == null ? new CopyOnWriteArrayList<>() : list;
            if (!l.contains(combatId)) {
                l.add(combatId);
            }
            return l;
        });
        log.debug("大厅索引新增: lobbyId={}, combatId={}", lobbyId, combatId);
    }

    /**
     * @return 是否确实移除了该 ID
     */
    public boolean remove(String combatId) {
        String lobbyId = lobbyByCombat.remove(combatId);
        if (lobbyId == null) {
            return false;
        }
        combatsByLobby.computeIfPresent(lobbyId, (k, list) -> {
            list.remove(combatId);
            return list.isEmpty() ? null : list;
        });
        log.debug("大厅索引剪除: lobbyId={}, combatId={}", lobbyId, combatId);
        return true;
    }

    /** 返回快照副本，按创建顺序 */
    public List<String> getActiveCombats(String lobbyId) {
        List<String> list = combatsByLobby.get(lobbyId);
        return list == null ? List.of() : List.copyOf(list);
    }

    @EventListener
    public void onCombatEnded(CombatEndedEvent event) {
        remove(event.combatId());
    }
}
