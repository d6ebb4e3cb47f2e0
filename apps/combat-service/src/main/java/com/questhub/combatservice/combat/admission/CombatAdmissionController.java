package com.questhub.combatservice.combat.admission;

import com.questhub.combatservice.combat.session.CombatRegistry;
import com.questhub.combatservice.combat.session.CombatSession;
import com.questhub.combatservice.common.exception.UnauthorizedException;
import com.questhub.combatservice.platform.auth.AccessTokenVerifier;
import com.questhub.combatservice.platform.auth.VerifiedToken;
import com.questhub.combatservice.platform.transport.CombatConnection;
import com.questhub.combatservice.platform.transport.CombatEvents;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * 战斗连接准入
 * ----------------------------------------
 * 对每个连接尝试 (connection, combatId, accessToken) 依次执行：
 *   1. 查找会话：不存在 → 断开
 *   2. 校验令牌：失败 → 发送 invalid_token 后断开
 *   3. 去重：该玩家已有实时连接 → 断开
 *   4. 接入：handlePlayer 返回 false（并发竞争落败）→ 断开
 *
 * 顺序不可调换：令牌校验必须早于去重与接入；任何拒绝分支都以断开连接结束。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CombatAdmissionController {

    private final CombatRegistry registry;
    private final AccessTokenVerifier tokenVerifier;

    /**
     * @return 被接纳时返回玩家 ID；被拒绝时为空（连接已断开）
     */
    public Optional<String> admit(CombatConnection connection, String combatId, String accessToken) {
        Optional<CombatSession> found = registry.get(combatId);
        if (found.isEmpty()) {
            log.info("【战斗准入】会话不存在，断开: connectionId={}, combatId={}", connection.id(), combatId);
            connection.disconnect();
            return Optional.empty();
        }
        CombatSession session = found.get();

        String playerId;
        try {
            VerifiedToken verified = tokenVerifier.verify(accessToken);
            playerId = verified.subjectId();
        } catch (UnauthorizedException e) {
            log.info("【战斗准入】令牌无效，断开: connectionId={}, combatId={}, reason={}",
                    connection.id(), combatId, e.getMessage());
            connection.emit(CombatEvents.INVALID_TOKEN, Map.of("message", e.getMessage()));
            connection.disconnect();
            return Optional.empty();
        }

        if (session.isPlayerInCombat(playerId)) {
            log.info("【战斗准入】玩家已在战斗中，拒绝重复连接: connectionId={}, combatId={}, playerId={}",
                    connection.id(), combatId, playerId);
            connection.disconnect();
            return Optional.empty();
        }

        if (!session.handlePlayer(playerId, connection)) {
            log.info("【战斗准入】接入竞争落败或会话已结束，断开: connectionId={}, combatId={}, playerId={}",
                    connection.id(), combatId, playerId);
            connection.disconnect();
            return Optional.empty();
        }

        log.debug("【战斗准入】接入成功: connectionId={}, combatId={}, playerId={}", connection.id(), combatId, playerId);
        return Optional.of(playerId);
    }
}
