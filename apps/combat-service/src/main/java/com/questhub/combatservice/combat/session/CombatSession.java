package com.questhub.combatservice.combat.session;

import com.questhub.combatservice.combat.domain.constants.CombatMessages;
import com.questhub.combatservice.combat.domain.model.BattlefieldSeed;
import com.questhub.combatservice.combat.domain.model.CombatStatus;
import com.questhub.combatservice.combat.domain.model.ControlInfo;
import com.questhub.combatservice.combat.domain.model.FieldPawn;
import com.questhub.combatservice.common.exception.CombatServiceException;
import com.questhub.combatservice.common.exception.CommandRejectedException;
import com.questhub.combatservice.common.exception.InternalFaultException;
import com.questhub.combatservice.platform.transport.CombatConnection;
import com.questhub.combatservice.platform.transport.CombatEvents;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 战斗会话（单场遭遇战的内存状态机）
 * ----------------------------------------
 * 状态：PENDING →(GM start)→ ACTIVE →(GM finish / 终止)→ FINISHED
 *
 * 线程模型：
 *   - 不同玩家的连接可能在不同线程上同时投递指令；
 *   - 所有状态变更都在 {@link #lock} 内串行执行，同一会话内按到达顺序生效；
 *   - 连接表使用 ConcurrentHashMap，isPlayerInCombat 等只读查询无需加锁；
 *   - 断开连接、结束通知在锁外执行。
 *
 * 回合：start 时 roundCount=1，从 field_pawns 的第一个棋子开始；
 * 每次 end_turn 轮转到下一个棋子，绕回第一个时 roundCount+1。
 */
@Slf4j
public class CombatSession {

    public static final int DEFAULT_LOG_LIMIT = 50;

    // ---- 基本信息（创建后不变）----
    private final String id;
    private final String nickname;
    private final String gmId;
    private final Set<String> roster;
    private final BattlefieldSeed seed;
    private final List<String> turnOrder;
    private final CombatEndedListener endedListener;
    private final int logLimit;

    /** playerId -> 当前唯一的实时连接 */
    private final Map<String, CombatConnection> connections = new ConcurrentHashMap<>();

    private final Object lock = new Object();

    private volatile CombatStatus status = CombatStatus.PENDING;
    private volatile int roundCount = 0;
    /** 当前回合棋子在 turnOrder 中的下标；未开始时为 -1（受 lock 保护） */
    private int turnIndex = -1;
    /** 受 lock 保护 */
    private final Deque<CombatPayloads.LogEntry> combatLog = new ArrayDeque<>();

    public CombatSession(String id, String nickname, BattlefieldSeed seed, String gmId,
                         Collection<String> players, CombatEndedListener endedListener) {
        this(id, nickname, seed, gmId, players, endedListener, DEFAULT_LOG_LIMIT);
    }

    public CombatSession(String id, String nickname, BattlefieldSeed seed, String gmId,
                         Collection<String> players, CombatEndedListener endedListener, int logLimit) {
        this.id = Objects.requireNonNull(id, "id");
        this.nickname = nickname;
        this.seed = Objects.requireNonNull(seed, "seed");
        this.gmId = Objects.requireNonNull(gmId, "gmId");
        this.roster = Set.copyOf(new LinkedHashSet<>(players == null ? List.of() : players));
        this.turnOrder = seed.turnOrder();
        this.endedListener = Objects.requireNonNull(endedListener, "endedListener");
        this.logLimit = Math.max(0, logLimit);
    }

    // =====================================================================
    // 查询
    // =====================================================================

    public String getId() { return id; }
    public String getNickname() { return nickname; }
    public String getGmId() { return gmId; }
    public Set<String> getRoster() { return roster; }
    public BattlefieldSeed getSeed() { return seed; }
    public CombatStatus getStatus() { return status; }
    public int getRoundCount() { return roundCount; }

    public boolean isActive() {
        return status == CombatStatus.ACTIVE;
    }

    public boolean isFinished() {
        return status == CombatStatus.FINISHED;
    }

    /**
     * 该玩家当前是否有已接纳的实时连接
     */
    public boolean isPlayerInCombat(String playerId) {
        return playerId != null && connections.containsKey(playerId);
    }

    public List<String> getConnectedPlayerIds() {
        return List.copyOf(connections.keySet());
    }

    /** 当前回合棋子所在格子；未开始或已结束时为 null */
    public String getCurrentPawn() {
        synchronized (lock) {
            return currentPawnLocked();
        }
    }

    // =====================================================================
    // 连接接入 / 释放
    // =====================================================================

    /**
     * 记录玩家的实时连接并下发握手快照。
     * 调用方已完成令牌校验与去重；此处用 putIfAbsent 兜住并发竞争。
     *
     * @return false 表示该玩家已被另一个连接占用，或会话已结束
     */
    public boolean handlePlayer(String playerId, CombatConnection connection) {
        synchronized (lock) {
            if (status == CombatStatus.FINISHED) {
                log.debug("会话已结束，拒绝接入: combatId={}, playerId={}", id, playerId);
                return false;
            }
            CombatConnection prev = connections.putIfAbsent(playerId, connection);
            if (prev != null) {
                log.debug("玩家已有连接，拒绝重复接入: combatId={}, playerId={}, existing={}", id, playerId, prev.id());
                return false;
            }
            log.info("玩家接入战斗: combatId={}, playerId={}, connectionId={}", id, playerId, connection.id());
            connection.emit(CombatEvents.HANDSHAKE, snapshotLocked(playerId));
            broadcastExceptLocked(playerId, CombatEvents.PLAYER_JOINED,
                    new CombatPayloads.Presence(playerId, getConnectedPlayerIds()));
            return true;
        }
    }

    /**
     * 连接关闭后释放槽位。只有槽位仍属于该连接时才会释放（防止旧连接的关闭回调踢掉重连后的新连接）。
     * 不会推动会话走向 FINISHED。
     */
    public boolean releasePlayer(String playerId, CombatConnection connection) {
        synchronized (lock) {
            boolean removed = connections.remove(playerId, connection);
            if (removed) {
                log.info("玩家离开战斗: combatId={}, playerId={}", id, playerId);
                if (status != CombatStatus.FINISHED) {
                    broadcastLocked(CombatEvents.PLAYER_LEFT,
                            new CombatPayloads.Presence(playerId, getConnectedPlayerIds()));
                }
            }
            return removed;
        }
    }

    // =====================================================================
    // 指令处理
    // =====================================================================

    /**
     * 处理一条来自已接纳连接的指令。
     * 被拒绝或出现异常时只向该连接回 error 事件，会话本身不受影响。
     */
    public void handleCommand(String playerId, CombatConnection connection, CombatCommand command) {
        List<CombatConnection> closing = null;
        try {
            synchronized (lock) {
                closing = dispatchLocked(playerId, connection, command);
            }
        } catch (CombatServiceException e) {
            log.debug("指令被拒绝: combatId={}, playerId={}, code={}, msg={}", id, playerId, e.code(), e.getMessage());
            connection.emit(CombatEvents.ERROR, new CombatPayloads.ErrorInfo(e.code(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("处理指令异常: combatId={}, playerId={}, command={}", id, playerId, command, e);
            connection.emit(CombatEvents.ERROR,
                    new CombatPayloads.ErrorInfo(CombatMessages.CODE_INTERNAL, InternalFaultException.PUBLIC_MESSAGE));
        }
        if (closing != null) {
            completeFinish(closing, reasonOf(command));
        }
    }

    /**
     * GM 开始战斗（PENDING → ACTIVE）
     */
    public void start(String requesterId) {
        synchronized (lock) {
            startLocked(requesterId);
        }
    }

    /**
     * 结束战斗。幂等：只有第一次调用会广播、断开连接并发出结束事件。
     *
     * @return 本次调用是否触发了状态迁移
     */
    public boolean finish(String reason) {
        List<CombatConnection> closing;
        synchronized (lock) {
            closing = finishLocked(reason);
        }
        if (closing == null) {
            return false;
        }
        completeFinish(closing, reason);
        return true;
    }

    private List<CombatConnection> dispatchLocked(String playerId, CombatConnection connection, CombatCommand command) {
        String type = command == null || command.getType() == null
                ? "" : command.getType().trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case CombatCommand.START:
                startLocked(playerId);
                return null;
            case CombatCommand.ACTION:
                actionLocked(playerId, command);
                return null;
            case CombatCommand.END_TURN:
                endTurnLocked(playerId, command);
                return null;
            case CombatCommand.FINISH:
                requireGm(playerId);
                return finishLocked(reasonOf(command));
            case CombatCommand.SNAPSHOT:
                connection.emit(CombatEvents.HANDSHAKE, snapshotLocked(playerId));
                return null;
            default:
                throw new CommandRejectedException(CombatMessages.CODE_BAD_COMMAND,
                        CombatMessages.MSG_UNKNOWN_COMMAND + (command == null ? null : command.getType()));
        }
    }

    private void startLocked(String requesterId) {
        requireGm(requesterId);
        if (status != CombatStatus.PENDING) {
            throw new CommandRejectedException(CombatMessages.CODE_NOT_ACTIVE, CombatMessages.MSG_ALREADY_STARTED);
        }
        if (turnOrder.isEmpty()) {
            throw new CommandRejectedException(CombatMessages.CODE_BAD_COMMAND, CombatMessages.MSG_NO_PAWNS);
        }
        status = CombatStatus.ACTIVE;
        roundCount = 1;
        turnIndex = 0;
        log.info("战斗开始: combatId={}, pawns={}", id, turnOrder.size());
        broadcastLocked(CombatEvents.COMBAT_STARTED, new CombatPayloads.Started(roundCount, currentPawnLocked()));
        broadcastTurnLocked();
    }

    private void actionLocked(String playerId, CombatCommand command) {
        String square = requireTurnOf(playerId, command);
        String action = command.getAction();
        if (action == null || action.isBlank()) {
            throw new CommandRejectedException(CombatMessages.CODE_BAD_COMMAND, "Action is required");
        }
        log.debug("执行行动: combatId={}, pawn={}, action={}, target={}", id, square, action, command.getTarget());
        broadcastLocked(CombatEvents.ACTION_PERFORMED,
                new CombatPayloads.ActionPerformed(square, action, command.getTarget(), playerId, roundCount));
    }

    private void endTurnLocked(String playerId, CombatCommand command) {
        requireTurnOf(playerId, command);
        turnIndex++;
        if (turnIndex >= turnOrder.size()) {
            turnIndex = 0;
            roundCount++;
            log.debug("进入新回合: combatId={}, round={}", id, roundCount);
            broadcastLocked(CombatEvents.ROUND_STARTED, new CombatPayloads.RoundStarted(roundCount));
        }
        broadcastTurnLocked();
    }

    /**
     * @return 需要在锁外断开的连接；已结束时返回 null
     */
    private List<CombatConnection> finishLocked(String reason) {
        if (status == CombatStatus.FINISHED) {
            return null;
        }
        status = CombatStatus.FINISHED;
        log.info("战斗结束: combatId={}, reason={}, round={}", id, reason, roundCount);
        broadcastLocked(CombatEvents.COMBAT_FINISHED, new CombatPayloads.Finished(reason, roundCount));
        List<CombatConnection> closing = new ArrayList<>(connections.values());
        connections.clear();
        turnIndex = -1;
        return closing;
    }

    private void completeFinish(List<CombatConnection> closing, String reason) {
        for (CombatConnection c : closing) {
            c.disconnect();
        }
        try {
            endedListener.onCombatEnded(new CombatEndedEvent(id, reason));
        } catch (RuntimeException e) {
            log.error("战斗结束通知失败: combatId={}", id, e);
        }
    }

    // =====================================================================
    // 校验
    // =====================================================================

    /**
     * action / end_turn 的公共校验：名单 → 状态 → 棋子存在 → 轮到该棋子 → 控制权
     *
     * @return 规范化后的格子
     */
    private String requireTurnOf(String playerId, CombatCommand command) {
        if (!roster.contains(playerId) && !isGm(playerId)) {
            throw new CommandRejectedException(CombatMessages.CODE_NOT_IN_ROSTER, CombatMessages.MSG_NOT_IN_ROSTER);
        }
        if (status != CombatStatus.ACTIVE) {
            throw new CommandRejectedException(CombatMessages.CODE_NOT_ACTIVE, CombatMessages.MSG_NOT_ACTIVE);
        }
        String current = currentPawnLocked();
        String square = command.getPawn() == null || command.getPawn().isBlank()
                ? current
                : command.getPawn().trim().toUpperCase(Locale.ROOT);
        if (seed.pawnAt(square) == null) {
            throw new CommandRejectedException(CombatMessages.CODE_BAD_COMMAND, "Unknown pawn: " + command.getPawn());
        }
        if (!square.equals(current)) {
            throw new CommandRejectedException(CombatMessages.CODE_NOT_YOUR_TURN, CombatMessages.MSG_NOT_YOUR_TURN);
        }
        if (!canControl(playerId, square)) {
            throw new CommandRejectedException(CombatMessages.CODE_NOT_YOUR_PAWN, CombatMessages.MSG_NOT_YOUR_PAWN);
        }
        return square;
    }

    private void requireGm(String playerId) {
        if (!isGm(playerId)) {
            throw new CommandRejectedException(CombatMessages.CODE_GM_ONLY, CombatMessages.MSG_GM_ONLY);
        }
    }

    private boolean isGm(String playerId) {
        return gmId.equals(playerId);
    }

    /**
     * 玩家棋子只能由其指定的玩家操作；AI、游戏逻辑以及未指派玩家的棋子由 GM 代为操作。
     */
    boolean canControl(String playerId, String square) {
        FieldPawn pawn = seed.pawnAt(square);
        if (pawn == null || playerId == null) {
            return false;
        }
        ControlInfo owner = pawn.owner();
        if (owner instanceof ControlInfo.PlayerControl pc && pc.id() != null) {
            return pc.id().equals(playerId) && (roster.contains(playerId) || isGm(playerId));
        }
        return isGm(playerId);
    }

    // =====================================================================
    // 广播 / 快照
    // =====================================================================

    private String currentPawnLocked() {
        if (turnIndex < 0 || turnIndex >= turnOrder.size()) {
            return null;
        }
        return turnOrder.get(turnIndex);
    }

    private void broadcastTurnLocked() {
        String current = currentPawnLocked();
        FieldPawn pawn = seed.pawnAt(current);
        broadcastLocked(CombatEvents.TURN_CHANGED,
                new CombatPayloads.TurnChanged(current, pawn == null ? null : pawn.owner(), roundCount));
    }

    private void broadcastLocked(String event, Object payload) {
        appendLogLocked(event, payload);
        for (CombatConnection c : connections.values()) {
            c.emit(event, payload);
        }
    }

    private void broadcastExceptLocked(String excludedPlayerId, String event, Object payload) {
        appendLogLocked(event, payload);
        connections.forEach((pid, c) -> {
            if (!pid.equals(excludedPlayerId)) {
                c.emit(event, payload);
            }
        });
    }

    private void appendLogLocked(String event, Object payload) {
        if (logLimit == 0) {
            return;
        }
        combatLog.addLast(new CombatPayloads.LogEntry(System.currentTimeMillis(), event, payload));
        while (combatLog.size() > logLimit) {
            combatLog.removeFirst();
        }
    }

    private CombatPayloads.Snapshot snapshotLocked(String playerId) {
        String current = currentPawnLocked();
        FieldPawn pawn = seed.pawnAt(current);
        List<String> controlled = new ArrayList<>();
        for (String square : turnOrder) {
            if (canControl(playerId, square)) {
                controlled.add(square);
            }
        }
        return new CombatPayloads.Snapshot(
                id,
                nickname,
                status.wire(),
                roundCount,
                seed,
                gmId,
                current,
                pawn == null ? null : pawn.owner(),
                getConnectedPlayerIds(),
                controlled,
                List.copyOf(combatLog));
    }

    private static String reasonOf(CombatCommand command) {
        if (command == null || command.getReason() == null || command.getReason().isBlank()) {
            return CombatMessages.REASON_GM_FINISHED;
        }
        return command.getReason();
    }

    @Override
    public String toString() {
        return "CombatSession{id='" + id + "', nickname='" + nickname + "', status=" + status
                + ", round=" + roundCount + ", connected=" + connections.size() + '}';
    }
}
