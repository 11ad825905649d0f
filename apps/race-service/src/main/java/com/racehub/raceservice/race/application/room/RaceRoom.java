package com.racehub.raceservice.race.application.room;

import com.racehub.raceservice.platform.config.RaceProperties;
import com.racehub.raceservice.platform.transport.Envelope;
import com.racehub.raceservice.race.domain.constants.GameMessages;
import com.racehub.raceservice.race.domain.enums.BalanceReason;
import com.racehub.raceservice.race.domain.enums.RacePhase;
import com.racehub.raceservice.race.domain.enums.WagerPolicy;
import com.racehub.raceservice.race.domain.error.ErrorCode;
import com.racehub.raceservice.race.domain.error.RaceException;
import com.racehub.raceservice.race.domain.model.Player;
import com.racehub.raceservice.race.domain.model.PlayerIdentity;
import com.racehub.raceservice.race.domain.model.RaceEntrant;
import com.racehub.raceservice.race.domain.model.RaceRound;
import com.racehub.raceservice.race.domain.model.RankedEntrant;
import com.racehub.raceservice.race.domain.model.RoomSummary;
import com.racehub.raceservice.race.domain.model.Settlement;
import com.racehub.raceservice.race.domain.model.SettlementEntry;
import com.racehub.raceservice.race.domain.rule.LaneState;
import com.racehub.raceservice.race.domain.rule.TickResult;
import com.racehub.raceservice.race.interfaces.ws.dto.MessageTypes;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.BalanceUpdate;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.BetPlaced;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.BettingStarted;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.CountdownTick;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.FinalPosition;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.LanePosition;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.PlayerJoined;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.PlayerLeft;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.PlayerReady;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.PlayerView;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.RaceFinished;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.RaceStarted;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.RaceState;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.RaceUpdate;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.WaitingForPlayers;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.Winner;
import com.racehub.raceservice.race.interfaces.ws.dto.RaceMessages.YourResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * RaceRoom（房间 actor）
 * ----------------------------------------
 * 一个房间一个实例，是该房间名单、奖池、比赛的唯一修改点。
 *
 * 执行模型：
 *  - 所有命令与计时回调都投递进 {@link RoomMailbox}，按到达顺序在同一时刻单线程处理；
 *  - 计时回调携带 "roundId:phaseSeq" 版本，阶段切换后旧回调自动作废；
 *  - 每次处理先校验、再修改，推送收集在 {@link RoomEffects} 中，
 *    处理完成且不变量校验通过后才统一发出；
 *  - RaceException 只回给发起者，房间状态不变；其它异常视为致命错误，房间退款并关闭。
 *
 * 阶段：WAITING → BETTING → COUNTDOWN → RACING → FINISHED → (WAITING | 销毁)
 */
@Slf4j
public class RaceRoom {

    public static final int MIN_CAPACITY = 2;
    public static final int MAX_CAPACITY = 5;

    @FunctionalInterface
    interface Handler {
        void handle(RoomEffects fx);
    }

    private final String roomId;
    private final String roomName;
    private final PlayerIdentity creator;
    private final boolean persistent;
    private final int capacity;
    private final long createdSeq;

    private final RoomContext ctx;
    private final RaceProperties props;
    private final RoomListener listener;
    private final RoomMailbox mailbox;

    // ---------- 以下状态只在房间线程上读写 ----------
    private RacePhase phase = RacePhase.WAITING;
    /** 本轮下注额，FIRST_BET 策略下为 0 表示尚未确定 */
    private long wagerAmount;
    private long pot;
    /** 按赛道号升序 */
    private final List<Player> players = new ArrayList<>();
    /** 倒计时/比赛中加入的玩家，FINISHED 时入座 */
    private final Map<String, PlayerIdentity> pendingJoins = new LinkedHashMap<>();
    /** 本轮中途空出的赛道，其它赛道用完之前不再分配 */
    private final Set<Integer> retiredLanes = new HashSet<>();
    private final Map<String, Long> graceTokens = new HashMap<>();
    /** 本轮每个玩家已成功扣款的次数，扣款幂等号按次数生成，失败重试沿用同一个 */
    private final Map<String, Integer> betAttempts = new HashMap<>();
    private String roundId;
    private long phaseSeq;
    private long phaseDeadlineMs;
    private RaceRound round;
    private List<LaneState> lanes = List.of();
    private long opSeq;
    private boolean closed;

    private volatile RoomSummary summary;

    public RaceRoom(String roomId,
                    String roomName,
                    PlayerIdentity creator,
                    long wagerAmount,
                    boolean persistent,
                    long createdSeq,
                    RoomContext ctx,
                    RoomListener listener) {
        this.roomId = roomId;
        this.roomName = roomName;
        this.creator = creator;
        this.persistent = persistent;
        this.createdSeq = createdSeq;
        this.ctx = ctx;
        this.props = ctx.props();
        this.listener = listener;
        this.capacity = props.getMaxCapacity();
        if (capacity < MIN_CAPACITY || capacity > MAX_CAPACITY) {
            throw new IllegalArgumentException("room capacity must be 2..5: " + capacity);
        }
        this.wagerAmount = wagerAmount;
        this.roundId = newRoundId();
        this.mailbox = new RoomMailbox(roomId, ctx.roomExecutor());
        this.summary = buildSummary();
    }

    // =====================================================================
    // 对外入口：全部投递进邮箱，调用方线程不接触房间状态
    // =====================================================================

    /**
     * 加入房间（已在房间内则视为重新进入：撤销待离开并下发快照）。
     * @param onRejected 加入被拒绝时回调（大厅释放占位）
     */
    public void join(PlayerIdentity identity, Runnable onRejected) {
        submit(identity.userId(), fx -> doJoin(identity, fx), onRejected);
    }

    public void leave(String userId) {
        submit(userId, fx -> doLeave(userId, fx), null);
    }

    /**
     * PLACE_BET：按指定金额下注。
     */
    public void placeBet(String userId, long amount) {
        submit(userId, fx -> doWager(userId, amount, false, fx), null);
    }

    /**
     * SET_READY：true 按本轮下注额下注（重复为空操作），false 在下注窗口内撤注退款。
     */
    public void setReady(String userId, boolean ready) {
        submit(userId, fx -> {
            if (ready) {
                doWager(userId, null, true, fx);
            } else {
                doUnready(userId, fx);
            }
        }, null);
    }

    /**
     * 连接断开：保留座位并开始宽限期计时。
     */
    public void disconnect(String userId) {
        submit(null, fx -> doDisconnect(userId, fx), null);
    }

    /**
     * 同一用户新连接：恢复座位并下发快照。
     */
    public void reattach(String userId) {
        submit(userId, fx -> doReattach(userId, fx), null);
    }

    public String roomId() {
        return roomId;
    }

    public boolean isPersistent() {
        return persistent;
    }

    /** 最近一次处理完成后的摘要，任意线程可读 */
    public RoomSummary summary() {
        return summary;
    }

    // =====================================================================
    // 邮箱处理
    // =====================================================================

    private void submit(String originUserId, Handler handler, Runnable onRejected) {
        mailbox.post(() -> process(originUserId, handler, onRejected));
    }

    /**
     * 计时回调：版本不一致说明阶段已经切换，直接丢弃。
     */
    private void submitTimer(String version, Handler handler) {
        submit(null, fx -> {
            if (!version.equals(version())) {
                log.debug("忽略过期计时回调: roomId={}, version={}, current={}", roomId, version, version());
                return;
            }
            handler.handle(fx);
        }, null);
    }

    private void process(String originUserId, Handler handler, Runnable onRejected) {
        if (closed) {
            if (onRejected != null) {
                onRejected.run();
            }
            if (originUserId != null) {
                ctx.notifier().sendTo(originUserId, Envelope.error(ErrorCode.ROOM_NOT_FOUND.name(), GameMessages.ROOM_NOT_FOUND));
            }
            return;
        }
        RoomEffects fx = new RoomEffects(ctx.notifier());
        try {
            handler.handle(fx);
            checkInvariants();
        } catch (RaceException e) {
            log.warn("房间拒绝命令: roomId={}, userId={}, code={}, msg={}", roomId, originUserId, e.getCode(), e.getMessage());
            if (onRejected != null) {
                onRejected.run();
            }
            if (originUserId != null) {
                ctx.notifier().sendTo(originUserId, Envelope.error(e.getCode().name(), e.getMessage()));
            }
            return;
        } catch (RuntimeException e) {
            fail(e);
            return;
        }
        if (!closed) {
            publishSummary(fx);
        }
        fx.flush();
    }

    // =====================================================================
    // 加入 / 离开
    // =====================================================================

    private void doJoin(PlayerIdentity identity, RoomEffects fx) {
        String userId = identity.userId();
        Player existing = find(userId);
        if (existing != null) {
            if (existing.isLeaving()) {
                existing.cancelLeaving();
                log.info("玩家重新加入，撤销待离开: roomId={}, userId={}", roomId, userId);
            }
            existing.markConnected();
            cancelGrace(userId);
            fx.sendTo(userId, Envelope.of(MessageTypes.RACE_STATE, raceState(userId)));
            return;
        }
        if (pendingJoins.containsKey(userId)) {
            fx.sendTo(userId, Envelope.of(MessageTypes.RACE_STATE, raceState(userId)));
            return;
        }
        if (players.size() + pendingJoins.size() >= capacity) {
            throw new RaceException(ErrorCode.ROOM_FULL, GameMessages.ROOM_FULL);
        }
        if (phase.queuesJoins()) {
            pendingJoins.put(userId, identity);
            log.info("比赛进行中，加入排队到下一轮: roomId={}, userId={}, phase={}", roomId, userId, phase);
            fx.sendTo(userId, Envelope.of(MessageTypes.RACE_STATE, raceState(userId)));
            return;
        }
        int lane = lowestFreeLane();
        if (lane < 0) {
            throw new RaceException(ErrorCode.ROOM_FULL, GameMessages.ROOM_FULL);
        }
        Player player = seat(identity, lane);
        log.info("玩家入座: roomId={}, userId={}, lane={}", roomId, userId, lane);
        broadcast(fx, Envelope.of(MessageTypes.PLAYER_JOINED, new PlayerJoined(
                userId, player.getUsername(), lane, player.getColor(), players.size())));
        fx.sendTo(userId, Envelope.of(MessageTypes.RACE_STATE, raceState(userId)));
    }

    private void doLeave(String userId, RoomEffects fx) {
        if (pendingJoins.remove(userId) != null) {
            log.info("排队玩家离开: roomId={}, userId={}", roomId, userId);
            fx.afterCommit(() -> listener.onPlayerRemoved(roomId, userId));
            destroyIfAbandoned(fx);
            return;
        }
        Player player = find(userId);
        if (player == null) {
            return;
        }
        switch (phase) {
            case WAITING, FINISHED -> removePlayer(player, false, fx);
            case BETTING -> {
                boolean refunded = player.isWagered();
                if (refunded) {
                    refundOne(player, fx);
                }
                retiredLanes.add(player.getLane());
                removePlayer(player, refunded, fx);
                afterWagerWithdrawn(fx);
            }
            case COUNTDOWN -> {
                if (player.isWagered()) {
                    deferLeave(player);
                } else {
                    retiredLanes.add(player.getLane());
                    removePlayer(player, false, fx);
                }
            }
            case RACING -> deferLeave(player);
        }
        destroyIfAbandoned(fx);
    }

    private void deferLeave(Player player) {
        player.markLeaving();
        log.info("本轮进行中，离开推迟到比赛结束: roomId={}, userId={}, phase={}", roomId, player.getUserId(), phase);
    }

    private void removePlayer(Player player, boolean refunded, RoomEffects fx) {
        String userId = player.getUserId();
        players.remove(player);
        cancelGrace(userId);
        log.info("玩家离开: roomId={}, userId={}, lane={}, refunded={}", roomId, userId, player.getLane(), refunded);
        Envelope<PlayerLeft> left = Envelope.of(MessageTypes.PLAYER_LEFT,
                new PlayerLeft(userId, player.getUsername(), players.size(), refunded));
        broadcast(fx, left);
        fx.sendTo(userId, left);
        fx.afterCommit(() -> listener.onPlayerRemoved(roomId, userId));
    }

    private void destroyIfAbandoned(RoomEffects fx) {
        if (!persistent && !closed && players.isEmpty() && pendingJoins.isEmpty()) {
            log.info("房间已清空，销毁: roomId={}, phase={}", roomId, phase);
            close();
            fx.afterCommit(() -> listener.onRoomClosed(this));
        }
    }

    // =====================================================================
    // 断线 / 重连
    // =====================================================================

    private void doDisconnect(String userId, RoomEffects fx) {
        if (pendingJoins.remove(userId) != null) {
            log.info("排队玩家断线，取消排队: roomId={}, userId={}", roomId, userId);
            fx.afterCommit(() -> listener.onPlayerRemoved(roomId, userId));
            destroyIfAbandoned(fx);
            return;
        }
        Player player = find(userId);
        if (player == null || !player.isConnected()) {
            return;
        }
        player.markDisconnected();
        long token = ++opSeq;
        graceTokens.put(userId, token);
        ctx.scheduler().schedule(graceKey(userId), props.getGraceSeconds() * 1000L,
                () -> submit(null, f -> onGraceExpired(userId, token, f), null));
        log.info("玩家断线，进入宽限期: roomId={}, userId={}, graceSeconds={}", roomId, userId, props.getGraceSeconds());
    }

    private void onGraceExpired(String userId, long token, RoomEffects fx) {
        Long current = graceTokens.get(userId);
        if (current == null || current != token) {
            return;
        }
        graceTokens.remove(userId);
        Player player = find(userId);
        if (player == null || player.isConnected()) {
            return;
        }
        log.info("宽限期到期，按离开处理: roomId={}, userId={}", roomId, userId);
        doLeave(userId, fx);
    }

    private void doReattach(String userId, RoomEffects fx) {
        Player player = find(userId);
        if (player != null) {
            player.markConnected();
            // 宽限期到期转成的推迟离开，在比赛结束前重连可撤销
            if (player.isLeaving()) {
                player.cancelLeaving();
            }
            cancelGrace(userId);
            log.info("玩家重连: roomId={}, userId={}, lane={}", roomId, userId, player.getLane());
            fx.sendTo(userId, Envelope.of(MessageTypes.RACE_STATE, raceState(userId)));
            return;
        }
        if (pendingJoins.containsKey(userId)) {
            fx.sendTo(userId, Envelope.of(MessageTypes.RACE_STATE, raceState(userId)));
        }
    }

    private void cancelGrace(String userId) {
        if (graceTokens.remove(userId) != null) {
            ctx.scheduler().stop(graceKey(userId));
        }
    }

    // =====================================================================
    // 下注
    // =====================================================================

    /**
     * @param requested PLACE_BET 的金额；SET_READY 时为 null，按本轮下注额
     * @param viaReady  来自 SET_READY（重复为空操作，并广播 PLAYER_READY）
     */
    private void doWager(String userId, Long requested, boolean viaReady, RoomEffects fx) {
        if (!phase.acceptsWagers()) {
            throw new RaceException(ErrorCode.INVALID_PHASE_FOR_ACTION, GameMessages.formatInvalidPhase(phase.wire()));
        }
        Player player = find(userId);
        if (player == null) {
            throw new RaceException(ErrorCode.NOT_IN_ROOM, GameMessages.NOT_IN_ROOM);
        }
        if (player.isWagered()) {
            if (viaReady) {
                return;
            }
            throw new RaceException(ErrorCode.ALREADY_WAGERED, GameMessages.ALREADY_WAGERED);
        }
        long amount;
        if (requested == null) {
            if (wagerAmount <= 0) {
                throw new RaceException(ErrorCode.INVALID_WAGER, GameMessages.WAGER_NOT_SET);
            }
            amount = wagerAmount;
        } else {
            if (requested < props.getMinBet()) {
                throw new RaceException(ErrorCode.INVALID_WAGER, GameMessages.formatMinBet(props.getMinBet()));
            }
            if (wagerAmount > 0 && requested != wagerAmount) {
                throw new RaceException(ErrorCode.WAGER_MISMATCH, GameMessages.formatWagerMismatch(wagerAmount));
            }
            amount = requested;
        }

        // 扣款失败（余额不足/钱包不可用）直接抛出，房间状态不变
        long balance = ctx.wallet().reserveAndDebit(userId, amount, betReference(userId));
        betAttempts.merge(userId, 1, Integer::sum);

        if (wagerAmount <= 0) {
            wagerAmount = amount;
        }
        player.placeWager(amount);
        pot += amount;
        log.info("下注成功: roomId={}, roundId={}, userId={}, amount={}, pot={}", roomId, roundId, userId, amount, pot);

        fx.sendTo(userId, Envelope.of(MessageTypes.BALANCE_UPDATE, new BalanceUpdate(balance, BalanceReason.BET_PLACED)));
        broadcast(fx, Envelope.of(MessageTypes.BET_PLACED, new BetPlaced(
                userId, player.getUsername(), amount, pot, wageredCount())));
        if (viaReady) {
            broadcast(fx, Envelope.of(MessageTypes.PLAYER_READY, new PlayerReady(
                    userId, player.getUsername(), true, wageredCount(), players.size(), pot)));
        }

        if (phase == RacePhase.WAITING) {
            enterBetting(player, fx);
        }
        maybeStartCountdown(fx);
    }

    private void doUnready(String userId, RoomEffects fx) {
        Player player = find(userId);
        if (player == null) {
            throw new RaceException(ErrorCode.NOT_IN_ROOM, GameMessages.NOT_IN_ROOM);
        }
        if (phase == RacePhase.WAITING) {
            return;
        }
        if (phase != RacePhase.BETTING) {
            throw new RaceException(ErrorCode.INVALID_PHASE_FOR_ACTION, GameMessages.formatInvalidPhase(phase.wire()));
        }
        if (!player.isWagered()) {
            return;
        }
        refundOne(player, fx);
        broadcast(fx, Envelope.of(MessageTypes.PLAYER_READY, new PlayerReady(
                userId, player.getUsername(), false, wageredCount(), players.size(), pot)));
        afterWagerWithdrawn(fx);
    }

    private void refundOne(Player player, RoomEffects fx) {
        long amount = player.clearWager();
        pot -= amount;
        Settlement refund = ctx.settlement().computeRefund(
                "refund:" + roundId + ":" + player.getUserId() + ":" + (++opSeq), roomId, roundId,
                List.of(new RaceEntrant(player.getUserId(), player.getUsername(), player.getLane(), player.getColor(), amount)));
        log.info("撤注退款: roomId={}, roundId={}, userId={}, amount={}", roomId, roundId, player.getUserId(), amount);
        fx.afterCommit(() -> applySettlement(refund, BalanceReason.REFUND));
    }

    /**
     * 退还所有已下注玩家的下注，并清空奖池。
     */
    private void refundAll(String settlementId, RoomEffects fx) {
        List<RaceEntrant> refunds = new ArrayList<>();
        for (Player p : players) {
            if (p.isWagered()) {
                refunds.add(new RaceEntrant(p.getUserId(), p.getUsername(), p.getLane(), p.getColor(), p.clearWager()));
            }
        }
        pot = 0;
        if (refunds.isEmpty()) {
            return;
        }
        Settlement refund = ctx.settlement().computeRefund(settlementId, roomId, roundId, refunds);
        log.info("整轮退款: roomId={}, roundId={}, players={}", roomId, roundId, refunds.size());
        fx.afterCommit(() -> applySettlement(refund, BalanceReason.REFUND));
    }

    private void afterWagerWithdrawn(RoomEffects fx) {
        if (phase != RacePhase.BETTING) {
            return;
        }
        if (wageredCount() == 0) {
            enterWaiting(GameMessages.formatWaitingForPlayers(props.getMinPlayers()), fx);
            return;
        }
        maybeStartCountdown(fx);
    }

    private void applySettlement(Settlement settlement, BalanceReason reason) {
        ctx.settlement().apply(settlement).whenComplete((outcome, ex) -> {
            if (ex != null) {
                log.error("结算执行失败: roomId={}, settlementId={}", roomId, settlement.settlementId(), ex);
                return;
            }
            outcome.balances().forEach((userId, balance) -> ctx.notifier().sendTo(userId,
                    Envelope.of(MessageTypes.BALANCE_UPDATE, new BalanceUpdate(balance, reason))));
        });
    }

    // =====================================================================
    // 阶段流转
    // =====================================================================

    private void enterBetting(Player trigger, RoomEffects fx) {
        phase = RacePhase.BETTING;
        nextPhase();
        long deadline = now() + props.getBettingSeconds() * 1000L;
        armPhaseTimer(deadline, true, this::onBettingTimeout);
        log.info("进入下注阶段: roomId={}, roundId={}, betAmount={}, triggeredBy={}", roomId, roundId, wagerAmount, trigger.getUserId());
        broadcast(fx, Envelope.of(MessageTypes.BETTING_STARTED, new BettingStarted(
                roundId, wagerAmount, props.getBettingSeconds(),
                new PlayerIdentity(trigger.getUserId(), trigger.getUsername()))));
    }

    private void onBettingTimeout(RoomEffects fx) {
        int wagered = wageredCount();
        if (wagered >= props.getMinPlayers()) {
            enterCountdown(fx);
            return;
        }
        log.info("下注窗口结束，人数不足: roomId={}, roundId={}, wagered={}", roomId, roundId, wagered);
        refundAll("refund:" + roundId, fx);
        enterWaiting(GameMessages.NOT_ENOUGH_PLAYERS, fx);
    }

    private void maybeStartCountdown(RoomEffects fx) {
        if (phase == RacePhase.BETTING
                && players.size() >= props.getMinPlayers()
                && players.stream().allMatch(Player::isWagered)) {
            enterCountdown(fx);
        }
    }

    private void enterCountdown(RoomEffects fx) {
        phase = RacePhase.COUNTDOWN;
        nextPhase();
        long deadline = now() + props.getCountdownSeconds() * 1000L;
        armPhaseTimer(deadline, true, this::startRace);
        log.info("进入开跑倒计时: roomId={}, roundId={}, pot={}", roomId, roundId, pot);
    }

    private void startRace(RoomEffects fx) {
        List<RaceEntrant> entrants = new ArrayList<>();
        for (Player p : players) {
            if (p.isWagered()) {
                entrants.add(new RaceEntrant(p.getUserId(), p.getUsername(), p.getLane(), p.getColor(), p.getWager()));
            }
        }
        if (entrants.size() < props.getMinPlayers()) {
            log.warn("开跑时下注人数不足，整轮退款: roomId={}, roundId={}, wagered={}", roomId, roundId, entrants.size());
            refundAll("refund:" + roundId, fx);
            enterWaiting(GameMessages.NOT_ENOUGH_PLAYERS, fx);
            return;
        }
        round = new RaceRound(roundId, roomId, entrants, now());
        List<LaneState> start = new ArrayList<>(entrants.size());
        for (RaceEntrant e : entrants) {
            start.add(new LaneState(e.userId(), e.lane(), 0));
        }
        lanes = List.copyOf(start);
        phase = RacePhase.RACING;
        nextPhase();
        phaseDeadlineMs = 0;
        String version = version();
        ctx.scheduler().startPeriodic(raceKey(), props.getTickIntervalMs(), () -> submitTimer(version, this::onRaceTick));
        log.info("比赛开始: roomId={}, roundId={}, entrants={}, pot={}", roomId, roundId, entrants.size(), round.getPot());
        broadcast(fx, Envelope.of(MessageTypes.RACE_STARTED, new RaceStarted(roundId, phase, round.getPot(), entrants)));
    }

    private void onRaceTick(RoomEffects fx) {
        TickResult tick = ctx.simulator().tick(lanes, ctx.random());
        lanes = tick.lanes();
        round.recordTick(tick.advances());
        List<LanePosition> positions = new ArrayList<>(lanes.size());
        for (LaneState l : lanes) {
            Player p = find(l.userId());
            if (p != null) {
                p.moveTo(l.position());
            }
            positions.add(new LanePosition(l.userId(), l.lane(), l.position(), tick.advances().getOrDefault(l.userId(), 0)));
        }
        broadcast(fx, Envelope.of(MessageTypes.RACE_UPDATE, new RaceUpdate(positions, tick.leaderId())));
        if (tick.finished()) {
            finishRace(tick, fx);
        }
    }

    private void finishRace(TickResult last, RoomEffects fx) {
        ctx.scheduler().stop(raceKey());
        List<RankedEntrant> ranking = ctx.simulator().rank(round.getEntrants(), lanes, last.finishers());
        round.seal(last.winnerId(), ranking);
        Settlement settlement = ctx.settlement().computeRaceSettlement(round);
        if (settlement.totalNetResult() != 0) {
            throw new IllegalStateException("settlement does not balance: " + settlement.settlementId());
        }

        phase = RacePhase.FINISHED;
        nextPhase();
        long deadline = now() + props.getCooldownSeconds() * 1000L;

        RankedEntrant first = ranking.get(0);
        Winner winner = new Winner(first.userId(), first.username(), first.lane(), first.color(), round.getPot());
        List<FinalPosition> finals = new ArrayList<>(ranking.size());
        for (RankedEntrant r : ranking) {
            finals.add(new FinalPosition(r.userId(), r.username(), r.position(), r.lane(), r.rank()));
        }
        for (String userId : audience()) {
            SettlementEntry entry = settlement.entryOf(userId);
            YourResult yours = entry == null ? null
                    : new YourResult(entry.rank(), entry.wager(), entry.winnings(), entry.netResult());
            fx.sendTo(userId, Envelope.of(MessageTypes.RACE_FINISHED, new RaceFinished(
                    roundId, phase, winner, finals, round.getPot(), yours, props.getCooldownSeconds())));
        }
        fx.afterCommit(() -> applySettlement(settlement, BalanceReason.WIN_CREDITED));
        log.info("比赛结束: roomId={}, roundId={}, winner={}, pot={}, ticks={}",
                roomId, roundId, first.userId(), round.getPot(), round.tickCount());

        // 本轮下注已进入结算，清空后奖池归零
        for (Player p : players) {
            p.clearWager();
        }
        pot = 0;
        retiredLanes.clear();
        applyDeferredLeaves(fx);
        applyPendingJoins(fx);
        armPhaseTimer(deadline, false, this::onCooldownElapsed);
    }

    private void applyDeferredLeaves(RoomEffects fx) {
        List<Player> leaving = players.stream().filter(Player::isLeaving).toList();
        for (Player p : leaving) {
            removePlayer(p, false, fx);
        }
    }

    private void applyPendingJoins(RoomEffects fx) {
        List<PlayerIdentity> joiners = new ArrayList<>(pendingJoins.values());
        pendingJoins.clear();
        for (PlayerIdentity identity : joiners) {
            int lane = lowestFreeLane();
            if (lane < 0) {
                log.warn("排队玩家入座失败，没有空赛道: roomId={}, userId={}", roomId, identity.userId());
                fx.sendTo(identity.userId(), Envelope.error(ErrorCode.ROOM_FULL.name(), GameMessages.ROOM_FULL));
                fx.afterCommit(() -> listener.onPlayerRemoved(roomId, identity.userId()));
                continue;
            }
            Player player = seat(identity, lane);
            log.info("排队玩家入座: roomId={}, userId={}, lane={}", roomId, identity.userId(), lane);
            broadcast(fx, Envelope.of(MessageTypes.PLAYER_JOINED, new PlayerJoined(
                    identity.userId(), player.getUsername(), lane, player.getColor(), players.size())));
            fx.sendTo(identity.userId(), Envelope.of(MessageTypes.RACE_STATE, raceState(identity.userId())));
        }
    }

    private void onCooldownElapsed(RoomEffects fx) {
        if (players.isEmpty() && !persistent) {
            destroyIfAbandoned(fx);
            return;
        }
        enterWaiting(GameMessages.formatWaitingForPlayers(props.getMinPlayers()), fx);
    }

    /**
     * 回到 WAITING：新 roundId，位置归零，保留在座玩家与赛道。
     * 调用前下注必须已经清空或退款。
     */
    private void enterWaiting(String message, RoomEffects fx) {
        ctx.scheduler().stop(phaseKey());
        ctx.scheduler().stop(raceKey());
        phase = RacePhase.WAITING;
        roundId = newRoundId();
        nextPhase();
        phaseDeadlineMs = 0;
        round = null;
        lanes = List.of();
        retiredLanes.clear();
        betAttempts.clear();
        for (Player p : players) {
            p.moveTo(0);
        }
        if (props.getWagerPolicy() == WagerPolicy.FIRST_BET && !persistent) {
            wagerAmount = 0;
        }
        log.info("回到等待阶段: roomId={}, roundId={}, players={}", roomId, roundId, players.size());
        broadcast(fx, Envelope.of(MessageTypes.WAITING_FOR_PLAYERS, new WaitingForPlayers(
                roundId, phase, players.size(), props.getMinPlayers(), message)));
    }

    // =====================================================================
    // 计时
    // =====================================================================

    private void armPhaseTimer(long deadline, boolean ticks, Handler onElapsed) {
        phaseDeadlineMs = deadline;
        String version = version();
        RacePhase tickPhase = phase;
        ctx.scheduler().startOrResume(phaseKey(), phase.wire(), deadline, version,
                ticks ? (key, owner, deadlineMs, remaining) -> submitTimer(version, fx -> broadcast(fx,
                        Envelope.of(MessageTypes.COUNTDOWN_TICK, new CountdownTick(tickPhase, remaining))))
                        : null,
                (key, owner, v) -> submitTimer(v, onElapsed));
    }

    private void nextPhase() {
        phaseSeq++;
    }

    private String version() {
        return roundId + ":" + phaseSeq;
    }

    String phaseKey() {
        return "race:" + roomId + ":phase";
    }

    String raceKey() {
        return "race:" + roomId + ":race";
    }

    String betReference(String userId) {
        return "bet:" + roundId + ":" + userId + ":" + (betAttempts.getOrDefault(userId, 0) + 1);
    }

    String graceKey(String userId) {
        return "race:" + roomId + ":grace:" + userId;
    }

    // =====================================================================
    // 致命错误与关闭
    // =====================================================================

    private void fail(RuntimeException cause) {
        log.error("房间出现致命错误，强制关闭: roomId={}, phase={}, roundId={}", roomId, phase, roundId, cause);
        try {
            if (round != null && round.isSealed()) {
                settleSealedRound();
            } else {
                refundWagers();
            }
        } catch (RuntimeException e) {
            log.error("致命错误退款提交失败: roomId={}, roundId={}", roomId, roundId, e);
        }
        close();
        try {
            listener.onRoomClosed(this);
        } catch (RuntimeException e) {
            log.error("通知大厅关闭房间失败: roomId={}", roomId, e);
        }
    }

    /**
     * 已封存的比赛按结果派奖（幂等号 race:{roundId}，已派过则台账忽略）；
     * 结算本身算不出来时，把本轮下注原样退回。
     */
    private void settleSealedRound() {
        Settlement settlement;
        try {
            settlement = ctx.settlement().computeRaceSettlement(round);
            if (settlement.totalNetResult() != 0) {
                throw new IllegalStateException("settlement does not balance: " + settlement.settlementId());
            }
        } catch (RuntimeException e) {
            log.error("已封存比赛无法结算，改为整轮退款: roomId={}, roundId={}", roomId, round.getRoundId(), e);
            applySettlement(ctx.settlement().computeRefund("refund:" + round.getRoundId() + ":abort", roomId,
                    round.getRoundId(), round.getEntrants()), BalanceReason.REFUND);
            return;
        }
        applySettlement(settlement, BalanceReason.WIN_CREDITED);
    }

    private void refundWagers() {
        List<RaceEntrant> refunds = new ArrayList<>();
        for (Player p : players) {
            if (p.isWagered()) {
                refunds.add(new RaceEntrant(p.getUserId(), p.getUsername(), p.getLane(), p.getColor(), p.getWager()));
            }
        }
        if (!refunds.isEmpty()) {
            applySettlement(ctx.settlement().computeRefund("refund:" + roundId + ":abort", roomId, roundId, refunds),
                    BalanceReason.REFUND);
        }
    }

    private void close() {
        closed = true;
        ctx.scheduler().stop(phaseKey());
        ctx.scheduler().stop(raceKey());
        for (String userId : new ArrayList<>(graceTokens.keySet())) {
            ctx.scheduler().stop(graceKey(userId));
        }
        graceTokens.clear();
    }

    /**
     * 每次处理后校验：人数不超容量、奖池等于下注之和、赛道不重复、位置不超过赛道长度。
     */
    private void checkInvariants() {
        if (players.size() + pendingJoins.size() > capacity) {
            throw new IllegalStateException("room over capacity: " + players.size() + "+" + pendingJoins.size());
        }
        long wagered = 0;
        Set<Integer> usedLanes = new HashSet<>();
        for (Player p : players) {
            if (p.isWagered()) {
                wagered += p.getWager();
            }
            if (!usedLanes.add(p.getLane())) {
                throw new IllegalStateException("duplicate lane: " + p.getLane());
            }
            if (p.getPosition() < 0 || p.getPosition() > ctx.simulator().trackLength()) {
                throw new IllegalStateException("position out of track: " + p.getUserId() + "=" + p.getPosition());
            }
        }
        if (wagered != pot) {
            throw new IllegalStateException("pot " + pot + " != wagers " + wagered);
        }
    }

    // =====================================================================
    // 视图
    // =====================================================================

    private RaceState raceState(String userId) {
        List<PlayerView> views = new ArrayList<>(players.size());
        for (Player p : players) {
            views.add(new PlayerView(p.getUserId(), p.getUsername(), p.isWagered(), p.isWagered(),
                    p.getPosition(), p.getLane(), p.getColor(), p.isConnected()));
        }
        Player me = find(userId);
        return new RaceState(roomId, roomName, roundId, phase, timeRemaining(), wagerAmount, pot,
                creator.userId(), creator.username(), persistent, capacity, views,
                ctx.wallet().getBalance(userId),
                me != null && me.isWagered(),
                me == null ? null : me.getLane(),
                pendingJoins.containsKey(userId));
    }

    private long timeRemaining() {
        if (phaseDeadlineMs <= 0) {
            return 0;
        }
        long remainMs = Math.max(0, phaseDeadlineMs - now());
        return (remainMs + 999) / 1000;
    }

    private void publishSummary(RoomEffects fx) {
        RoomSummary next = buildSummary();
        if (!next.equals(summary)) {
            summary = next;
            fx.afterCommit(() -> listener.onSummaryChanged(this, next));
        }
    }

    private RoomSummary buildSummary() {
        return new RoomSummary(roomId, roomName, creator.userId(), creator.username(), wagerAmount,
                players.size(), capacity, persistent, phase, wageredCount(), createdSeq);
    }

    /**
     * 房间广播对象：在座玩家（不含待离开者）与排队玩家。
     */
    private List<String> audience() {
        List<String> ids = new ArrayList<>(players.size() + pendingJoins.size());
        for (Player p : players) {
            if (!p.isLeaving()) {
                ids.add(p.getUserId());
            }
        }
        ids.addAll(pendingJoins.keySet());
        return ids;
    }

    private void broadcast(RoomEffects fx, Envelope<?> message) {
        fx.sendTo(audience(), message);
    }

    // =====================================================================
    // 工具
    // =====================================================================

    private Player seat(PlayerIdentity identity, int lane) {
        Player player = new Player(identity.userId(), identity.username(), lane);
        players.add(player);
        players.sort(Comparator.comparingInt(Player::getLane));
        return player;
    }

    /**
     * 优先分配本轮未用过的赛道；只剩本轮空出的赛道时再复用其中最小的。
     */
    private int lowestFreeLane() {
        Set<Integer> used = new HashSet<>();
        for (Player p : players) {
            used.add(p.getLane());
        }
        int fallback = -1;
        for (int lane = 1; lane <= capacity; lane++) {
            if (used.contains(lane)) {
                continue;
            }
            if (!retiredLanes.contains(lane)) {
                return lane;
            }
            if (fallback < 0) {
                fallback = lane;
            }
        }
        if (fallback > 0) {
            retiredLanes.remove(fallback);
        }
        return fallback;
    }

    private Player find(String userId) {
        for (Player p : players) {
            if (p.getUserId().equals(userId)) {
                return p;
            }
        }
        return null;
    }

    private int wageredCount() {
        int n = 0;
        for (Player p : players) {
            if (p.isWagered()) {
                n++;
            }
        }
        return n;
    }

    private long now() {
        return ctx.clock().millis();
    }

    private static String newRoundId() {
        return UUID.randomUUID().toString();
    }

    // ---------- 以下读取方法仅供房间线程与测试使用 ----------

    RacePhase phase() {
        return phase;
    }

    long pot() {
        return pot;
    }

    long wagerAmount() {
        return wagerAmount;
    }

    String roundId() {
        return roundId;
    }

    List<Player> players() {
        return List.copyOf(players);
    }

    Set<String> pendingJoinIds() {
        return Set.copyOf(pendingJoins.keySet());
    }

    RaceRound currentRound() {
        return round;
    }

    boolean isClosed() {
        return closed;
    }

    Player player(String userId) {
        return find(userId);
    }
}
