package com.racehub.raceservice.race.application.settlement;

import com.racehub.raceservice.application.wallet.WalletGateway;
import com.racehub.raceservice.platform.config.RaceProperties;
import com.racehub.raceservice.race.domain.model.RaceEntrant;
import com.racehub.raceservice.race.domain.model.RaceRound;
import com.racehub.raceservice.race.domain.model.RankedEntrant;
import com.racehub.raceservice.race.domain.model.Settlement;
import com.racehub.raceservice.race.domain.model.SettlementEntry;
import com.racehub.raceservice.race.domain.repository.SettlementLedger;
import com.racehub.raceservice.race.infrastructure.kafka.RaceEventPublisher;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 结算服务
 * ----------------------------------------
 * 职责：
 *  1. 根据封存的 RaceRound 计算结算（冠军独得奖池，其余为 0，净输赢 = 赢得 - 下注）；
 *  2. 计算退款结算（下注原样退回，净输赢为 0）；
 *  3. 在结算线程上执行入账：台账抢占保证同一结算只执行一次，
 *     钱包调用按 walletSettlement 重试，耗尽后登记待补发，不回报给玩家；
 *  4. 比赛结算完成后发布 Kafka 事件，并对大额派奖做播报。
 *
 * 下注扣款不在这里：扣款发生在房间下注时，结算只负责入账。
 */
@Slf4j
@Service
public class SettlementService {

    public static final String RETRY_NAME = "walletSettlement";
    public static final String REASON_WIN = "duck_race_win";
    public static final String REASON_REFUND = "duck_race_refund";

    private final WalletGateway walletGateway;
    private final SettlementLedger ledger;
    private final RaceEventPublisher eventPublisher;
    private final BigWinNotifier bigWinNotifier;
    private final Retry retry;
    private final Executor settlementExecutor;
    private final RaceProperties props;
    private final Clock clock;

    public SettlementService(WalletGateway walletGateway,
                             SettlementLedger ledger,
                             RaceEventPublisher eventPublisher,
                             BigWinNotifier bigWinNotifier,
                             RetryRegistry retryRegistry,
                             @Qualifier("settlementExecutor") Executor settlementExecutor,
                             RaceProperties props,
                             Clock clock) {
        this.walletGateway = walletGateway;
        this.ledger = ledger;
        this.eventPublisher = eventPublisher;
        this.bigWinNotifier = bigWinNotifier;
        this.retry = retryRegistry.retry(RETRY_NAME);
        this.settlementExecutor = settlementExecutor;
        this.props = props;
        this.clock = clock;
    }

    /**
     * 计算比赛结算，幂等键为 "race:{roundId}"。
     * @param round 已封存的比赛
     */
    public Settlement computeRaceSettlement(RaceRound round) {
        if (!round.isSealed()) {
            throw new IllegalStateException("round not sealed: " + round.getRoundId());
        }
        Map<String, Integer> ranks = new LinkedHashMap<>();
        for (RankedEntrant r : round.getRanking()) {
            ranks.put(r.userId(), r.rank());
        }
        List<SettlementEntry> entries = new ArrayList<>(round.getEntrants().size());
        for (RaceEntrant e : round.getEntrants()) {
            long winnings = e.userId().equals(round.getWinnerId()) ? round.getPot() : 0L;
            entries.add(SettlementEntry.of(e.userId(), e.username(), ranks.getOrDefault(e.userId(), 0),
                    e.wager(), winnings));
        }
        return new Settlement("race:" + round.getRoundId(), Settlement.Type.RACE, round.getRoomId(),
                round.getRoundId(), round.getPot(), round.getWinnerId(), entries);
    }

    /**
     * 计算退款结算。
     * @param settlementId 幂等键（调用方保证同一笔退款不变）
     * @param roomId       房间
     * @param roundId      所属轮次
     * @param refunds      被退款的下注（wager 即退款额）
     */
    public Settlement computeRefund(String settlementId, String roomId, String roundId, List<RaceEntrant> refunds) {
        List<SettlementEntry> entries = new ArrayList<>(refunds.size());
        long pot = 0;
        for (RaceEntrant e : refunds) {
            entries.add(SettlementEntry.of(e.userId(), e.username(), 0, e.wager(), e.wager()));
            pot += e.wager();
        }
        return new Settlement(settlementId, Settlement.Type.REFUND, roomId, roundId, pot, null, entries);
    }

    /**
     * 异步执行结算。
     * @return 执行结果；台账异常时以异常完成
     */
    public CompletableFuture<SettlementOutcome> apply(Settlement settlement) {
        return CompletableFuture.supplyAsync(() -> execute(settlement), settlementExecutor);
    }

    /**
     * 同步执行结算（运行在结算线程上）。
     */
    SettlementOutcome execute(Settlement settlement) {
        if (!ledger.claim(settlement)) {
            log.info("结算已执行过，忽略重复提交: settlementId={}", settlement.settlementId());
            return SettlementOutcome.duplicate(settlement.settlementId());
        }
        ledger.recordResults(settlement);

        String reason = settlement.type() == Settlement.Type.RACE ? REASON_WIN : REASON_REFUND;
        Map<String, Long> balances = new LinkedHashMap<>();
        List<String> pending = new ArrayList<>();
        for (SettlementEntry entry : settlement.payouts()) {
            try {
                long balance = retry.executeSupplier(() -> walletGateway.credit(
                        entry.userId(), entry.winnings(), settlement.settlementId(), reason));
                balances.put(entry.userId(), balance);
            } catch (RuntimeException e) {
                log.error("入账重试耗尽，登记待补发: settlementId={}, userId={}, amount={}",
                        settlement.settlementId(), entry.userId(), entry.winnings(), e);
                ledger.markPendingPayout(settlement.settlementId(), entry.userId(), entry.winnings(), e.toString());
                pending.add(entry.userId());
            }
        }
        if (pending.isEmpty()) {
            ledger.markSettled(settlement.settlementId());
        }

        if (settlement.type() == Settlement.Type.RACE) {
            eventPublisher.publishGameCompleted(settlement, clock.millis());
            for (SettlementEntry entry : settlement.payouts()) {
                if (entry.winnings() >= props.getBigWinThreshold()) {
                    bigWinNotifier.notifyBigWin(settlement, entry);
                }
            }
        }
        log.info("结算完成: settlementId={}, type={}, pot={}, paid={}, pending={}",
                settlement.settlementId(), settlement.type(), settlement.pot(), balances.size(), pending.size());
        return new SettlementOutcome(settlement.settlementId(), true, balances, pending);
    }
}
