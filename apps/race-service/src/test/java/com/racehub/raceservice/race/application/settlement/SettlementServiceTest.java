package com.racehub.raceservice.race.application.settlement;

import com.racehub.raceservice.application.wallet.WalletGateway;
import com.racehub.raceservice.platform.config.RaceProperties;
import com.racehub.raceservice.race.domain.constants.LaneColors;
import com.racehub.raceservice.race.domain.error.ErrorCode;
import com.racehub.raceservice.race.domain.error.RaceException;
import com.racehub.raceservice.race.domain.model.RaceEntrant;
import com.racehub.raceservice.race.domain.model.RaceRound;
import com.racehub.raceservice.race.domain.model.RankedEntrant;
import com.racehub.raceservice.race.domain.model.Settlement;
import com.racehub.raceservice.race.domain.model.SettlementEntry;
import com.racehub.raceservice.race.domain.repository.SettlementLedger;
import com.racehub.raceservice.race.infrastructure.kafka.RaceEventPublisher;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SettlementServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private RaceProperties props;
    private WalletGateway wallet;
    private InMemorySettlementLedger ledger;
    private RaceEventPublisher publisher;
    private BigWinNotifier bigWinNotifier;
    private SettlementService service;

    @BeforeEach
    void setUp() {
        props = new RaceProperties();
        wallet = mock(WalletGateway.class);
        when(wallet.credit(anyString(), anyLong(), anyString(), anyString())).thenReturn(16000L);
        ledger = new InMemorySettlementLedger();
        publisher = mock(RaceEventPublisher.class);
        bigWinNotifier = mock(BigWinNotifier.class);
        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .build());
        service = new SettlementService(wallet, ledger, publisher, bigWinNotifier, retryRegistry,
                Runnable::run, props, clock);
    }

    private static RaceEntrant entrant(String userId, int lane) {
        return new RaceEntrant(userId, userId.toUpperCase(), lane, LaneColors.of(lane), 2000);
    }

    private static RankedEntrant ranked(String userId, int lane, int position, int rank) {
        return new RankedEntrant(userId, userId.toUpperCase(), lane, LaneColors.of(lane), position, rank);
    }

    /** 三人参赛，b 夺冠 */
    private static RaceRound finishedRound() {
        RaceRound round = new RaceRound("r1", "room-1",
                List.of(entrant("a", 1), entrant("b", 2), entrant("c", 3)), 0L);
        round.recordTick(Map.of("a", 5, "b", 9, "c", 3));
        round.seal("b", List.of(ranked("b", 2, 100, 1), ranked("a", 1, 96, 2), ranked("c", 3, 80, 3)));
        return round;
    }

    @Test
    void winnerTakesWholePot() {
        Settlement settlement = service.computeRaceSettlement(finishedRound());

        assertThat(settlement.settlementId()).isEqualTo("race:r1");
        assertThat(settlement.type()).isEqualTo(Settlement.Type.RACE);
        assertThat(settlement.pot()).isEqualTo(6000);
        assertThat(settlement.totalNetResult()).isZero();
        assertThat(settlement.entryOf("b").winnings()).isEqualTo(6000);
        assertThat(settlement.entryOf("b").netResult()).isEqualTo(4000);
        assertThat(settlement.entryOf("b").rank()).isEqualTo(1);
        assertThat(settlement.entryOf("a").netResult()).isEqualTo(-2000);
        assertThat(settlement.entryOf("c").rank()).isEqualTo(3);
        assertThat(settlement.payouts()).extracting(SettlementEntry::userId).containsExactly("b");
    }

    @Test
    void unsealedRoundCannotBeSettled() {
        RaceRound open = new RaceRound("r2", "room-1", List.of(entrant("a", 1), entrant("b", 2)), 0L);

        assertThatThrownBy(() -> service.computeRaceSettlement(open)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void refundReturnsEachWagerWithZeroNet() {
        Settlement refund = service.computeRefund("refund:r1", "room-1", "r1",
                List.of(entrant("a", 1), entrant("b", 2)));

        assertThat(refund.type()).isEqualTo(Settlement.Type.REFUND);
        assertThat(refund.pot()).isEqualTo(4000);
        assertThat(refund.winnerId()).isNull();
        assertThat(refund.entries()).extracting(SettlementEntry::netResult).containsOnly(0L);
        assertThat(refund.payouts()).hasSize(2);
    }

    @Test
    void settlementIsAppliedOnlyOnce() {
        Settlement settlement = service.computeRaceSettlement(finishedRound());

        SettlementOutcome first = service.apply(settlement).join();
        SettlementOutcome second = service.apply(settlement).join();

        assertThat(first.applied()).isTrue();
        assertThat(first.fullyPaid()).isTrue();
        assertThat(first.balances()).containsEntry("b", 16000L).hasSize(1);
        assertThat(second.applied()).isFalse();
        verify(wallet, times(1)).credit("b", 6000L, "race:r1", SettlementService.REASON_WIN);
        verify(publisher, times(1)).publishGameCompleted(settlement, clock.millis());
        assertThat(ledger.status("race:r1")).contains(SettlementLedger.Status.SETTLED);
        assertThat(ledger.recorded("race:r1")).isPresent();
    }

    @Test
    void transientWalletFailureIsRetried() {
        when(wallet.credit("b", 6000L, "race:r1", SettlementService.REASON_WIN))
                .thenThrow(new RaceException(ErrorCode.WALLET_UNAVAILABLE))
                .thenReturn(16000L);

        SettlementOutcome outcome = service.execute(service.computeRaceSettlement(finishedRound()));

        assertThat(outcome.fullyPaid()).isTrue();
        assertThat(outcome.balances()).containsEntry("b", 16000L);
        verify(wallet, times(2)).credit("b", 6000L, "race:r1", SettlementService.REASON_WIN);
    }

    @Test
    void exhaustedRetriesLeavePendingPayout() {
        when(wallet.credit(anyString(), anyLong(), anyString(), anyString()))
                .thenThrow(new RaceException(ErrorCode.WALLET_UNAVAILABLE));

        SettlementOutcome outcome = service.execute(service.computeRaceSettlement(finishedRound()));

        assertThat(outcome.applied()).isTrue();
        assertThat(outcome.fullyPaid()).isFalse();
        assertThat(outcome.pendingUserIds()).containsExactly("b");
        assertThat(outcome.balances()).isEmpty();
        verify(wallet, times(3)).credit("b", 6000L, "race:r1", SettlementService.REASON_WIN);
        assertThat(ledger.status("race:r1")).contains(SettlementLedger.Status.PENDING_PAYOUT);
        assertThat(ledger.pendingPayouts("race:r1")).containsEntry("b", 6000L);
    }

    @Test
    void refundIsCreditedWithoutPublishing() {
        Settlement refund = service.computeRefund("refund:r1", "room-1", "r1",
                List.of(entrant("a", 1), entrant("b", 2)));

        SettlementOutcome outcome = service.execute(refund);

        assertThat(outcome.balances()).containsOnlyKeys("a", "b");
        verify(wallet).credit("a", 2000L, "refund:r1", SettlementService.REASON_REFUND);
        verify(wallet).credit("b", 2000L, "refund:r1", SettlementService.REASON_REFUND);
        verifyNoInteractions(publisher, bigWinNotifier);
    }

    @Test
    void bigWinIsAnnouncedAtThreshold() {
        props.setBigWinThreshold(6000);
        Settlement settlement = service.computeRaceSettlement(finishedRound());

        service.execute(settlement);

        verify(bigWinNotifier).notifyBigWin(settlement, settlement.entryOf("b"));
    }

    @Test
    void smallWinIsNotAnnounced() {
        props.setBigWinThreshold(6001);

        service.execute(service.computeRaceSettlement(finishedRound()));

        verify(bigWinNotifier, never()).notifyBigWin(any(), any());
    }
}
