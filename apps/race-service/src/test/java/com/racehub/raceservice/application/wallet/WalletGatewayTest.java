package com.racehub.raceservice.application.wallet;

import com.racehub.raceservice.infrastructure.client.wallet.WalletClient;
import com.racehub.raceservice.infrastructure.client.wallet.dto.WalletBalanceView;
import com.racehub.raceservice.infrastructure.client.wallet.dto.WalletOperationRequest;
import com.racehub.raceservice.infrastructure.client.wallet.dto.WalletReservationView;
import com.racehub.raceservice.race.domain.error.ErrorCode;
import com.racehub.raceservice.race.domain.error.RaceException;
import com.racehub.raceservice.race.domain.repository.SettlementLedger;
import com.racehub.web.common.ApiResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WalletGatewayTest {

    private WalletClient client;
    private SettlementLedger ledger;
    private WalletGateway gateway;

    @BeforeEach
    void setUp() {
        client = mock(WalletClient.class);
        ledger = mock(SettlementLedger.class);
        gateway = new WalletGateway(client, ledger);
    }

    private static ApiResponse<WalletBalanceView> balance(long amount) {
        WalletBalanceView view = new WalletBalanceView();
        view.setBalance(amount);
        return ApiResponse.success(view);
    }

    private static ApiResponse<WalletReservationView> reservation(boolean ok) {
        WalletReservationView view = new WalletReservationView();
        view.setOk(ok);
        return ApiResponse.success(view);
    }

    @Test
    void debitReservesThenDebits() {
        when(client.checkAndReserve(any())).thenReturn(reservation(true));
        when(client.debit(any())).thenReturn(balance(8000));

        long left = gateway.reserveAndDebit("u1", 2000, "bet:r1:u1:1");

        assertThat(left).isEqualTo(8000);
        verify(client).debit(new WalletOperationRequest("u1", 2000, "bet:r1:u1:1", "duck_race_bet"));
    }

    @Test
    void failedReservationMeansInsufficientBalance() {
        when(client.checkAndReserve(any())).thenReturn(reservation(false));

        assertThatThrownBy(() -> gateway.reserveAndDebit("u1", 2000, "bet:r1:u1:1"))
                .isInstanceOf(RaceException.class)
                .satisfies(e -> assertThat(((RaceException) e).getCode()).isEqualTo(ErrorCode.INSUFFICIENT_BALANCE));
        verify(client, never()).debit(any());
        verify(ledger, never()).markUnconfirmedDebit(anyString(), anyString(), anyLong(), anyString());
    }

    @Test
    void debitFailureAfterReservationIsRecordedForReconciliation() {
        when(client.checkAndReserve(any())).thenReturn(reservation(true));
        when(client.debit(any())).thenThrow(new IllegalStateException("read timed out"));

        assertThatThrownBy(() -> gateway.reserveAndDebit("u1", 2000, "bet:r1:u1:1"))
                .isInstanceOf(IllegalStateException.class);
        verify(ledger).markUnconfirmedDebit(eq("bet:r1:u1:1"), eq("u1"), eq(2000L), anyString());
    }

    @Test
    void emptyDebitResponseIsRecordedAndWalletUnavailable() {
        when(client.checkAndReserve(any())).thenReturn(reservation(true));
        when(client.debit(any())).thenReturn(ApiResponse.serverError("down"));

        assertThatThrownBy(() -> gateway.reserveAndDebit("u1", 2000, "bet:r1:u1:1"))
                .isInstanceOf(RaceException.class)
                .satisfies(e -> assertThat(((RaceException) e).getCode()).isEqualTo(ErrorCode.WALLET_UNAVAILABLE));
        verify(ledger).markUnconfirmedDebit(eq("bet:r1:u1:1"), eq("u1"), eq(2000L), anyString());
    }

    @Test
    void ledgerOutageDoesNotHideDebitFailure() {
        when(client.checkAndReserve(any())).thenReturn(reservation(true));
        when(client.debit(any())).thenThrow(new IllegalStateException("read timed out"));
        doThrow(new IllegalStateException("redis down"))
                .when(ledger).markUnconfirmedDebit(anyString(), anyString(), anyLong(), anyString());

        assertThatThrownBy(() -> gateway.reserveAndDebit("u1", 2000, "bet:r1:u1:1"))
                .hasMessage("read timed out");
    }

    @Test
    void emptyCreditResponseMeansWalletUnavailable() {
        when(client.credit(any())).thenReturn(ApiResponse.serverError("down"));

        assertThatThrownBy(() -> gateway.credit("u1", 4000, "race:r1", "duck_race_win"))
                .isInstanceOf(RaceException.class)
                .satisfies(e -> assertThat(((RaceException) e).getCode()).isEqualTo(ErrorCode.WALLET_UNAVAILABLE));
    }

    @Test
    void balanceIsNullWhenWalletHasNoData() {
        when(client.getBalance("u1")).thenReturn(ApiResponse.notFound("no wallet"));
        when(client.getBalance("u2")).thenReturn(balance(500));

        assertThat(gateway.getBalance("u1")).isNull();
        assertThat(gateway.getBalance("u2")).isEqualTo(500L);
    }
}
