package com.racehub.raceservice.application.wallet;

import com.racehub.raceservice.infrastructure.client.wallet.WalletClient;
import com.racehub.raceservice.infrastructure.client.wallet.dto.WalletBalanceView;
import com.racehub.raceservice.infrastructure.client.wallet.dto.WalletOperationRequest;
import com.racehub.raceservice.infrastructure.client.wallet.dto.WalletReservationView;
import com.racehub.raceservice.race.domain.error.ErrorCode;
import com.racehub.raceservice.race.domain.error.RaceException;
import com.racehub.raceservice.race.domain.repository.SettlementLedger;
import com.racehub.web.common.ApiResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 钱包网关（比赛域调用钱包域的统一入口）。
 * 通过 Feign Client 调用 wallet-service，并在此处统一做熔断/兜底。
 *
 * 约定：
 *  - 查询余额失败时返回 null，不影响大厅与房间快照；
 *  - 扣款/入账失败一律转换为 {@link RaceException}（WALLET_UNAVAILABLE），
 *    余额不足等领域拒绝原样抛出，由调用方决定重试或回报玩家。
 *  - 预留成功后扣款失败或超时，钱包侧状态未知，下注幂等号登记到台账等待对账；
 *  - 本类不缓存余额，每次都以钱包为准。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WalletGateway {

    private final WalletClient walletClient;
    private final SettlementLedger ledger;

    /**
     * 查询余额。
     * @return 余额，钱包不可用时返回 null
     */
    @CircuitBreaker(name = "walletClient", fallbackMethod = "fallbackBalance")
    public Long getBalance(String userId) {
        ApiResponse<WalletBalanceView> resp = walletClient.getBalance(userId);
        if (resp == null || !resp.hasData()) {
            log.warn("查询余额失败: userId={}, response={}", userId, resp);
            return null;
        }
        return resp.data().getBalance();
    }

    /**
     * 下注扣款：先校验并预留，再扣款。
     * @param userId    玩家
     * @param amount    下注额
     * @param reference 幂等号，同一次下注的重试必须相同
     * @return 扣款后余额
     * @throws RaceException INSUFFICIENT_BALANCE / WALLET_UNAVAILABLE
     */
    @CircuitBreaker(name = "walletClient", fallbackMethod = "fallbackDebit")
    public long reserveAndDebit(String userId, long amount, String reference) {
        WalletOperationRequest req = new WalletOperationRequest(userId, amount, reference, "duck_race_bet");
        ApiResponse<WalletReservationView> reserved = walletClient.checkAndReserve(req);
        if (reserved == null || !reserved.hasData()) {
            throw new RaceException(ErrorCode.WALLET_UNAVAILABLE);
        }
        if (!reserved.data().isOk()) {
            throw new RaceException(ErrorCode.INSUFFICIENT_BALANCE);
        }
        ApiResponse<WalletBalanceView> debited;
        try {
            debited = walletClient.debit(req);
        } catch (RuntimeException e) {
            recordUnconfirmedDebit(req, e.toString());
            throw e;
        }
        if (debited == null || !debited.hasData()) {
            recordUnconfirmedDebit(req, "debit response without data: " + debited);
            throw new RaceException(ErrorCode.WALLET_UNAVAILABLE);
        }
        return debited.data().getBalance();
    }

    private void recordUnconfirmedDebit(WalletOperationRequest req, String reason) {
        log.error("预留成功但扣款未确认，登记待对账: userId={}, amount={}, reference={}, reason={}",
                req.getUserId(), req.getAmount(), req.getReference(), reason);
        try {
            ledger.markUnconfirmedDebit(req.getReference(), req.getUserId(), req.getAmount(), reason);
        } catch (RuntimeException e) {
            log.error("未确认扣款登记失败: reference={}", req.getReference(), e);
        }
    }

    /**
     * 入账（派奖/退款）。
     * @param userId    玩家
     * @param amount    金额
     * @param reference 幂等号（settlementId）
     * @param reason    原因
     * @return 入账后余额
     * @throws RaceException WALLET_UNAVAILABLE
     */
    @CircuitBreaker(name = "walletClient", fallbackMethod = "fallbackCredit")
    public long credit(String userId, long amount, String reference, String reason) {
        ApiResponse<WalletBalanceView> resp = walletClient.credit(
                new WalletOperationRequest(userId, amount, reference, reason));
        if (resp == null || !resp.hasData()) {
            throw new RaceException(ErrorCode.WALLET_UNAVAILABLE);
        }
        return resp.data().getBalance();
    }

    @SuppressWarnings("unused")
    private Long fallbackBalance(String userId, Throwable ex) {
        log.warn("调用 wallet-service 查询余额失败，走兜底: userId={}, ex={}", userId, ex.toString());
        return null;
    }

    @SuppressWarnings("unused")
    private long fallbackDebit(String userId, long amount, String reference, Throwable ex) {
        throw translate("扣款", userId, amount, ex);
    }

    @SuppressWarnings("unused")
    private long fallbackCredit(String userId, long amount, String reference, String reason, Throwable ex) {
        throw translate("入账", userId, amount, ex);
    }

    private RaceException translate(String op, String userId, long amount, Throwable ex) {
        if (ex instanceof RaceException re) {
            return re;
        }
        log.warn("调用 wallet-service {}失败: userId={}, amount={}, ex={}", op, userId, amount, ex.toString());
        return new RaceException(ErrorCode.WALLET_UNAVAILABLE, ErrorCode.WALLET_UNAVAILABLE.defaultMessage(), ex);
    }
}
