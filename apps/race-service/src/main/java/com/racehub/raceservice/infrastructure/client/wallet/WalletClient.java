package com.racehub.raceservice.infrastructure.client.wallet;

import com.racehub.raceservice.infrastructure.client.wallet.dto.WalletBalanceView;
import com.racehub.raceservice.infrastructure.client.wallet.dto.WalletOperationRequest;
import com.racehub.raceservice.infrastructure.client.wallet.dto.WalletReservationView;
import com.racehub.web.common.ApiResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * 调用 wallet-service 内部余额接口的 Feign Client。
 *
 * 使用 Spring Cloud LoadBalancer 解析服务名，本地开发通过 simple discovery 指定地址。
 * 熔断与兜底统一在 {@link com.racehub.raceservice.application.wallet.WalletGateway} 中处理。
 */
@FeignClient(
        name = "wallet-service",
        path = "/api/internal/wallet"
)
public interface WalletClient {

    /**
     * 查询余额。
     */
    @GetMapping("/{userId}/balance")
    ApiResponse<WalletBalanceView> getBalance(@PathVariable("userId") String userId);

    /**
     * 校验余额并预留（ok=false 表示余额不足）。
     */
    @PostMapping("/reserve")
    ApiResponse<WalletReservationView> checkAndReserve(@RequestBody WalletOperationRequest request);

    /**
     * 扣款（下注）。
     */
    @PostMapping("/debit")
    ApiResponse<WalletBalanceView> debit(@RequestBody WalletOperationRequest request);

    /**
     * 入账（派奖/退款），reference 相同的请求由钱包侧去重。
     */
    @PostMapping("/credit")
    ApiResponse<WalletBalanceView> credit(@RequestBody WalletOperationRequest request);
}
