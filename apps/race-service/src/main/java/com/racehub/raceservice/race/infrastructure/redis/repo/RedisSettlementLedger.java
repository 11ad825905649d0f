package com.racehub.raceservice.race.infrastructure.redis.repo;

import com.racehub.raceservice.race.domain.model.Settlement;
import com.racehub.raceservice.race.domain.model.SettlementEntry;
import com.racehub.raceservice.race.domain.repository.SettlementLedger;
import com.racehub.raceservice.race.infrastructure.redis.RedisKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 Redis 的结算台账。
 * 状态键用 SETNX 抢占，抢不到说明该结算已经执行过（重复提交/重试）。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisSettlementLedger implements SettlementLedger {

    /** 台账保留 7 天，足够覆盖补发窗口 */
    private static final Duration LEDGER_TTL = Duration.ofDays(7);

    private final StringRedisTemplate redis;

    @Override
    public boolean claim(Settlement settlement) {
        Boolean ok = redis.opsForValue().setIfAbsent(
                RedisKeys.settlementStatus(settlement.settlementId()), Status.SETTLING.name(), LEDGER_TTL);
        return Boolean.TRUE.equals(ok);
    }

    @Override
    public void recordResults(Settlement settlement) {
        String key = RedisKeys.settlementResults(settlement.settlementId());
        Map<String, String> results = new LinkedHashMap<>();
        for (SettlementEntry e : settlement.entries()) {
            results.put(e.userId(), String.valueOf(e.netResult()));
        }
        if (results.isEmpty()) {
            return;
        }
        redis.opsForHash().putAll(key, results);
        redis.expire(key, LEDGER_TTL);
    }

    @Override
    public void markSettled(String settlementId) {
        redis.opsForValue().set(RedisKeys.settlementStatus(settlementId), Status.SETTLED.name(), LEDGER_TTL);
    }

    @Override
    public void markPendingPayout(String settlementId, String userId, long amount, String reason) {
        redis.opsForValue().set(RedisKeys.settlementStatus(settlementId), Status.PENDING_PAYOUT.name(), LEDGER_TTL);
        String pendingKey = RedisKeys.pendingPayouts(settlementId);
        redis.opsForHash().put(pendingKey, userId, String.valueOf(amount));
        redis.expire(pendingKey, LEDGER_TTL);
        redis.opsForSet().add(RedisKeys.pendingPayoutIndex(), settlementId);
        log.debug("已登记待补发派奖: settlementId={}, userId={}, amount={}, reason={}",
                settlementId, userId, amount, reason);
    }

    @Override
    public void markUnconfirmedDebit(String reference, String userId, long amount, String reason) {
        String key = RedisKeys.unconfirmedDebit(reference);
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("userId", userId);
        fields.put("amount", String.valueOf(amount));
        fields.put("reason", String.valueOf(reason));
        redis.opsForHash().putAll(key, fields);
        redis.expire(key, LEDGER_TTL);
        redis.opsForSet().add(RedisKeys.unconfirmedDebitIndex(), reference);
    }

    @Override
    public Optional<Status> status(String settlementId) {
        String raw = redis.opsForValue().get(RedisKeys.settlementStatus(settlementId));
        return raw == null ? Optional.empty() : Optional.of(Status.valueOf(raw));
    }
}
