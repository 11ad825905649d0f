package com.racehub.raceservice.race.application.room;

import com.racehub.raceservice.application.wallet.WalletGateway;
import com.racehub.raceservice.clock.scheduler.CountdownScheduler;
import com.racehub.raceservice.platform.config.RaceProperties;
import com.racehub.raceservice.race.application.settlement.SettlementService;
import com.racehub.raceservice.race.domain.rule.RaceSimulator;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.random.RandomGenerator;

/**
 * 房间共享的协作者。
 *
 * @param roomExecutor 房间邮箱的执行线程池
 * @param random       比赛随机源
 */
public record RoomContext(RaceProperties props,
                          CountdownScheduler scheduler,
                          WalletGateway wallet,
                          SettlementService settlement,
                          PlayerNotifier notifier,
                          RaceSimulator simulator,
                          RandomGenerator random,
                          Clock clock,
                          Executor roomExecutor) {
}
