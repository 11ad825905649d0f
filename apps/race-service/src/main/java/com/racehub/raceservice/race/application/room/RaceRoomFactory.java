package com.racehub.raceservice.race.application.room;

import com.racehub.raceservice.application.wallet.WalletGateway;
import com.racehub.raceservice.clock.scheduler.CountdownScheduler;
import com.racehub.raceservice.platform.config.RaceProperties;
import com.racehub.raceservice.race.application.settlement.SettlementService;
import com.racehub.raceservice.race.domain.model.PlayerIdentity;
import com.racehub.raceservice.race.domain.rule.RaceSimulator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.random.RandomGenerator;

/**
 * 房间工厂：把 Spring 管理的协作者装配进每个房间 actor。
 */
@Component
public class RaceRoomFactory {

    private final RoomContext context;

    public RaceRoomFactory(RaceProperties props,
                           CountdownScheduler countdownScheduler,
                           WalletGateway walletGateway,
                           SettlementService settlementService,
                           PlayerNotifier playerNotifier,
                           RaceSimulator raceSimulator,
                           @Qualifier("raceRandom") RandomGenerator raceRandom,
                           Clock raceClock,
                           @Qualifier("roomExecutor") Executor roomExecutor) {
        this.context = new RoomContext(props, countdownScheduler, walletGateway, settlementService,
                playerNotifier, raceSimulator, raceRandom, raceClock, roomExecutor);
    }

    public RaceRoom create(String roomId, String roomName, PlayerIdentity creator, long wagerAmount,
                           boolean persistent, long createdSeq, RoomListener listener) {
        return new RaceRoom(roomId, roomName, creator, wagerAmount, persistent, createdSeq, context, listener);
    }
}
