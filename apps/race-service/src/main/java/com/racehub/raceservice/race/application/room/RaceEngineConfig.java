package com.racehub.raceservice.race.application.room;

import com.racehub.raceservice.platform.config.RaceProperties;
import com.racehub.raceservice.race.domain.rule.RaceSimulator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.random.RandomGenerator;

/**
 * 比赛模拟器与随机源。
 */
@Configuration
public class RaceEngineConfig {

    @Bean
    public RaceSimulator raceSimulator(RaceProperties props) {
        return new RaceSimulator(props.getTrackLength(), props.getAdvanceMin(), props.getAdvanceMax());
    }

    /**
     * 所有房间共用；SecureRandom 线程安全。
     */
    @Bean(name = "raceRandom")
    public RandomGenerator raceRandom() {
        return new SecureRandom();
    }
}
