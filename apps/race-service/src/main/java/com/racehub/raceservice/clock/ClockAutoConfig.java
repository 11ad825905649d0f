package com.racehub.raceservice.clock;

import com.racehub.raceservice.clock.scheduler.CountdownScheduler;
import com.racehub.raceservice.clock.scheduler.CountdownSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * ClockAutoConfig
 * ---------------------------------------
 * 倒计时相关 Bean 的装配：把调度线程池与系统时钟注入到通用调度引擎中。
 *
 * 说明：
 *  - 线程池 raceClockScheduler 由 RoomExecutorConfig 提供。
 *  - 这里不关心任何业务细节，只负责把基础设施拼起来。
 */
@Configuration
public class ClockAutoConfig {

    /**
     * 服务端权威时钟，房间用它计算阶段截止时间；测试中替换为固定时钟。
     */
    @Bean
    public Clock raceClock() {
        return Clock.systemUTC();
    }

    /**
     * 注册通用倒计时调度器。
     * @param raceClockScheduler 调度线程池
     * @param raceClock          时钟
     * @return CountdownScheduler 实例
     */
    @Bean
    public CountdownScheduler countdownScheduler(@Qualifier("raceClockScheduler") ScheduledThreadPoolExecutor raceClockScheduler,
                                                 Clock raceClock) {
        return new CountdownSchedulerImpl(raceClockScheduler, raceClock); // 纯引擎，无业务逻辑
    }
}
