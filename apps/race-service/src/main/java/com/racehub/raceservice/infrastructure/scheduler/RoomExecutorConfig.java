package com.racehub.raceservice.infrastructure.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 比赛服务的三个线程池：
 *  - raceClockScheduler：阶段倒计时、比赛帧、断线宽限期、心跳巡检，任务只往房间邮箱投递消息；
 *  - roomExecutor：房间邮箱处理；
 *  - settlementExecutor：派奖/退款。
 * 三者互相隔离，钱包慢调用不会拖住计时，计时回调也不会挤占房间处理。
 */
@Configuration
public class RoomExecutorConfig {

    @Value("${scheduler.clock.corePoolSize:2}")
    private int clockPoolSize;

    @Value("${scheduler.room.poolSize:0}")
    private int roomPoolSize;

    @Value("${scheduler.settlement.poolSize:2}")
    private int settlementPoolSize;

    @Bean(name = "raceClockScheduler", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor raceClockScheduler() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(clockPoolSize, named("race-clock-"),
                new ThreadPoolExecutor.DiscardPolicy());
        // 取消的计时任务立即出队，避免频繁重排倒计时堆积
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * 房间邮箱的执行线程：所有房间共享，同一房间同一时刻最多占用一个线程。
     */
    @Bean(name = "roomExecutor", destroyMethod = "shutdown")
    public ExecutorService roomExecutor() {
        int poolSize = roomPoolSize > 0 ? roomPoolSize : Math.max(2, Runtime.getRuntime().availableProcessors());
        return new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), named("race-room-"));
    }

    /**
     * 派奖/退款线程：钱包调用带重试退避，不能占用房间线程。
     */
    @Bean(name = "settlementExecutor", destroyMethod = "shutdown")
    public ExecutorService settlementExecutor() {
        return new ThreadPoolExecutor(settlementPoolSize, settlementPoolSize, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), named("settlement-"));
    }

    private static ThreadFactory named(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger idx = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + idx.getAndIncrement());
                // 设置为守护线程
                t.setDaemon(true);
                return t;
            }
        };
    }
}
