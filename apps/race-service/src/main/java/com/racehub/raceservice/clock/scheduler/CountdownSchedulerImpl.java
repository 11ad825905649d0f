package com.racehub.raceservice.clock.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CountdownSchedulerImpl
 * ---------------------------------------
 * 通用倒计时调度引擎的默认实现（进程内）。
 *
 * 职责：
 *  - 使用 ScheduledThreadPoolExecutor 每秒调度倒计时任务；
 *  - 维护 key -> 任务句柄，保证同一 key 只有一个任务；
 *  - 回调中的异常只记日志，不影响调度线程。
 *
 * 房间是进程内 actor，重启后房间本身不复存在，因此倒计时状态不做持久化。
 */
@Slf4j
public class CountdownSchedulerImpl implements CountdownScheduler {

    // 调度器：每秒触发一次
    private final ScheduledThreadPoolExecutor scheduler;
    private final Clock clock;

    // key -> 任务句柄
    private final ConcurrentMap<String, ScheduledFuture<?>> activeTasks = new ConcurrentHashMap<>();

    public CountdownSchedulerImpl(ScheduledThreadPoolExecutor scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public void startOrResume(String key, String owner, long deadlineEpochMs, String version,
                              TickListener onTick, TimeoutHandler onTimeout) {
        // 防止重复任务：先取消老任务
        stop(key);
        CountdownState state = new CountdownState(key, owner, version, deadlineEpochMs);
        long remainMs = deadlineEpochMs - clock.millis();
        // 已到期：直接做超时，不再调度
        if (remainMs <= 0) {
            safeTimeout(onTimeout, state);
            return;
        }
        // 立即首帧 TICK
        fireTick(onTick, state);
        ScheduledFuture<?> fut = scheduler.scheduleAtFixedRate(
                () -> tickTask(state, onTick, onTimeout),
                1,
                1,
                TimeUnit.SECONDS);
        activeTasks.put(key, fut);
    }

    @Override
    public void startPeriodic(String key, long periodMs, Runnable task) {
        stop(key);
        ScheduledFuture<?> fut = scheduler.scheduleAtFixedRate(
                () -> safeRun(key, task), periodMs, periodMs, TimeUnit.MILLISECONDS);
        activeTasks.put(key, fut);
    }

    @Override
    public void schedule(String key, long delayMs, Runnable task) {
        stop(key);
        AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
        ScheduledFuture<?> fut = scheduler.schedule(() -> {
            // 一次性任务：执行时只移除自己（key 可能已被新任务替换）
            activeTasks.remove(key, self.get());
            safeRun(key, task);
        }, delayMs, TimeUnit.MILLISECONDS);
        self.set(fut);
        activeTasks.put(key, fut);
    }

    @Override
    public void stop(String key) {
        ScheduledFuture<?> f = activeTasks.remove(key);
        // 取消调度，但不打断正在运行
        if (f != null) f.cancel(false);
    }

    @Override
    public int activeCount() {
        return activeTasks.size();
    }

    /**
     * 周期任务：判定到期则停止并触发超时，否则发出一帧 TICK。
     */
    private void tickTask(CountdownState state, TickListener onTick, TimeoutHandler onTimeout) {
        long remainMs = state.deadlineEpochMs - clock.millis();
        if (remainMs <= 0) {
            stop(state.key);
            safeTimeout(onTimeout, state);
            return;
        }
        fireTick(onTick, state);
    }

    private void fireTick(TickListener onTick, CountdownState state) {
        if (onTick == null) return;
        long remainMs = Math.max(0, state.deadlineEpochMs - clock.millis());
        // 向上取整，首帧显示完整秒数
        long left = (remainMs + 999) / 1000;
        try {
            onTick.onTick(state.key, state.owner, state.deadlineEpochMs, left);
        } catch (RuntimeException e) {
            log.warn("倒计时 TICK 回调异常: key={}", state.key, e);
        }
    }

    private void safeTimeout(TimeoutHandler onTimeout, CountdownState state) {
        if (onTimeout == null) return;
        try {
            onTimeout.onTimeout(state.key, state.owner, state.version);
        } catch (RuntimeException e) {
            log.warn("倒计时超时回调异常: key={}, version={}", state.key, state.version, e);
        }
    }

    private void safeRun(String key, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.warn("定时任务执行异常: key={}", key, e);
        }
    }

    /**
     * 倒计时状态
     */
    private record CountdownState(String key, String owner, String version, long deadlineEpochMs) {
    }
}
