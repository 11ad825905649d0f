package com.racehub.raceservice.race.application.room;

import com.racehub.raceservice.clock.scheduler.CountdownScheduler;

import java.util.HashMap;
import java.util.Map;

/**
 * 手动驱动的调度器：测试里显式触发到期、比赛帧与宽限期。
 */
class ManualCountdownScheduler implements CountdownScheduler {

    record Countdown(String owner, long deadlineEpochMs, String version, TickListener onTick, TimeoutHandler onTimeout) {
    }

    private final Map<String, Countdown> countdowns = new HashMap<>();
    private final Map<String, Runnable> periodic = new HashMap<>();
    private final Map<String, Runnable> oneShots = new HashMap<>();

    @Override
    public void startOrResume(String key, String owner, long deadlineEpochMs, String version,
                              TickListener onTick, TimeoutHandler onTimeout) {
        stop(key);
        countdowns.put(key, new Countdown(owner, deadlineEpochMs, version, onTick, onTimeout));
    }

    @Override
    public void startPeriodic(String key, long periodMs, Runnable task) {
        stop(key);
        periodic.put(key, task);
    }

    @Override
    public void schedule(String key, long delayMs, Runnable task) {
        stop(key);
        oneShots.put(key, task);
    }

    @Override
    public void stop(String key) {
        countdowns.remove(key);
        periodic.remove(key);
        oneShots.remove(key);
    }

    @Override
    public int activeCount() {
        return countdowns.size() + periodic.size() + oneShots.size();
    }

    boolean has(String key) {
        return countdowns.containsKey(key) || periodic.containsKey(key) || oneShots.containsKey(key);
    }

    Countdown countdown(String key) {
        return countdowns.get(key);
    }

    /** 倒计时到期 */
    void elapse(String key) {
        Countdown c = countdowns.remove(key);
        if (c == null) {
            throw new IllegalStateException("no countdown armed for " + key);
        }
        c.onTimeout().onTimeout(key, c.owner(), c.version());
    }

    /** 推一帧倒计时 TICK */
    void tick(String key, long remainingSeconds) {
        Countdown c = countdowns.get(key);
        if (c != null && c.onTick() != null) {
            c.onTick().onTick(key, c.owner(), c.deadlineEpochMs(), remainingSeconds);
        }
    }

    /** 执行一次周期任务，未调度时返回 false */
    boolean runPeriodic(String key) {
        Runnable task = periodic.get(key);
        if (task == null) {
            return false;
        }
        task.run();
        return true;
    }

    /** 触发一次性任务 */
    void fire(String key) {
        Runnable task = oneShots.remove(key);
        if (task == null) {
            throw new IllegalStateException("nothing scheduled for " + key);
        }
        task.run();
    }
}
