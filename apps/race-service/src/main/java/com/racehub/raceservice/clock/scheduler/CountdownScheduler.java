package com.racehub.raceservice.clock.scheduler;

/**
 * CountdownScheduler
 * ---------------------------------------
 * 通用的“倒计时调度器”接口，完全独立于比赛业务。
 *
 * 设计目标：
 *  - 提供统一的倒计时能力（启动/停止），以及固定频率任务与一次性延时任务。
 *  - 暴露“每秒 tick 回调”和“到期 timeout 回调”。
 *  - 回调运行在调度线程上，不关心消息广播与规则，由上层把回调转投到房间邮箱。
 *  - 同一个 key 同时只存在一个任务，重复启动会先取消旧任务。
 */
public interface CountdownScheduler {

    /**
     * TickListener
     * ---------------------------------------
     * 每秒触发一次，用于向上层报告：当前 key 的 owner、绝对截止时间、剩余秒数。
     */
    interface TickListener {
        /**
         * 每秒调用一次的回调。
         * @param key              业务键（如 "race:{roomId}:phase"）
         * @param owner            被计时的对象（比赛里是阶段名）
         * @param deadlineEpochMs  绝对截止时间（毫秒）
         * @param remainingSeconds 剩余秒数（向上取整）
         */
        void onTick(String key, String owner, long deadlineEpochMs, long remainingSeconds);
    }

    /**
     * TimeoutHandler
     * ---------------------------------------
     * 到期时回调一次，由上层做权威业务处理。
     */
    interface TimeoutHandler {
        /**
         * 倒计时到期时触发。
         * @param key     业务键
         * @param owner   被计时的对象
         * @param version 阶段版本（上层用来丢弃过期回调）
         */
        void onTimeout(String key, String owner, String version);
    }

    /**
     * 启动指定 key 的倒计时：立即推一帧 tick，之后每秒一帧，到期回调一次。
     * @param key             业务键
     * @param owner           被计时的对象
     * @param deadlineEpochMs 绝对截止时间（毫秒）
     * @param version         阶段版本
     * @param onTick          每秒回调，可为 null
     * @param onTimeout       到期回调
     */
    void startOrResume(String key, String owner, long deadlineEpochMs, String version,
                       TickListener onTick, TimeoutHandler onTimeout);

    /**
     * 以固定频率执行任务（比赛帧），直到 stop(key)。
     * @param key      业务键
     * @param periodMs 周期（毫秒），首帧延迟一个周期
     * @param task     任务
     */
    void startPeriodic(String key, long periodMs, Runnable task);

    /**
     * 一次性延时任务（断线宽限期）。
     * @param key     业务键
     * @param delayMs 延迟（毫秒）
     * @param task    任务
     */
    void schedule(String key, long delayMs, Runnable task);

    /**
     * 停止指定 key 的任务（不打断正在执行的回调）。
     * @param key 业务键
     */
    void stop(String key);

    /**
     * @return 当前仍在调度的任务数
     */
    int activeCount();
}
