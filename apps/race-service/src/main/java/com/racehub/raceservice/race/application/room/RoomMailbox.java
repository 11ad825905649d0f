package com.racehub.raceservice.race.application.room;

import lombok.extern.slf4j.Slf4j;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 房间邮箱：任意线程投递，同一时刻最多一个线程按到达顺序消费。
 * 所有房间共享同一个执行线程池，房间之间互不阻塞。
 */
@Slf4j
public class RoomMailbox {

    private final String roomId;
    private final Executor executor;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public RoomMailbox(String roomId, Executor executor) {
        this.roomId = roomId;
        this.executor = executor;
    }

    public void post(Runnable message) {
        queue.offer(message);
        scheduleDrain();
    }

    public int pending() {
        return queue.size();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.error("房间邮箱调度被拒绝: roomId={}, pending={}", roomId, queue.size(), e);
        }
    }

    private void drain() {
        try {
            Runnable message;
            while ((message = queue.poll()) != null) {
                try {
                    message.run();
                } catch (RuntimeException e) {
                    log.error("房间消息处理异常: roomId={}", roomId, e);
                }
            }
        } finally {
            draining.set(false);
        }
        // 释放标记与新消息入队之间的空窗
        if (!queue.isEmpty()) {
            scheduleDrain();
        }
    }
}
