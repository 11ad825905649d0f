package com.racehub.raceservice.race.application.room;

import com.racehub.raceservice.platform.transport.Envelope;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次房间处理产生的对外效果（推送、异步结算、回报大厅）。
 * 处理成功且不变量校验通过后才按顺序执行；处理失败时整体丢弃。
 */
@Slf4j
class RoomEffects {

    private final PlayerNotifier notifier;
    private final List<Runnable> actions = new ArrayList<>();

    RoomEffects(PlayerNotifier notifier) {
        this.notifier = notifier;
    }

    void sendTo(String userId, Envelope<?> message) {
        actions.add(() -> notifier.sendTo(userId, message));
    }

    void sendTo(Iterable<String> userIds, Envelope<?> message) {
        for (String userId : userIds) {
            sendTo(userId, message);
        }
    }

    void afterCommit(Runnable action) {
        actions.add(action);
    }

    boolean isEmpty() {
        return actions.isEmpty();
    }

    void flush() {
        for (Runnable action : actions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.warn("房间效果执行失败", e);
            }
        }
        actions.clear();
    }
}
