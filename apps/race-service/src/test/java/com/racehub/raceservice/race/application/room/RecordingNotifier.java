package com.racehub.raceservice.race.application.room;

import com.racehub.raceservice.platform.transport.Envelope;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 记录所有推送，按用户与类型查询。
 */
class RecordingNotifier implements PlayerNotifier {

    record Sent(String userId, Envelope<?> message) {
    }

    final List<Sent> direct = new ArrayList<>();
    final List<Envelope<?>> global = new ArrayList<>();

    @Override
    public synchronized void sendTo(String userId, Envelope<?> message) {
        direct.add(new Sent(userId, message));
    }

    @Override
    public synchronized void broadcastAll(Envelope<?> message) {
        global.add(message);
    }

    synchronized List<Envelope<?>> to(String userId, String type) {
        return direct.stream()
                .filter(s -> s.userId().equals(userId) && s.message().type().equals(type))
                .<Envelope<?>>map(Sent::message)
                .toList();
    }

    @SuppressWarnings("unchecked")
    synchronized <T> T last(String userId, String type) {
        List<Envelope<?>> list = to(userId, type);
        if (list.isEmpty()) {
            throw new AssertionError("no " + type + " sent to " + userId + ", got " + typesTo(userId));
        }
        return (T) list.get(list.size() - 1).payload();
    }

    synchronized List<String> typesTo(String userId) {
        return direct.stream().filter(s -> s.userId().equals(userId)).map(s -> s.message().type()).toList();
    }

    synchronized long count(String type) {
        return direct.stream().filter(s -> s.message().type().equals(type)).count();
    }

    synchronized List<Envelope<?>> global(String type) {
        return global.stream().filter(e -> e.type().equals(type)).toList();
    }

    /** ERROR 帧的错误码 */
    synchronized String lastErrorCode(String userId) {
        Map<?, ?> payload = last(userId, "ERROR");
        return (String) payload.get("code");
    }

    synchronized void clear() {
        direct.clear();
        global.clear();
    }
}
