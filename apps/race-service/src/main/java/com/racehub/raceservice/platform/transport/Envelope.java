package com.racehub.raceservice.platform.transport;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * 传输消息外壳（WebSocket 下行帧）
 * - JSON 结构：{"type": ..., "payload": {...}, "timestamp": epochMs}
 * - timestamp 由服务端在构造时赋值
 * - 提供静态工厂：of / error / bare
 *
 * 用法示例：
 *   Envelope<RaceUpdate> msg = Envelope.of(MessageTypes.RACE_UPDATE, update);
 *   Envelope<Map<String, String>> err = Envelope.error("ROOM_FULL", "房间已满");
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Envelope<T> implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    private final String type;
    private final T payload;
    private final long timestamp;   // 服务器时间戳（ms）

    private Envelope(String type, T payload, long timestamp) {
        this.type = Objects.requireNonNull(type, "type");
        this.payload = payload;
        this.timestamp = timestamp;
    }

    public static <T> Envelope<T> of(String type, T payload) {
        return new Envelope<>(type, payload, Instant.now().toEpochMilli());
    }

    /** 无载荷消息（如 PONG） */
    public static Envelope<Void> bare(String type) {
        return new Envelope<>(type, null, Instant.now().toEpochMilli());
    }

    /** 错误通知：payload = {code, message} */
    public static Envelope<Map<String, String>> error(String code, String message) {
        return of("ERROR", Map.of("code", code, "message", message == null ? "" : message));
    }

    public String type()   { return type; }
    public T payload()     { return payload; }
    public long timestamp() { return timestamp; }

    @Override public String toString() {
        return "Envelope{type='" + type + "', timestamp=" + timestamp + '}';
    }
}
