package com.racehub.raceservice.race.application.room;

import com.racehub.raceservice.platform.transport.Envelope;

/**
 * 下行推送出口：房间与大厅只通过它给连接发消息，不直接接触 WebSocket。
 * 实现必须线程安全，且不向调用方抛出发送异常。
 */
public interface PlayerNotifier {

    /**
     * 推送给某个用户的当前连接，不在线时丢弃。
     */
    void sendTo(String userId, Envelope<?> message);

    /**
     * 推送给所有在线连接（大厅级事件）。
     */
    void broadcastAll(Envelope<?> message);
}
