package com.racehub.raceservice.platform.ws;

import com.racehub.raceservice.platform.config.RaceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 心跳巡检：超过 heartbeat-timeout-seconds 未收到任何帧的连接被关闭，
 * 关闭后按普通断线处理（保留座位，进入宽限期）。
 */
@Slf4j
@Component
public class HeartbeatMonitor {

    private final ConnectionRegistry connections;
    private final WebSocketDisconnectHelper disconnectHelper;
    private final ScheduledThreadPoolExecutor scheduler;
    private final RaceProperties props;
    private final Clock clock;

    private ScheduledFuture<?> task;

    public HeartbeatMonitor(ConnectionRegistry connections,
                            WebSocketDisconnectHelper disconnectHelper,
                            @Qualifier("raceClockScheduler") ScheduledThreadPoolExecutor scheduler,
                            RaceProperties props,
                            Clock raceClock) {
        this.connections = connections;
        this.disconnectHelper = disconnectHelper;
        this.scheduler = scheduler;
        this.props = props;
        this.clock = raceClock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (task != null) {
            return;
        }
        long period = props.getHeartbeatSweepSeconds();
        task = scheduler.scheduleAtFixedRate(this::sweepSafely, period, period, TimeUnit.SECONDS);
        log.info("心跳巡检已启动: timeoutSeconds={}, sweepSeconds={}", props.getHeartbeatTimeoutSeconds(), period);
    }

    /**
     * 关闭所有超时连接。
     * @return 本次关闭的连接数
     */
    public int sweep() {
        long cutoff = clock.millis() - props.getHeartbeatTimeoutSeconds() * 1000L;
        int closed = 0;
        for (WebSocketSession session : connections.staleSessions(cutoff)) {
            log.info("心跳超时，关闭连接: sessionId={}", session.getId());
            disconnectHelper.forceDisconnect(session, CloseStatus.SESSION_NOT_RELIABLE);
            closed++;
        }
        return closed;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.warn("心跳巡检异常", e);
        }
    }
}
