package com.racehub.raceservice.platform.ws;

import com.racehub.raceservice.platform.config.RaceProperties;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HeartbeatMonitorTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void sweepClosesConnectionsSilentPastTimeout() {
        RaceProperties props = new RaceProperties();
        props.setHeartbeatTimeoutSeconds(60);
        ConnectionRegistry connections = mock(ConnectionRegistry.class);
        WebSocketDisconnectHelper disconnectHelper = mock(WebSocketDisconnectHelper.class);
        WebSocketSession stale = mock(WebSocketSession.class);
        when(connections.staleSessions(clock.millis() - 60_000)).thenReturn(List.of(stale));

        HeartbeatMonitor monitor = new HeartbeatMonitor(connections, disconnectHelper,
                mock(ScheduledThreadPoolExecutor.class), props, clock);

        assertThat(monitor.sweep()).isEqualTo(1);
        verify(disconnectHelper).forceDisconnect(stale, CloseStatus.SESSION_NOT_RELIABLE);
    }
}
