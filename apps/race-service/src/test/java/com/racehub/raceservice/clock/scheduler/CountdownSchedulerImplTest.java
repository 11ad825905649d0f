package com.racehub.raceservice.clock.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CountdownSchedulerImplTest {

    private final ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void expiredDeadlineTimesOutImmediately() {
        Clock clock = Clock.systemUTC();
        CountdownSchedulerImpl scheduler = new CountdownSchedulerImpl(executor, clock);
        AtomicReference<String> version = new AtomicReference<>();

        scheduler.startOrResume("race:r:phase", "betting", clock.millis() - 1, "round:1",
                null, (key, owner, v) -> version.set(v));

        assertThat(version.get()).isEqualTo("round:1");
        assertThat(scheduler.activeCount()).isZero();
    }

    @Test
    void firstTickIsImmediateAndRoundedUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        CountdownSchedulerImpl scheduler = new CountdownSchedulerImpl(executor, clock);
        AtomicLong remaining = new AtomicLong(-1);

        scheduler.startOrResume("race:r:phase", "countdown", clock.millis() + 2500, "round:2",
                (key, owner, deadline, left) -> remaining.set(left), (key, owner, v) -> { });

        assertThat(remaining.get()).isEqualTo(3);
        assertThat(scheduler.activeCount()).isEqualTo(1);
        scheduler.stop("race:r:phase");
        assertThat(scheduler.activeCount()).isZero();
    }

    @Test
    void countdownTimesOutAfterDeadline() throws InterruptedException {
        Clock clock = Clock.systemUTC();
        CountdownSchedulerImpl scheduler = new CountdownSchedulerImpl(executor, clock);
        CountDownLatch timedOut = new CountDownLatch(1);

        scheduler.startOrResume("race:r:phase", "betting", clock.millis() + 1200, "round:3",
                null, (key, owner, v) -> timedOut.countDown());

        assertThat(timedOut.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.activeCount()).isZero();
    }

    @Test
    void oneShotRunsOnceAndReleasesKey() throws InterruptedException {
        CountdownSchedulerImpl scheduler = new CountdownSchedulerImpl(executor, Clock.systemUTC());
        CountDownLatch ran = new CountDownLatch(1);

        scheduler.schedule("race:r:grace:u1", 20, ran::countDown);

        assertThat(ran.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.activeCount()).isZero();
    }

    @Test
    void stopCancelsPendingTask() throws InterruptedException {
        CountdownSchedulerImpl scheduler = new CountdownSchedulerImpl(executor, Clock.systemUTC());
        AtomicBoolean ran = new AtomicBoolean();

        scheduler.schedule("race:r:grace:u1", 200, () -> ran.set(true));
        scheduler.stop("race:r:grace:u1");
        Thread.sleep(400);

        assertThat(ran).isFalse();
        assertThat(scheduler.activeCount()).isZero();
    }

    @Test
    void rescheduleReplacesPreviousTask() throws InterruptedException {
        CountdownSchedulerImpl scheduler = new CountdownSchedulerImpl(executor, Clock.systemUTC());
        AtomicBoolean first = new AtomicBoolean();
        CountDownLatch second = new CountDownLatch(1);

        scheduler.schedule("race:r:grace:u1", 100, () -> first.set(true));
        scheduler.schedule("race:r:grace:u1", 150, second::countDown);

        assertThat(second.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(first).isFalse();
    }

    @Test
    void periodicTaskSurvivesExceptionsUntilStopped() throws InterruptedException {
        CountdownSchedulerImpl scheduler = new CountdownSchedulerImpl(executor, Clock.systemUTC());
        CountDownLatch frames = new CountDownLatch(3);

        scheduler.startPeriodic("race:r:race", 10, () -> {
            frames.countDown();
            throw new IllegalStateException("frame failed");
        });

        assertThat(frames.await(2, TimeUnit.SECONDS)).isTrue();
        scheduler.stop("race:r:race");
        assertThat(scheduler.activeCount()).isZero();
    }
}
