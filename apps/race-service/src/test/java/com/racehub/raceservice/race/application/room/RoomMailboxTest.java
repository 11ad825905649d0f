package com.racehub.raceservice.race.application.room;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class RoomMailboxTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void messagesFromOneSenderRunInOrder() throws InterruptedException {
        RoomMailbox mailbox = new RoomMailbox("room-1", pool);
        List<Integer> seen = new ArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        for (int i = 0; i < 500; i++) {
            int n = i;
            mailbox.post(() -> seen.add(n));
        }
        mailbox.post(done::countDown);

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen).hasSize(500).isSorted();
    }

    @Test
    void concurrentPostsNeverOverlap() throws InterruptedException {
        RoomMailbox mailbox = new RoomMailbox("room-1", pool);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger overlaps = new AtomicInteger();
        AtomicInteger processed = new AtomicInteger();
        int senders = 4;
        int perSender = 1000;
        CountDownLatch finished = new CountDownLatch(senders * perSender);

        Thread[] threads = new Thread[senders];
        for (int t = 0; t < senders; t++) {
            threads[t] = new Thread(() -> {
                for (int i = 0; i < perSender; i++) {
                    mailbox.post(() -> {
                        if (running.incrementAndGet() > 1) {
                            overlaps.incrementAndGet();
                        }
                        processed.incrementAndGet();
                        running.decrementAndGet();
                        finished.countDown();
                    });
                }
            });
            threads[t].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        assertThat(finished.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(processed.get()).isEqualTo(senders * perSender);
        assertThat(overlaps.get()).isZero();
    }

    @Test
    void failingMessageDoesNotStopLaterOnes() throws InterruptedException {
        RoomMailbox mailbox = new RoomMailbox("room-1", pool);
        CountDownLatch after = new CountDownLatch(1);

        mailbox.post(() -> {
            throw new IllegalStateException("boom");
        });
        mailbox.post(after::countDown);

        assertThat(after.await(5, TimeUnit.SECONDS)).isTrue();
    }
}
