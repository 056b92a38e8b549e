package com.vision_assistant_service.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

class SerializedCallerExecutorTest {

    private final SerializedCallerExecutor executor = new SerializedCallerExecutor();

    @Test
    void runsOnCallingThread() {
        List<String> threads = new CopyOnWriteArrayList<>();

        executor.execute(() -> threads.add(Thread.currentThread().getName()));

        assertThat(threads).containsExactly(Thread.currentThread().getName());
    }

    @Test
    void secondTaskWaitsForFirst() throws InterruptedException {
        List<String> events = new CopyOnWriteArrayList<>();
        CountDownLatch firstRunning = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        CountDownLatch secondSubmitted = new CountDownLatch(1);

        Thread writer = new Thread(() -> executor.execute(() -> {
            events.add("write started");
            firstRunning.countDown();
            awaitQuietly(releaseFirst);
            events.add("write finished");
        }), "writer");
        Thread closer = new Thread(() -> {
            secondSubmitted.countDown();
            executor.execute(() -> events.add("close"));
        }, "closer");

        writer.start();
        assertThat(firstRunning.await(5, TimeUnit.SECONDS)).isTrue();
        closer.start();
        assertThat(secondSubmitted.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);

        assertThat(events).containsExactly("write started");

        releaseFirst.countDown();
        writer.join(5000);
        closer.join(5000);

        assertThat(events).containsExactly("write started", "write finished", "close");
    }

    @Test
    void failingTaskReleasesLock() throws InterruptedException {
        assertThatThrownBy(() -> executor.execute(() -> {
            throw new IllegalStateException("write failed");
        })).isInstanceOf(IllegalStateException.class);
        List<String> events = new CopyOnWriteArrayList<>();

        Thread other = new Thread(() -> executor.execute(() -> events.add("ran")));
        other.start();
        other.join(5000);

        assertThat(events).containsExactly("ran");
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
