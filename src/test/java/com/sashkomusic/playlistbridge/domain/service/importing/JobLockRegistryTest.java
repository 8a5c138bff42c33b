package com.sashkomusic.playlistbridge.domain.service.importing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

public class JobLockRegistryTest {

    private JobLockRegistry registry;

    @BeforeEach
    public void setup() {
        registry = new JobLockRegistry();
    }

    @Test
    public void testRelease_InsideOwnLockForgetsJob() {
        registry.requestCancel("job-1");

        registry.runLocked("job-1", () -> registry.release("job-1"));

        assertThat(registry.isTracked("job-1")).isFalse();
        assertThat(registry.isCancelled("job-1")).isFalse();
    }

    @Test
    public void testRelease_KeepsLockHeldByAnotherThread() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> registry.runLocked("job-1", () -> {
                held.countDown();
                try {
                    finish.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

            registry.release("job-1");
            assertThat(registry.isTracked("job-1")).isTrue();

            finish.countDown();
            holder.get(5, TimeUnit.SECONDS);
            registry.release("job-1");
            assertThat(registry.isTracked("job-1")).isFalse();
        } finally {
            executor.shutdownNow();
        }
    }
}
