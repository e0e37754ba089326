package com.dev.sacudo.session;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SerialExecutorTest {

    @Test
    void runsTasksOneAtATimeInSubmissionOrder() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        SerialExecutor executor = new SerialExecutor(pool, "g1");
        List<Integer> order = new CopyOnWriteArrayList<>();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(100);

        for (int i = 0; i < 100; i++) {
            int task = i;
            executor.execute(() -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                order.add(task);
                running.decrementAndGet();
                done.countDown();
            });
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(maxRunning.get()).isEqualTo(1);
        assertThat(order).isSorted().hasSize(100);
        pool.shutdownNow();
    }

    @Test
    void tagsTasksWithGuild() throws InterruptedException {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        SerialExecutor executor = new SerialExecutor(pool, "g42");
        List<String> seen = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        executor.execute(() -> {
            seen.add(MDC.get(SerialExecutor.MDC_GUILD));
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen).containsExactly("g42");
        pool.shutdownNow();
    }

    @Test
    void failingTaskDoesNotStallTheQueue() throws InterruptedException {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        SerialExecutor executor = new SerialExecutor(pool, "g1");
        CountDownLatch done = new CountDownLatch(1);

        executor.execute(() -> {
            throw new IllegalStateException("boom");
        });
        executor.execute(done::countDown);

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        pool.shutdownNow();
    }
}
