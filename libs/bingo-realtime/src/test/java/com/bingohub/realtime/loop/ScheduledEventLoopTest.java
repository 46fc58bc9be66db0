package com.bingohub.realtime.loop;

import com.bingohub.realtime.loop.EventLoop.ScheduledTask;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduledEventLoopTest {

    @Test
    void tasksRunInOrderOnOneThreadAndSurviveFailures() throws Exception {
        try (ScheduledEventLoop loop = new ScheduledEventLoop("test-loop")) {
            List<String> seen = new CopyOnWriteArrayList<>();
            CountDownLatch done = new CountDownLatch(1);
            loop.execute(() -> seen.add(Thread.currentThread().getName() + ":a"));
            loop.execute(() -> {
                throw new IllegalStateException("boom");
            });
            loop.execute(() -> seen.add(Thread.currentThread().getName() + ":b"));
            loop.execute(done::countDown);

            assertTrue(done.await(5, TimeUnit.SECONDS));
            assertEquals(List.of("test-loop:a", "test-loop:b"), seen);
        }
    }

    @Test
    void cancelledTaskDoesNotRun() throws Exception {
        try (ScheduledEventLoop loop = new ScheduledEventLoop("test-loop")) {
            CountDownLatch fired = new CountDownLatch(1);
            ScheduledTask task = loop.schedule(fired::countDown, 200);
            task.cancel();

            assertTrue(task.isCancelled());
            assertFalse(fired.await(400, TimeUnit.MILLISECONDS));
        }
    }
}
