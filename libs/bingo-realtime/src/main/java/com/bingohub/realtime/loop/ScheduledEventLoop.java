package com.bingohub.realtime.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledEventLoop
 * ---------------------------------------
 * 基于单线程 ScheduledThreadPoolExecutor 的事件循环实现。
 *
 * 说明：
 *  - 线程命名为 {name}，守护线程，JVM 退出时不阻塞；
 *  - 启用 setRemoveOnCancelPolicy(true)，取消的重连/窗口任务及时移出队列；
 *  - 任务内异常只记录日志，不影响后续任务（周期任务除外：心跳由上层自行兜底）。
 */
public class ScheduledEventLoop implements EventLoop, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScheduledEventLoop.class);

    private final ScheduledThreadPoolExecutor executor;

    public ScheduledEventLoop(String name) {
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
        this.executor = new ScheduledThreadPoolExecutor(1, tf, new ThreadPoolExecutor.AbortPolicy());
        this.executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(guard(task));
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delayMs) {
        ScheduledFuture<?> f = executor.schedule(guard(task), Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        return new FutureTask(f);
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs) {
        ScheduledFuture<?> f = executor.scheduleAtFixedRate(
                guard(task), Math.max(0, initialDelayMs), periodMs, TimeUnit.MILLISECONDS);
        return new FutureTask(f);
    }

    @Override
    public long now() {
        return System.currentTimeMillis();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("事件循环任务执行异常", e);
            }
        };
    }

    private record FutureTask(ScheduledFuture<?> future) implements ScheduledTask {
        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
