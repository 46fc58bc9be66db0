package com.bingohub.realtime.loop;

import java.util.concurrent.Executor;

/**
 * EventLoop
 * -------------------------------------------------------
 * 单线程事件循环抽象：连接管理、叫号同步、声明协议的所有可变状态只在循环线程上读写。
 * -------------------------------------------------------
 * 约定：
 *  - execute：投递任务到循环（按投递顺序执行）；
 *  - schedule / scheduleAtFixedRate：唯一的定时能力（退避重连、心跳、声明合并窗口）；
 *  - now：循环使用的时钟（毫秒），测试中可替换为虚拟时钟；
 *  - 传输层与存储层的异步回调必须先切回循环，再触碰状态。
 */
public interface EventLoop extends Executor {

    /**
     * 投递任务，按 FIFO 顺序在循环线程上执行。
     */
    @Override
    void execute(Runnable task);

    /**
     * 延迟执行一次。
     * @param task    任务
     * @param delayMs 延迟毫秒
     * @return 可取消的句柄
     */
    ScheduledTask schedule(Runnable task, long delayMs);

    /**
     * 固定频率重复执行（仅心跳使用）。
     */
    ScheduledTask scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs);

    /**
     * 当前时间（毫秒）。
     */
    long now();

    /**
     * 定时任务句柄；cancel 可重复调用。
     */
    interface ScheduledTask {
        void cancel();

        boolean isCancelled();
    }
}
