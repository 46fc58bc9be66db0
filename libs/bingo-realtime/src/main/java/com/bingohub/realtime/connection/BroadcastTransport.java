package com.bingohub.realtime.connection;

import java.util.concurrent.CompletableFuture;

/**
 * BroadcastTransport
 * ----------------------------------------
 * 广播传输原语（外部协作方，不在核心内实现）：Redis pub/sub、托管实时服务等。
 * - open：开始接收某频道的消息，并通过 listener 回报掉线；
 * - publish：向频道发布一条已编码的消息（事件类型在消息外壳内区分）；
 * - close：停止接收，可重复调用。
 *
 * 回调可能在任意线程触发，调用方负责切回自己的事件循环。
 */
public interface BroadcastTransport {

    CompletableFuture<Void> open(String channel, Listener listener);

    CompletableFuture<Void> publish(String channel, String message);

    void close(String channel);

    /**
     * 传输层回调。
     */
    interface Listener {
        void onMessage(String channel, String message);

        void onDropped(String channel, Throwable cause);
    }
}
