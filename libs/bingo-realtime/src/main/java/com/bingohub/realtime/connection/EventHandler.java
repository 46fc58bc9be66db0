package com.bingohub.realtime.connection;

import com.bingohub.realtime.protocol.EventEnvelope;

/**
 * 按事件类型注册的处理器，在事件循环线程上被调用。
 */
@FunctionalInterface
public interface EventHandler {
    void onEvent(EventEnvelope envelope);
}
