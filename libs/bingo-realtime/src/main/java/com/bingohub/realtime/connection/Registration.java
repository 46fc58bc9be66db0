package com.bingohub.realtime.connection;

/**
 * 订阅句柄。unsubscribe 可重复调用，连接关闭后调用同样安全。
 */
@FunctionalInterface
public interface Registration {
    void unsubscribe();
}
