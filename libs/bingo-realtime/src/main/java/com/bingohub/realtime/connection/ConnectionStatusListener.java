package com.bingohub.realtime.connection;

/**
 * 连接状态变化监听（无需轮询）。
 */
@FunctionalInterface
public interface ConnectionStatusListener {
    void onStatusChanged(ConnectionStatus previous, ConnectionStatus current);
}
