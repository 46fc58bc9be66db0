package com.bingohub.realtime.connection;

/**
 * 连接状态。迁移只由 SessionConnection 负责，其余组件只读。
 *
 * unknown → connecting → connected
 * connected → disconnected（传输断开 / 心跳超时）
 * disconnected → connecting（退避重试）
 * connecting → error（重试耗尽）
 */
public enum ConnectionState {
    CONNECTED("connected"),
    CONNECTING("connecting"),
    DISCONNECTED("disconnected"),
    ERROR("error"),
    UNKNOWN("unknown");

    private final String wire;

    ConnectionState(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }
}
