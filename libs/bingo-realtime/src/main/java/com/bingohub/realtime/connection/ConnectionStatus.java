package com.bingohub.realtime.connection;

/**
 * 连接状态快照（不可变）。
 *
 * @param state       当前状态
 * @param retryCount  已安排的重试次数（连上后清零）
 * @param nextRetryAt 下次重试的绝对时间（毫秒），无计划时为 0
 */
public record ConnectionStatus(ConnectionState state, int retryCount, long nextRetryAt) {

    public static ConnectionStatus initial() {
        return new ConnectionStatus(ConnectionState.UNKNOWN, 0, 0L);
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }
}
