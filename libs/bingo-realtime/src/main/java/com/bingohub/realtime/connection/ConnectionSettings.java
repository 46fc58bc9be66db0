package com.bingohub.realtime.connection;

import com.bingohub.realtime.protocol.BingoChannels;
import org.apache.commons.lang3.Validate;

/**
 * 连接参数。
 *
 * @param backoff             重连退避策略
 * @param heartbeatIntervalMs 心跳间隔
 * @param livenessTimeoutMs   超过该时长没有任何传输层活动即判定断开
 * @param channelPrefix       频道前缀
 */
public record ConnectionSettings(BackoffPolicy backoff,
                                 long heartbeatIntervalMs,
                                 long livenessTimeoutMs,
                                 String channelPrefix) {

    public ConnectionSettings {
        Validate.notNull(backoff, "backoff");
        Validate.isTrue(heartbeatIntervalMs > 0, "heartbeatIntervalMs 必须大于 0");
        Validate.isTrue(livenessTimeoutMs > heartbeatIntervalMs, "livenessTimeoutMs 必须大于心跳间隔");
        Validate.notBlank(channelPrefix, "channelPrefix");
    }

    public static ConnectionSettings defaults() {
        return new ConnectionSettings(new BackoffPolicy(1000, 10_000, 10), 30_000, 75_000, BingoChannels.DEFAULT_PREFIX);
    }
}
