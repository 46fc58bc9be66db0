package com.bingohub.realtime.protocol;

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * 统一管理频道命名，避免字符串散落。
 * 格式：{prefix}:session:{sessionId}:{calls|claims}，默认前缀 bingo:v1。
 */
public final class BingoChannels {

    public static final String DEFAULT_PREFIX = "bingo:v1";

    private static final String SESSION = ":session:";

    private BingoChannels() {}

    public static String of(String prefix, String sessionId, ChannelKind kind) {
        return prefix + SESSION + sessionId + ":" + kind.suffix();
    }

    /** 订阅全部会话频道时使用的通配模式 */
    public static String allSessionsPattern(String prefix) {
        return prefix + SESSION + "*";
    }

    /**
     * 从频道名反解 sessionId；不符合命名规则时返回 empty。
     */
    public static Optional<String> sessionIdOf(String prefix, String channel) {
        String head = prefix + SESSION;
        if (channel == null || !channel.startsWith(head)) {
            return Optional.empty();
        }
        String rest = channel.substring(head.length());
        String sessionId = StringUtils.substringBeforeLast(rest, ":");
        return StringUtils.isBlank(sessionId) || sessionId.equals(rest) ? Optional.empty() : Optional.of(sessionId);
    }
}
