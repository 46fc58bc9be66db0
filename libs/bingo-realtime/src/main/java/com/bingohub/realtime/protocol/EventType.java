package com.bingohub.realtime.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * 事件类型（v1 协议）。线上名称即 wire 字段 type 的取值，所属频道在这里统一定义。
 */
public enum EventType {

    /** 叫号方 → 玩家：叫出一个号码 */
    NUMBER_CALLED("number-called", ChannelKind.CALLS),
    /** 叫号方 → 玩家：重置本局（新代数） */
    GAME_RESET("game-reset", ChannelKind.CALLS),
    /** 叫号方 → 玩家：当前中奖图案变更 */
    PATTERN_CHANGED("pattern-changed", ChannelKind.CALLS),
    /** 连接保活 */
    HEARTBEAT("heartbeat", ChannelKind.CALLS),
    /** 玩家 → 叫号方：提交中奖声明 */
    CLAIM_SUBMITTED("claim-submitted", ChannelKind.CLAIMS),
    /** 叫号方 → 玩家：声明校验进度（validating / valid） */
    CLAIM_CHECKING("claim-checking", ChannelKind.CLAIMS),
    /** 叫号方 → 玩家：声明判定结果 */
    CLAIM_RESOLVED("claim-resolved", ChannelKind.CLAIMS);

    private final String wire;
    private final ChannelKind channel;

    EventType(String wire, ChannelKind channel) {
        this.wire = wire;
        this.channel = channel;
    }

    public String wire() {
        return wire;
    }

    public ChannelKind channel() {
        return channel;
    }

    public static Optional<EventType> fromWire(String wire) {
        return Arrays.stream(values()).filter(t -> t.wire.equals(wire)).findFirst();
    }
}
