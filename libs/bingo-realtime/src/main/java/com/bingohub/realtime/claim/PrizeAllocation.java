package com.bingohub.realtime.claim;

import java.util.Arrays;

/**
 * 多人并列中奖时的分奖方式。
 */
public enum PrizeAllocation {
    /** 平分一份奖品 */
    SHARED("shared"),
    /** 每人一份完整奖品 */
    EACH_FULL("each-full");

    private final String wire;

    PrizeAllocation(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    /**
     * @throws IllegalArgumentException 未知取值
     */
    public static PrizeAllocation fromWire(String wire) {
        return Arrays.stream(values())
                .filter(a -> a.wire.equalsIgnoreCase(wire) || a.name().equalsIgnoreCase(wire))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的分奖方式: " + wire));
    }
}
