package com.bingohub.realtime.claim;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * 声明状态机：
 * <pre>
 * none → pending → validating → valid | invalid
 * valid → validated | rejected（并列判定 / 叫号方驳回）
 * validating → rejected（奖项已判定）
 * pending → invalid（图案未开放、本局已重置等无需校验票面的情况）
 * </pre>
 * valid 仍可能被判定，不算终态；invalid / validated / rejected 为终态。
 */
public enum ClaimStatus {
    NONE("none"),
    PENDING("pending"),
    VALIDATING("validating"),
    VALID("valid"),
    INVALID("invalid"),
    VALIDATED("validated"),
    REJECTED("rejected");

    private final String wire;

    ClaimStatus(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public boolean isTerminal() {
        return this == INVALID || this == VALIDATED || this == REJECTED;
    }

    /**
     * 叫号方使用：只允许直接边。
     */
    public boolean canTransitionTo(ClaimStatus next) {
        return next(this).contains(next);
    }

    /**
     * 玩家投影使用：广播事件可能跳过中间状态，只要求向前可达。
     */
    public boolean canAdvanceTo(ClaimStatus target) {
        if (this == target) {
            return false;
        }
        Set<ClaimStatus> seen = EnumSet.noneOf(ClaimStatus.class);
        return reachable(this, target, seen);
    }

    public static Optional<ClaimStatus> fromWire(String wire) {
        return Arrays.stream(values()).filter(s -> s.wire.equals(wire)).findFirst();
    }

    private static boolean reachable(ClaimStatus from, ClaimStatus target, Set<ClaimStatus> seen) {
        for (ClaimStatus n : next(from)) {
            if (n == target) {
                return true;
            }
            if (seen.add(n) && reachable(n, target, seen)) {
                return true;
            }
        }
        return false;
    }

    private static Set<ClaimStatus> next(ClaimStatus s) {
        return switch (s) {
            case NONE -> EnumSet.of(PENDING);
            case PENDING -> EnumSet.of(VALIDATING, INVALID);
            case VALIDATING -> EnumSet.of(VALID, INVALID, REJECTED);
            case VALID -> EnumSet.of(VALIDATED, REJECTED);
            case INVALID, VALIDATED, REJECTED -> EnumSet.noneOf(ClaimStatus.class);
        };
    }
}
