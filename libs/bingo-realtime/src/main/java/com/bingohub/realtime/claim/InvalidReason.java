package com.bingohub.realtime.claim;

/**
 * 声明未通过 / 被驳回的原因代码（随 claim-resolved 下发给提交者）。
 */
public enum InvalidReason {
    PATTERN_INCOMPLETE("pattern-incomplete"),
    PATTERN_NOT_ACTIVE("pattern-not-active"),
    GAME_RESET("game-reset"),
    GENERATION_MISMATCH("generation-mismatch"),
    MALFORMED_TICKET("malformed-ticket"),
    UNREACHABLE("unreachable"),
    PRIZE_ALREADY_AWARDED("prize-already-awarded"),
    CALLER_REJECTED("caller-rejected");

    private final String code;

    InvalidReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
