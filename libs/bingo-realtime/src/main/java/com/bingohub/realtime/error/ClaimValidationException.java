package com.bingohub.realtime.error;

import com.bingohub.realtime.claim.InvalidReason;

import java.util.List;

/**
 * 声明未通过图案校验。以 invalid + 可读原因回告提交者，从不致命。
 */
public class ClaimValidationException extends BingoRealtimeException {

    private final InvalidReason reason;
    /** 距离完成还差的号码数（未知时为 null） */
    private final Integer toGo;
    /** 玩家快照中认为已叫、但叫号方尚未叫出的号码（仅诊断用） */
    private final List<Integer> notYetCalled;

    public ClaimValidationException(InvalidReason reason, String message, Integer toGo, List<Integer> notYetCalled) {
        super(message);
        this.reason = reason;
        this.toGo = toGo;
        this.notYetCalled = notYetCalled == null ? List.of() : List.copyOf(notYetCalled);
    }

    public ClaimValidationException(InvalidReason reason, String message) {
        this(reason, message, null, List.of());
    }

    public InvalidReason getReason() {
        return reason;
    }

    public Integer getToGo() {
        return toGo;
    }

    public List<Integer> getNotYetCalled() {
        return notYetCalled;
    }
}
