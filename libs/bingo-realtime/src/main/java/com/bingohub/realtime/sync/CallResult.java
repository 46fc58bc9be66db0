package com.bingohub.realtime.sync;

/**
 * 叫号结果。
 *
 * @param outcome   CALLED / DUPLICATE（重复号码为无操作）
 * @param state     操作后的状态
 * @param published 增量是否成功广播（持久化成功后广播失败不回滚，玩家重连时补齐）
 */
public record CallResult(Outcome outcome, CallState state, boolean published) {

    public enum Outcome {
        CALLED,
        DUPLICATE
    }

    public boolean isDuplicate() {
        return outcome == Outcome.DUPLICATE;
    }
}
