package com.bingohub.realtime.sync;

/**
 * 叫号状态变化回调（事件循环线程上调用）。
 */
public interface CallStateListener {

    default void onNumberCalled(int number, CallState state) {
    }

    default void onGameReset(CallState state) {
    }

    /**
     * 全量替换（拉取对齐或缓存加载）。
     * @param stale true 表示数据来自本地缓存，尚未对齐
     */
    default void onStateReplaced(CallState state, boolean stale) {
    }

    default void onPatternChanged(String pattern, CallState state) {
    }
}
