package com.bingohub.realtime.sync;

/**
 * 玩家侧叫号数据的来源状态。
 * - Fresh：已与权威状态对齐（广播增量或全量拉取）；
 * - Stale：仅有本地缓存，等待对齐；
 * - Unknown：尚无任何数据。
 */
public sealed interface SyncState permits SyncState.Fresh, SyncState.Stale, SyncState.Unknown {

    record Fresh(long generation, CallState data) implements SyncState {
    }

    record Stale(CallState data) implements SyncState {
    }

    record Unknown() implements SyncState {
    }

    static SyncState unknown() {
        return new Unknown();
    }
}
