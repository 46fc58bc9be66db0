package com.bingohub.bingoservice.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 * pub/sub 频道名不在这里，统一由 BingoChannels 生成。
 */
public final class RedisKeys {

    private static final String PFX = "bingo:";

    private RedisKeys() {}

    // ---- 会话元信息 ----
    public static String session(String sessionId) {
        return PFX + "session:" + sessionId + ":meta";
    }

    // ---- 叫号状态（已叫号码、代数、当前图案） ----
    public static String callState(String sessionId) {
        return PFX + "session:" + sessionId + ":calls-state";
    }
}
