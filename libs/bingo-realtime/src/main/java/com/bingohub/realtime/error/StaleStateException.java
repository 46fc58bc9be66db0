package com.bingohub.realtime.error;

/**
 * 拉取结果的代数落后于内存状态（或被更新的请求取代）。静默丢弃，不提示用户。
 */
public class StaleStateException extends BingoRealtimeException {

    private final long staleGeneration;
    private final long currentGeneration;

    public StaleStateException(long staleGeneration, long currentGeneration) {
        super("过期状态已丢弃: generation=" + staleGeneration + ", current=" + currentGeneration);
        this.staleGeneration = staleGeneration;
        this.currentGeneration = currentGeneration;
    }

    public long getStaleGeneration() {
        return staleGeneration;
    }

    public long getCurrentGeneration() {
        return currentGeneration;
    }
}
