package com.bingohub.realtime.error;

/**
 * 持久化写入失败。叫号/重置在持久化成功前不算提交，调用方需重试后才会广播。
 */
public class PersistenceException extends BingoRealtimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
