package com.bingohub.realtime.error;

/**
 * 传输不可达 / 超时。按退避策略重试，重试耗尽后才以 ConnectionState.ERROR 暴露。
 */
public class TransportException extends BingoRealtimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
