package com.bingohub.realtime.error;

/**
 * 实时核心异常基类。
 * 所有失败路径最终落到可观察的终态（连接 error、声明 invalid/rejected、重试计划），不允许拖垮进程。
 */
public class BingoRealtimeException extends RuntimeException {

    public BingoRealtimeException(String message) {
        super(message);
    }

    public BingoRealtimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
