package com.bingohub.bingoservice.caller.service;

import com.bingohub.realtime.claim.CallerClaimProtocol;
import com.bingohub.realtime.connection.SessionConnection;
import com.bingohub.realtime.sync.CallSyncEngine;

/**
 * 单个会话在本进程内的运行态：连接 + 叫号引擎 + 声明判定。不落盘。
 */
public record CallerRuntime(SessionConnection connection,
                            CallSyncEngine callSync,
                            CallerClaimProtocol claims) {

    public void stop() {
        claims.stop();
        callSync.stop();
    }
}
