package com.bingohub.realtime.sync;

/**
 * CALLER：唯一写入方，负责持久化与广播；PLAYER：只读投影。
 */
public enum SyncRole {
    CALLER,
    PLAYER
}
