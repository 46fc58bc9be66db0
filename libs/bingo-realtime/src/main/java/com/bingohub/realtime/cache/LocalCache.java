package com.bingohub.realtime.cache;

import java.util.Optional;

/**
 * 设备本地缓存：每会话一份快照，跨重启保留，仅作“离线可渲染”的兜底数据。
 * 实现不得抛出异常：读写失败按缓存缺失处理。
 */
public interface LocalCache {

    Optional<CachedCallState> load(String sessionId);

    void save(CachedCallState state);

    void evict(String sessionId);
}
