package com.bingohub.realtime.support;

import com.bingohub.realtime.cache.CachedCallState;
import com.bingohub.realtime.cache.LocalCache;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryLocalCache implements LocalCache {

    private final Map<String, CachedCallState> data = new HashMap<>();

    @Override
    public Optional<CachedCallState> load(String sessionId) {
        return Optional.ofNullable(data.get(sessionId));
    }

    @Override
    public void save(CachedCallState state) {
        data.put(state.getSessionId(), state);
    }

    @Override
    public void evict(String sessionId) {
        data.remove(sessionId);
    }
}
