package com.bingohub.realtime.support;

import com.bingohub.realtime.store.CallStateStore;
import com.bingohub.realtime.store.StoredCallState;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 测试用存储：写入时深拷贝，可模拟写失败与挂起的读取。
 */
public class InMemoryCallStateStore implements CallStateStore {

    private final Map<String, StoredCallState> data = new ConcurrentHashMap<>();
    private boolean failPut;
    private boolean failGet;
    private CompletableFuture<Optional<StoredCallState>> heldGet;
    private int putCount;
    private int getCount;

    public void failPut(boolean fail) {
        this.failPut = fail;
    }

    public void failGet(boolean fail) {
        this.failGet = fail;
    }

    /**
     * 下一次 get 不立即完成，返回的 future 由测试手动完成。
     */
    public CompletableFuture<Optional<StoredCallState>> holdNextGet() {
        heldGet = new CompletableFuture<>();
        return heldGet;
    }

    public void seed(StoredCallState state) {
        data.put(state.getSessionId(), copy(state));
    }

    public StoredCallState peek(String sessionId) {
        return data.get(sessionId);
    }

    public int putCount() {
        return putCount;
    }

    public int getCount() {
        return getCount;
    }

    @Override
    public CompletableFuture<Optional<StoredCallState>> get(String sessionId) {
        getCount++;
        if (heldGet != null) {
            CompletableFuture<Optional<StoredCallState>> f = heldGet;
            heldGet = null;
            return f;
        }
        if (failGet) {
            return CompletableFuture.failedFuture(new IllegalStateException("模拟读取失败"));
        }
        return CompletableFuture.completedFuture(Optional.ofNullable(data.get(sessionId)).map(InMemoryCallStateStore::copy));
    }

    @Override
    public CompletableFuture<Void> put(String sessionId, StoredCallState state) {
        putCount++;
        if (failPut) {
            return CompletableFuture.failedFuture(new IllegalStateException("模拟写入失败"));
        }
        data.put(sessionId, copy(state));
        return CompletableFuture.completedFuture(null);
    }

    private static StoredCallState copy(StoredCallState s) {
        return StoredCallState.builder()
                .sessionId(s.getSessionId())
                .calledNumbers(new ArrayList<>(s.getCalledNumbers()))
                .lastCalledNumber(s.getLastCalledNumber())
                .generation(s.getGeneration())
                .currentWinPattern(s.getCurrentWinPattern())
                .updatedAt(s.getUpdatedAt())
                .build();
    }
}
