package com.bingohub.realtime.store;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 持久化存储（外部协作方）：每个会话的已叫号码与当前图案。
 * - 单写入方下读写强一致（写后读可见）；
 * - 多写入方（多个叫号标签页）时按最后写入为准，不做乐观锁。
 *
 * 实现失败时以异常完成 future，不要在调用线程直接抛出。
 */
public interface CallStateStore {

    CompletableFuture<Optional<StoredCallState>> get(String sessionId);

    CompletableFuture<Void> put(String sessionId, StoredCallState state);
}
