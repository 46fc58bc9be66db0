package com.bingohub.realtime.cache;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 基于本地文件的缓存实现（fastjson2）。
 * 文件名：bingo-numbers-session-{sessionId}.json；先写临时文件再原子替换，避免读到半截内容。
 */
public class FileLocalCache implements LocalCache {

    private static final Logger log = LoggerFactory.getLogger(FileLocalCache.class);

    private static final String FILE_PREFIX = "bingo-numbers-session-";

    private final Path dir;

    public FileLocalCache(Path dir) {
        this.dir = Validate.notNull(dir, "dir");
    }

    @Override
    public Optional<CachedCallState> load(String sessionId) {
        Path file = fileOf(sessionId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            CachedCallState state = JSON.parseObject(json, CachedCallState.class);
            if (state != null) {
                // 内容不满足 CallState 约束（如重复号码）时同样视为损坏
                state.toCallState(sessionId);
            }
            return Optional.ofNullable(state);
        } catch (IOException | JSONException e) {
            log.warn("读取本地缓存失败，按缺失处理: session={}, cause={}", sessionId, e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("本地缓存内容非法，已删除: session={}, cause={}", sessionId, e.getMessage());
            evict(sessionId);
            return Optional.empty();
        }
    }

    @Override
    public void save(CachedCallState state) {
        Path file = fileOf(state.getSessionId());
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, FILE_PREFIX, ".tmp");
            Files.writeString(tmp, JSON.toJSONString(state), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.warn("写入本地缓存失败: session={}, cause={}", state.getSessionId(), e.getMessage());
            deleteQuietly(tmp);
        }
    }

    @Override
    public void evict(String sessionId) {
        try {
            Files.deleteIfExists(fileOf(sessionId));
        } catch (IOException e) {
            log.warn("删除本地缓存失败: session={}, cause={}", sessionId, e.getMessage());
        }
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("清理临时文件失败: {}", tmp, e);
        }
    }

    Path fileOf(String sessionId) {
        String safe = sessionId.replaceAll("[^A-Za-z0-9_.-]", "_");
        return dir.resolve(FILE_PREFIX + safe + ".json");
    }
}
