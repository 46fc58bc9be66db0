package com.bingohub.realtime.connection;

import org.apache.commons.lang3.Validate;

/**
 * 指数退避：delay = min(base × 2^attempt, maxDelay)，最多 maxAttempts 次。
 */
public record BackoffPolicy(long baseDelayMs, long maxDelayMs, int maxAttempts) {

    public BackoffPolicy {
        Validate.isTrue(baseDelayMs > 0, "baseDelayMs 必须大于 0");
        Validate.isTrue(maxDelayMs >= baseDelayMs, "maxDelayMs 不能小于 baseDelayMs");
        Validate.isTrue(maxAttempts >= 0, "maxAttempts 不能为负数");
    }

    /**
     * @param attempt 第几次重试（从 0 开始）
     */
    public long delayFor(int attempt) {
        Validate.isTrue(attempt >= 0, "attempt 不能为负数");
        if (attempt >= 62 || baseDelayMs > (maxDelayMs >> attempt)) {
            return maxDelayMs;
        }
        return baseDelayMs << attempt;
    }
}
