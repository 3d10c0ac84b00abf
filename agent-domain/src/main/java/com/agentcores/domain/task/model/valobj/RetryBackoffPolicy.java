package com.agentcores.domain.task.model.valobj;

import java.time.Duration;

/**
 * 指数退避：base × 2^retryCount，上限 max。
 *
 * @param baseDelay 基础延迟
 * @param maxDelay 最大延迟
 */
public record RetryBackoffPolicy(Duration baseDelay, Duration maxDelay) {

    public RetryBackoffPolicy {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("Retry base delay must be non-negative");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Retry max delay must be >= base delay");
        }
    }

    /**
     * @param priorRetryCount 本次失败之前已计入的重试次数
     */
    public Duration delayFor(int priorRetryCount) {
        int exponent = Math.min(Math.max(priorRetryCount, 0), 30);
        long millis = baseDelay.toMillis();
        long scaled = millis > (Long.MAX_VALUE >> exponent) ? Long.MAX_VALUE : millis << exponent;
        return scaled >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis(scaled);
    }
}
