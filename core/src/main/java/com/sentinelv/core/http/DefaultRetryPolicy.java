package com.sentinelv.core.http;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 일시적 오류에서만 재시도. 500ms → 1000ms → 2000ms (±10% jitter), 한 번 대기는 maxDelay 이하.
 * CT 로그 조회처럼 응답이 느리고 429를 자주 돌려주는 소스용.
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxDelayMillis;

    public DefaultRetryPolicy() { this(3, 500, Duration.ofSeconds(5)); }

    public DefaultRetryPolicy(int maxAttempts, long baseMillis, Duration maxDelay) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxDelayMillis = Math.max(this.baseMillis, maxDelay == null ? Long.MAX_VALUE : maxDelay.toMillis());
    }

    @Override public boolean shouldRetry(int statusCode, int attempt) {
        return attempt < maxAttempts && RetryPolicy.isTransient(statusCode);
    }

    @Override public Duration nextDelay(int attempt) {
        long raw = baseMillis << Math.min(20, Math.max(0, attempt - 1));
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2);
        return Duration.ofMillis(Math.min(maxDelayMillis, (long) (raw * jitter)));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
