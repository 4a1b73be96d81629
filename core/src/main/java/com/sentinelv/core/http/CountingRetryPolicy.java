package com.sentinelv.core.http;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/** 재시도 횟수를 세는 데코레이터. 호출 1건마다 새로 만든다. */
public final class CountingRetryPolicy implements RetryPolicy {
    private final RetryPolicy delegate;
    private final AtomicInteger retries = new AtomicInteger();

    public CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean shouldRetry(int statusCode, int attempt) {
        boolean ok = delegate.shouldRetry(statusCode, attempt);
        if (ok) retries.incrementAndGet();
        return ok;
    }

    @Override
    public Duration nextDelay(int attempt) {
        return delegate.nextDelay(attempt);
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    public int getRetryCount() {
        return retries.get();
    }
}
