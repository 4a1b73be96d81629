package com.sentinelv.core.http;

import java.time.Duration;

/** 재시도 조건/지연을 결정하는 정책. 상태 -1 은 전송 오류(타임아웃, 연결 실패). */
public interface RetryPolicy {
    /** attempt는 1부터 시작(현재 시도 번호). true면 지연 후 재시도. */
    boolean shouldRetry(int statusCode, int attempt);

    /** attempt 다음 시도 전 대기 시간. */
    Duration nextDelay(int attempt);

    /** 최대 시도 횟수(첫 시도 포함). */
    int maxAttempts();

    /** 한 번만 시도 (지리 정보 제공자처럼 폴백이 따로 있는 경우) */
    RetryPolicy NONE = new RetryPolicy() {
        @Override public boolean shouldRetry(int statusCode, int attempt) { return false; }
        @Override public Duration nextDelay(int attempt) { return Duration.ZERO; }
        @Override public int maxAttempts() { return 1; }
    };

    /** 429, 5xx, 전송 오류 */
    static boolean isTransient(int statusCode) {
        return statusCode == 429 || statusCode >= 500 || statusCode == -1;
    }
}
