package com.sentinelv.core.util;

import java.time.Duration;
import java.util.Objects;

/**
 * 스텔스 페이싱: 네트워크 호출 "직전"마다 고정 지연.
 * 자산 단위가 아니라 호출 단위이므로 호출이 많은 자산은 그만큼 여러 번 대기한다.
 */
public final class Pacer {
    private final Duration delay;
    private final Sleeper sleeper;

    public Pacer(Duration delay, Sleeper sleeper) {
        this.delay = (delay == null || delay.isNegative()) ? Duration.ZERO : delay;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public static Pacer none() { return new Pacer(Duration.ZERO, DefaultSleeper.INSTANCE); }

    /** 지연이 0이면 즉시 반환. 인터럽트는 호출자에게 그대로 전달 */
    public void beforeCall() throws InterruptedException {
        if (!delay.isZero()) sleeper.sleep(delay);
    }

    public Duration getDelay() { return delay; }
}
