package com.sentinelv.core.http;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * 호스트별 동시 연결 상한 (세마포어 풀). 키는 소문자 호스트명.
 * try-with-resources 로 반납: {@code try (HostPermits.Permit p = permits.acquire(host)) { ... }}
 */
public final class HostPermits {
    private final int perHost;
    private final Map<String, Semaphore> pools = new ConcurrentHashMap<>();

    public HostPermits(int perHost) {
        if (perHost < 1) throw new IllegalArgumentException("perHost must be >= 1");
        this.perHost = perHost;
    }

    public Permit acquire(String host) throws InterruptedException {
        Semaphore s = pool(host);
        s.acquire();
        return new Permit(s);
    }

    /** 현재 남은 허가 수 (테스트/진단용) */
    public int available(String host) {
        return pool(host).availablePermits();
    }

    public int getPerHost() { return perHost; }

    private Semaphore pool(String host) {
        String key = host == null ? "" : host.toLowerCase(Locale.ROOT);
        return pools.computeIfAbsent(key, k -> new Semaphore(perHost, true));
    }

    public static final class Permit implements AutoCloseable {
        private final Semaphore owner;
        private boolean released;

        private Permit(Semaphore owner) { this.owner = owner; }

        @Override public void close() {
            if (!released) {
                released = true;
                owner.release();
            }
        }
    }
}
