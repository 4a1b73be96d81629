package com.sentinelv.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 감사 1회분 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class ScanStats {
    private final AtomicLong networkCalls  = new AtomicLong(0);   // DNS/HTTP/TLS 시도 총합(재시도 포함)
    private final AtomicLong retries       = new AtomicLong(0);
    private final AtomicLong dnsFailures   = new AtomicLong(0);
    private final AtomicLong geoFailures   = new AtomicLong(0);   // 모든 제공자 실패
    private final AtomicLong tlsFailures   = new AtomicLong(0);
    private final AtomicLong sourceFailures = new AtomicLong(0);  // 서브도메인 소스 단위 실패
    private final AtomicInteger assetsCompleted = new AtomicInteger(0);
    private final AtomicInteger assetsDropped   = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addNetworkCall() { networkCalls.incrementAndGet(); }
    public void addRetries(long n) { retries.addAndGet(n); }
    public void addDnsFailure() { dnsFailures.incrementAndGet(); }
    public void addGeoFailure() { geoFailures.incrementAndGet(); }
    public void addTlsFailure() { tlsFailures.incrementAndGet(); }
    public void addSourceFailure() { sourceFailures.incrementAndGet(); }
    public void addCompleted() { assetsCompleted.incrementAndGet(); }
    public void addDropped() { assetsDropped.incrementAndGet(); }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(
                networkCalls.get(), retries.get(),
                dnsFailures.get(), geoFailures.get(), tlsFailures.get(), sourceFailures.get(),
                assetsCompleted.get(), assetsDropped.get(), maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long networkCalls;
        public final long retries;
        public final long dnsFailures;
        public final long geoFailures;
        public final long tlsFailures;
        public final long sourceFailures;
        public final int  assetsCompleted;
        public final int  assetsDropped;
        public final int  maxObservedConcurrency;

        public Snapshot(long networkCalls, long retries, long dnsFailures, long geoFailures,
                        long tlsFailures, long sourceFailures,
                        int assetsCompleted, int assetsDropped, int maxObservedConcurrency) {
            this.networkCalls = networkCalls;
            this.retries = retries;
            this.dnsFailures = dnsFailures;
            this.geoFailures = geoFailures;
            this.tlsFailures = tlsFailures;
            this.sourceFailures = sourceFailures;
            this.assetsCompleted = assetsCompleted;
            this.assetsDropped = assetsDropped;
            this.maxObservedConcurrency = maxObservedConcurrency;
        }

        public static final Snapshot EMPTY = new Snapshot(0, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
