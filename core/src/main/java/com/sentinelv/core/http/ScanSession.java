package com.sentinelv.core.http;

import com.sentinelv.core.model.ScanConfig;
import com.sentinelv.core.model.ScanStats;
import com.sentinelv.core.util.DefaultSleeper;
import com.sentinelv.core.util.NamedThreadFactory;
import com.sentinelv.core.util.Pacer;
import com.sentinelv.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 감사 1회 범위의 공유 자원. try-with-resources 로 열고 닫는다.
 *  - HttpClient 와 그 executor
 *  - DNS 블로킹 조회용 executor
 *  - 자산별 워치독 스케줄러
 *  - 호스트별 연결 허가, 페이서, 통계
 * 어떤 종료 경로(성공/실패/취소)에서도 close() 가 모든 스레드를 정리한다.
 */
public final class ScanSession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ScanSession.class);

    private final String rootDomain;
    private final ScanConfig config;
    private final ScanStats stats = new ScanStats();
    private final HostPermits permits;
    private final Pacer pacer;
    private final Sleeper sleeper;
    private final HttpFetcher fetcher;
    private final ExecutorService httpExecutor;     // 테스트 sender 주입 시 null
    private final ExecutorService dnsExecutor;
    private final ScheduledExecutorService watchdog;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /** 실제 네트워크(HttpClient) 경로 */
    public static ScanSession open(String rootDomain, ScanConfig config) {
        return new ScanSession(rootDomain, config, null, DefaultSleeper.INSTANCE);
    }

    /** 테스트용: 송신 훅과 슬리퍼 주입 */
    public static ScanSession open(String rootDomain, ScanConfig config,
                                   HttpFetcher.HttpSender sender, Sleeper sleeper) {
        return new ScanSession(rootDomain, config, Objects.requireNonNull(sender, "sender"), sleeper);
    }

    private ScanSession(String rootDomain, ScanConfig config, HttpFetcher.HttpSender sender, Sleeper sleeper) {
        this.rootDomain = Objects.requireNonNull(rootDomain, "rootDomain");
        this.config = Objects.requireNonNull(config, "config");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.permits = new HostPermits(config.getMaxConnectionsPerHost());
        this.pacer = new Pacer(config.getPerRequestDelay(), sleeper);

        HttpFetcher.HttpSender s = sender;
        if (s == null) {
            this.httpExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("audit-http"));
            HttpClient client = HttpClient.newBuilder()
                    .executor(httpExecutor)
                    .connectTimeout(config.getTimeout())
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .build();
            s = req -> client.send(req, HttpResponse.BodyHandlers.ofString());
        } else {
            this.httpExecutor = null;
        }
        this.fetcher = new HttpFetcher(s, permits, pacer, stats, config.getTimeout());
        this.dnsExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("audit-dns"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("audit-watchdog"));
    }

    public String rootDomain() { return rootDomain; }
    public ScanConfig config() { return config; }
    public ScanStats stats() { return stats; }
    public HostPermits permits() { return permits; }
    public Pacer pacer() { return pacer; }
    public Sleeper sleeper() { return sleeper; }
    public HttpFetcher fetcher() { return fetcher; }
    public ExecutorService dnsExecutor() { return dnsExecutor; }
    public ScheduledExecutorService watchdog() { return watchdog; }
    public boolean isClosed() { return closed.get(); }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        watchdog.shutdownNow();
        dnsExecutor.shutdownNow();
        if (httpExecutor != null) httpExecutor.shutdownNow();
        try {
            dnsExecutor.awaitTermination(1, TimeUnit.SECONDS);
            if (httpExecutor != null) httpExecutor.awaitTermination(1, TimeUnit.SECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        LOG.debug("Session closed: root={}", rootDomain);
    }
}
